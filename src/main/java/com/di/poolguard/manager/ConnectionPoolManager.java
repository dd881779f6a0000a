package com.di.poolguard.manager;

import com.di.poolguard.breaker.CircuitBreaker;
import com.di.poolguard.breaker.CircuitBreakerSnapshot;
import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.config.ConnectionPoolConfigListener;
import com.di.poolguard.config.ConnectionPoolProfile;
import com.di.poolguard.health.HealthEvaluator;
import com.di.poolguard.health.HealthStatus;
import com.di.poolguard.health.HealthThresholds;
import com.di.poolguard.health.OptimizationAdvisor;
import com.di.poolguard.health.PerformanceReport;
import com.di.poolguard.metrics.ConnectionTelemetry;
import com.di.poolguard.metrics.InFlightConnectionTelemetry;
import com.di.poolguard.metrics.MetricsHistory;
import com.di.poolguard.metrics.MetricsSampler;
import com.di.poolguard.metrics.PoolMetrics;
import com.di.poolguard.metrics.PoolMetricsRecorder;
import com.di.poolguard.retry.PoolOperation;
import com.di.poolguard.retry.RetryExecutor;
import com.di.poolguard.retry.Sleeper;
import com.di.poolguard.trend.TrendAnalyzer;
import com.di.poolguard.trend.TrendReport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point of the access layer: owns the config, breaker, sampler and retry executor of
 * one pool and exposes health, statistics and admin operations over them.
 *
 * <p>Built explicitly and handed to callers; there is no global instance. Every collaborator
 * shares one {@link ReentrantLock}, and the active config is an immutable value behind a
 * volatile reference, so {@link #configureProfile(String)} takes effect for the next call
 * without tearing a running one.
 *
 * <p>Lifecycle: created, then {@link #start()} (background sampling), then {@link #stop()}.
 * Stopping is final and idempotent.
 */
@Slf4j
public class ConnectionPoolManager {

    public static final Duration DEFAULT_SAMPLING_INTERVAL = Duration.ofSeconds(5);
    public static final int DEFAULT_STATISTICS_WINDOW = 50;

    private enum Lifecycle { CREATED, STARTED, STOPPED }

    private final ReentrantLock lock = new ReentrantLock();
    private final Duration samplingInterval;
    private final int statisticsWindow;
    private final PoolMetricsRecorder recorder;
    private final MetricsSampler sampler;
    private final CircuitBreaker breaker;
    private final RetryExecutor retryExecutor;
    private final HealthEvaluator healthEvaluator;
    private final OptimizationAdvisor advisor = new OptimizationAdvisor();
    private final TrendAnalyzer trendAnalyzer = new TrendAnalyzer();
    private final List<ConnectionPoolConfigListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionPoolConfig config;
    private Lifecycle lifecycle = Lifecycle.CREATED;

    /**
     * Every argument is optional.
     *
     * @param telemetry source of active connection counts; defaults to counting in-flight attempts
     * @param sleeper   backoff sleep; defaults to a timed wait that {@link #stop()} interrupts
     */
    @Builder
    private ConnectionPoolManager(ConnectionPoolConfig config,
                                  Duration samplingInterval,
                                  Integer historyCapacity,
                                  Integer statisticsWindow,
                                  Integer errorRateWindow,
                                  HealthThresholds healthThresholds,
                                  ConnectionTelemetry telemetry,
                                  PoolMetricsRecorder recorder,
                                  Clock clock,
                                  Sleeper sleeper) {
        this.config = config != null ? config : ConnectionPoolConfig.defaults();
        this.samplingInterval = samplingInterval != null ? samplingInterval : DEFAULT_SAMPLING_INTERVAL;
        this.statisticsWindow = statisticsWindow != null ? statisticsWindow : DEFAULT_STATISTICS_WINDOW;
        this.recorder = recorder != null ? recorder : new PoolMetricsRecorder(new SimpleMeterRegistry());
        Clock effectiveClock = clock != null ? clock : Clock.systemUTC();

        InFlightConnectionTelemetry inFlight = new InFlightConnectionTelemetry();
        this.sampler = new MetricsSampler(this::getConfig, lock, effectiveClock,
                telemetry != null ? telemetry : inFlight,
                historyCapacity != null ? historyCapacity : MetricsHistory.DEFAULT_CAPACITY,
                errorRateWindow != null ? errorRateWindow : MetricsSampler.DEFAULT_ERROR_RATE_WINDOW);
        this.breaker = new CircuitBreaker(this::getConfig, lock, effectiveClock, this.recorder);
        this.retryExecutor = new RetryExecutor(this::getConfig, lock, breaker, sampler, inFlight,
                this.recorder, sleeper);
        this.healthEvaluator = new HealthEvaluator(healthThresholds != null ? healthThresholds : HealthThresholds.DEFAULTS);

        this.recorder.bindPoolGauges(() -> sampler.latest().orElse(null));
        this.recorder.bindBreakerGauge(breaker::getConsecutiveFailures);
    }

    // ============================================================================
    // Lifecycle
    // ============================================================================

    /**
     * Starts background sampling when monitoring is enabled. No-op when already started.
     *
     * @throws IllegalStateException after {@link #stop()}
     */
    public synchronized void start() {
        if (lifecycle == Lifecycle.STARTED) {
            return;
        }
        if (lifecycle == Lifecycle.STOPPED) {
            throw new IllegalStateException("Connection pool manager was stopped and cannot be restarted");
        }
        lifecycle = Lifecycle.STARTED;
        ConnectionPoolConfig cfg = config;
        if (cfg.isMonitoringEnabled()) {
            sampler.start(samplingInterval);
        }
        log.info("[POOL] Manager started | maxConnections={} | maxRetries={} | breakerEnabled={} | monitoring={}",
                cfg.getMaxConnections(), cfg.getMaxRetries(), cfg.isCircuitBreakerEnabled(), cfg.isMonitoringEnabled());
    }

    /**
     * Halts sampling and aborts callers waiting in a retry backoff.
     */
    public synchronized void stop() {
        if (lifecycle == Lifecycle.STOPPED) {
            return;
        }
        lifecycle = Lifecycle.STOPPED;
        retryExecutor.shutdown();
        sampler.stop();
        log.info("[POOL] Manager stopped | breaker={} | cumulativeErrors={}",
                breaker.getState().getLabel(), sampler.getCumulativeErrors());
    }

    public synchronized boolean isRunning() {
        return lifecycle == Lifecycle.STARTED;
    }

    public boolean isMonitoring() {
        return sampler.isRunning();
    }

    // ============================================================================
    // Operations
    // ============================================================================

    /**
     * Runs {@code op} through the breaker and retry policy of the active config.
     *
     * @see RetryExecutor#execute(String, PoolOperation)
     */
    public <T> T execute(String operationName, PoolOperation<T> op) {
        return retryExecutor.execute(operationName, op);
    }

    public HealthStatus health() {
        return healthEvaluator.evaluate(sampler.current(), sampler.recentErrorRate(), breaker.getState());
    }

    public PoolStatistics statistics() {
        List<PoolMetrics> recent = sampler.recentHistory(statisticsWindow);
        TrendReport trends = trendAnalyzer.analyze(recent);
        return new PoolStatistics(sampler.current(), recent, trends, sampler.telemetrySource());
    }

    public PerformanceReport performance() {
        return advisor.report(health());
    }

    /**
     * Takes a sample now and appends it to the history, outside the timer schedule.
     */
    public PoolMetrics sampleNow() {
        return sampler.sample();
    }

    // ============================================================================
    // Administration
    // ============================================================================

    /**
     * Replaces the active config with a named preset. Breaker state and metrics history are
     * kept; the new threshold and cooldown apply from the next breaker decision.
     *
     * @throws com.di.poolguard.exception.PoolConfigException for an unknown profile
     */
    public ConnectionPoolConfig configureProfile(String profileName) {
        ConnectionPoolProfile profile = ConnectionPoolProfile.fromName(profileName);
        return applyConfig(profile.config(), profile.getProfileName());
    }

    /**
     * Replaces the active config with an explicit value.
     */
    public ConnectionPoolConfig configure(ConnectionPoolConfig newConfig) {
        if (newConfig == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        return applyConfig(newConfig, "custom");
    }

    public CircuitBreakerSnapshot resetCircuitBreaker() {
        breaker.reset();
        return breaker.snapshot();
    }

    public CircuitBreakerSnapshot circuitBreaker() {
        return breaker.snapshot();
    }

    public ConnectionPoolConfig getConfig() {
        return config;
    }

    public void addConfigListener(ConnectionPoolConfigListener listener) {
        listeners.add(listener);
    }

    public String getTelemetrySource() {
        return sampler.telemetrySource();
    }

    private ConnectionPoolConfig applyConfig(ConnectionPoolConfig next, String label) {
        ConnectionPoolConfig previous = swapConfig(next);
        log.info("[CONFIG] Pool config changed | profile={} | maxConnections={}->{} | maxRetries={}->{} | "
                        + "breakerThreshold={}->{} | breakerCooldown={}->{}",
                label, previous.getMaxConnections(), next.getMaxConnections(),
                previous.getMaxRetries(), next.getMaxRetries(),
                previous.getCircuitBreakerThreshold(), next.getCircuitBreakerThreshold(),
                previous.getCircuitBreakerCooldown(), next.getCircuitBreakerCooldown());
        for (ConnectionPoolConfigListener listener : listeners) {
            try {
                listener.onConfigChanged(previous, next);
            } catch (RuntimeException e) {
                log.error("[CONFIG] Config listener failed | listener={} | error={}",
                        listener.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
        return next;
    }

    /**
     * Publishes {@code next} and brings breaker and sampler in line with it. Serialized with
     * {@link #start()} and {@link #stop()} so the sampler always ends up matching the last
     * config written.
     */
    private synchronized ConnectionPoolConfig swapConfig(ConnectionPoolConfig next) {
        ConnectionPoolConfig previous;
        lock.lock();
        try {
            previous = config;
            config = next;
        } finally {
            lock.unlock();
        }
        // a disabled breaker is bypassed entirely, so it must not stay open behind the bypass
        if (previous.isCircuitBreakerEnabled() && !next.isCircuitBreakerEnabled()) {
            breaker.reset();
        }
        if (lifecycle == Lifecycle.STARTED) {
            if (next.isMonitoringEnabled() && !sampler.isRunning()) {
                sampler.start(samplingInterval);
            } else if (!next.isMonitoringEnabled() && sampler.isRunning()) {
                sampler.stop();
            }
        }
        return previous;
    }
}
