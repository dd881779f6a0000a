package com.di.poolguard.metrics;

import com.di.poolguard.config.ConnectionPoolConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Produces {@link PoolMetrics} snapshots and keeps a bounded history of them.
 *
 * <p>Two mutation paths, both under the manager lock:
 * <ul>
 *   <li>{@link #recordOutcome(double, boolean)} - called by the retry executor after every attempt</li>
 *   <li>{@link #sample()} - called by the background timer (or directly), appends to history</li>
 * </ul>
 * The timer is a single daemon thread started by {@link #start(Duration)} and stopped by
 * {@link #stop()}.
 */
@Slf4j
public class MetricsSampler {

    /** Number of attempt latencies the rolling average is computed over. */
    public static final int LATENCY_WINDOW = 100;
    public static final int DEFAULT_ERROR_RATE_WINDOW = 20;
    static final double HIGH_UTILIZATION_LOG_THRESHOLD = 0.9;

    private final Supplier<ConnectionPoolConfig> config;
    private final Lock lock;
    private final Clock clock;
    private final ConnectionTelemetry telemetry;
    private final MetricsHistory history;
    private final int errorRateWindow;

    private final Deque<Double> latencies = new ArrayDeque<>(LATENCY_WINDOW);
    private final Deque<Boolean> outcomes;
    private double latencySum;
    private long cumulativeErrors;

    private volatile ScheduledExecutorService scheduler;

    public MetricsSampler(Supplier<ConnectionPoolConfig> config, Lock lock, Clock clock,
                          ConnectionTelemetry telemetry, int historyCapacity, int errorRateWindow) {
        if (errorRateWindow <= 0) {
            throw new IllegalArgumentException("errorRateWindow must be > 0, got " + errorRateWindow);
        }
        this.config = config;
        this.lock = lock;
        this.clock = clock;
        this.telemetry = telemetry;
        this.history = new MetricsHistory(historyCapacity);
        this.errorRateWindow = errorRateWindow;
        this.outcomes = new ArrayDeque<>(errorRateWindow);
    }

    /**
     * Takes a snapshot and appends it to the history, evicting the oldest sample when full.
     */
    public PoolMetrics sample() {
        PoolMetrics metrics;
        lock.lock();
        try {
            metrics = snapshotLocked();
            history.append(metrics);
        } finally {
            lock.unlock();
        }
        if (metrics.utilization() > HIGH_UTILIZATION_LOG_THRESHOLD) {
            log.warn("[POOL] High pool utilization: {}% | active={}, total={}",
                    String.format("%.1f", metrics.utilization() * 100),
                    metrics.activeConnections(), metrics.totalConnections());
        }
        return metrics;
    }

    /**
     * Snapshot of the current state without touching the history.
     */
    public PoolMetrics current() {
        lock.lock();
        try {
            return snapshotLocked();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Feeds one attempt outcome into the rolling latency average, the cumulative error
     * count and the error-rate window.
     */
    public void recordOutcome(double latencyMs, boolean success) {
        lock.lock();
        try {
            double latency = Math.max(0.0, latencyMs);
            if (latencies.size() == LATENCY_WINDOW) {
                latencySum -= latencies.removeFirst();
            }
            latencies.addLast(latency);
            latencySum += latency;

            if (outcomes.size() == errorRateWindow) {
                outcomes.removeFirst();
            }
            outcomes.addLast(success);
            if (!success) {
                cumulativeErrors++;
            }
        } finally {
            lock.unlock();
        }
    }

    /** Failed outcomes among the most recent {@code errorRateWindow} attempts; 0 when none recorded. */
    public double recentErrorRate() {
        lock.lock();
        try {
            if (outcomes.isEmpty()) {
                return 0.0;
            }
            long failures = outcomes.stream().filter(ok -> !ok).count();
            return (double) failures / outcomes.size();
        } finally {
            lock.unlock();
        }
    }

    /** All retained samples, oldest first. */
    public List<PoolMetrics> history() {
        lock.lock();
        try {
            return history.snapshot();
        } finally {
            lock.unlock();
        }
    }

    public List<PoolMetrics> recentHistory(int limit) {
        lock.lock();
        try {
            return history.recent(limit);
        } finally {
            lock.unlock();
        }
    }

    public Optional<PoolMetrics> latest() {
        lock.lock();
        try {
            return history.latest();
        } finally {
            lock.unlock();
        }
    }

    public long getCumulativeErrors() {
        lock.lock();
        try {
            return cumulativeErrors;
        } finally {
            lock.unlock();
        }
    }

    public String telemetrySource() {
        return telemetry.source();
    }

    // ============================================================================
    // Timer lifecycle
    // ============================================================================

    /**
     * Starts periodic sampling. No-op when already running.
     */
    public synchronized void start(Duration interval) {
        if (scheduler != null) {
            return;
        }
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("sampling interval must be > 0, got " + interval);
        }
        ScheduledExecutorService executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "poolguard-metrics-sampler");
            t.setDaemon(true);
            return t;
        });
        long periodMs = interval.toMillis();
        executor.scheduleAtFixedRate(this::sampleQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        scheduler = executor;
        log.info("[POOL] Metrics sampler started | interval={} | telemetry={} | historyCapacity={}",
                interval, telemetry.source(), history.capacity());
    }

    /**
     * Stops periodic sampling and waits briefly for a running tick. Safe to call repeatedly.
     */
    public synchronized void stop() {
        ScheduledExecutorService executor = scheduler;
        if (executor == null) {
            return;
        }
        scheduler = null;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("[POOL] Metrics sampler did not terminate within 2s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[POOL] Metrics sampler stopped | samplesRetained={}", history().size());
    }

    public boolean isRunning() {
        return scheduler != null;
    }

    private void sampleQuietly() {
        try {
            sample();
        } catch (RuntimeException e) {
            // keep the schedule alive; a thrown exception would cancel it
            log.warn("[POOL] Metrics sample failed: {}", e.getMessage(), e);
        }
    }

    // caller holds the lock
    private PoolMetrics snapshotLocked() {
        int total = config.get().getMaxConnections();
        double avg = latencies.isEmpty() ? 0.0 : latencySum / latencies.size();
        return PoolMetrics.of(clock.instant(), telemetry.activeConnections(), total, cumulativeErrors, avg);
    }
}
