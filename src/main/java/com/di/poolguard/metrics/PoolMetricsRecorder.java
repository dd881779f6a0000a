package com.di.poolguard.metrics;

import com.di.poolguard.breaker.CircuitBreakerState;
import com.di.poolguard.exception.ErrorCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;
import java.util.function.IntSupplier;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;

/**
 * Publishes operation outcomes, breaker transitions and sampled pool state to Micrometer.
 * All meter names live here so dashboards have one place to look.
 */
@Slf4j
public class PoolMetricsRecorder {

    public static final String OPERATION_DURATION = "poolguard.operation.duration";
    public static final String OPERATION_ERRORS = "poolguard.operation.errors";
    public static final String OPERATION_REJECTED = "poolguard.operation.rejected";
    public static final String RETRY_ATTEMPTS = "poolguard.retry.attempts";
    public static final String BREAKER_TRANSITIONS = "poolguard.breaker.transitions";
    public static final String POOL_UTILIZATION = "poolguard.pool.utilization";
    public static final String POOL_ACTIVE = "poolguard.pool.active";
    public static final String POOL_CUMULATIVE_ERRORS = "poolguard.pool.errors.cumulative";
    public static final String BREAKER_CONSECUTIVE_FAILURES = "poolguard.breaker.consecutive.failures";

    private final MeterRegistry meterRegistry;

    public PoolMetricsRecorder(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    // ============================================================================
    // Operation outcomes
    // ============================================================================

    /**
     * Records one attempt of an operation.
     *
     * @param category null for successful attempts
     */
    public void recordAttempt(String operationName, long durationNanos, boolean success, ErrorCategory category) {
        Timer.builder(OPERATION_DURATION)
                .description("Wall-clock time of a single operation attempt")
                .tag("operation", operationName)
                .tag("outcome", success ? "success" : "failure")
                .register(meterRegistry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        if (!success) {
            Counter.builder(OPERATION_ERRORS)
                    .description("Failed operation attempts by error category")
                    .tag("operation", operationName)
                    .tag("category", category != null ? category.tag() : ErrorCategory.UNKNOWN.tag())
                    .register(meterRegistry)
                    .increment();
        }
    }

    /** A retry was scheduled (attempts after the first). */
    public void recordRetry(String operationName) {
        Counter.builder(RETRY_ATTEMPTS)
                .description("Retries scheduled after a failed attempt")
                .tag("operation", operationName)
                .register(meterRegistry)
                .increment();
    }

    /** The breaker rejected the operation without an attempt. */
    public void recordRejected(String operationName) {
        Counter.builder(OPERATION_REJECTED)
                .description("Operations rejected by an open circuit breaker")
                .tag("operation", operationName)
                .register(meterRegistry)
                .increment();
    }

    // ============================================================================
    // Breaker & pool state
    // ============================================================================

    public void recordBreakerTransition(CircuitBreakerState target) {
        Counter.builder(BREAKER_TRANSITIONS)
                .description("Circuit breaker state transitions by target state")
                .tag("state", target.getLabel())
                .register(meterRegistry)
                .increment();
    }

    /**
     * Registers gauges over the latest sample. The supplier may return null before the first sample.
     */
    public void bindPoolGauges(Supplier<PoolMetrics> latest) {
        Gauge.builder(POOL_UTILIZATION, latest, s -> value(s.get(), PoolMetrics::utilization))
                .description("Fraction of pool capacity in use at the last sample")
                .strongReference(true)
                .register(meterRegistry);
        Gauge.builder(POOL_ACTIVE, latest, s -> value(s.get(), m -> m.activeConnections()))
                .description("Active connections at the last sample")
                .strongReference(true)
                .register(meterRegistry);
        Gauge.builder(POOL_CUMULATIVE_ERRORS, latest, s -> value(s.get(), m -> m.cumulativeErrors()))
                .description("Failed attempts since startup at the last sample")
                .strongReference(true)
                .register(meterRegistry);
        log.debug("[POOL] Registered pool gauges");
    }

    public void bindBreakerGauge(IntSupplier consecutiveFailures) {
        Gauge.builder(BREAKER_CONSECUTIVE_FAILURES, consecutiveFailures, IntSupplier::getAsInt)
                .description("Consecutive terminal failures counted by the circuit breaker")
                .strongReference(true)
                .register(meterRegistry);
    }

    private static double value(PoolMetrics m, ToDoubleFunction<PoolMetrics> f) {
        return m != null ? f.applyAsDouble(m) : 0.0;
    }
}
