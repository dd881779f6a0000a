package com.di.poolguard.retry;

import com.di.poolguard.breaker.CircuitBreaker;
import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.exception.CircuitOpenException;
import com.di.poolguard.exception.ErrorCategory;
import com.di.poolguard.exception.OperationAbortedException;
import com.di.poolguard.exception.OperationFailedException;
import com.di.poolguard.metrics.InFlightConnectionTelemetry;
import com.di.poolguard.metrics.MetricsSampler;
import com.di.poolguard.metrics.PoolMetricsRecorder;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Runs an operation behind the circuit breaker with bounded, exponentially backed-off retries.
 *
 * <p>Per call:
 * <ol>
 *   <li>Breaker denies: {@link CircuitOpenException}, the operation is not invoked.</li>
 *   <li>Up to {@code maxRetries + 1} attempts. A success reports to breaker and sampler and returns.</li>
 *   <li>A failure is recorded; if attempts remain the caller sleeps {@code retryBaseDelay * 2^attemptIndex}.</li>
 *   <li>After the last failed attempt the breaker gets exactly one failure and
 *       {@link OperationFailedException} is thrown with the last failure as cause.</li>
 * </ol>
 * Retries inside one call never trip the breaker individually; only exhaustion counts.
 *
 * <p>No lock is held while the operation runs or while sleeping. {@link #shutdown()} wakes
 * sleeping callers, which then fail with {@link OperationAbortedException}.
 */
@Slf4j
public class RetryExecutor {

    /** Upper bound for a single backoff, reached only through overflow. */
    static final Duration MAX_BACKOFF = Duration.ofHours(1);

    private final Supplier<ConnectionPoolConfig> config;
    private final Lock lock;
    private final CircuitBreaker breaker;
    private final MetricsSampler sampler;
    private final InFlightConnectionTelemetry inFlight;
    private final PoolMetricsRecorder recorder;
    private final Sleeper sleeper;

    private final CountDownLatch shutdownSignal = new CountDownLatch(1);
    private volatile boolean shutdown;

    public RetryExecutor(Supplier<ConnectionPoolConfig> config, Lock lock, CircuitBreaker breaker,
                         MetricsSampler sampler, InFlightConnectionTelemetry inFlight,
                         PoolMetricsRecorder recorder, Sleeper sleeper) {
        this.config = config;
        this.lock = lock;
        this.breaker = breaker;
        this.sampler = sampler;
        this.inFlight = inFlight;
        this.recorder = recorder;
        this.sleeper = sleeper != null ? sleeper : this::awaitShutdown;
    }

    /**
     * Executes {@code op} under the retry and breaker policy.
     *
     * @throws CircuitOpenException      breaker open, nothing attempted
     * @throws OperationFailedException  all attempts failed
     * @throws OperationAbortedException executor shut down or caller interrupted mid-retry
     */
    public <T> T execute(String operationName, PoolOperation<T> op) {
        if (shutdown) {
            throw new OperationAbortedException(operationName, "executor is shut down");
        }
        if (!breaker.canExecute()) {
            recorder.recordRejected(operationName);
            log.warn("[RETRY] Rejected | op={} | reason=circuit breaker open", operationName);
            throw new CircuitOpenException(operationName);
        }

        ConnectionPoolConfig cfg = config.get();
        int maxAttempts = cfg.getMaxRetries() + 1;
        Exception lastFailure = null;

        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            long startNanos = System.nanoTime();
            inFlight.acquire();
            try {
                T result = op.execute();
                onAttemptSucceeded(operationName, attempt, System.nanoTime() - startNanos);
                return result;
            } catch (Exception e) {
                if (e instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                lastFailure = e;
                boolean lastAttempt = attempt + 1 >= maxAttempts;
                onAttemptFailed(operationName, attempt, maxAttempts, System.nanoTime() - startNanos, e, lastAttempt);
            } finally {
                inFlight.release();
            }

            if (attempt + 1 < maxAttempts) {
                Duration delay = backoffDelay(cfg.getRetryBaseDelay(), attempt);
                recorder.recordRetry(operationName);
                backoff(operationName, delay, lastFailure);
            }
        }

        log.error("[RETRY] Exhausted | op={} | attempts={} | category={} | lastError={}",
                operationName, maxAttempts, ErrorCategory.categorize(lastFailure),
                lastFailure != null ? lastFailure.getMessage() : null);
        throw new OperationFailedException(operationName, maxAttempts, lastFailure);
    }

    /**
     * Delay before the retry following zero-based {@code attemptIndex}: {@code base * 2^attemptIndex},
     * saturating at one hour.
     */
    public static Duration backoffDelay(Duration base, int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must be >= 0, got " + attemptIndex);
        }
        if (base.isZero()) {
            return Duration.ZERO;
        }
        if (attemptIndex >= 62) {
            return MAX_BACKOFF;
        }
        long factor = 1L << attemptIndex;
        long baseMillis = base.toMillis();
        if (baseMillis > MAX_BACKOFF.toMillis() / factor) {
            return MAX_BACKOFF;
        }
        return base.multipliedBy(factor);
    }

    /**
     * Stops accepting calls and wakes callers sleeping in a backoff. Idempotent.
     */
    public void shutdown() {
        if (shutdown) {
            return;
        }
        shutdown = true;
        shutdownSignal.countDown();
        log.info("[RETRY] Executor shut down | pending backoffs will abort");
    }

    public boolean isShutdown() {
        return shutdown;
    }

    private void onAttemptSucceeded(String operationName, int attempt, long durationNanos) {
        double latencyMs = durationNanos / 1_000_000.0;
        lock.lock();
        try {
            breaker.onSuccess();
            sampler.recordOutcome(latencyMs, true);
        } finally {
            lock.unlock();
        }
        recorder.recordAttempt(operationName, durationNanos, true, null);
        if (attempt > 0) {
            log.info("[RETRY] Recovered | op={} | attempt={} | latencyMs={}",
                    operationName, attempt + 1, String.format("%.1f", latencyMs));
        } else {
            log.debug("[RETRY] Succeeded | op={} | latencyMs={}", operationName, String.format("%.1f", latencyMs));
        }
    }

    private void onAttemptFailed(String operationName, int attempt, int maxAttempts, long durationNanos,
                                 Exception failure, boolean lastAttempt) {
        double latencyMs = durationNanos / 1_000_000.0;
        ErrorCategory category = ErrorCategory.categorize(failure);
        lock.lock();
        try {
            sampler.recordOutcome(latencyMs, false);
            if (lastAttempt) {
                breaker.onFailure();
            }
        } finally {
            lock.unlock();
        }
        recorder.recordAttempt(operationName, durationNanos, false, category);
        log.warn("[RETRY] Attempt failed | op={} | attempt={}/{} | category={} | latencyMs={} | error={}",
                operationName, attempt + 1, maxAttempts, category,
                String.format("%.1f", latencyMs), failure.getMessage());
    }

    private void backoff(String operationName, Duration delay, Exception lastFailure) {
        if (shutdown) {
            throw new OperationAbortedException(operationName, "executor shut down before retry", lastFailure);
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new OperationAbortedException(operationName, "caller interrupted before retry", lastFailure);
        }
        log.debug("[RETRY] Backing off | op={} | delay={}", operationName, delay);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            OperationAbortedException aborted =
                    new OperationAbortedException(operationName, "interrupted during backoff", lastFailure);
            aborted.addSuppressed(e);
            throw aborted;
        }
        if (shutdown) {
            throw new OperationAbortedException(operationName, "executor shut down during backoff", lastFailure);
        }
    }

    private void awaitShutdown(Duration delay) throws InterruptedException {
        if (!delay.isZero()) {
            shutdownSignal.await(delay.toNanos(), TimeUnit.NANOSECONDS);
        }
    }
}
