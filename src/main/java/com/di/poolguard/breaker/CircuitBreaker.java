package com.di.poolguard.breaker;

import com.di.poolguard.config.ConnectionPoolConfig;
import com.di.poolguard.metrics.PoolMetricsRecorder;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.locks.Lock;
import java.util.function.Supplier;

/**
 * Consecutive-failure circuit breaker guarding whether operations may run at all.
 *
 * <p>Threshold, cooldown and the enabled flag are read from the active config on every call,
 * so a profile swap takes effect without losing the current state. When the breaker is
 * disabled it is bypassed entirely: {@link #canExecute()} is always {@code true} and
 * outcome calls do nothing.
 *
 * <p>State is guarded by the lock shared with the metrics sampler; transitions are internal
 * bookkeeping and never throw.
 */
@Slf4j
public class CircuitBreaker {

    private final Supplier<ConnectionPoolConfig> config;
    private final Lock lock;
    private final Clock clock;
    private final PoolMetricsRecorder recorder;

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int consecutiveFailures;
    private Instant lastTransitionTime;

    public CircuitBreaker(Supplier<ConnectionPoolConfig> config, Lock lock, Clock clock,
                          PoolMetricsRecorder recorder) {
        this.config = config;
        this.lock = lock;
        this.clock = clock;
        this.recorder = recorder;
        this.lastTransitionTime = clock.instant();
    }

    /**
     * Admission check. CLOSED and HALF_OPEN admit; OPEN admits only once the cooldown has
     * elapsed, and that check moves the breaker to HALF_OPEN.
     */
    public boolean canExecute() {
        ConnectionPoolConfig cfg = config.get();
        if (!cfg.isCircuitBreakerEnabled()) {
            return true;
        }
        lock.lock();
        try {
            if (state != CircuitBreakerState.OPEN) {
                return true;
            }
            Duration sinceOpened = Duration.between(lastTransitionTime, clock.instant());
            if (sinceOpened.compareTo(cfg.getCircuitBreakerCooldown()) >= 0) {
                transitionTo(CircuitBreakerState.HALF_OPEN);
                log.info("[BREAKER] Cooldown of {} elapsed | state=half-open | admitting trial operation",
                        cfg.getCircuitBreakerCooldown());
                return true;
            }
            return false;
        } finally {
            lock.unlock();
        }
    }

    public void onSuccess() {
        if (!config.get().isCircuitBreakerEnabled()) {
            return;
        }
        lock.lock();
        try {
            consecutiveFailures = 0;
            if (state == CircuitBreakerState.HALF_OPEN) {
                transitionTo(CircuitBreakerState.CLOSED);
                log.info("[BREAKER] Trial operation succeeded | state=closed");
            }
        } finally {
            lock.unlock();
        }
    }

    public void onFailure() {
        ConnectionPoolConfig cfg = config.get();
        if (!cfg.isCircuitBreakerEnabled()) {
            return;
        }
        lock.lock();
        try {
            consecutiveFailures++;
            if (state == CircuitBreakerState.HALF_OPEN) {
                transitionTo(CircuitBreakerState.OPEN);
                log.error("[BREAKER] Trial operation failed | state=open | cooldown restarted ({})",
                        cfg.getCircuitBreakerCooldown());
            } else if (state == CircuitBreakerState.CLOSED
                    && consecutiveFailures >= cfg.getCircuitBreakerThreshold()) {
                transitionTo(CircuitBreakerState.OPEN);
                log.error("[BREAKER] Opened after {} consecutive failures (threshold={}) | cooldown={}",
                        consecutiveFailures, cfg.getCircuitBreakerThreshold(), cfg.getCircuitBreakerCooldown());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Administrative override: force CLOSED, zero the failure count and restart the clock.
     */
    public void reset() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            consecutiveFailures = 0;
            if (previous != CircuitBreakerState.CLOSED) {
                transitionTo(CircuitBreakerState.CLOSED);
            } else {
                lastTransitionTime = clock.instant();
            }
            log.info("[BREAKER] Manual reset | previousState={} | state=closed", previous.getLabel());
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    public int getConsecutiveFailures() {
        lock.lock();
        try {
            return consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerSnapshot snapshot() {
        boolean enabled = config.get().isCircuitBreakerEnabled();
        lock.lock();
        try {
            return new CircuitBreakerSnapshot(state, consecutiveFailures, lastTransitionTime, enabled);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void transitionTo(CircuitBreakerState next) {
        state = next;
        lastTransitionTime = clock.instant();
        recorder.recordBreakerTransition(next);
    }
}
