package com.di.poolguard.breaker;

import java.time.Instant;

/**
 * Point-in-time view of the breaker, for admin responses and logs.
 */
public record CircuitBreakerSnapshot(
    CircuitBreakerState state,
    int consecutiveFailures,
    Instant lastTransitionTime,
    boolean enabled
) {}
