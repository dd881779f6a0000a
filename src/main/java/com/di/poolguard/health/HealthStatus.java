package com.di.poolguard.health;

import com.di.poolguard.breaker.CircuitBreakerState;
import com.di.poolguard.metrics.PoolMetrics;

import java.util.List;

/**
 * Derived on every request, never stored.
 *
 * @param recommendations every applicable recommendation, deduplicated, in rule order
 * @param errorRate       failed fraction of the recent attempt window
 */
public record HealthStatus(
    HealthLevel status,
    String message,
    PoolMetrics metrics,
    List<String> recommendations,
    CircuitBreakerState circuitBreakerState,
    double errorRate
) {

    public HealthStatus {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
