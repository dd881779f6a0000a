package com.di.poolguard.health;

import com.di.poolguard.metrics.PoolMetrics;

import java.util.List;

/**
 * Health plus optimization advice for the current snapshot.
 *
 * @param recommendations health recommendations followed by optimization recommendations, deduplicated
 */
public record PerformanceReport(HealthStatus health, PoolMetrics metrics, List<String> recommendations) {

    public PerformanceReport {
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }
}
