package com.di.poolguard.manager;

import com.di.poolguard.metrics.PoolMetrics;
import com.di.poolguard.trend.TrendReport;

import java.util.List;

/**
 * @param current         fresh snapshot, not part of {@code historical}
 * @param historical      most recent retained samples, oldest first
 * @param telemetrySource where active connection counts come from ({@code hikari} or {@code in-flight})
 */
public record PoolStatistics(
    PoolMetrics current,
    List<PoolMetrics> historical,
    TrendReport trends,
    String telemetrySource
) {

    public PoolStatistics {
        historical = historical == null ? List.of() : List.copyOf(historical);
    }
}
