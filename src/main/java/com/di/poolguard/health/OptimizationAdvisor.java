package com.di.poolguard.health;

import com.di.poolguard.metrics.PoolMetrics;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sizing and tuning hints from a single snapshot, independent of the health level.
 */
public class OptimizationAdvisor {

    static final double HIGH_UTILIZATION = 0.7;
    static final double LOW_UTILIZATION = 0.3;
    static final double SLOW_CONNECTION_MS = 200.0;
    static final long MANY_ERRORS = 5;

    public static final String REC_GROW_POOL = "Consider increasing max connections to improve throughput";
    public static final String REC_SLOW_CONNECTIONS = "High connection time detected - check database performance";
    public static final String REC_MANY_ERRORS =
            "Many connection errors - review network connectivity and database health";
    public static final String REC_SHRINK_POOL =
            "Low pool utilization - consider reducing max connections to save resources";

    public List<String> recommend(PoolMetrics metrics) {
        List<String> out = new ArrayList<>();
        if (metrics.utilization() > HIGH_UTILIZATION) {
            out.add(REC_GROW_POOL);
        }
        if (metrics.avgConnectionTimeMs() > SLOW_CONNECTION_MS) {
            out.add(REC_SLOW_CONNECTIONS);
        }
        if (metrics.cumulativeErrors() > MANY_ERRORS) {
            out.add(REC_MANY_ERRORS);
        }
        if (metrics.utilization() < LOW_UTILIZATION) {
            out.add(REC_SHRINK_POOL);
        }
        return out;
    }

    /**
     * Health recommendations first, then optimization hints, duplicates dropped.
     */
    public PerformanceReport report(HealthStatus health) {
        Set<String> combined = new LinkedHashSet<>(health.recommendations());
        combined.addAll(recommend(health.metrics()));
        return new PerformanceReport(health, health.metrics(), new ArrayList<>(combined));
    }
}
