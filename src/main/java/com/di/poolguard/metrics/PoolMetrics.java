package com.di.poolguard.metrics;

import java.time.Instant;

/**
 * One sample of pool state.
 *
 * <p>Always satisfies {@code activeConnections + idleConnections == totalConnections} and
 * {@code utilization == activeConnections / totalConnections}; use {@link #of} to build one.
 *
 * @param cumulativeErrors failed attempts since the manager was created (monotonic)
 */
public record PoolMetrics(
    Instant timestamp,
    int activeConnections,
    int idleConnections,
    int totalConnections,
    long cumulativeErrors,
    double avgConnectionTimeMs,
    double utilization
) {

    /**
     * Builds a sample from a raw active count, clamped to {@code [0, totalConnections]}.
     */
    public static PoolMetrics of(Instant timestamp, int activeConnections, int totalConnections,
                                 long cumulativeErrors, double avgConnectionTimeMs) {
        if (totalConnections <= 0) {
            throw new IllegalArgumentException("totalConnections must be > 0, got " + totalConnections);
        }
        int active = Math.max(0, Math.min(activeConnections, totalConnections));
        return new PoolMetrics(
                timestamp,
                active,
                totalConnections - active,
                totalConnections,
                cumulativeErrors,
                avgConnectionTimeMs,
                (double) active / totalConnections);
    }
}
