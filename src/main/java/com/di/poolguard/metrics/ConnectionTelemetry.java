package com.di.poolguard.metrics;

/**
 * Source of the active-connection count read by {@link MetricsSampler}.
 */
@FunctionalInterface
public interface ConnectionTelemetry {

    /** Connections (or logical slots) in use right now. */
    int activeConnections();

    /** Short label for logs and the statistics payload, e.g. {@code hikari} or {@code in-flight}. */
    default String source() {
        return getClass().getSimpleName();
    }
}
