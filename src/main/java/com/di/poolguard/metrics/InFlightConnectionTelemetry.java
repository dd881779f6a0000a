package com.di.poolguard.metrics;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Estimator used when the query executor exposes no pool telemetry: counts operation
 * attempts currently running through the retry executor. Each attempt is assumed to hold
 * one logical slot, so this approximates, and does not measure, physical connection use.
 */
public class InFlightConnectionTelemetry implements ConnectionTelemetry {

    private final AtomicInteger inFlight = new AtomicInteger();

    public void acquire() {
        inFlight.incrementAndGet();
    }

    public void release() {
        inFlight.updateAndGet(v -> v > 0 ? v - 1 : 0);
    }

    @Override
    public int activeConnections() {
        return inFlight.get();
    }

    @Override
    public String source() {
        return "in-flight";
    }
}
