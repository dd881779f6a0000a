package com.di.poolguard.controller;

import com.di.poolguard.breaker.CircuitBreakerState;

/**
 * Outcome of a successful validation query run through the manager.
 */
public record ProbeResult(String query, int rows, long durationMs, CircuitBreakerState circuitBreakerState) {}
