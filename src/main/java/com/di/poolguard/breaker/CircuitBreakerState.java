package com.di.poolguard.breaker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Circuit breaker states.
 *
 * <pre>
 * CLOSED ──(consecutive failures &gt;= threshold)──► OPEN
 * OPEN ──(cooldown elapsed, checked by canExecute)──► HALF_OPEN
 * HALF_OPEN ──(success)──► CLOSED
 * HALF_OPEN ──(failure)──► OPEN
 * </pre>
 */
public enum CircuitBreakerState {
    CLOSED("closed"),
    OPEN("open"),
    HALF_OPEN("half-open");

    private final String label;

    CircuitBreakerState(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
