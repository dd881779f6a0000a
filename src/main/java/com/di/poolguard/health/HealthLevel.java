package com.di.poolguard.health;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tri-level health, ordered by severity.
 */
public enum HealthLevel {
    HEALTHY("healthy"),
    WARNING("warning"),
    CRITICAL("critical");

    private final String label;

    HealthLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
