package com.di.poolguard.trend;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Trend {
    INCREASING("increasing"),
    DECREASING("decreasing"),
    STABLE("stable");

    private final String label;

    Trend(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
