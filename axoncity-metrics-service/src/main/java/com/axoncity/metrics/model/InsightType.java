package com.axoncity.metrics.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InsightType {
    POSITIVE,
    CAUTION,
    NEUTRAL;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
