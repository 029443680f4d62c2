package com.axoncity.metrics.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction of a percentage delta, bucketed at ±10% and ±50%.
 */
public enum TrendIndicator {

    STRONG_UP("▲▲"),
    UP("▲"),
    FLAT(""),
    DOWN("▼"),
    STRONG_DOWN("▼▼");

    private final String glyph;

    TrendIndicator(String glyph) {
        this.glyph = glyph;
    }

    public static TrendIndicator of(double deltaPercent) {
        if (deltaPercent > 50) {
            return STRONG_UP;
        }
        if (deltaPercent > 10) {
            return UP;
        }
        if (deltaPercent < -50) {
            return STRONG_DOWN;
        }
        if (deltaPercent < -10) {
            return DOWN;
        }
        return FLAT;
    }

    @JsonValue
    public String glyph() {
        return glyph;
    }
}
