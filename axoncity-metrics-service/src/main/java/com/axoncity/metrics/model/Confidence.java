package com.axoncity.metrics.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How much of a metric's input data was actually observed. Not a statistical certainty.
 */
public enum Confidence {

    LOW("low", "Limited data; interpret with caution"),
    MEDIUM("medium", "Interpretation may depend on context"),
    HIGH("high", "Based on clear quantitative differences");

    private final String label;
    private final String explanation;

    Confidence(String label, String explanation) {
        this.label = label;
        this.explanation = explanation;
    }

    /**
     * Grades the share of required inputs that had data: at least 80% is high, at least 50% medium.
     */
    public static Confidence fromShare(int present, int required) {
        if (required <= 0) {
            return LOW;
        }
        if (present >= required * 0.8) {
            return HIGH;
        }
        if (present >= required * 0.5) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String explanation() {
        return explanation;
    }
}
