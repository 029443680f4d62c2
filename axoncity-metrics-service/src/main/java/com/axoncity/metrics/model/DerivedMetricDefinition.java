package com.axoncity.metrics.model;

import java.util.List;

/**
 * Catalog entry describing a derived index, including its canonical interpretation thresholds.
 */
public record DerivedMetricDefinition(
        DerivedMetricId id,
        String name,
        String description,
        String formula,
        String unit,
        List<String> requiredLayers,
        Interpretation interpretation,
        Thresholds thresholds
) {

    public DerivedMetricDefinition {
        requiredLayers = requiredLayers == null ? List.of() : List.copyOf(requiredLayers);
    }

    public record Interpretation(String low, String medium, String high) {
    }

    public record Thresholds(double low, double high) {

        public String levelOf(double value) {
            if (value < low) {
                return "low";
            }
            if (value >= high) {
                return "high";
            }
            return "medium";
        }
    }
}
