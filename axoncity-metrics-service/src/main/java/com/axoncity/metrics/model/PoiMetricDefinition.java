package com.axoncity.metrics.model;

import java.util.List;

/**
 * Catalog entry for a POI-level metric. Ranges are ordered by {@code min}; {@code max} is null
 * for the open-ended last range.
 */
public record PoiMetricDefinition(
        String id,
        String name,
        String shortName,
        String formula,
        String description,
        String unit,
        String higherMeans,
        List<InterpretationRange> interpretation,
        String citation
) {

    public PoiMetricDefinition {
        interpretation = interpretation == null ? List.of() : List.copyOf(interpretation);
    }

    public record InterpretationRange(double min, Double max, String label, String description) {

        public boolean contains(double value) {
            return value >= min && (max == null || value < max);
        }
    }

    public InterpretationRange rangeOf(double value) {
        for (InterpretationRange range : interpretation) {
            if (range.contains(value)) {
                return range;
            }
        }
        return interpretation.isEmpty() ? null : interpretation.get(interpretation.size() - 1);
    }
}
