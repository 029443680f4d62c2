package com.axoncity.metrics.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An index produced outside the engine and imported from delimited text. Values are keyed by
 * area name, a {@code "lat,lon"} string or a synthetic {@code row-N}, and always lie within
 * {@code [min, max]}.
 */
public record ExternalIndex(
        String id,
        String name,
        String source,
        String description,
        Map<String, Double> values,
        double min,
        double max,
        String unit,
        Instant importedAt
) {

    public ExternalIndex {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("An external index needs at least one value");
        }
        if (!Double.isFinite(min) || !Double.isFinite(max) || min > max) {
            throw new IllegalArgumentException("Invalid value range [" + min + ", " + max + "]");
        }
        for (Map.Entry<String, Double> entry : values.entrySet()) {
            Double value = entry.getValue();
            if (entry.getKey() == null || value == null) {
                throw new IllegalArgumentException("External index keys and values must not be null");
            }
            if (!Double.isFinite(value) || value < min || value > max) {
                throw new IllegalArgumentException("Value " + value + " for \"" + entry.getKey()
                        + "\" lies outside [" + min + ", " + max + "]");
            }
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
