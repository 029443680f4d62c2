package com.axoncity.metrics.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one derived index. {@code breakdown} keeps every intermediate quantity that fed
 * {@code value}, in insertion order.
 */
public record DerivedMetricValue(
        DerivedMetricId metricId,
        double value,
        Confidence confidence,
        Map<String, Double> breakdown
) {

    public DerivedMetricValue {
        breakdown = breakdown == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(breakdown));
    }
}
