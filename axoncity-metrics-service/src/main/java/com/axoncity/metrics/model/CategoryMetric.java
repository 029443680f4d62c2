package com.axoncity.metrics.model;

/**
 * One POI category's slice of an area. {@code share} is a percentage of the area's total count.
 */
public record CategoryMetric(
        String id,
        String name,
        long count,
        double density,
        double share,
        String color
) {
}
