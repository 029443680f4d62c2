package com.axoncity.metrics.model;

/**
 * One row of a side-by-side comparison; {@code delta} is the percentage change of A relative to B.
 */
public record MetricComparison(
        String metricId,
        String metricName,
        double valueA,
        double valueB,
        double delta,
        TrendIndicator indicator,
        String unit
) {
}
