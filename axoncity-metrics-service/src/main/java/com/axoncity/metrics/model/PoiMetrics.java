package com.axoncity.metrics.model;

import java.time.Instant;
import java.util.List;

public record PoiMetrics(
        long totalCount,
        double density,
        double diversityIndex,
        String diversityLabel,
        List<CategoryMetric> categoryBreakdown,
        double coverageScore,
        String coverageLabel,
        double areaKm2,
        Instant timestamp
) {

    public PoiMetrics {
        categoryBreakdown = categoryBreakdown == null ? List.of() : List.copyOf(categoryBreakdown);
    }

    public CategoryMetric category(PoiCategory category) {
        return categoryBreakdown.stream()
                .filter(metric -> metric.id().equals(category.id()))
                .findFirst()
                .orElse(null);
    }
}
