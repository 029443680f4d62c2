package com.axoncity.metrics.model;

import java.util.List;

public record Insight(
        String title,
        String description,
        Confidence confidence,
        List<String> relatedMetrics,
        InsightType type
) {

    public Insight {
        relatedMetrics = relatedMetrics == null ? List.of() : List.copyOf(relatedMetrics);
    }
}
