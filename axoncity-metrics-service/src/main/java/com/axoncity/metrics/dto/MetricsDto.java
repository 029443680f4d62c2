package com.axoncity.metrics.dto;

import com.axoncity.metrics.model.AreaGeometry;
import com.axoncity.metrics.model.Confidence;
import com.axoncity.metrics.model.DerivedMetricDefinition.Interpretation;
import com.axoncity.metrics.model.DerivedMetricDefinition.Thresholds;
import com.axoncity.metrics.model.InsightType;
import com.axoncity.metrics.model.LayerStats;
import com.axoncity.metrics.model.MetricComparison;
import com.axoncity.metrics.model.PoiMetricDefinition.InterpretationRange;
import com.axoncity.metrics.model.PoiMetrics;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class MetricsDto {

    /**
     * One drawn area. {@code areaKm2} wins over the geometry's own area when both are given.
     */
    public record AreaRequest(
            String name,
            Double areaKm2,
            AreaGeometry geometry,
            Map<String, LayerStats> layers
    ) {}

    public record AreaReport(
            String name,
            double areaKm2,
            PoiMetrics poiMetrics,
            List<DerivedMetricReport> derivedMetrics
    ) {}

    public record DerivedMetricReport(
            String metricId,
            String name,
            double value,
            String unit,
            Confidence confidence,
            String confidenceExplanation,
            String level,
            Map<String, Double> breakdown
    ) {}

    public record ComparisonRequest(
            AreaRequest areaA,
            AreaRequest areaB
    ) {}

    public record ComparisonReport(
            AreaReport areaA,
            AreaReport areaB,
            List<MetricComparison> poiComparison,
            List<MetricComparison> derivedComparison,
            List<InsightDetail> insights
    ) {}

    public record InsightsRequest(
            List<AreaRequest> areas
    ) {}

    public record InsightDetail(
            String title,
            String description,
            Confidence confidence,
            String confidenceExplanation,
            List<String> relatedMetrics,
            InsightType type
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MetricDefinitionDetail(
            String id,
            String kind,
            String name,
            String shortName,
            String description,
            String formula,
            String unit,
            List<String> requiredLayers,
            Thresholds thresholds,
            Interpretation interpretation,
            List<InterpretationRange> ranges,
            String higherMeans,
            String citation
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record MetricInterpretation(
            String metricId,
            double value,
            String level,
            String description
    ) {}

    public record ImportPreview(
            String delimiter,
            List<String> headers,
            List<Map<String, String>> sampleRows,
            int rowCount,
            int droppedRows,
            String detectedLatColumn,
            String detectedLonColumn
    ) {}

    public record ImportRequest(
            String content,
            String fileName,
            String name,
            String description,
            String unit,
            String valueColumn,
            String areaColumn,
            String latColumn,
            String lonColumn
    ) {}

    public record ExternalIndexSummary(
            String id,
            String name,
            String source,
            int valueCount,
            double min,
            double max,
            String unit,
            Instant importedAt
    ) {}

    public record ErrorResponse(
            String error,
            String message
    ) {}

    private MetricsDto() {}
}
