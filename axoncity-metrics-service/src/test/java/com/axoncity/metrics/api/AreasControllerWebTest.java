package com.axoncity.metrics.api;

import com.axoncity.metrics.controller.AreasController;
import com.axoncity.metrics.dto.MetricsDto.AreaReport;
import com.axoncity.metrics.dto.MetricsDto.AreaRequest;
import com.axoncity.metrics.dto.MetricsDto.ComparisonReport;
import com.axoncity.metrics.dto.MetricsDto.ComparisonRequest;
import com.axoncity.metrics.dto.MetricsDto.DerivedMetricReport;
import com.axoncity.metrics.dto.MetricsDto.InsightDetail;
import com.axoncity.metrics.dto.MetricsDto.InsightsRequest;
import com.axoncity.metrics.exception.InvalidRequestException;
import com.axoncity.metrics.model.CategoryMetric;
import com.axoncity.metrics.model.Confidence;
import com.axoncity.metrics.model.InsightType;
import com.axoncity.metrics.model.MetricComparison;
import com.axoncity.metrics.model.PoiMetrics;
import com.axoncity.metrics.model.TrendIndicator;
import com.axoncity.metrics.service.UrbanMetricsService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = AreasController.class)
class AreasControllerWebTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    UrbanMetricsService urbanMetricsService;

    @Test
    void postMetrics_returns200_andJson() throws Exception {
        when(urbanMetricsService.analyze(any(AreaRequest.class))).thenReturn(report("Old Town"));

        mvc.perform(post("/api/v1/areas/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Old Town","areaKm2":1.0,"layers":{"poi-food-drink":{"featureCount":100}}}
                                """))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/json"))
                .andExpect(jsonPath("$.name").value("Old Town"))
                .andExpect(jsonPath("$.poiMetrics.density").value(100.0))
                .andExpect(jsonPath("$.poiMetrics.timestamp").value("2026-01-15T10:00:00Z"))
                .andExpect(jsonPath("$.derivedMetrics[0].metricId").value("fifteen_min_score"))
                .andExpect(jsonPath("$.derivedMetrics[0].confidence").value("high"))
                .andExpect(jsonPath("$.derivedMetrics[0].breakdown.food").value(1.0));
    }

    @Test
    void postMetrics_acceptsGeoJsonGeometry() throws Exception {
        when(urbanMetricsService.analyze(any(AreaRequest.class))).thenReturn(report("Cell"));

        mvc.perform(post("/api/v1/areas/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Cell","geometry":{"type":"Polygon","coordinates":[[[0,0],[1,0],[1,1],[0,1],[0,0]]]}}
                                """))
                .andExpect(status().isOk());
    }

    @Test
    void postMetrics_invalidGeometry_returns400() throws Exception {
        mvc.perform(post("/api/v1/areas/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Line","geometry":{"type":"LineString","coordinates":[[0,0],[1,1]]}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void postMetrics_openRing_returns400() throws Exception {
        mvc.perform(post("/api/v1/areas/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Open","geometry":{"type":"Polygon","coordinates":[[[0,0],[1,0],[1,1],[0,1]]]}}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("MALFORMED_REQUEST"));
    }

    @Test
    void postMetrics_invalidArea_returns400() throws Exception {
        when(urbanMetricsService.analyze(any(AreaRequest.class)))
                .thenThrow(new InvalidRequestException("areaKm2 must be a finite, non-negative number: -1.0"));

        mvc.perform(post("/api/v1/areas/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"areaKm2\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("INVALID_REQUEST"));
    }

    @Test
    void postBatch_returnsOneReportPerArea() throws Exception {
        when(urbanMetricsService.analyzeAll(anyList())).thenReturn(List.of(report("Area A"), report("Area B")));

        mvc.perform(post("/api/v1/areas/metrics/batch")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"areaKm2\":1},{\"areaKm2\":2}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[1].name").value("Area B"));
    }

    @Test
    void postCompare_rendersIndicatorGlyph() throws Exception {
        MetricComparison density = new MetricComparison("density", "POI Density", 300, 100, 200,
                TrendIndicator.STRONG_UP, "per km²");
        InsightDetail insight = new InsightDetail("Significant Density Difference", "A has 200% higher POI density than B",
                Confidence.HIGH, Confidence.HIGH.explanation(), List.of("poiDensity"), InsightType.NEUTRAL);
        when(urbanMetricsService.compare(any(ComparisonRequest.class))).thenReturn(new ComparisonReport(
                report("A"), report("B"), List.of(density), List.of(), List.of(insight)));

        mvc.perform(post("/api/v1/areas/compare")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"areaA\":{\"areaKm2\":1},\"areaB\":{\"areaKm2\":1}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.poiComparison[0].delta").value(200.0))
                .andExpect(jsonPath("$.poiComparison[0].indicator").value("▲▲"))
                .andExpect(jsonPath("$.insights[0].type").value("neutral"));
    }

    @Test
    void postInsights_returns200() throws Exception {
        when(urbanMetricsService.insights(any(InsightsRequest.class))).thenReturn(List.of());

        mvc.perform(post("/api/v1/areas/insights")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"areas\":[]}"))
                .andExpect(status().isOk())
                .andExpect(content().json("[]"));
    }

    @Test
    void malformedJson_returns400() throws Exception {
        mvc.perform(post("/api/v1/areas/metrics")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest());
    }

    private static AreaReport report(String name) {
        PoiMetrics poi = new PoiMetrics(100, 100.0, 0.0, "Very Low",
                List.of(new CategoryMetric("food", "Food & Dining", 100, 100.0, 100.0, "#FF5733")),
                12.5, "Limited", 1.0, Instant.parse("2026-01-15T10:00:00Z"));
        DerivedMetricReport fifteen = new DerivedMetricReport("fifteen_min_score", "15-Minute City Score", 20.0, "",
                Confidence.HIGH, Confidence.HIGH.explanation(), "low", Map.of("food", 1.0));
        return new AreaReport(name, 1.0, poi, List.of(fifteen));
    }
}
