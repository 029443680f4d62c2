package com.axoncity.metrics.controller;

import com.axoncity.metrics.dto.MetricsDto.AreaReport;
import com.axoncity.metrics.dto.MetricsDto.AreaRequest;
import com.axoncity.metrics.dto.MetricsDto.ComparisonReport;
import com.axoncity.metrics.dto.MetricsDto.ComparisonRequest;
import com.axoncity.metrics.dto.MetricsDto.InsightDetail;
import com.axoncity.metrics.dto.MetricsDto.InsightsRequest;
import com.axoncity.metrics.service.UrbanMetricsService;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class AreasController {

    private final UrbanMetricsService service;

    public AreasController(UrbanMetricsService service) {
        this.service = service;
    }

    @PostMapping("/areas/metrics")
    public AreaReport metrics(@RequestBody AreaRequest request) {
        return service.analyze(request);
    }

    @PostMapping("/areas/metrics/batch")
    public List<AreaReport> batch(@RequestBody List<AreaRequest> requests) {
        return service.analyzeAll(requests);
    }

    @PostMapping("/areas/compare")
    public ComparisonReport compare(@RequestBody ComparisonRequest request) {
        return service.compare(request);
    }

    @PostMapping("/areas/insights")
    public List<InsightDetail> insights(@RequestBody InsightsRequest request) {
        return service.insights(request);
    }
}
