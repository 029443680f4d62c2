package com.axoncity.metrics.service;

import com.axoncity.metrics.calculator.DerivedIndexCalculator;
import com.axoncity.metrics.calculator.InsightGenerator;
import com.axoncity.metrics.calculator.MetricComparator;
import com.axoncity.metrics.calculator.PoiMetricsCalculator;
import com.axoncity.metrics.dto.MetricsDto.AreaReport;
import com.axoncity.metrics.dto.MetricsDto.AreaRequest;
import com.axoncity.metrics.dto.MetricsDto.ComparisonReport;
import com.axoncity.metrics.dto.MetricsDto.ComparisonRequest;
import com.axoncity.metrics.dto.MetricsDto.DerivedMetricReport;
import com.axoncity.metrics.dto.MetricsDto.InsightDetail;
import com.axoncity.metrics.dto.MetricsDto.InsightsRequest;
import com.axoncity.metrics.exception.InvalidRequestException;
import com.axoncity.metrics.model.AreaContext;
import com.axoncity.metrics.model.DerivedMetricDefinition;
import com.axoncity.metrics.model.DerivedMetricId;
import com.axoncity.metrics.model.DerivedMetricValue;
import com.axoncity.metrics.model.Insight;
import com.axoncity.metrics.model.LayerIds;
import com.axoncity.metrics.model.MetricComparison;
import com.axoncity.metrics.model.NamedArea;
import com.axoncity.metrics.model.PoiMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import static com.axoncity.metrics.config.AsyncConfig.AXONCITY_EXECUTOR;

/**
 * Runs the scoring engine for drawn areas. Each area is scored independently, so multi-area
 * requests are fanned out on the shared executor and joined in request order.
 */
@Service
public class UrbanMetricsService {

    private static final Logger log = LoggerFactory.getLogger(UrbanMetricsService.class);

    private static final String UNNAMED_AREA = "Area";

    private final PoiMetricsCalculator poiCalculator;
    private final DerivedIndexCalculator derivedCalculator;
    private final MetricComparator comparator;
    private final InsightGenerator insightGenerator;
    private final MetricCatalogService catalog;
    private final Executor asyncExecutor;

    public UrbanMetricsService(PoiMetricsCalculator poiCalculator,
                               DerivedIndexCalculator derivedCalculator,
                               MetricComparator comparator,
                               InsightGenerator insightGenerator,
                               MetricCatalogService catalog,
                               @Qualifier(AXONCITY_EXECUTOR) Executor asyncExecutor) {
        this.poiCalculator = poiCalculator;
        this.derivedCalculator = derivedCalculator;
        this.comparator = comparator;
        this.insightGenerator = insightGenerator;
        this.catalog = catalog;
        this.asyncExecutor = asyncExecutor;
    }

    public AreaReport analyze(AreaRequest request) {
        if (request == null) {
            throw new InvalidRequestException("Area request is required");
        }
        AreaContext context = toContext(request);
        PoiMetrics poiMetrics = poiCalculator.calculate(context);
        List<DerivedMetricValue> derived = derivedCalculator.calculateAll(context);

        log.debug("Scored area '{}' ({} km², {} POIs, coverage {}%)",
                nameOf(request, 0), context.areaKm2(), poiMetrics.totalCount(), poiMetrics.coverageScore());

        Map<DerivedMetricId, DerivedMetricDefinition> definitions = catalog.derivedDefinitions();
        List<DerivedMetricReport> reports = derived.stream()
                .map(value -> toReport(value, definitions.get(value.metricId())))
                .toList();

        return new AreaReport(nameOf(request, 0), context.areaKm2(), poiMetrics, reports);
    }

    public List<AreaReport> analyzeAll(List<AreaRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            return List.of();
        }
        List<AreaRequest> named = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            named.add(withName(requests.get(i), i));
        }

        List<CompletableFuture<AreaReport>> reports = named.stream()
                .map(request -> CompletableFuture.supplyAsync(() -> analyze(request), asyncExecutor))
                .toList();

        return reports.stream()
                .map(UrbanMetricsService::joinUnwrapped)
                .toList();
    }

    public ComparisonReport compare(ComparisonRequest request) {
        if (request == null || request.areaA() == null || request.areaB() == null) {
            throw new InvalidRequestException("Comparison needs both areaA and areaB");
        }
        List<AreaReport> reports = analyzeAll(List.of(request.areaA(), request.areaB()));
        AreaReport a = reports.get(0);
        AreaReport b = reports.get(1);

        List<MetricComparison> poiRows = comparator.compare(a.poiMetrics(), b.poiMetrics());
        List<MetricComparison> derivedRows = comparator.compare(
                toValues(a.derivedMetrics()), toValues(b.derivedMetrics()), catalog.derivedDefinitions());

        List<Insight> insights = insightGenerator.generate(List.of(
                new NamedArea(a.name(), a.poiMetrics()),
                new NamedArea(b.name(), b.poiMetrics())));

        return new ComparisonReport(a, b, poiRows, derivedRows, toDetails(insights));
    }

    /**
     * Insights for one or two areas; any other number of areas yields none.
     */
    public List<InsightDetail> insights(InsightsRequest request) {
        if (request == null || request.areas() == null) {
            return List.of();
        }
        List<AreaRequest> areas = request.areas();
        if (areas.isEmpty() || areas.size() > 2) {
            return List.of();
        }
        List<NamedArea> named = new ArrayList<>(areas.size());
        for (int i = 0; i < areas.size(); i++) {
            AreaRequest area = areas.get(i);
            if (area == null) {
                throw new InvalidRequestException("Area " + (i + 1) + " is missing");
            }
            named.add(new NamedArea(nameOf(area, i), poiCalculator.calculate(toContext(area))));
        }
        return toDetails(insightGenerator.generate(named));
    }

    AreaContext toContext(AreaRequest request) {
        if (request.layers() != null) {
            long unknown = request.layers().keySet().stream().filter(id -> !LayerIds.isKnown(id)).count();
            if (unknown > 0) {
                log.debug("Ignoring {} unknown layer id(s) for area '{}'", unknown, request.name());
            }
        }
        if (request.areaKm2() != null) {
            if (!Double.isFinite(request.areaKm2()) || request.areaKm2() < 0) {
                throw new InvalidRequestException("areaKm2 must be a finite, non-negative number: " + request.areaKm2());
            }
            return new AreaContext(request.areaKm2(), request.geometry(), request.layers());
        }
        if (request.geometry() != null) {
            return AreaContext.fromGeometry(request.geometry(), request.layers());
        }
        return AreaContext.of(0.0, request.layers());
    }

    private DerivedMetricReport toReport(DerivedMetricValue value, DerivedMetricDefinition definition) {
        return new DerivedMetricReport(
                value.metricId().id(),
                definition != null ? definition.name() : value.metricId().id(),
                value.value(),
                definition != null ? definition.unit() : "",
                value.confidence(),
                value.confidence().explanation(),
                catalog.levelOf(value.metricId(), value.value()),
                value.breakdown()
        );
    }

    private static List<DerivedMetricValue> toValues(List<DerivedMetricReport> reports) {
        return reports.stream()
                .map(report -> new DerivedMetricValue(
                        DerivedMetricId.fromId(report.metricId()),
                        report.value(),
                        report.confidence(),
                        report.breakdown()))
                .toList();
    }

    private static List<InsightDetail> toDetails(List<Insight> insights) {
        return insights.stream()
                .map(insight -> new InsightDetail(
                        insight.title(),
                        insight.description(),
                        insight.confidence(),
                        insight.confidence().explanation(),
                        insight.relatedMetrics(),
                        insight.type()))
                .toList();
    }

    private static AreaRequest withName(AreaRequest request, int index) {
        if (request == null) {
            throw new InvalidRequestException("Area " + (index + 1) + " is missing");
        }
        return new AreaRequest(nameOf(request, index), request.areaKm2(), request.geometry(), request.layers());
    }

    private static String nameOf(AreaRequest request, int index) {
        if (request.name() != null && !request.name().isBlank()) {
            return request.name();
        }
        return UNNAMED_AREA + " " + (char) ('A' + Math.min(index, 25));
    }

    private static <T> T joinUnwrapped(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
