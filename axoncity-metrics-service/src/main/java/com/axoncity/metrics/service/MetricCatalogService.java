package com.axoncity.metrics.service;

import com.axoncity.metrics.dto.MetricsDto.MetricDefinitionDetail;
import com.axoncity.metrics.dto.MetricsDto.MetricInterpretation;
import com.axoncity.metrics.model.DerivedMetricDefinition;
import com.axoncity.metrics.model.DerivedMetricId;
import com.axoncity.metrics.model.PoiMetricDefinition;
import com.axoncity.metrics.model.PoiMetricDefinition.InterpretationRange;
import com.axoncity.metrics.repository.MetricDefinitionsRepository;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class MetricCatalogService {

    static final String KIND_DERIVED = "derived";
    static final String KIND_POI = "poi";

    private final MetricDefinitionsRepository repo;

    public MetricCatalogService(MetricDefinitionsRepository repo) {
        this.repo = repo;
    }

    /**
     * Derived indices first, in reporting order, then POI metrics by id.
     */
    public List<MetricDefinitionDetail> listDefinitions() {
        List<MetricDefinitionDetail> definitions = new ArrayList<>();
        repo.findAllDerived().forEach(definition -> definitions.add(toDetail(definition)));
        repo.findAllPoi().forEach(definition -> definitions.add(toDetail(definition)));
        return definitions;
    }

    public MetricDefinitionDetail getDefinition(String metricId) {
        if (DerivedMetricId.isDerived(metricId)) {
            return toDetail(requireDerived(DerivedMetricId.fromId(metricId)));
        }
        return toDetail(requirePoi(metricId));
    }

    public Map<DerivedMetricId, DerivedMetricDefinition> derivedDefinitions() {
        return repo.derivedById();
    }

    /**
     * Level ({@code low|medium|high}) of a derived index, or the label of the matching range of a
     * POI metric.
     */
    public MetricInterpretation interpret(String metricId, double value) {
        if (DerivedMetricId.isDerived(metricId)) {
            DerivedMetricDefinition definition = requireDerived(DerivedMetricId.fromId(metricId));
            String level = definition.thresholds().levelOf(value);
            return new MetricInterpretation(metricId, value, level, interpretationText(definition, level));
        }

        PoiMetricDefinition definition = requirePoi(metricId);
        InterpretationRange range = definition.rangeOf(value);
        if (range == null) {
            return new MetricInterpretation(metricId, value, null, null);
        }
        return new MetricInterpretation(metricId, value, range.label(), range.description());
    }

    public String levelOf(DerivedMetricId metricId, double value) {
        return repo.findDerived(metricId)
                .map(definition -> definition.thresholds().levelOf(value))
                .orElse(null);
    }

    private DerivedMetricDefinition requireDerived(DerivedMetricId metricId) {
        return repo.findDerived(metricId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + metricId.id()));
    }

    private PoiMetricDefinition requirePoi(String metricId) {
        return repo.findPoi(metricId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + metricId));
    }

    private static String interpretationText(DerivedMetricDefinition definition, String level) {
        if (definition.interpretation() == null) {
            return null;
        }
        return switch (level) {
            case "low" -> definition.interpretation().low();
            case "high" -> definition.interpretation().high();
            default -> definition.interpretation().medium();
        };
    }

    private static MetricDefinitionDetail toDetail(DerivedMetricDefinition definition) {
        return new MetricDefinitionDetail(
                definition.id().id(),
                KIND_DERIVED,
                definition.name(),
                null,
                definition.description(),
                definition.formula(),
                definition.unit(),
                definition.requiredLayers(),
                definition.thresholds(),
                definition.interpretation(),
                null,
                null,
                null
        );
    }

    private static MetricDefinitionDetail toDetail(PoiMetricDefinition definition) {
        return new MetricDefinitionDetail(
                definition.id(),
                KIND_POI,
                definition.name(),
                definition.shortName(),
                definition.description(),
                definition.formula(),
                definition.unit(),
                null,
                null,
                null,
                definition.interpretation(),
                definition.higherMeans(),
                definition.citation()
        );
    }
}
