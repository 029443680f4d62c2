package com.axoncity.metrics.calculator;

import com.axoncity.metrics.model.DerivedMetricDefinition;
import com.axoncity.metrics.model.DerivedMetricId;
import com.axoncity.metrics.model.DerivedMetricValue;
import com.axoncity.metrics.model.MetricComparison;
import com.axoncity.metrics.model.PoiMetrics;
import com.axoncity.metrics.model.TrendIndicator;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Percentage deltas of area A relative to area B.
 */
public class MetricComparator {

    /**
     * {@code (a - b) / b · 100}; when {@code b} is 0 the delta is 100 for a positive {@code a}
     * and 0 otherwise.
     */
    public static double delta(double a, double b) {
        double delta;
        if (b == 0) {
            delta = a > 0 ? 100.0 : 0.0;
        } else {
            delta = (a - b) / b * 100.0;
        }
        return Double.isFinite(delta) ? delta : 0.0;
    }

    public MetricComparison compare(String metricId, String metricName, double valueA, double valueB, String unit) {
        double delta = delta(valueA, valueB);
        return new MetricComparison(metricId, metricName, valueA, valueB, delta, TrendIndicator.of(delta), unit);
    }

    public List<MetricComparison> compare(PoiMetrics a, PoiMetrics b) {
        return List.of(
                compare("totalCount", "Total POIs", a.totalCount(), b.totalCount(), "count"),
                compare("density", "POI Density", a.density(), b.density(), "per km²"),
                compare("diversityIndex", "Diversity Index", a.diversityIndex(), b.diversityIndex(), "index"),
                compare("coverageScore", "Data Coverage Score", a.coverageScore(), b.coverageScore(), "%")
        );
    }

    /**
     * One row per derived metric present in both lists, in metric order. A metric without a
     * definition is labelled with its id.
     */
    public List<MetricComparison> compare(List<DerivedMetricValue> a, List<DerivedMetricValue> b,
                                          Map<DerivedMetricId, DerivedMetricDefinition> definitions) {
        Map<DerivedMetricId, DerivedMetricValue> byIdA = index(a);
        Map<DerivedMetricId, DerivedMetricValue> byIdB = index(b);

        List<MetricComparison> rows = new ArrayList<>();
        for (DerivedMetricId metricId : DerivedMetricId.values()) {
            DerivedMetricValue valueA = byIdA.get(metricId);
            DerivedMetricValue valueB = byIdB.get(metricId);
            if (valueA == null || valueB == null) {
                continue;
            }
            DerivedMetricDefinition definition = definitions.get(metricId);
            String name = definition != null ? definition.name() : metricId.id();
            String unit = definition != null ? definition.unit() : "";
            rows.add(compare(metricId.id(), name, valueA.value(), valueB.value(), unit));
        }
        return rows;
    }

    private static Map<DerivedMetricId, DerivedMetricValue> index(List<DerivedMetricValue> values) {
        Map<DerivedMetricId, DerivedMetricValue> byId = new EnumMap<>(DerivedMetricId.class);
        for (DerivedMetricValue value : values) {
            byId.put(value.metricId(), value);
        }
        return byId;
    }
}
