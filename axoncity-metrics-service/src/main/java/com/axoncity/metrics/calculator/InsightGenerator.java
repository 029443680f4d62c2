package com.axoncity.metrics.calculator;

import com.axoncity.metrics.model.CategoryMetric;
import com.axoncity.metrics.model.Confidence;
import com.axoncity.metrics.model.Insight;
import com.axoncity.metrics.model.InsightType;
import com.axoncity.metrics.model.NamedArea;
import com.axoncity.metrics.model.PoiCategory;
import com.axoncity.metrics.model.PoiMetrics;

import java.util.ArrayList;
import java.util.List;

/**
 * Short observations about one area, or about the differences between two. Rules run in a
 * fixed order and the wording never claims causation.
 */
public class InsightGenerator {

    public static final int MAX_INSIGHTS = 4;

    static final double HIGH_DENSITY = 200.0;
    static final double LOW_DENSITY = 50.0;
    static final double DIVERSE_MIX = 1.5;

    static final double DENSITY_DELTA = 50.0;
    static final double COVERAGE_GAP = 20.0;
    static final double DIVERSITY_GAP = 0.3;
    static final double SCALE_DELTA = 100.0;
    static final double FOOD_DELTA = 75.0;

    public List<Insight> generate(List<NamedArea> areas) {
        if (areas == null || areas.isEmpty() || areas.size() > 2) {
            return List.of();
        }
        List<Insight> insights = areas.size() == 1
                ? singleArea(areas.get(0))
                : twoAreas(areas.get(0), areas.get(1));
        return insights.size() > MAX_INSIGHTS ? List.copyOf(insights.subList(0, MAX_INSIGHTS)) : List.copyOf(insights);
    }

    private List<Insight> singleArea(NamedArea area) {
        List<Insight> insights = new ArrayList<>();
        PoiMetrics metrics = area.metrics();

        if (metrics.density() >= HIGH_DENSITY) {
            insights.add(new Insight(
                    "High Amenity Density",
                    area.name() + " has " + Math.round(metrics.density())
                            + " POIs per km², suggesting a service-rich environment.",
                    Confidence.HIGH,
                    List.of("poiDensity"),
                    InsightType.POSITIVE));
        } else if (metrics.density() < LOW_DENSITY) {
            insights.add(new Insight(
                    "Low Amenity Density",
                    area.name() + " has limited amenities (" + Math.round(metrics.density())
                            + " per km²). This may indicate a more residential or rural character.",
                    Confidence.HIGH,
                    List.of("poiDensity"),
                    InsightType.CAUTION));
        }

        if (metrics.diversityIndex() >= DIVERSE_MIX) {
            insights.add(new Insight(
                    "Diverse Amenity Mix",
                    "Good variety of amenity types, suggesting a mixed-use character.",
                    Confidence.MEDIUM,
                    List.of("diversityIndex"),
                    InsightType.POSITIVE));
        }
        return insights;
    }

    private List<Insight> twoAreas(NamedArea a, NamedArea b) {
        List<Insight> insights = new ArrayList<>();
        PoiMetrics metricsA = a.metrics();
        PoiMetrics metricsB = b.metrics();

        if (metricsB.density() > 0) {
            double densityDelta = MetricComparator.delta(metricsA.density(), metricsB.density());
            if (Math.abs(densityDelta) > DENSITY_DELTA) {
                NamedArea higher = densityDelta > 0 ? a : b;
                NamedArea lower = densityDelta > 0 ? b : a;
                insights.add(new Insight(
                        "Significant Density Difference",
                        higher.name() + " has " + Math.abs(Math.round(densityDelta))
                                + "% higher POI density than " + lower.name()
                                + ", suggesting a more service-rich environment.",
                        Confidence.HIGH,
                        List.of("poiDensity"),
                        InsightType.NEUTRAL));
            }
        }

        double coverageGap = metricsA.coverageScore() - metricsB.coverageScore();
        if (Math.abs(coverageGap) > COVERAGE_GAP) {
            NamedArea better = coverageGap > 0 ? a : b;
            NamedArea worse = coverageGap > 0 ? b : a;
            insights.add(new Insight(
                    "Data Coverage Difference",
                    better.name() + " has better data coverage than " + worse.name()
                            + ". Results for " + worse.name() + " may be less complete.",
                    Confidence.MEDIUM,
                    List.of("coverageScore"),
                    InsightType.CAUTION));
        }

        double diversityGap = metricsA.diversityIndex() - metricsB.diversityIndex();
        if (Math.abs(diversityGap) > DIVERSITY_GAP) {
            NamedArea more = diversityGap > 0 ? a : b;
            NamedArea less = diversityGap > 0 ? b : a;
            insights.add(new Insight(
                    "Amenity Diversity",
                    more.name() + " has a more diverse mix of amenity types compared to " + less.name() + ".",
                    Confidence.MEDIUM,
                    List.of("diversityIndex"),
                    InsightType.NEUTRAL));
        }

        if (metricsB.areaKm2() > 0) {
            double sizeDelta = MetricComparator.delta(metricsA.areaKm2(), metricsB.areaKm2());
            if (Math.abs(sizeDelta) > SCALE_DELTA) {
                insights.add(new Insight(
                        "Different Scale",
                        "The areas differ significantly in size (" + Math.abs(Math.round(sizeDelta))
                                + "%). Per km² metrics provide a fairer comparison.",
                        Confidence.HIGH,
                        List.of("areaSize"),
                        InsightType.CAUTION));
            }
        }

        CategoryMetric foodA = metricsA.category(PoiCategory.FOOD);
        CategoryMetric foodB = metricsB.category(PoiCategory.FOOD);
        if (foodA != null && foodB != null && foodA.count() > 0 && foodB.count() > 0 && foodB.density() > 0) {
            double foodDelta = MetricComparator.delta(foodA.density(), foodB.density());
            if (Math.abs(foodDelta) > FOOD_DELTA) {
                NamedArea more = foodDelta > 0 ? a : b;
                insights.add(new Insight(
                        "Dining Options",
                        more.name() + " has noticeably more food & dining options per km².",
                        Confidence.MEDIUM,
                        List.of(PoiCategory.FOOD.id()),
                        InsightType.NEUTRAL));
            }
        }
        return insights;
    }
}
