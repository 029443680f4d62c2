package com.axoncity.metrics.calculator;

import com.axoncity.metrics.model.AreaContext;
import com.axoncity.metrics.model.CategoryMetric;
import com.axoncity.metrics.model.LayerStats;
import com.axoncity.metrics.model.PoiCategory;
import com.axoncity.metrics.model.PoiMetrics;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static com.axoncity.metrics.model.LayerIds.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PoiMetricsCalculatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final PoiMetricsCalculator calculator =
            new PoiMetricsCalculator(Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void singleFoodLayer_givesDensityCoverageAndZeroDiversity() {
        AreaContext context = AreaContext.of(1.0, Map.of(POI_FOOD_DRINK, LayerStats.ofCount(100)));

        PoiMetrics metrics = calculator.calculate(context);

        assertThat(metrics.totalCount()).isEqualTo(100);
        assertThat(metrics.density()).isEqualTo(100.0);
        assertThat(metrics.coverageScore()).isEqualTo(12.5);
        assertThat(metrics.coverageLabel()).isEqualTo("Limited");
        assertThat(metrics.diversityIndex()).isZero();
        assertThat(metrics.diversityLabel()).isEqualTo("None");
        assertThat(metrics.timestamp()).isEqualTo(NOW);
        assertThat(metrics.category(PoiCategory.FOOD).share()).isEqualTo(100.0);
    }

    @Test
    void zeroArea_keepsCountsButDensityIsZero() {
        AreaContext context = AreaContext.of(0.0, Map.of(
                POI_SHOPPING, LayerStats.ofCount(40),
                PARKS, LayerStats.ofCount(3)));

        PoiMetrics metrics = calculator.calculate(context);

        assertThat(metrics.totalCount()).isEqualTo(43);
        assertThat(metrics.density()).isZero();
        assertThat(metrics.categoryBreakdown())
                .extracting(CategoryMetric::density)
                .allMatch(density -> density == 0.0);
    }

    @Test
    void everyCategoryPresent_givesFullCoverageAndSharesSumToHundred() {
        Map<String, LayerStats> layers = new HashMap<>();
        layers.put(POI_FOOD_DRINK, LayerStats.ofCount(12));
        layers.put(POI_SHOPPING, LayerStats.ofCount(7));
        layers.put(POI_GROCERY, LayerStats.ofCount(3));
        layers.put(POI_HEALTH, LayerStats.ofCount(2));
        layers.put(POI_EDUCATION, LayerStats.ofCount(5));
        layers.put(BIKE_LANES, LayerStats.ofCount(1));
        layers.put(RAIL_LINES, LayerStats.ofCount(9));
        layers.put(TREES, LayerStats.ofCount(31));

        PoiMetrics metrics = calculator.calculate(AreaContext.of(2.5, layers));

        assertThat(metrics.coverageScore()).isEqualTo(100.0);
        assertThat(metrics.coverageLabel()).isEqualTo("Excellent");
        double shareSum = metrics.categoryBreakdown().stream().mapToDouble(CategoryMetric::share).sum();
        assertThat(shareSum).isCloseTo(100.0, within(1e-6));
        assertThat(metrics.density()).isCloseTo(70 / 2.5, within(1e-9));
    }

    @Test
    void twoEqualCategories_giveLnTwoDiversity() {
        AreaContext context = AreaContext.of(1.0, Map.of(
                POI_GROCERY, LayerStats.ofCount(10),
                POI_HEALTH, LayerStats.ofCount(10)));

        PoiMetrics metrics = calculator.calculate(context);

        assertThat(metrics.diversityIndex()).isCloseTo(Math.log(2), within(1e-12));
        assertThat(metrics.diversityLabel()).isEqualTo("Low");
        assertThat(metrics.coverageScore()).isEqualTo(25.0);
    }

    @Test
    void bikeCategory_sumsAllItsLayers() {
        AreaContext context = AreaContext.of(1.0, Map.of(
                POI_BIKE_PARKING, LayerStats.ofCount(4),
                POI_BIKE_SHOPS, LayerStats.ofCount(1),
                BIKE_LANES, new LayerStats(6, 0.0, 1200.0)));

        PoiMetrics metrics = calculator.calculate(context);

        assertThat(metrics.category(PoiCategory.BIKE).count()).isEqualTo(11);
    }

    @Test
    void noData_givesAllZeroMetrics() {
        PoiMetrics metrics = calculator.calculate(AreaContext.of(3.0, Map.of()));

        assertThat(metrics.totalCount()).isZero();
        assertThat(metrics.density()).isZero();
        assertThat(metrics.diversityIndex()).isZero();
        assertThat(metrics.coverageScore()).isZero();
        assertThat(metrics.categoryBreakdown()).hasSize(8)
                .allMatch(category -> category.share() == 0.0 && category.count() == 0);
    }

    @Test
    void countsBeyondIntRange_doNotOverflow() {
        AreaContext context = AreaContext.of(1.0, Map.of(
                POI_FOOD_DRINK, LayerStats.ofCount(Integer.MAX_VALUE),
                POI_SHOPPING, LayerStats.ofCount(Integer.MAX_VALUE)));

        PoiMetrics metrics = calculator.calculate(context);

        assertThat(metrics.totalCount()).isEqualTo(2L * Integer.MAX_VALUE);
        assertThat(metrics.density()).isEqualTo(2.0 * Integer.MAX_VALUE);
        assertThat(metrics.category(PoiCategory.FOOD).share()).isEqualTo(50.0);
        assertThat(metrics.category(PoiCategory.SHOPPING).share()).isEqualTo(50.0);
        assertThat(metrics.diversityIndex()).isCloseTo(Math.log(2), within(1e-12));
    }

    @Test
    void labels_followFixedThresholds() {
        assertThat(PoiMetricsCalculator.diversityLabel(0.49)).isEqualTo("Very Low");
        assertThat(PoiMetricsCalculator.diversityLabel(1.0)).isEqualTo("Moderate");
        assertThat(PoiMetricsCalculator.diversityLabel(1.99)).isEqualTo("High");
        assertThat(PoiMetricsCalculator.diversityLabel(2.0)).isEqualTo("Very High");

        assertThat(PoiMetricsCalculator.coverageLabel(90)).isEqualTo("Excellent");
        assertThat(PoiMetricsCalculator.coverageLabel(75)).isEqualTo("Good");
        assertThat(PoiMetricsCalculator.coverageLabel(50)).isEqualTo("Partial");
        assertThat(PoiMetricsCalculator.coverageLabel(49.9)).isEqualTo("Limited");
    }
}
