package com.axoncity.metrics.calculator;

import com.axoncity.metrics.model.AreaContext;
import com.axoncity.metrics.model.CategoryMetric;
import com.axoncity.metrics.model.PoiCategory;
import com.axoncity.metrics.model.PoiMetrics;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Counts, densities and the Shannon diversity of the eight POI categories of an area.
 */
public class PoiMetricsCalculator {

    private final Clock clock;

    public PoiMetricsCalculator(Clock clock) {
        this.clock = clock;
    }

    public PoiMetrics calculate(AreaContext context) {
        double areaKm2 = context.areaKm2();

        long[] counts = new long[PoiCategory.values().length];
        long totalCount = 0;
        for (PoiCategory category : PoiCategory.values()) {
            long count = category.count(context);
            counts[category.ordinal()] = count;
            totalCount += count;
        }

        List<CategoryMetric> breakdown = new ArrayList<>(counts.length);
        int categoriesWithData = 0;
        for (PoiCategory category : PoiCategory.values()) {
            long count = counts[category.ordinal()];
            if (count > 0) {
                categoriesWithData++;
            }
            breakdown.add(new CategoryMetric(
                    category.id(),
                    category.displayName(),
                    count,
                    perKm2(count, areaKm2),
                    totalCount > 0 ? (double) count / totalCount * 100.0 : 0.0,
                    category.color()
            ));
        }

        double diversity = shannonIndex(counts);
        double coverage = (double) categoriesWithData / counts.length * 100.0;

        return new PoiMetrics(
                totalCount,
                perKm2(totalCount, areaKm2),
                diversity,
                diversityLabel(diversity),
                breakdown,
                coverage,
                coverageLabel(coverage),
                areaKm2,
                Instant.now(clock)
        );
    }

    /**
     * {@code H = -Σ p ln p} over the non-zero counts; 0 when every count is 0.
     */
    public static double shannonIndex(long[] counts) {
        long total = 0;
        for (long count : counts) {
            total += count;
        }
        if (total == 0) {
            return 0.0;
        }
        double entropy = 0.0;
        for (long count : counts) {
            if (count > 0) {
                double p = (double) count / total;
                entropy -= p * Math.log(p);
            }
        }
        return entropy;
    }

    public static String diversityLabel(double index) {
        if (index == 0.0) {
            return "None";
        }
        if (index < 0.5) {
            return "Very Low";
        }
        if (index < 1.0) {
            return "Low";
        }
        if (index < 1.5) {
            return "Moderate";
        }
        if (index < 2.0) {
            return "High";
        }
        return "Very High";
    }

    public static String coverageLabel(double score) {
        if (score >= 90) {
            return "Excellent";
        }
        if (score >= 70) {
            return "Good";
        }
        if (score >= 50) {
            return "Partial";
        }
        return "Limited";
    }

    private static double perKm2(long count, double areaKm2) {
        return areaKm2 > 0 ? count / areaKm2 : 0.0;
    }
}
