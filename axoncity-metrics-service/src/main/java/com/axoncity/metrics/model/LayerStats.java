package com.axoncity.metrics.model;

/**
 * Scalar statistics of one map layer, already clipped to the area of interest.
 */
public record LayerStats(
        int featureCount,
        double totalAreaM2,
        double totalLengthM
) {

    public static final LayerStats EMPTY = new LayerStats(0, 0.0, 0.0);

    public LayerStats {
        if (featureCount < 0) {
            throw new IllegalArgumentException("featureCount must not be negative: " + featureCount);
        }
        requireNonNegative("totalAreaM2", totalAreaM2);
        requireNonNegative("totalLengthM", totalLengthM);
    }

    public static LayerStats ofCount(int featureCount) {
        return new LayerStats(featureCount, 0.0, 0.0);
    }

    public static LayerStats ofArea(double totalAreaM2) {
        return new LayerStats(0, totalAreaM2, 0.0);
    }

    public static LayerStats ofLength(double totalLengthM) {
        return new LayerStats(0, 0.0, totalLengthM);
    }

    private static void requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0.0) {
            throw new IllegalArgumentException(field + " must be a finite, non-negative number: " + value);
        }
    }
}
