package com.axoncity.metrics.model;

import com.axoncity.metrics.geometry.GeodesicArea;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of everything the calculators read for one area: its size, its outline
 * (optional) and the statistics of each loaded layer.
 */
public record AreaContext(
        double areaKm2,
        AreaGeometry geometry,
        Map<String, LayerStats> layers
) {

    public AreaContext {
        if (!Double.isFinite(areaKm2) || areaKm2 < 0.0) {
            throw new IllegalArgumentException("areaKm2 must be a finite, non-negative number: " + areaKm2);
        }
        layers = layers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(layers));
    }

    public static AreaContext of(double areaKm2, Map<String, LayerStats> layers) {
        return new AreaContext(areaKm2, null, layers);
    }

    public static AreaContext fromGeometry(AreaGeometry geometry, Map<String, LayerStats> layers) {
        return new AreaContext(GeodesicArea.areaKm2(geometry), geometry, layers);
    }

    public LayerStats layer(String layerId) {
        LayerStats stats = layers.get(layerId);
        return stats != null ? stats : LayerStats.EMPTY;
    }

    public int count(String layerId) {
        return layer(layerId).featureCount();
    }

    public double areaM2(String layerId) {
        return layer(layerId).totalAreaM2();
    }

    public double lengthM(String layerId) {
        return layer(layerId).totalLengthM();
    }
}
