package com.axoncity.metrics.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

import static com.axoncity.metrics.model.LayerIds.*;

/**
 * The nine derived indices, in the order they are reported.
 */
public enum DerivedMetricId {

    DIVERSITY_INDEX("diversity_index",
            List.of(POI_FOOD_DRINK, POI_SHOPPING, POI_GROCERY, POI_HEALTH, POI_EDUCATION)),
    GREEN_RATIO("green_ratio",
            List.of(PARKS, WATER)),
    BUILDING_DENSITY("building_density",
            List.of(BUILDINGS_RESIDENTIAL, BUILDINGS_COMMERCIAL, BUILDINGS_INDUSTRIAL, BUILDINGS_OTHER)),
    TRANSIT_COVERAGE("transit_coverage",
            List.of(TRANSIT_STOPS, RAIL_LINES)),
    MIXED_USE_SCORE("mixed_use_score",
            List.of(BUILDINGS_RESIDENTIAL, BUILDINGS_COMMERCIAL)),
    WALKABILITY_PROXY("walkability_proxy",
            List.of(POI_FOOD_DRINK, POI_SHOPPING, POI_GROCERY, POI_HEALTH, POI_EDUCATION,
                    PARKS, TRANSIT_STOPS, ROADS_PRIMARY, ROADS_RESIDENTIAL)),
    FIFTEEN_MIN_SCORE("fifteen_min_score",
            List.of(POI_FOOD_DRINK, POI_GROCERY, POI_HEALTH, POI_EDUCATION, PARKS, TRANSIT_STOPS)),
    BIKE_SCORE("bike_score",
            List.of(BIKE_LANES, POI_BIKE_PARKING, POI_BIKE_SHOPS, ROADS_PRIMARY, ROADS_RESIDENTIAL)),
    STREET_CONNECTIVITY("street_connectivity",
            List.of(ROADS_PRIMARY, ROADS_RESIDENTIAL));

    private final String id;
    private final List<String> requiredLayers;

    DerivedMetricId(String id, List<String> requiredLayers) {
        this.id = id;
        this.requiredLayers = requiredLayers;
    }

    @JsonValue
    public String id() {
        return id;
    }

    public List<String> requiredLayers() {
        return requiredLayers;
    }

    @JsonCreator
    public static DerivedMetricId fromId(String id) {
        for (DerivedMetricId metric : values()) {
            if (metric.id.equals(id)) {
                return metric;
            }
        }
        throw new IllegalArgumentException("Unknown derived metric: " + id);
    }

    public static boolean isDerived(String id) {
        for (DerivedMetricId metric : values()) {
            if (metric.id.equals(id)) {
                return true;
            }
        }
        return false;
    }
}
