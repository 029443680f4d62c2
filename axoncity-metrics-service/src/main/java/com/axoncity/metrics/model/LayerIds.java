package com.axoncity.metrics.model;

import java.util.Set;

/**
 * Identifiers of the map layers the engine knows about. Layers outside this set are
 * accepted in requests and simply never read.
 */
public final class LayerIds {

    public static final String BUILDINGS_RESIDENTIAL = "buildings-residential";
    public static final String BUILDINGS_COMMERCIAL = "buildings-commercial";
    public static final String BUILDINGS_INDUSTRIAL = "buildings-industrial";
    public static final String BUILDINGS_OTHER = "buildings-other";

    public static final String ROADS_PRIMARY = "roads-primary";
    public static final String ROADS_RESIDENTIAL = "roads-residential";
    public static final String BIKE_LANES = "bike-lanes";
    public static final String CROSSWALKS = "crosswalks";

    public static final String TRANSIT_STOPS = "transit-stops";
    public static final String RAIL_LINES = "rail-lines";
    public static final String PARKING = "parking";

    public static final String TRAFFIC_SIGNALS = "traffic-signals";

    public static final String PARKS = "parks";
    public static final String WATER = "water";
    public static final String TREES = "trees";

    public static final String POI_FOOD_DRINK = "poi-food-drink";
    public static final String POI_SHOPPING = "poi-shopping";
    public static final String POI_GROCERY = "poi-grocery";
    public static final String POI_HEALTH = "poi-health";
    public static final String POI_EDUCATION = "poi-education";
    public static final String POI_BIKE_PARKING = "poi-bike-parking";
    public static final String POI_BIKE_SHOPS = "poi-bike-shops";

    public static final Set<String> KNOWN = Set.of(
            BUILDINGS_RESIDENTIAL, BUILDINGS_COMMERCIAL, BUILDINGS_INDUSTRIAL, BUILDINGS_OTHER,
            ROADS_PRIMARY, ROADS_RESIDENTIAL, BIKE_LANES, CROSSWALKS,
            TRANSIT_STOPS, RAIL_LINES, PARKING,
            TRAFFIC_SIGNALS,
            PARKS, WATER, TREES,
            POI_FOOD_DRINK, POI_SHOPPING, POI_GROCERY, POI_HEALTH, POI_EDUCATION,
            POI_BIKE_PARKING, POI_BIKE_SHOPS
    );

    public static boolean isKnown(String layerId) {
        return layerId != null && KNOWN.contains(layerId);
    }

    private LayerIds() {}
}
