package com.axoncity.metrics.model;

import java.util.List;

import static com.axoncity.metrics.model.LayerIds.*;

public enum PoiCategory {

    FOOD("food", "Food & Dining", "#FF5733", List.of(POI_FOOD_DRINK)),
    SHOPPING("shopping", "Retail & Shopping", "#FFC300", List.of(POI_SHOPPING)),
    GROCERY("grocery", "Grocery & Convenience", "#4CAF50", List.of(POI_GROCERY)),
    HEALTH("health", "Healthcare", "#F44336", List.of(POI_HEALTH)),
    EDUCATION("education", "Education", "#673AB7", List.of(POI_EDUCATION)),
    BIKE("bike", "Cycling Infrastructure", "#00BCD4", List.of(POI_BIKE_PARKING, POI_BIKE_SHOPS, BIKE_LANES)),
    TRANSIT("transit", "Public Transit", "#0080FF", List.of(TRANSIT_STOPS, RAIL_LINES)),
    GREEN("green", "Green Space", "#228B22", List.of(PARKS, TREES));

    private final String id;
    private final String displayName;
    private final String color;
    private final List<String> layerIds;

    PoiCategory(String id, String displayName, String color, List<String> layerIds) {
        this.id = id;
        this.displayName = displayName;
        this.color = color;
        this.layerIds = layerIds;
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    public String color() {
        return color;
    }

    public List<String> layerIds() {
        return layerIds;
    }

    public long count(AreaContext context) {
        long total = 0;
        for (String layerId : layerIds) {
            total += context.count(layerId);
        }
        return total;
    }
}
