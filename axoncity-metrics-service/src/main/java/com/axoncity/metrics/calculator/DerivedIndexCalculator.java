package com.axoncity.metrics.calculator;

import com.axoncity.metrics.model.AreaContext;
import com.axoncity.metrics.model.Confidence;
import com.axoncity.metrics.model.DerivedMetricId;
import com.axoncity.metrics.model.DerivedMetricValue;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.axoncity.metrics.model.LayerIds.*;

/**
 * Nine 0-100 urban indices computed from layer statistics. Every division by area or count is
 * guarded and every final value is clamped, so no input produces NaN or an exception; missing
 * data shows up as a lower {@link Confidence} instead.
 */
public class DerivedIndexCalculator {

    static final double M2_PER_KM2 = 1_000_000.0;
    static final double ROAD_METRES_PER_INTERSECTION = 200.0;

    static final double TRANSIT_RAIL_WEIGHT = 2.0;
    static final double TRANSIT_BUS_WEIGHT = 1.0;
    static final double TRANSIT_HIGH_DENSITY = 50.0;

    static final double WALK_AMENITY_SHARE = 0.85;
    static final double WALK_MAX_PEDESTRIAN_BONUS = 15.0;
    static final double GOOD_INTERSECTION_DENSITY = 100.0;

    static final double BIKE_INFRASTRUCTURE_WEIGHT = 0.50;
    static final double BIKE_AMENITIES_WEIGHT = 0.30;
    static final double BIKE_CONNECTIVITY_WEIGHT = 0.20;
    static final double BIKE_EXCELLENT_LANE_DENSITY = 5.0;
    static final double BIKE_EXCELLENT_PARKING_DENSITY = 50.0;
    static final double BIKE_EXCELLENT_SHOP_DENSITY = 2.0;

    private static final List<WalkCategory> WALK_CATEGORIES = List.of(
            new WalkCategory("grocery", POI_GROCERY, 3, 5),
            new WalkCategory("restaurants", POI_FOOD_DRINK, 3, 10),
            new WalkCategory("shopping", POI_SHOPPING, 2, 5),
            new WalkCategory("coffee", POI_FOOD_DRINK, 2, 4),
            new WalkCategory("parks", PARKS, 2, 3),
            new WalkCategory("schools", POI_EDUCATION, 2, 3),
            new WalkCategory("healthcare", POI_HEALTH, 1, 2)
    );

    private static final List<EssentialCategory> ESSENTIAL_CATEGORIES = List.of(
            new EssentialCategory("food", List.of(POI_FOOD_DRINK, POI_GROCERY)),
            new EssentialCategory("healthcare", List.of(POI_HEALTH)),
            new EssentialCategory("education", List.of(POI_EDUCATION)),
            new EssentialCategory("green_space", List.of(PARKS)),
            new EssentialCategory("transit", List.of(TRANSIT_STOPS, RAIL_LINES))
    );

    private static final List<String> ROAD_LAYERS = List.of(ROADS_PRIMARY, ROADS_RESIDENTIAL);

    public List<DerivedMetricValue> calculateAll(AreaContext context) {
        return List.of(
                diversityIndex(context),
                greenRatio(context),
                buildingDensity(context),
                transitCoverage(context),
                mixedUseScore(context),
                walkabilityProxy(context),
                fifteenMinuteScore(context),
                bikeScore(context),
                streetConnectivity(context)
        );
    }

    public DerivedMetricValue calculate(DerivedMetricId metricId, AreaContext context) {
        return switch (metricId) {
            case DIVERSITY_INDEX -> diversityIndex(context);
            case GREEN_RATIO -> greenRatio(context);
            case BUILDING_DENSITY -> buildingDensity(context);
            case TRANSIT_COVERAGE -> transitCoverage(context);
            case MIXED_USE_SCORE -> mixedUseScore(context);
            case WALKABILITY_PROXY -> walkabilityProxy(context);
            case FIFTEEN_MIN_SCORE -> fifteenMinuteScore(context);
            case BIKE_SCORE -> bikeScore(context);
            case STREET_CONNECTIVITY -> streetConnectivity(context);
        };
    }

    /**
     * Shannon entropy of the five POI layer counts, normalized by {@code ln(5)}.
     */
    public DerivedMetricValue diversityIndex(AreaContext context) {
        List<String> layers = DerivedMetricId.DIVERSITY_INDEX.requiredLayers();
        Map<String, Double> breakdown = new LinkedHashMap<>();
        long[] counts = new long[layers.size()];
        int present = 0;
        for (int i = 0; i < layers.size(); i++) {
            counts[i] = context.count(layers.get(i));
            breakdown.put(layers.get(i), (double) counts[i]);
            if (counts[i] > 0) {
                present++;
            }
        }

        double entropy = PoiMetricsCalculator.shannonIndex(counts);
        double maxEntropy = Math.log(layers.size());
        breakdown.put("entropy", entropy);
        breakdown.put("max_entropy", maxEntropy);

        if (present == 0) {
            return result(DerivedMetricId.DIVERSITY_INDEX, 0.0, Confidence.LOW, breakdown);
        }
        double value = maxEntropy > 0 ? entropy / maxEntropy * 100.0 : 0.0;
        return result(DerivedMetricId.DIVERSITY_INDEX, value,
                Confidence.fromShare(present, layers.size()), breakdown);
    }

    public DerivedMetricValue greenRatio(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        AreaShare share = areaShare(context, DerivedMetricId.GREEN_RATIO.requiredLayers(), breakdown);
        breakdown.put("total_green_area_m2", share.totalM2());
        breakdown.put("area_m2", share.areaM2());

        Confidence confidence = share.layersWithArea() > 0 && share.areaM2() > 0
                ? Confidence.HIGH
                : Confidence.LOW;
        return result(DerivedMetricId.GREEN_RATIO, share.percent(), confidence, breakdown);
    }

    public DerivedMetricValue buildingDensity(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        AreaShare share = areaShare(context, DerivedMetricId.BUILDING_DENSITY.requiredLayers(), breakdown);
        breakdown.put("total_building_area_m2", share.totalM2());
        breakdown.put("area_m2", share.areaM2());

        Confidence confidence;
        if (share.areaM2() <= 0 || share.layersWithArea() == 0) {
            confidence = Confidence.LOW;
        } else if (share.layersWithArea() >= 2) {
            confidence = Confidence.HIGH;
        } else {
            confidence = Confidence.MEDIUM;
        }
        return result(DerivedMetricId.BUILDING_DENSITY, share.percent(), confidence, breakdown);
    }

    /**
     * Mode-weighted stop density, log-normalized so that 50 weighted stops per km² scores 100.
     */
    public DerivedMetricValue transitCoverage(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        int railCount = context.count(RAIL_LINES);
        int busCount = context.count(TRANSIT_STOPS);

        breakdown.put(RAIL_LINES + "_count", (double) railCount);
        breakdown.put(RAIL_LINES + "_weighted", railCount * TRANSIT_RAIL_WEIGHT);
        breakdown.put(TRANSIT_STOPS + "_count", (double) busCount);
        breakdown.put(TRANSIT_STOPS + "_weighted", busCount * TRANSIT_BUS_WEIGHT);

        double weightedSum = railCount * TRANSIT_RAIL_WEIGHT + busCount * TRANSIT_BUS_WEIGHT;
        breakdown.put("total_stops", (double) railCount + busCount);
        breakdown.put("weighted_sum", weightedSum);

        double areaKm2 = context.areaKm2();
        if (weightedSum == 0 || areaKm2 <= 0) {
            breakdown.put("weighted_density", 0.0);
            breakdown.put("raw_score", 0.0);
            return result(DerivedMetricId.TRANSIT_COVERAGE, 0.0, Confidence.LOW, breakdown);
        }

        double weightedDensity = weightedSum / areaKm2;
        double score = logScore(weightedDensity, TRANSIT_HIGH_DENSITY);
        breakdown.put("weighted_density", weightedDensity);
        breakdown.put("raw_score", score);

        Confidence confidence;
        if (railCount > 0 && busCount > 0) {
            confidence = Confidence.HIGH;
        } else if (railCount > 0 || busCount > 0) {
            confidence = Confidence.MEDIUM;
        } else {
            confidence = Confidence.LOW;
        }
        return result(DerivedMetricId.TRANSIT_COVERAGE, score, confidence, breakdown);
    }

    /**
     * 100 when residential and commercial footprint are equal, 0 when only one of them exists.
     */
    public DerivedMetricValue mixedUseScore(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double residential = context.areaM2(BUILDINGS_RESIDENTIAL);
        double commercial = context.areaM2(BUILDINGS_COMMERCIAL);
        breakdown.put(BUILDINGS_RESIDENTIAL, residential);
        breakdown.put(BUILDINGS_COMMERCIAL, commercial);

        double total = residential + commercial;
        if (total <= 0) {
            breakdown.put("residential_ratio", 0.0);
            breakdown.put("commercial_ratio", 0.0);
            return result(DerivedMetricId.MIXED_USE_SCORE, 0.0, Confidence.LOW, breakdown);
        }

        double residentialRatio = residential / total;
        double commercialRatio = commercial / total;
        breakdown.put("residential_ratio", residentialRatio);
        breakdown.put("commercial_ratio", commercialRatio);

        double value = (1.0 - Math.abs(residentialRatio - commercialRatio)) * 100.0;
        return result(DerivedMetricId.MIXED_USE_SCORE, value, Confidence.HIGH, breakdown);
    }

    /**
     * Weighted amenity score (at most 85 points) plus a pedestrian bonus of up to 15 points from
     * estimated intersection density.
     */
    public DerivedMetricValue walkabilityProxy(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double areaKm2 = context.areaKm2();

        double weightedScore = 0.0;
        double totalWeight = 0.0;
        int categoriesWithData = 0;
        for (WalkCategory category : WALK_CATEGORIES) {
            int count = context.count(category.layerId());
            double density = areaKm2 > 0 ? count / areaKm2 : 0.0;
            double score = decayScore(density, category.maxCount() * 2.0);

            breakdown.put(category.id() + "_count", (double) count);
            breakdown.put(category.id() + "_score", score);

            weightedScore += score * category.weight();
            totalWeight += category.weight();
            if (count > 0) {
                categoriesWithData++;
            }
        }

        double amenity = totalWeight > 0 ? weightedScore / totalWeight * WALK_AMENITY_SHARE : 0.0;
        double intersectionDensity = intersectionDensity(context);
        double bonus = Math.min(WALK_MAX_PEDESTRIAN_BONUS,
                intersectionDensity / GOOD_INTERSECTION_DENSITY * WALK_MAX_PEDESTRIAN_BONUS);

        breakdown.put("intersection_density", intersectionDensity);
        breakdown.put("pedestrian_bonus", bonus);
        breakdown.put("amenity_component", amenity);
        breakdown.put("categories_with_data", (double) categoriesWithData);

        Confidence confidence;
        if (areaKm2 <= 0 || categoriesWithData < 3) {
            confidence = Confidence.LOW;
        } else if (categoriesWithData >= 5) {
            confidence = Confidence.HIGH;
        } else {
            confidence = Confidence.MEDIUM;
        }
        return result(DerivedMetricId.WALKABILITY_PROXY, Math.min(100.0, amenity + bonus), confidence, breakdown);
    }

    /**
     * Share of the five essential category groups with at least one feature. Presence only, so
     * the confidence is always high.
     */
    public DerivedMetricValue fifteenMinuteScore(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        int present = 0;
        for (EssentialCategory category : ESSENTIAL_CATEGORIES) {
            boolean hasAccess = category.layerIds().stream().anyMatch(layerId -> context.count(layerId) > 0);
            breakdown.put(category.id(), hasAccess ? 1.0 : 0.0);
            if (hasAccess) {
                present++;
            }
        }
        breakdown.put("categories_present", (double) present);

        double value = (double) present / ESSENTIAL_CATEGORIES.size() * 100.0;
        return result(DerivedMetricId.FIFTEEN_MIN_SCORE, value, Confidence.HIGH, breakdown);
    }

    /**
     * Infrastructure 50%, amenities 30%, connectivity 20%.
     */
    public DerivedMetricValue bikeScore(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double areaKm2 = context.areaKm2();

        double laneLength = context.lengthM(BIKE_LANES);
        int parkingCount = context.count(POI_BIKE_PARKING);
        int shopsCount = context.count(POI_BIKE_SHOPS);

        double laneDensity = 0.0;
        double infrastructure = 0.0;
        double parkingDensity = 0.0;
        double shopsDensity = 0.0;
        double parkingScore = 0.0;
        double shopsScore = 0.0;
        double amenities = 0.0;
        double intersectionDensity = 0.0;
        double connectivity = 0.0;

        if (areaKm2 > 0) {
            laneDensity = laneLength / 1000.0 / areaKm2;
            infrastructure = logScore(laneDensity, BIKE_EXCELLENT_LANE_DENSITY);

            parkingDensity = parkingCount / areaKm2;
            shopsDensity = shopsCount / areaKm2;
            parkingScore = logScore(parkingDensity, BIKE_EXCELLENT_PARKING_DENSITY);
            shopsScore = logScore(shopsDensity, BIKE_EXCELLENT_SHOP_DENSITY);
            amenities = parkingScore * 0.7 + shopsScore * 0.3;

            intersectionDensity = intersectionDensity(context);
            connectivity = Math.min(100.0, intersectionDensity / GOOD_INTERSECTION_DENSITY * 100.0);
        }

        double weightedInfrastructure = infrastructure * BIKE_INFRASTRUCTURE_WEIGHT;
        double weightedAmenities = amenities * BIKE_AMENITIES_WEIGHT;
        double weightedConnectivity = connectivity * BIKE_CONNECTIVITY_WEIGHT;

        breakdown.put("bike_lane_length_m", areaKm2 > 0 ? laneLength : 0.0);
        breakdown.put("bike_lane_density", laneDensity);
        breakdown.put("infrastructure_score", infrastructure);
        breakdown.put("bike_parking_count", areaKm2 > 0 ? parkingCount : 0.0);
        breakdown.put("bike_shops_count", areaKm2 > 0 ? shopsCount : 0.0);
        breakdown.put("parking_density", parkingDensity);
        breakdown.put("shops_density", shopsDensity);
        breakdown.put("parking_score", parkingScore);
        breakdown.put("shops_score", shopsScore);
        breakdown.put("amenities_score", amenities);
        breakdown.put("intersection_density", intersectionDensity);
        breakdown.put("connectivity_score", connectivity);
        breakdown.put("weighted_infrastructure", weightedInfrastructure);
        breakdown.put("weighted_amenities", weightedAmenities);
        breakdown.put("weighted_connectivity", weightedConnectivity);

        if (areaKm2 <= 0) {
            return result(DerivedMetricId.BIKE_SCORE, 0.0, Confidence.LOW, breakdown);
        }

        boolean hasInfrastructure = laneLength > 0;
        boolean hasAmenities = parkingCount > 0 || shopsCount > 0;
        Confidence confidence;
        if (hasInfrastructure && hasAmenities) {
            confidence = Confidence.HIGH;
        } else if (hasInfrastructure || hasAmenities) {
            confidence = Confidence.MEDIUM;
        } else {
            confidence = Confidence.LOW;
        }
        return result(DerivedMetricId.BIKE_SCORE,
                weightedInfrastructure + weightedAmenities + weightedConnectivity, confidence, breakdown);
    }

    /**
     * Estimated intersections per km², one intersection per 200 m of road.
     */
    public DerivedMetricValue streetConnectivity(AreaContext context) {
        Map<String, Double> breakdown = new LinkedHashMap<>();
        double totalLength = 0.0;
        int present = 0;
        for (String layerId : ROAD_LAYERS) {
            double length = context.lengthM(layerId);
            breakdown.put(layerId, length);
            totalLength += length;
            if (length > 0) {
                present++;
            }
        }

        double intersections = totalLength / ROAD_METRES_PER_INTERSECTION;
        double density = context.areaKm2() > 0 ? intersections / context.areaKm2() : 0.0;
        breakdown.put("total_road_length_m", totalLength);
        breakdown.put("estimated_intersections", intersections);
        breakdown.put("intersection_density", density);

        Confidence confidence = context.areaKm2() > 0
                ? Confidence.fromShare(present, ROAD_LAYERS.size())
                : Confidence.LOW;
        return result(DerivedMetricId.STREET_CONNECTIVITY, density, confidence, breakdown);
    }

    static double intersectionDensity(AreaContext context) {
        if (context.areaKm2() <= 0) {
            return 0.0;
        }
        double totalLength = 0.0;
        for (String layerId : ROAD_LAYERS) {
            totalLength += context.lengthM(layerId);
        }
        return totalLength / ROAD_METRES_PER_INTERSECTION / context.areaKm2();
    }

    /**
     * {@code 100 · ln(1 + density) / ln(1 + benchmark)}, capped at 100.
     */
    static double logScore(double density, double benchmark) {
        if (density <= 0) {
            return 0.0;
        }
        return Math.min(100.0, Math.log1p(density) / Math.log1p(benchmark) * 100.0);
    }

    /**
     * Density stand-in for distance decay: saturates once density reaches {@code maxDensity}.
     */
    static double decayScore(double density, double maxDensity) {
        if (density <= 0 || maxDensity <= 0) {
            return 0.0;
        }
        double normalized = Math.min(density / maxDensity, 1.0);
        return Math.min(100.0, Math.log1p(normalized * 10.0) / Math.log1p(10.0) * 100.0);
    }

    static double clamp(double value) {
        if (!Double.isFinite(value)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(100.0, value));
    }

    private static AreaShare areaShare(AreaContext context, List<String> layers, Map<String, Double> breakdown) {
        double total = 0.0;
        int withArea = 0;
        for (String layerId : layers) {
            double area = context.areaM2(layerId);
            breakdown.put(layerId, area);
            total += area;
            if (area > 0) {
                withArea++;
            }
        }
        double areaM2 = context.areaKm2() * M2_PER_KM2;
        double percent = areaM2 > 0 ? total / areaM2 * 100.0 : 0.0;
        return new AreaShare(total, areaM2, percent, withArea);
    }

    private static DerivedMetricValue result(DerivedMetricId metricId, double value,
                                             Confidence confidence, Map<String, Double> breakdown) {
        return new DerivedMetricValue(metricId, clamp(value), confidence, breakdown);
    }

    private record AreaShare(double totalM2, double areaM2, double percent, int layersWithArea) {
    }

    private record WalkCategory(String id, String layerId, int weight, int maxCount) {
    }

    private record EssentialCategory(String id, List<String> layerIds) {
    }
}
