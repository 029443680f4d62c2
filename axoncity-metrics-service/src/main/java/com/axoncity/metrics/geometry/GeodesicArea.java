package com.axoncity.metrics.geometry;

import com.axoncity.metrics.model.AreaGeometry;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Polygon;

/**
 * Area of WGS84 polygons on a sphere of the mean earth radius, using the spherical-excess ring
 * formula (Chamberlain and Duquette, "Some Algorithms for Polygons on a Sphere", JPL 2007).
 * JTS coordinates are read as {@code x = lon}, {@code y = lat}.
 */
public final class GeodesicArea {

    public static final double EARTH_RADIUS_M = 6_371_008.8;

    private static final double M2_PER_KM2 = 1_000_000.0;

    private GeodesicArea() {
    }

    public static double areaKm2(AreaGeometry geometry) {
        return areaM2(geometry) / M2_PER_KM2;
    }

    public static double areaM2(AreaGeometry geometry) {
        if (geometry == null) {
            return 0.0;
        }
        double total = 0.0;
        for (Polygon polygon : geometry.polygons()) {
            total += polygonArea(polygon);
        }
        return total;
    }

    /**
     * Exterior ring minus holes. A polygon whose holes exceed its outline yields 0.
     */
    static double polygonArea(Polygon polygon) {
        if (polygon.isEmpty()) {
            return 0.0;
        }
        double area = Math.abs(ringArea(polygon.getExteriorRing().getCoordinates()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            area -= Math.abs(ringArea(polygon.getInteriorRingN(i).getCoordinates()));
        }
        return Math.max(0.0, area);
    }

    static double ringArea(Coordinate[] ring) {
        int n = ring.length;
        if (n <= 2) {
            return 0.0;
        }
        double total = 0.0;
        for (int i = 0; i < n; i++) {
            Coordinate lower;
            Coordinate middle;
            Coordinate upper;
            if (i == n - 2) {
                lower = ring[n - 2];
                middle = ring[n - 1];
                upper = ring[0];
            } else if (i == n - 1) {
                lower = ring[n - 1];
                middle = ring[0];
                upper = ring[1];
            } else {
                lower = ring[i];
                middle = ring[i + 1];
                upper = ring[i + 2];
            }
            total += (Math.toRadians(upper.x) - Math.toRadians(lower.x))
                    * Math.sin(Math.toRadians(middle.y));
        }
        return total * EARTH_RADIUS_M * EARTH_RADIUS_M / 2.0;
    }
}
