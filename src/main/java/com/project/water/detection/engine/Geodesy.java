package com.project.water.detection.engine;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;

/**
 * Spherical-earth helpers for WGS84 longitude/latitude geometries.
 */
public final class Geodesy {

    /** Mean earth radius in metres. */
    public static final double EARTH_RADIUS_M = 6_371_008.8;

    /** Length of one degree of latitude in metres. */
    public static final double METERS_PER_DEGREE = EARTH_RADIUS_M * Math.PI / 180.0;

    private Geodesy() {
    }

    /**
     * Area of a polygonal geometry on the sphere, in square metres.
     * Holes are subtracted, non-polygonal components contribute nothing.
     */
    public static double area(Geometry geometry) {
        double total = 0.0;
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Geometry part = geometry.getGeometryN(i);
            if (part instanceof Polygon) {
                total += polygonArea((Polygon) part);
            } else if (part != geometry) {
                total += area(part);
            }
        }
        return total;
    }

    private static double polygonArea(Polygon polygon) {
        double area = Math.abs(ringArea(polygon.getExteriorRing()));
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            area -= Math.abs(ringArea(polygon.getInteriorRingN(i)));
        }
        return Math.max(0.0, area);
    }

    // Exact for edges running along meridians and parallels, which is what traced pixel outlines are.
    private static double ringArea(LinearRing ring) {
        Coordinate[] coords = ring.getCoordinates();
        if (coords.length < 4) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = 0; i < coords.length - 1; i++) {
            double lon1 = Math.toRadians(coords[i].x);
            double lon2 = Math.toRadians(coords[i + 1].x);
            double lat1 = Math.toRadians(coords[i].y);
            double lat2 = Math.toRadians(coords[i + 1].y);
            sum += (lon2 - lon1) * (Math.sin(lat1) + Math.sin(lat2));
        }
        return sum * EARTH_RADIUS_M * EARTH_RADIUS_M / 2.0;
    }

    /** Converts a ground distance to degrees of latitude. */
    public static double metersToDegrees(double meters) {
        return meters / METERS_PER_DEGREE;
    }
}
