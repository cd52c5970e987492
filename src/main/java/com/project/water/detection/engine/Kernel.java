package com.project.water.detection.engine;

/**
 * Neighbourhood used by focal filters.
 *
 * @param shape  square or circle
 * @param radius radius in {@code units}
 * @param units  metres or pixels
 */
public record Kernel(Shape shape, double radius, Units units) {

    public enum Shape { SQUARE, CIRCLE }

    public enum Units { METERS, PIXELS }

    public Kernel {
        if (shape == null || units == null) {
            throw new IllegalArgumentException("Kernel shape and units are required");
        }
        if (radius < 0 || !Double.isFinite(radius)) {
            throw new IllegalArgumentException("Kernel radius must be a non-negative number: " + radius);
        }
    }

    public static Kernel circle(double radiusMeters) {
        return new Kernel(Shape.CIRCLE, radiusMeters, Units.METERS);
    }

    public static Kernel square(double radiusMeters) {
        return new Kernel(Shape.SQUARE, radiusMeters, Units.METERS);
    }

    /** Radius expressed in pixels of a grid with the given resolution. */
    public double radiusInPixels(double resolutionMeters) {
        return units == Units.PIXELS ? radius : radius / resolutionMeters;
    }
}
