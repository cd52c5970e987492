package com.project.water.detection.engine;

/**
 * Options of raster-to-polygon conversion.
 *
 * @param scaleMeters    resolution the vectorization runs at
 * @param eightConnected whether diagonal neighbours join a region
 * @param maxPixels      pixel budget, exceeding it fails the call
 */
public record VectorOptions(double scaleMeters, boolean eightConnected, long maxPixels) {

    public VectorOptions {
        if (scaleMeters <= 0) {
            throw new IllegalArgumentException("scale must be positive: " + scaleMeters);
        }
        if (maxPixels < 1) {
            throw new IllegalArgumentException("maxPixels must be positive: " + maxPixels);
        }
    }
}
