package com.project.water.detection.engine;

/**
 * Options of a region reduction.
 *
 * @param scaleMeters resolution the reduction runs at
 * @param maxPixels   pixel budget
 * @param bestEffort  allow a coarser scale when the budget would be exceeded
 */
public record ReduceOptions(double scaleMeters, long maxPixels, boolean bestEffort) {

    public ReduceOptions {
        if (scaleMeters <= 0) {
            throw new IllegalArgumentException("scale must be positive: " + scaleMeters);
        }
        if (maxPixels < 1) {
            throw new IllegalArgumentException("maxPixels must be positive: " + maxPixels);
        }
    }
}
