package com.project.water.detection.engine;

import java.util.List;

/**
 * Opaque, immutable multi-band raster produced by a {@link RasterEngine}.
 * Pixel values are only reachable through engine operations.
 */
public interface RasterImage {

    GridGeometry grid();

    List<String> bandNames();

    default boolean hasBand(String name) {
        return bandNames().contains(name);
    }
}
