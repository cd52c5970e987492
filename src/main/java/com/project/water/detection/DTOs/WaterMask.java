package com.project.water.detection.DTOs;

import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.RasterImage;

/** Single-band binary raster, 1 = candidate water. */
public record WaterMask(RasterImage image) {

    public static final String BAND = "water";

    public WaterMask {
        if (image == null || image.bandNames().size() != 1) {
            throw new IllegalArgumentException("Water mask must be a single-band image");
        }
    }

    public GridGeometry grid() {
        return image.grid();
    }
}
