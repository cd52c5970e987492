package com.project.water.detection.engine;

import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.Set;

/**
 * One SAR acquisition: linear {@code VV} and {@code VH} backscatter plus an {@code elevation} band (metres).
 */
public record SarScene(
        String id,
        Instant acquired,
        Geometry footprint,
        String instrumentMode,
        OrbitPass orbitPass,
        Set<String> polarisations,
        RasterImage image
) {
    public static final String BAND_VV = "VV";
    public static final String BAND_VH = "VH";
    public static final String BAND_ELEVATION = "elevation";

    public enum OrbitPass { ASCENDING, DESCENDING }

    public SarScene {
        polarisations = Set.copyOf(polarisations);
    }
}
