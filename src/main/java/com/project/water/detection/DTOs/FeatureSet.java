package com.project.water.detection.DTOs;

import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.RasterImage;
import org.locationtech.jts.geom.Geometry;

import java.util.List;

/** Detection features over an AOI, plus the AOI they were clipped to. */
public record FeatureSet(RasterImage image, Geometry aoi) {

    public static final String VV_DB = "VV_db";
    public static final String VH_DB = "VH_db";
    public static final String VV_VH_DIFF = "VV_VH_diff";
    public static final String TEXTURE = "texture";
    public static final String SLOPE = "slope";
    /** Unfiltered VV in dB; optional. */
    public static final String VV_DB_RAW = "VV_db_raw";

    public static final List<String> REQUIRED_BANDS = List.of(VV_DB, VH_DB, VV_VH_DIFF, TEXTURE, SLOPE);

    public FeatureSet {
        if (image == null || aoi == null) {
            throw new IllegalArgumentException("Feature image and AOI are required");
        }
        for (String band : REQUIRED_BANDS) {
            if (!image.hasBand(band)) {
                throw new IllegalArgumentException("Feature set is missing band '" + band + "', has " + image.bandNames());
            }
        }
    }

    public GridGeometry grid() {
        return image.grid();
    }
}
