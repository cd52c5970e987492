package com.project.water.detection.service;

import com.project.water.detection.DTOs.DetectionResult;
import com.project.water.detection.DTOs.WaterMask;
import com.project.water.detection.DTOs.WaterPolygon;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterImage;
import com.project.water.detection.engine.VectorOptions;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a water mask into polygons: one per 4-connected water region inside the AOI, sized
 * geodesically, dropped when smaller than the area floor, then simplified.
 */
@Service
public class VectorizerAreaFilter {
    private static final Logger log = LoggerFactory.getLogger(VectorizerAreaFilter.class);

    /** Ground area of one 10 m pixel, the unit of {@code min_area_pixels}. */
    public static final double NOMINAL_PIXEL_AREA_M2 = 100.0;

    private final RasterEngine engine;
    private final DetectionSettings settings;

    public VectorizerAreaFilter(RasterEngine engine, DetectionSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    public DetectionResult vectorize(WaterMask mask, Geometry aoi, int minAreaPixels) {
        double minAreaM2 = minAreaPixels * NOMINAL_PIXEL_AREA_M2;
        try {
            RasterImage water = engine.selfMask(mask.image());
            List<Geometry> regions = engine.reduceToVectors(water, aoi,
                    new VectorOptions(settings.vectorScaleM(), false, settings.maxPixels()));

            List<WaterPolygon> kept = new ArrayList<>();
            int dropped = 0;
            for (Geometry region : regions) {
                double area = engine.geodesicArea(region);
                if (area < minAreaM2) {
                    dropped++;
                    continue;
                }
                kept.add(new WaterPolygon(engine.simplify(region, settings.simplifyMaxErrorM()), area));
            }

            DetectionResult result = DetectionResult.of(kept);
            log.info("Vectorized {} water regions: kept {}, dropped {} below {} m2, total {} km2",
                    regions.size(), kept.size(), dropped, minAreaM2, String.format("%.3f", result.totalAreaKm2()));
            return result;
        } catch (RuntimeException e) {
            log.error("Error vectorizing water mask: {}", e.getMessage(), e);
            return DetectionResult.empty();
        }
    }
}
