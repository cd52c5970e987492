package com.project.water.detection.service;

import com.project.water.detection.DTOs.WaterMask;
import com.project.water.detection.engine.Kernel;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterEngineException;
import com.project.water.detection.engine.RasterImage;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Removes speckle from a water mask with an opening (erode, dilate) and fills small gaps with a
 * closing (dilate, erode), both using one circular kernel.
 */
@Service
public class MorphologicalRefiner {
    private static final Logger log = LoggerFactory.getLogger(MorphologicalRefiner.class);

    private final RasterEngine engine;

    public MorphologicalRefiner(RasterEngine engine) {
        this.engine = engine;
    }

    public WaterMask refine(WaterMask mask, double radiusMeters, Geometry aoi) {
        Kernel kernel = Kernel.circle(radiusMeters);
        try {
            RasterImage opened = engine.focalMax(engine.focalMin(mask.image(), kernel), kernel);
            RasterImage closed = engine.focalMin(engine.focalMax(opened, kernel), kernel);
            RasterImage clipped = engine.clip(closed, aoi);
            log.debug("Refined water mask with a {} m circular kernel", radiusMeters);
            return new WaterMask(engine.rename(clipped, WaterMask.BAND));
        } catch (RasterEngineException e) {
            throw new UpstreamComputeException(PipelineStage.MORPHOLOGY,
                    "Morphological cleanup failed: " + e.getMessage(), e);
        }
    }
}
