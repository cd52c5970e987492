package com.project.water.detection.service;

import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.Kernel;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterEngineException;
import com.project.water.detection.engine.RasterImage;
import com.project.water.detection.engine.SarScene;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds detection features from a raw scene: speckle-filtered backscatter in dB, the VV-VH
 * difference, VV texture and terrain slope, all clipped to the AOI.
 */
@Service
public class FeatureDeriver {
    private static final Logger log = LoggerFactory.getLogger(FeatureDeriver.class);

    /** Ground size of one texture window step. */
    static final double TEXTURE_STEP_M = 10.0;

    private final RasterEngine engine;
    private final DetectionSettings settings;

    public FeatureDeriver(RasterEngine engine, DetectionSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    public FeatureSet derive(SarScene scene, Geometry aoi, int textureWindow) {
        try {
            RasterImage vv = engine.select(scene.image(), SarScene.BAND_VV);
            RasterImage vh = engine.select(scene.image(), SarScene.BAND_VH);

            RasterImage vvRaw = engine.rename(toDb(vv), FeatureSet.VV_DB_RAW);

            Kernel speckle = Kernel.square(settings.speckleRadiusM());
            RasterImage vvDb = engine.rename(toDb(engine.focalMedian(vv, speckle)), FeatureSet.VV_DB);
            RasterImage vhDb = engine.rename(toDb(engine.focalMedian(vh, speckle)), FeatureSet.VH_DB);

            RasterImage diff = engine.rename(engine.subtract(vvDb, vhDb), FeatureSet.VV_VH_DIFF);
            RasterImage texture = engine.rename(
                    engine.focalStdDev(vvDb, Kernel.square(textureWindow * TEXTURE_STEP_M)), FeatureSet.TEXTURE);
            RasterImage slope = engine.rename(
                    engine.slope(engine.select(scene.image(), SarScene.BAND_ELEVATION)), FeatureSet.SLOPE);

            RasterImage features = engine.clip(engine.cat(vvDb, vhDb, diff, texture, slope, vvRaw), aoi);
            log.info("Derived features for scene {} (texture window {}, speckle radius {} m)",
                    scene.id(), textureWindow, settings.speckleRadiusM());
            return new FeatureSet(features, aoi);
        } catch (RasterEngineException | IllegalArgumentException e) {
            log.error("Error deriving features for scene {}: {}", scene.id(), e.getMessage());
            throw new UpstreamComputeException(PipelineStage.FEATURE_DERIVATION,
                    "Feature derivation failed: " + e.getMessage(), e);
        }
    }

    private RasterImage toDb(RasterImage linear) {
        return engine.multiply(engine.log10(linear), 10.0);
    }
}
