package com.project.water.detection.service;

import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterEngineException;
import com.project.water.detection.engine.SarScene;
import com.project.water.detection.engine.SceneQuery;
import com.project.water.detection.exceptions.NoDataException;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.locationtech.jts.geom.Geometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;

/** Finds the most recent dual-polarisation IW scene covering an AOI. */
@Service
public class SceneLocator {
    private static final Logger log = LoggerFactory.getLogger(SceneLocator.class);

    static final String INSTRUMENT_MODE = "IW";

    private final RasterEngine engine;
    private final DetectionSettings settings;
    private final Clock clock;

    @Autowired
    public SceneLocator(RasterEngine engine, DetectionSettings settings) {
        this(engine, settings, Clock.systemUTC());
    }

    SceneLocator(RasterEngine engine, DetectionSettings settings, Clock clock) {
        this.engine = engine;
        this.settings = settings;
        this.clock = clock;
    }

    public SarScene locate(Geometry aoi) {
        Instant now = clock.instant();
        SceneQuery query = new SceneQuery(aoi, now.minus(Duration.ofDays(settings.lookupDays())), now,
                Set.of(SarScene.BAND_VV, SarScene.BAND_VH), INSTRUMENT_MODE, settings.orbitPass());
        try {
            SarScene scene = engine.latestScene(query)
                    .orElseThrow(() -> new NoDataException(
                            "No Sentinel-1 imagery found in last " + settings.lookupDays() + " days for this area"));
            log.info("Found scene {} acquired {}", scene.id(), scene.acquired());
            return scene;
        } catch (RasterEngineException e) {
            throw new UpstreamComputeException(PipelineStage.SCENE_LOOKUP,
                    "Scene lookup failed: " + e.getMessage(), e);
        }
    }
}
