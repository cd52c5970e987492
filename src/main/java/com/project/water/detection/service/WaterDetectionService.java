package com.project.water.detection.service;

import com.project.water.detection.DTOs.DetectionMetadata;
import com.project.water.detection.DTOs.DetectionParameters;
import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.DTOs.ParametersUsed;
import com.project.water.detection.DTOs.PipelineOutcome;
import com.project.water.detection.DTOs.ValidatedAoi;
import com.project.water.detection.DTOs.WaterDetectionRequest;
import com.project.water.detection.DTOs.WaterDetectionResponse;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.SarScene;
import com.project.water.detection.exceptions.NoDataException;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Request orchestration: AOI validation, scene lookup, feature derivation and the detection
 * pipeline, run on the worker pool under a per-request timeout.
 */
@Service
public class WaterDetectionService {
    private static final Logger log = LoggerFactory.getLogger(WaterDetectionService.class);

    private static final DateTimeFormatter ACQUISITION_DATE = DateTimeFormatter.ISO_LOCAL_DATE.withZone(ZoneOffset.UTC);

    private final AoiValidator aoiValidator;
    private final SceneLocator sceneLocator;
    private final FeatureDeriver featureDeriver;
    private final WaterDetectionPipeline pipeline;
    private final GeoJsonMapper geoJsonMapper;
    private final ExecutorService detectionExecutor;
    private final DetectionSettings settings;

    public WaterDetectionService(AoiValidator aoiValidator, SceneLocator sceneLocator, FeatureDeriver featureDeriver,
                                 WaterDetectionPipeline pipeline, GeoJsonMapper geoJsonMapper,
                                 ExecutorService detectionExecutor, DetectionSettings settings) {
        this.aoiValidator = aoiValidator;
        this.sceneLocator = sceneLocator;
        this.featureDeriver = featureDeriver;
        this.pipeline = pipeline;
        this.geoJsonMapper = geoJsonMapper;
        this.detectionExecutor = detectionExecutor;
        this.settings = settings;
    }

    public WaterDetectionResponse detect(WaterDetectionRequest request) {
        long start = System.nanoTime();
        DetectionParameters params = request.toParameters();

        log.info("Validating AOI geometry...");
        ValidatedAoi aoi = aoiValidator.validate(request.geometry());

        Future<WaterDetectionResponse> task = detectionExecutor.submit(() -> process(aoi, params, start));
        try {
            return task.get(settings.timeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            task.cancel(true);
            log.error("Water detection timed out after {} s", settings.timeoutSeconds());
            throw new UpstreamComputeException(PipelineStage.PIPELINE,
                    "Water detection timed out after " + settings.timeoutSeconds() + " seconds", e);
        } catch (InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new UpstreamComputeException(PipelineStage.PIPELINE, "Water detection was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new UpstreamComputeException(PipelineStage.PIPELINE, "Water detection failed: " + cause, cause);
        }
    }

    private WaterDetectionResponse process(ValidatedAoi aoi, DetectionParameters params, long start) {
        SarScene scene;
        try {
            log.info("Fetching Sentinel-1 imagery...");
            scene = sceneLocator.locate(aoi.geometry());
        } catch (NoDataException e) {
            log.warn("No imagery for AOI: {}", e.getMessage());
            DetectionMetadata metadata = new DetectionMetadata(null, null, 0.0, 0.0, elapsedSeconds(start),
                    round(aoi.areaKm2(), 2), null, null, Map.of(), e.getMessage());
            return new WaterDetectionResponse(geoJsonMapper.emptyCollection(), metadata);
        }

        log.info("Deriving features...");
        FeatureSet features = featureDeriver.derive(scene, aoi.geometry(), params.textureWindowOrDefault());

        log.info("Detecting water...");
        PipelineOutcome outcome = pipeline.run(features, params);

        double waterKm2 = outcome.result().totalAreaKm2();
        double percentage = aoi.areaKm2() > 0 ? round(waterKm2 / aoi.areaKm2() * 100.0, 2) : 0.0;
        DetectionMetadata metadata = new DetectionMetadata(
                ACQUISITION_DATE.format(scene.acquired()),
                scene.id(),
                round(waterKm2, 3),
                percentage,
                elapsedSeconds(start),
                round(aoi.areaKm2(), 2),
                ParametersUsed.of(params, outcome.threshold(), settings.morphologyRadiusM()),
                outcome.threshold(),
                outcome.criterionPixelCounts(),
                null);

        log.info("Detection complete: {} km2 water ({}%) in {} s",
                metadata.waterAreaKm2(), metadata.waterPercentage(), metadata.processingTimeSeconds());
        return new WaterDetectionResponse(geoJsonMapper.toFeatureCollection(outcome.result()), metadata);
    }

    private static double elapsedSeconds(long start) {
        return round((System.nanoTime() - start) / 1e9, 2);
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
