package com.project.water.detection.config;

import com.project.water.detection.engine.SarScene;
import com.project.water.detection.engine.local.LocalRasterEngine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the raster engine (initialized at startup, shut down with the context),
 * the detection settings and the worker pool requests run on.
 */
@Configuration
public class PipelineConfig {

    @Bean(initMethod = "initialize", destroyMethod = "shutdown")
    public LocalRasterEngine rasterEngine() {
        return new LocalRasterEngine();
    }

    @Bean
    public DetectionSettings detectionSettings(
            @Value("${app.detection.aoi-max-area-km2:2500}") double aoiMaxAreaKm2,
            @Value("${app.detection.lookup-days:30}") int lookupDays,
            @Value("${app.detection.orbit-pass:ASCENDING}") SarScene.OrbitPass orbitPass,
            @Value("${app.detection.speckle-radius-m:50}") double speckleRadiusM,
            @Value("${app.detection.morphology-radius-m:10}") double morphologyRadiusM,
            @Value("${app.detection.fallback-threshold-db:-18}") double fallbackThresholdDb,
            @Value("${app.detection.stats-scale-m:100}") double statsScaleM,
            @Value("${app.detection.vector-scale-m:10}") double vectorScaleM,
            @Value("${app.detection.max-pixels:1000000000}") long maxPixels,
            @Value("${app.detection.simplify-max-error-m:100}") double simplifyMaxErrorM,
            @Value("${app.detection.timeout-seconds:120}") long timeoutSeconds) {
        return new DetectionSettings(aoiMaxAreaKm2, lookupDays, orbitPass, speckleRadiusM, morphologyRadiusM,
                fallbackThresholdDb, statsScaleM, vectorScaleM, maxPixels, simplifyMaxErrorM, timeoutSeconds);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService detectionExecutor(@Value("${app.detection.worker-threads:4}") int workerThreads) {
        return Executors.newFixedThreadPool(workerThreads);
    }
}
