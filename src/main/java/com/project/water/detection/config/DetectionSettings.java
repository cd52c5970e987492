package com.project.water.detection.config;

import com.project.water.detection.engine.SarScene;

/**
 * Process-wide tuning of the detection chain, bound from {@code app.detection.*}.
 *
 * @param aoiMaxAreaKm2       largest AOI accepted
 * @param lookupDays          how far back a scene may be
 * @param orbitPass           orbit direction of eligible scenes
 * @param speckleRadiusM      focal median radius applied to raw backscatter
 * @param morphologyRadiusM   opening/closing radius
 * @param fallbackThresholdDb VV threshold used when statistics fail
 * @param statsScaleM         resolution of threshold statistics
 * @param vectorScaleM        resolution of vectorization
 * @param maxPixels           pixel budget of reductions and vectorization
 * @param simplifyMaxErrorM   outline simplification tolerance
 * @param timeoutSeconds      per-request pipeline timeout
 */
public record DetectionSettings(
        double aoiMaxAreaKm2,
        int lookupDays,
        SarScene.OrbitPass orbitPass,
        double speckleRadiusM,
        double morphologyRadiusM,
        double fallbackThresholdDb,
        double statsScaleM,
        double vectorScaleM,
        long maxPixels,
        double simplifyMaxErrorM,
        long timeoutSeconds
) {
    public static DetectionSettings defaults() {
        return new DetectionSettings(2500, 30, SarScene.OrbitPass.ASCENDING, 50, 10, -18, 100, 10,
                1_000_000_000L, 100, 120);
    }
}
