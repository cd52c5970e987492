package com.project.water.detection.DTOs;

import java.util.Map;

public record DetectionMetadata(
        String acquisitionDate,
        String sceneId,
        double waterAreaKm2,
        double waterPercentage,
        double processingTimeSeconds,
        double aoiAreaKm2,
        ParametersUsed parametersUsed,
        ThresholdDecision threshold,
        Map<String, Long> criterionPixelCounts,
        String warning
) {}
