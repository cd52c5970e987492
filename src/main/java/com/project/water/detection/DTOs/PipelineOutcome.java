package com.project.water.detection.DTOs;

import java.util.Map;

public record PipelineOutcome(DetectionResult result, ThresholdDecision threshold, Map<String, Long> criterionPixelCounts) {}
