package com.project.water.detection.exceptions;

/**
 * No eligible imagery exists for the AOI in the lookup window.
 * Callers turn this into a successful, empty result carrying a warning.
 */
public class NoDataException extends WaterDetectionException {
    public NoDataException(String message) { super(PipelineStage.SCENE_LOOKUP, message); }
}
