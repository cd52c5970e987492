package com.project.water.detection.exceptions;

/** The AOI geometry is invalid or too large. The pipeline is never invoked. */
public class AoiValidationException extends WaterDetectionException {
    public AoiValidationException(String message) { super(PipelineStage.AOI_VALIDATION, message); }
    public AoiValidationException(String message, Throwable cause) { super(PipelineStage.AOI_VALIDATION, message, cause); }
}
