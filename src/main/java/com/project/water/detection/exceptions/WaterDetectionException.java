package com.project.water.detection.exceptions;

/** Domain-specific exception for water detection errors. */
public class WaterDetectionException extends RuntimeException {
    private final PipelineStage stage;

    public WaterDetectionException(PipelineStage stage, String message) {
        super(message);
        this.stage = stage;
    }

    public WaterDetectionException(PipelineStage stage, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }

    public PipelineStage getStage() {
        return stage;
    }
}
