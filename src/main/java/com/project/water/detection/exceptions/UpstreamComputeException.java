package com.project.water.detection.exceptions;

/** A raster engine call failed, timed out or returned malformed data. */
public class UpstreamComputeException extends WaterDetectionException {
    public UpstreamComputeException(PipelineStage stage, String message) { super(stage, message); }
    public UpstreamComputeException(PipelineStage stage, String message, Throwable cause) { super(stage, message, cause); }
}
