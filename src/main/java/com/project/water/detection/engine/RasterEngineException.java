package com.project.water.detection.engine;

/** Raised by a {@link RasterEngine} when an operation cannot be computed. */
public class RasterEngineException extends RuntimeException {
    public RasterEngineException(String message) { super(message); }
    public RasterEngineException(String message, Throwable cause) { super(message, cause); }
}
