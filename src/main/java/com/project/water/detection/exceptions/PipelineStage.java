package com.project.water.detection.exceptions;

/** Stage of the detection chain an error originated from, used for log context. */
public enum PipelineStage {
    AOI_VALIDATION,
    SCENE_LOOKUP,
    FEATURE_DERIVATION,
    THRESHOLD_SELECTION,
    RULE_COMBINATION,
    MORPHOLOGY,
    VECTORIZATION,
    PIPELINE
}
