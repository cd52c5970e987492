package com.project.water.detection.DTOs;

/** Parameters as actually applied; disabled optional criteria are {@code null}. */
public record ParametersUsed(
        double vvThreshold,
        ThresholdProvenance vvThresholdMode,
        double vhThreshold,
        Double vvVhDiff,
        double slopeMax,
        Double textureMax,
        int minAreaPixels,
        int textureWindow,
        double morphologyRadiusM
) {
    public static ParametersUsed of(DetectionParameters params, ThresholdDecision threshold, double morphologyRadiusM) {
        return new ParametersUsed(
                threshold.value(),
                threshold.provenance(),
                params.vhThresholdOrDefault(),
                params.vvVhDiff(),
                params.slopeMaxOrDefault(),
                params.textureMax(),
                params.minAreaPixelsOrDefault(),
                params.textureWindowOrDefault(),
                morphologyRadiusM);
    }
}
