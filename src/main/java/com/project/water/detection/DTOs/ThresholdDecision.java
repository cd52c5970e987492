package com.project.water.detection.DTOs;

/**
 * Resolved VV threshold and where it came from. {@code band}, {@code rule} and
 * {@code percentiles} are only set for {@link ThresholdProvenance#AUTO}.
 */
public record ThresholdDecision(
        double value,
        ThresholdProvenance provenance,
        String band,
        String rule,
        PercentileStats percentiles
) {
    public static ThresholdDecision manual(double value) {
        return new ThresholdDecision(value, ThresholdProvenance.MANUAL, null, null, null);
    }

    public static ThresholdDecision auto(double value, String band, String rule, PercentileStats percentiles) {
        return new ThresholdDecision(value, ThresholdProvenance.AUTO, band, rule, percentiles);
    }

    public static ThresholdDecision fallback(double value) {
        return new ThresholdDecision(value, ThresholdProvenance.AUTO_FALLBACK, null, null, null);
    }
}
