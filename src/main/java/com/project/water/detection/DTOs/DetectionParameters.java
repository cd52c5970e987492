package com.project.water.detection.DTOs;

import java.util.OptionalDouble;

/**
 * Optional detection overrides. Every field may be {@code null}.
 *
 * <table>
 *   <caption>Defaults when absent</caption>
 *   <tr><th>field</th><th>domain</th><th>absent</th></tr>
 *   <tr><td>vvThreshold</td><td>[-30, 0] dB</td><td>adaptive threshold</td></tr>
 *   <tr><td>vhThreshold</td><td>[-35, 0] dB</td><td>-20 dB</td></tr>
 *   <tr><td>vvVhDiff</td><td>[0, 10] dB</td><td>criterion disabled</td></tr>
 *   <tr><td>slopeMax</td><td>[0, 30] degrees</td><td>5 degrees</td></tr>
 *   <tr><td>textureMax</td><td>&ge; 0 dB</td><td>criterion disabled</td></tr>
 *   <tr><td>minAreaPixels</td><td>&ge; 1</td><td>100</td></tr>
 *   <tr><td>textureWindow</td><td>[1, 9] pixels</td><td>3</td></tr>
 * </table>
 */
public record DetectionParameters(
        Double vvThreshold,
        Double vhThreshold,
        Double vvVhDiff,
        Double slopeMax,
        Double textureMax,
        Integer minAreaPixels,
        Integer textureWindow
) {
    public static final double VV_MIN = -30, VV_MAX = 0;
    public static final double VH_MIN = -35, VH_MAX = 0;
    public static final double DIFF_MIN = 0, DIFF_MAX = 10;
    public static final double SLOPE_MIN = 0, SLOPE_MAX = 30;

    public static final double DEFAULT_VH_THRESHOLD = -20;
    public static final double DEFAULT_SLOPE_MAX = 5;
    public static final int DEFAULT_MIN_AREA_PIXELS = 100;
    public static final int DEFAULT_TEXTURE_WINDOW = 3;

    public DetectionParameters {
        checkRange("vv_threshold", vvThreshold, VV_MIN, VV_MAX);
        checkRange("vh_threshold", vhThreshold, VH_MIN, VH_MAX);
        checkRange("vv_vh_diff", vvVhDiff, DIFF_MIN, DIFF_MAX);
        checkRange("slope_max", slopeMax, SLOPE_MIN, SLOPE_MAX);
        checkRange("texture_max", textureMax, 0, Double.MAX_VALUE);
        if (minAreaPixels != null && minAreaPixels < 1) {
            throw new IllegalArgumentException("min_area_pixels must be at least 1: " + minAreaPixels);
        }
        if (textureWindow != null && (textureWindow < 1 || textureWindow > 9)) {
            throw new IllegalArgumentException("texture_window must be within [1, 9]: " + textureWindow);
        }
    }

    public static DetectionParameters defaults() {
        return new DetectionParameters(null, null, null, null, null, null, null);
    }

    public double vhThresholdOrDefault() {
        return vhThreshold != null ? vhThreshold : DEFAULT_VH_THRESHOLD;
    }

    public double slopeMaxOrDefault() {
        return slopeMax != null ? slopeMax : DEFAULT_SLOPE_MAX;
    }

    public int minAreaPixelsOrDefault() {
        return minAreaPixels != null ? minAreaPixels : DEFAULT_MIN_AREA_PIXELS;
    }

    public int textureWindowOrDefault() {
        return textureWindow != null ? textureWindow : DEFAULT_TEXTURE_WINDOW;
    }

    /** Empty when the VV-VH difference criterion is disabled. */
    public OptionalDouble vvVhDiffCriterion() {
        return vvVhDiff != null ? OptionalDouble.of(vvVhDiff) : OptionalDouble.empty();
    }

    /** Empty when the texture criterion is disabled. */
    public OptionalDouble textureCriterion() {
        return textureMax != null ? OptionalDouble.of(textureMax) : OptionalDouble.empty();
    }

    private static void checkRange(String name, Double value, double min, double max) {
        if (value != null && (value.isNaN() || value < min || value > max)) {
            throw new IllegalArgumentException(name + " must be within [" + min + ", " + max + "]: " + value);
        }
    }
}
