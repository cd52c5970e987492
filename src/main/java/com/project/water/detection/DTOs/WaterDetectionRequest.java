package com.project.water.detection.DTOs;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Map;

/** Body of {@code POST /detect-water}. */
public record WaterDetectionRequest(
        @NotNull(message = "geometry is required")
        Map<String, Object> geometry,

        @DecimalMin(value = "-30", message = "vv_threshold must be >= -30 dB")
        @DecimalMax(value = "0", message = "vv_threshold must be <= 0 dB")
        Double vvThreshold,

        @DecimalMin(value = "-35", message = "vh_threshold must be >= -35 dB")
        @DecimalMax(value = "0", message = "vh_threshold must be <= 0 dB")
        Double vhThreshold,

        @DecimalMin(value = "0", message = "vv_vh_diff must be >= 0 dB")
        @DecimalMax(value = "10", message = "vv_vh_diff must be <= 10 dB")
        Double vvVhDiff,

        @DecimalMin(value = "0", message = "slope_max must be >= 0 degrees")
        @DecimalMax(value = "30", message = "slope_max must be <= 30 degrees")
        Double slopeMax,

        @DecimalMin(value = "0", message = "texture_max must be >= 0 dB")
        Double textureMax,

        @Min(value = 1, message = "min_area_pixels must be at least 1")
        Integer minAreaPixels,

        @Min(value = 1, message = "texture_window must be at least 1")
        @Max(value = 9, message = "texture_window must be at most 9")
        Integer textureWindow
) {
    public DetectionParameters toParameters() {
        return new DetectionParameters(vvThreshold, vhThreshold, vvVhDiff, slopeMax, textureMax, minAreaPixels, textureWindow);
    }
}
