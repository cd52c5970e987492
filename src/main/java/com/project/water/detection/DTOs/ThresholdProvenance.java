package com.project.water.detection.DTOs;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ThresholdProvenance {
    MANUAL("manual"),
    AUTO("auto"),
    AUTO_FALLBACK("auto-fallback");

    private final String label;

    ThresholdProvenance(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
