package com.project.water.detection.DTOs;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Combined mask plus per-criterion pixel counts, keyed {@code vv}, {@code vh}, {@code slope},
 * {@code vv_vh_diff}, {@code texture} and {@code combined}. Counts may be empty if they could not be computed.
 */
public record RuleOutcome(WaterMask mask, Map<String, Long> criterionPixelCounts) {

    public RuleOutcome {
        criterionPixelCounts = Collections.unmodifiableMap(new LinkedHashMap<>(criterionPixelCounts));
    }
}
