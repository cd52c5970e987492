package com.project.water.detection.service;

import com.project.water.detection.DTOs.DetectionParameters;
import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.DTOs.PercentileStats;
import com.project.water.detection.DTOs.ThresholdDecision;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterImage;
import com.project.water.detection.engine.ReduceOptions;
import com.project.water.detection.engine.Reducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;
import java.util.function.ToDoubleFunction;

/**
 * Picks the VV backscatter threshold separating water from land.
 * <p>
 * A manual override always wins. Otherwise the threshold comes from the spread between the
 * median and the lower quartile of the scene's VV distribution, evaluated against
 * {@link #RULES} in order.
 */
@Service
public class ThresholdSelector {
    private static final Logger log = LoggerFactory.getLogger(ThresholdSelector.class);

    /** Candidate bands, least processed first. */
    static final List<String> BAND_PREFERENCE = List.of(FeatureSet.VV_DB_RAW, FeatureSet.VV_DB);

    record GapRule(String name, DoublePredicate matches, ToDoubleFunction<PercentileStats> threshold) {}

    /** First match wins. */
    static final List<GapRule> RULES = List.of(
            // clear water body: undercut the median to take the whole low-backscatter population
            new GapRule("bimodal", gap -> gap > 8, s -> s.p25() + 0.4 * s.gap()),
            new GapRule("moderate", gap -> gap > 5, PercentileStats::p35),
            new GapRule("unimodal", gap -> true, PercentileStats::p25)
    );

    private final RasterEngine engine;
    private final DetectionSettings settings;

    public ThresholdSelector(RasterEngine engine, DetectionSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    public ThresholdDecision select(FeatureSet features, Double manualOverride) {
        if (manualOverride != null) {
            log.info("Using manual VV threshold: {} dB", manualOverride);
            return ThresholdDecision.manual(manualOverride);
        }

        String band = BAND_PREFERENCE.stream()
                .filter(features.image()::hasBand)
                .findFirst()
                .orElse(FeatureSet.VV_DB);
        try {
            PercentileStats stats = computeStatistics(features, band);
            if (stats == null) {
                log.warn("Percentile statistics for {} are incomplete, using fallback threshold {} dB",
                        band, settings.fallbackThresholdDb());
                return ThresholdDecision.fallback(settings.fallbackThresholdDb());
            }
            return decide(stats, band);
        } catch (RuntimeException e) {
            log.error("Error computing VV threshold from {}: {}", band, e.getMessage());
            return ThresholdDecision.fallback(settings.fallbackThresholdDb());
        }
    }

    /** Applies the gap rule table to a set of percentiles. */
    public ThresholdDecision decide(PercentileStats stats, String band) {
        double gap = stats.gap();
        GapRule rule = RULES.stream()
                .filter(r -> r.matches().test(gap))
                .findFirst()
                .orElseThrow();
        double raw = rule.threshold().applyAsDouble(stats);
        double value = clampToDomain(raw);
        if (value != raw) {
            log.warn("Adaptive threshold {} dB outside the VV domain, clamped to {} dB", raw, value);
        }
        log.info("Auto VV threshold: {} dB (rule={}, p25={}, p50={}, gap={})",
                String.format("%.2f", value), rule.name(), stats.p25(), stats.p50(), String.format("%.2f", gap));
        return ThresholdDecision.auto(value, band, rule.name(), stats);
    }

    private PercentileStats computeStatistics(FeatureSet features, String band) {
        RasterImage image = engine.select(features.image(), band);
        ReduceOptions options = new ReduceOptions(settings.statsScaleM(), settings.maxPixels(), true);
        Map<String, Double> values = engine.reduceRegion(image, Reducer.percentile(PercentileStats.LEVELS),
                features.aoi(), options);

        double[] p = new double[PercentileStats.LEVELS.length];
        for (int i = 0; i < p.length; i++) {
            Double v = values.get(Reducer.percentileKey(band, PercentileStats.LEVELS[i]));
            if (v == null) {
                return null;
            }
            p[i] = v;
        }
        PercentileStats stats = new PercentileStats(p[0], p[1], p[2], p[3], p[4], p[5]);
        return stats.isFinite() ? stats : null;
    }

    private static double clampToDomain(double value) {
        return Math.max(DetectionParameters.VV_MIN, Math.min(DetectionParameters.VV_MAX, value));
    }
}
