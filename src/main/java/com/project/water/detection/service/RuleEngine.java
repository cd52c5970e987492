package com.project.water.detection.service;

import com.project.water.detection.DTOs.DetectionParameters;
import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.DTOs.RuleOutcome;
import com.project.water.detection.DTOs.ThresholdDecision;
import com.project.water.detection.DTOs.WaterMask;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterEngineException;
import com.project.water.detection.engine.RasterImage;
import com.project.water.detection.engine.ReduceOptions;
import com.project.water.detection.engine.Reducer;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Combines per-pixel criteria into the candidate water mask.
 * <p>
 * {@code VV < threshold} and {@code slope < slope_max} always apply. The VV-VH difference and
 * texture criteria apply only when their parameter is supplied. All composition is a logical AND,
 * so adding criteria never grows the mask. The VH criterion is evaluated and counted for
 * diagnostics but is not part of the mask.
 */
@Service
public class RuleEngine {
    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final RasterEngine engine;
    private final DetectionSettings settings;

    public RuleEngine(RasterEngine engine, DetectionSettings settings) {
        this.engine = engine;
        this.settings = settings;
    }

    public RuleOutcome combine(FeatureSet features, ThresholdDecision threshold, DetectionParameters params) {
        Map<String, RasterImage> criteria = new LinkedHashMap<>();
        RasterImage mask;
        try {
            RasterImage vv = criterion(features, FeatureSet.VV_DB, threshold.value());
            RasterImage slope = criterion(features, FeatureSet.SLOPE, params.slopeMaxOrDefault());
            RasterImage vh = criterion(features, FeatureSet.VH_DB, params.vhThresholdOrDefault());
            criteria.put("vv", vv);
            criteria.put("vh", vh);
            criteria.put("slope", slope);

            mask = engine.and(vv, slope);

            OptionalDouble diffMax = params.vvVhDiffCriterion();
            if (diffMax.isPresent()) {
                RasterImage diff = criterion(features, FeatureSet.VV_VH_DIFF, diffMax.getAsDouble());
                criteria.put("vv_vh_diff", diff);
                mask = engine.and(mask, diff);
            }
            OptionalDouble textureMax = params.textureCriterion();
            if (textureMax.isPresent()) {
                RasterImage texture = criterion(features, FeatureSet.TEXTURE, textureMax.getAsDouble());
                criteria.put("texture", texture);
                mask = engine.and(mask, texture);
            }
            mask = engine.rename(mask, WaterMask.BAND);
        } catch (RasterEngineException e) {
            throw new UpstreamComputeException(PipelineStage.RULE_COMBINATION,
                    "Failed to combine water criteria: " + e.getMessage(), e);
        }

        log.info("Detection criteria: VV < {} dB, slope < {} deg, VV-VH diff {}, texture {} (VH < {} dB diagnostic only)",
                String.format("%.2f", threshold.value()),
                params.slopeMaxOrDefault(),
                describe(params.vvVhDiffCriterion()),
                describe(params.textureCriterion()),
                params.vhThresholdOrDefault());

        criteria.put("combined", mask);
        return new RuleOutcome(new WaterMask(mask), countPixels(criteria, features));
    }

    private RasterImage criterion(FeatureSet features, String band, double bound) {
        return engine.lessThan(engine.select(features.image(), band), bound);
    }

    private Map<String, Long> countPixels(Map<String, RasterImage> criteria, FeatureSet features) {
        ReduceOptions options = new ReduceOptions(features.grid().resolutionMeters(), settings.maxPixels(), true);
        Map<String, Long> counts = new LinkedHashMap<>();
        try {
            for (var entry : criteria.entrySet()) {
                Map<String, Double> sums = engine.reduceRegion(entry.getValue(), Reducer.sum(), features.aoi(), options);
                double sum = sums.values().stream().mapToDouble(Double::doubleValue).sum();
                counts.put(entry.getKey(), Math.round(sum));
            }
        } catch (RasterEngineException e) {
            log.warn("Criterion pixel counts unavailable: {}", e.getMessage());
            return Map.of();
        }
        log.debug("Criterion pixel counts: {}", counts);
        return counts;
    }

    private static String describe(OptionalDouble bound) {
        return bound.isPresent() ? "< " + bound.getAsDouble() : "disabled";
    }
}
