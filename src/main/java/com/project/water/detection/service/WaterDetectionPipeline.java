package com.project.water.detection.service;

import com.project.water.detection.DTOs.DetectionParameters;
import com.project.water.detection.DTOs.DetectionResult;
import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.DTOs.PipelineOutcome;
import com.project.water.detection.DTOs.RuleOutcome;
import com.project.water.detection.DTOs.ThresholdDecision;
import com.project.water.detection.DTOs.WaterMask;
import com.project.water.detection.config.DetectionSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Threshold, rule combination, morphology and vectorization over one feature set. */
@Service
public class WaterDetectionPipeline {
    private static final Logger log = LoggerFactory.getLogger(WaterDetectionPipeline.class);

    private final ThresholdSelector thresholdSelector;
    private final RuleEngine ruleEngine;
    private final MorphologicalRefiner refiner;
    private final VectorizerAreaFilter vectorizer;
    private final DetectionSettings settings;

    public WaterDetectionPipeline(ThresholdSelector thresholdSelector, RuleEngine ruleEngine,
                                  MorphologicalRefiner refiner, VectorizerAreaFilter vectorizer,
                                  DetectionSettings settings) {
        this.thresholdSelector = thresholdSelector;
        this.ruleEngine = ruleEngine;
        this.refiner = refiner;
        this.vectorizer = vectorizer;
        this.settings = settings;
    }

    public PipelineOutcome run(FeatureSet features, DetectionParameters params) {
        ThresholdDecision threshold = thresholdSelector.select(features, params.vvThreshold());
        RuleOutcome rules = ruleEngine.combine(features, threshold, params);
        WaterMask refined = refiner.refine(rules.mask(), settings.morphologyRadiusM(), features.aoi());
        DetectionResult result = vectorizer.vectorize(refined, features.aoi(), params.minAreaPixelsOrDefault());
        log.debug("Pipeline finished: threshold {} dB ({}), {} polygons",
                threshold.value(), threshold.provenance().label(), result.polygons().size());
        return new PipelineOutcome(result, threshold, rules.criterionPixelCounts());
    }
}
