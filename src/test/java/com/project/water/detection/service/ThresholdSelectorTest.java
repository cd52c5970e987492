package com.project.water.detection.service;

import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.DTOs.PercentileStats;
import com.project.water.detection.DTOs.ThresholdDecision;
import com.project.water.detection.DTOs.ThresholdProvenance;
import com.project.water.detection.SyntheticScenes;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.local.LocalRaster;
import com.project.water.detection.engine.local.LocalRasterEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ThresholdSelectorTest {
    private LocalRasterEngine engine;
    private ThresholdSelector selector;

    @BeforeEach
    void setUp() {
        engine = new LocalRasterEngine();
        engine.initialize();
        selector = new ThresholdSelector(engine, DetectionSettings.defaults());
    }

    @Test
    void decide_bimodalGap_undercutsMedian() {
        PercentileStats stats = new PercentileStats(-25, -23, -22, -15, -10, -5);

        ThresholdDecision decision = selector.decide(stats, FeatureSet.VV_DB);

        assertThat(decision.value()).isCloseTo(-17.2, within(1e-9));
        assertThat(decision.rule()).isEqualTo("bimodal");
        assertThat(decision.provenance()).isEqualTo(ThresholdProvenance.AUTO);
    }

    @Test
    void decide_moderateGap_usesP35() {
        PercentileStats stats = new PercentileStats(-24, -22, -20, -17.5, -13, -8);

        ThresholdDecision decision = selector.decide(stats, FeatureSet.VV_DB);

        assertThat(decision.value()).isEqualTo(-17.5);
        assertThat(decision.rule()).isEqualTo("moderate");
    }

    @Test
    void decide_gapOfExactlyEight_isModerate() {
        PercentileStats stats = new PercentileStats(-24, -22, -20, -16, -12, -8);

        assertThat(selector.decide(stats, FeatureSet.VV_DB).value()).isEqualTo(-16);
    }

    @Test
    void decide_unimodal_usesP25() {
        PercentileStats stats = new PercentileStats(-14, -13, -12, -11, -9, -6);

        ThresholdDecision decision = selector.decide(stats, FeatureSet.VV_DB);

        assertThat(decision.value()).isEqualTo(-12);
        assertThat(decision.rule()).isEqualTo("unimodal");
    }

    @Test
    void decide_gapOfExactlyFive_isUnimodal() {
        PercentileStats stats = new PercentileStats(-20, -18, -15, -13, -10, -5);

        assertThat(selector.decide(stats, FeatureSet.VV_DB).value()).isEqualTo(-15);
    }

    @Test
    void decide_clampsToVvDomain() {
        PercentileStats stats = new PercentileStats(-45, -42, -40, -38, -30, -20);

        assertThat(selector.decide(stats, FeatureSet.VV_DB).value()).isEqualTo(-30);
    }

    @Test
    void select_manualOverride_winsWithoutStatistics() {
        LocalRasterEngine uninitialized = new LocalRasterEngine();
        ThresholdSelector manualOnly = new ThresholdSelector(uninitialized, DetectionSettings.defaults());

        ThresholdDecision decision = manualOnly.select(SyntheticScenes.lakeFeatures(), -14.5);

        assertThat(decision.value()).isEqualTo(-14.5);
        assertThat(decision.provenance()).isEqualTo(ThresholdProvenance.MANUAL);
        assertThat(decision.percentiles()).isNull();
    }

    @Test
    void select_lakeScene_picksBimodalThreshold() {
        ThresholdDecision decision = selector.select(SyntheticScenes.lakeFeatures(), null);

        // 30% water at -23 dB, 70% land at -10 dB
        assertThat(decision.provenance()).isEqualTo(ThresholdProvenance.AUTO);
        assertThat(decision.band()).isEqualTo(FeatureSet.VV_DB);
        assertThat(decision.percentiles().p25()).isEqualTo(-23);
        assertThat(decision.percentiles().p50()).isEqualTo(-10);
        assertThat(decision.value()).isCloseTo(-17.8, within(1e-4));
    }

    @Test
    void select_prefersRawBandWhenPresent() {
        FeatureSet lake = SyntheticScenes.lakeFeatures();
        LocalRaster raw = LocalRaster.constant(lake.grid(), FeatureSet.VV_DB_RAW, -12f);
        FeatureSet withRaw = new FeatureSet(engine.cat(lake.image(), raw), lake.aoi());

        ThresholdDecision decision = selector.select(withRaw, null);

        assertThat(decision.band()).isEqualTo(FeatureSet.VV_DB_RAW);
        assertThat(decision.value()).isEqualTo(-12);
    }

    @Test
    void select_emptyRegion_fallsBack() {
        FeatureSet lake = SyntheticScenes.lakeFeatures();
        FeatureSet elsewhere = new FeatureSet(lake.image(), SyntheticScenes.box(50, 10, 50.1, 10.1));

        ThresholdDecision decision = selector.select(elsewhere, null);

        assertThat(decision.provenance()).isEqualTo(ThresholdProvenance.AUTO_FALLBACK);
        assertThat(decision.value()).isEqualTo(-18);
    }

    @Test
    void select_engineFailure_fallsBack() {
        ThresholdSelector broken = new ThresholdSelector(new LocalRasterEngine(), DetectionSettings.defaults());

        ThresholdDecision decision = broken.select(SyntheticScenes.lakeFeatures(), null);

        assertThat(decision.provenance()).isEqualTo(ThresholdProvenance.AUTO_FALLBACK);
        assertThat(decision.value()).isEqualTo(-18);
    }
}
