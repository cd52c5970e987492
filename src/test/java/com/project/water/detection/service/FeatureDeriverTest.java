package com.project.water.detection.service;

import com.project.water.detection.DTOs.FeatureSet;
import com.project.water.detection.SyntheticScenes;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.SarScene;
import com.project.water.detection.engine.local.LocalRaster;
import com.project.water.detection.engine.local.LocalRasterEngine;
import com.project.water.detection.exceptions.PipelineStage;
import com.project.water.detection.exceptions.UpstreamComputeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.assertj.core.api.Assertions.within;

class FeatureDeriverTest {
    private LocalRasterEngine engine;
    private FeatureDeriver deriver;

    @BeforeEach
    void setUp() {
        engine = new LocalRasterEngine();
        engine.initialize();
        deriver = new FeatureDeriver(engine, DetectionSettings.defaults());
    }

    @Test
    void derive_producesAllDetectionBands() {
        SarScene scene = SyntheticScenes.lakeScene("S1_TEST", Instant.now());

        FeatureSet features = deriver.derive(scene, SyntheticScenes.gridAoi(), 3);

        assertThat(features.image().bandNames()).contains(
                FeatureSet.VV_DB, FeatureSet.VH_DB, FeatureSet.VV_VH_DIFF,
                FeatureSet.TEXTURE, FeatureSet.SLOPE, FeatureSet.VV_DB_RAW);
        assertThat(features.grid()).isEqualTo(scene.image().grid());
    }

    @Test
    void derive_convertsBackscatterToDecibels() {
        FeatureSet features = deriver.derive(SyntheticScenes.lakeScene("S1_TEST", Instant.now()),
                SyntheticScenes.gridAoi(), 3);
        LocalRaster image = (LocalRaster) features.image();

        // deep inside the lake and deep inside land, away from filter edges
        assertThat(image.valueAt(FeatureSet.VV_DB, 20, 20)).isCloseTo(-23.01f, within(0.01f));
        assertThat(image.valueAt(FeatureSet.VH_DB, 20, 20)).isCloseTo(-30f, within(0.01f));
        assertThat(image.valueAt(FeatureSet.VV_VH_DIFF, 20, 20)).isCloseTo(6.99f, within(0.01f));
        assertThat(image.valueAt(FeatureSet.VV_DB, 85, 85)).isCloseTo(-10f, within(0.01f));
        assertThat(image.valueAt(FeatureSet.VV_DB_RAW, 59, 49)).isCloseTo(-23.01f, within(0.01f));
    }

    @Test
    void derive_flatHomogeneousAreas_haveNoSlopeOrTexture() {
        FeatureSet features = deriver.derive(SyntheticScenes.lakeScene("S1_TEST", Instant.now()),
                SyntheticScenes.gridAoi(), 3);
        LocalRaster image = (LocalRaster) features.image();

        assertThat(image.valueAt(FeatureSet.SLOPE, 50, 50)).isZero();
        assertThat(image.valueAt(FeatureSet.TEXTURE, 20, 20)).isCloseTo(0f, within(1e-4f));
        assertThat(image.valueAt(FeatureSet.TEXTURE, 60, 20)).isGreaterThan(1f);
    }

    @Test
    void derive_masksPixelsOutsideAoi() {
        GridGeometry grid = SyntheticScenes.GRID;
        Geometry northHalf = SyntheticScenes.box(grid.west(), grid.north() - 50 * grid.stepLat(),
                grid.west() + 100 * grid.stepLon(), grid.north());

        FeatureSet features = deriver.derive(SyntheticScenes.lakeScene("S1_TEST", Instant.now()), northHalf, 3);
        LocalRaster image = (LocalRaster) features.image();

        assertThat(image.valueAt(FeatureSet.VV_DB, 10, 10)).isNotNaN();
        assertThat(image.valueAt(FeatureSet.VV_DB, 10, 90)).isNaN();
        assertThat(image.valueAt(FeatureSet.SLOPE, 10, 90)).isNaN();
    }

    @Test
    void derive_sceneWithoutElevation_failsAsUpstreamError() {
        LocalRaster image = LocalRaster.builder(SyntheticScenes.GRID)
                .band(SarScene.BAND_VV, (x, y) -> 0.1f)
                .band(SarScene.BAND_VH, (x, y) -> 0.02f)
                .build();
        SarScene scene = new SarScene("S1_NO_DEM", Instant.now(), SyntheticScenes.gridAoi(), "IW",
                SarScene.OrbitPass.ASCENDING, Set.of(SarScene.BAND_VV, SarScene.BAND_VH), image);

        UpstreamComputeException e = catchThrowableOfType(
                () -> deriver.derive(scene, SyntheticScenes.gridAoi(), 3), UpstreamComputeException.class);

        assertThat(e).isNotNull();
        assertThat(e.getStage()).isEqualTo(PipelineStage.FEATURE_DERIVATION);
    }
}
