package com.project.water.detection.service;

import com.project.water.detection.DTOs.DetectionResult;
import com.project.water.detection.DTOs.WaterMask;
import com.project.water.detection.DTOs.WaterPolygon;
import com.project.water.detection.SyntheticScenes;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.local.LocalRaster;
import com.project.water.detection.engine.local.LocalRasterEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Geometry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VectorizerAreaFilterTest {
    private static final GridGeometry GRID = GridGeometry.of(10.0, 45.0, 50, 50, 10);

    private LocalRasterEngine engine;
    private VectorizerAreaFilter vectorizer;
    private Geometry aoi;

    @BeforeEach
    void setUp() {
        engine = new LocalRasterEngine();
        engine.initialize();
        vectorizer = new VectorizerAreaFilter(engine, DetectionSettings.defaults());
        aoi = SyntheticScenes.footprint(GRID);
    }

    @Test
    void vectorize_dropsRegionsBelowAreaFloor() {
        // 4 x 10 pixels (~4000 m2) and 6 x 10 pixels (~6000 m2)
        WaterMask mask = mask((x, y) -> (x >= 2 && x < 6 && y >= 2 && y < 12)
                || (x >= 20 && x < 26 && y >= 20 && y < 30) ? 1f : 0f);

        DetectionResult result = vectorizer.vectorize(mask, aoi, 50);

        assertThat(result.polygons()).hasSize(1);
        assertThat(result.polygons().get(0).areaM2()).isCloseTo(6000, within(10.0));
    }

    @Test
    void vectorize_everyPolygonMeetsFloor_andTotalsMatch() {
        WaterMask mask = mask((x, y) -> (x < 10 && y < 10) || (x >= 30 && x < 45 && y >= 30 && y < 40)
                || (x == 25 && y == 5) ? 1f : 0f);

        DetectionResult result = vectorizer.vectorize(mask, aoi, 20);

        assertThat(result.polygons()).hasSize(2);
        double sum = 0;
        for (WaterPolygon polygon : result.polygons()) {
            assertThat(polygon.areaM2()).isGreaterThanOrEqualTo(20 * VectorizerAreaFilter.NOMINAL_PIXEL_AREA_M2);
            sum += polygon.areaM2();
        }
        assertThat(result.totalAreaKm2()).isCloseTo(sum / 1_000_000.0, within(1e-12));
        assertThat(result.totalAreaKm2()).isCloseTo(0.025, within(0.0005));
    }

    @Test
    void vectorize_diagonalNeighboursAreSeparateRegions() {
        WaterMask mask = mask((x, y) -> (x >= 10 && x < 20 && y >= 10 && y < 20)
                || (x >= 20 && x < 30 && y >= 20 && y < 30) ? 1f : 0f);

        DetectionResult result = vectorizer.vectorize(mask, aoi, 50);

        assertThat(result.polygons()).hasSize(2);
    }

    @Test
    void vectorize_outlineWithHole_excludesHoleArea() {
        WaterMask mask = mask((x, y) -> x >= 5 && x < 25 && y >= 5 && y < 25
                && !(x >= 10 && x < 20 && y >= 10 && y < 20) ? 1f : 0f);

        DetectionResult result = vectorizer.vectorize(mask, aoi, 1);

        assertThat(result.polygons()).hasSize(1);
        assertThat(result.polygons().get(0).areaM2()).isCloseTo(30_000, within(50.0));
    }

    @Test
    void vectorize_emptyMask_returnsEmptyResult() {
        DetectionResult result = vectorizer.vectorize(mask((x, y) -> 0f), aoi, 1);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.totalAreaKm2()).isZero();
    }

    @Test
    void vectorize_engineFailure_returnsEmptyResult() {
        VectorizerAreaFilter broken = new VectorizerAreaFilter(new LocalRasterEngine(), DetectionSettings.defaults());

        DetectionResult result = broken.vectorize(mask((x, y) -> 1f), aoi, 1);

        assertThat(result.isEmpty()).isTrue();
        assertThat(result.totalAreaKm2()).isZero();
    }

    private static WaterMask mask(LocalRaster.PixelFunction function) {
        return new WaterMask(LocalRaster.builder(GRID).band(WaterMask.BAND, function).build());
    }
}
