package com.project.water.detection.service;

import com.project.water.detection.SyntheticScenes;
import com.project.water.detection.config.DetectionSettings;
import com.project.water.detection.engine.SarScene;
import com.project.water.detection.engine.local.LocalRasterEngine;
import com.project.water.detection.exceptions.NoDataException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SceneLocatorTest {
    private static final Instant NOW = Instant.parse("2024-06-30T12:00:00Z");

    private LocalRasterEngine engine;
    private SceneLocator locator;

    @BeforeEach
    void setUp() {
        engine = new LocalRasterEngine();
        engine.initialize();
        locator = new SceneLocator(engine, DetectionSettings.defaults(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void locate_returnsMostRecentEligibleScene() {
        engine.register(SyntheticScenes.lakeScene("older", NOW.minus(Duration.ofDays(20))));
        engine.register(SyntheticScenes.lakeScene("newest", NOW.minus(Duration.ofDays(2))));
        engine.register(SyntheticScenes.lakeScene("middle", NOW.minus(Duration.ofDays(10))));

        assertThat(locator.locate(SyntheticScenes.gridAoi()).id()).isEqualTo("newest");
    }

    @Test
    void locate_ignoresScenesOutsideLookupWindow() {
        engine.register(SyntheticScenes.lakeScene("stale", NOW.minus(Duration.ofDays(31))));

        assertThatThrownBy(() -> locator.locate(SyntheticScenes.gridAoi()))
                .isInstanceOf(NoDataException.class)
                .hasMessage("No Sentinel-1 imagery found in last 30 days for this area");
    }

    @Test
    void locate_ignoresOtherOrbitPass() {
        engine.register(SyntheticScenes.scene("descending", NOW.minus(Duration.ofDays(1)), SarScene.OrbitPass.DESCENDING));
        engine.register(SyntheticScenes.lakeScene("ascending", NOW.minus(Duration.ofDays(5))));

        assertThat(locator.locate(SyntheticScenes.gridAoi()).id()).isEqualTo("ascending");
    }

    @Test
    void locate_ignoresScenesNotCoveringAoi() {
        engine.register(SyntheticScenes.lakeScene("elsewhere", NOW.minus(Duration.ofDays(1))));

        assertThatThrownBy(() -> locator.locate(SyntheticScenes.box(100, 10, 100.1, 10.1)))
                .isInstanceOf(NoDataException.class);
    }
}
