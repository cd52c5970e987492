package com.project.water.detection.engine;

import org.locationtech.jts.geom.Geometry;

import java.time.Instant;
import java.util.Set;

/** Filter for {@link RasterEngine#latestScene(SceneQuery)}. */
public record SceneQuery(
        Geometry aoi,
        Instant from,
        Instant to,
        Set<String> polarisations,
        String instrumentMode,
        SarScene.OrbitPass orbitPass
) {
    public SceneQuery {
        polarisations = Set.copyOf(polarisations);
    }

    public boolean matches(SarScene scene) {
        return !scene.acquired().isBefore(from)
                && !scene.acquired().isAfter(to)
                && scene.polarisations().containsAll(polarisations)
                && instrumentMode.equals(scene.instrumentMode())
                && orbitPass == scene.orbitPass()
                && scene.footprint().intersects(aoi);
    }
}
