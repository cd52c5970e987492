package com.project.water.detection.engine;

import org.locationtech.jts.geom.Geometry;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computational substrate for band algebra, focal filters, region statistics and vectorization.
 * <p>
 * Every operation returns a new image; inputs are never modified. Masked pixels are carried
 * through band algebra, ignored by focal filters and reductions, and never vectorized.
 * Failures surface as {@link RasterEngineException}.
 * <p>
 * Implementations must be initialized before use and are safe for concurrent requests afterwards.
 */
public interface RasterEngine {

    void initialize();

    void shutdown();

    boolean isInitialized();

    /** Most recent scene matching the query, if any. */
    Optional<SarScene> latestScene(SceneQuery query);

    RasterImage select(RasterImage image, String band);

    RasterImage rename(RasterImage image, String band);

    /** Stacks the bands of all images, which must share one grid. */
    RasterImage cat(RasterImage... images);

    RasterImage subtract(RasterImage a, RasterImage b);

    RasterImage log10(RasterImage image);

    RasterImage multiply(RasterImage image, double factor);

    /** 1 where the pixel is below {@code value}, else 0. */
    RasterImage lessThan(RasterImage image, double value);

    /** 1 where both inputs are non-zero, else 0. */
    RasterImage and(RasterImage a, RasterImage b);

    /** Masks every zero pixel. */
    RasterImage selfMask(RasterImage image);

    /** Masks every pixel whose centre lies outside {@code geometry}. */
    RasterImage clip(RasterImage image, Geometry geometry);

    RasterImage focalMin(RasterImage image, Kernel kernel);

    RasterImage focalMax(RasterImage image, Kernel kernel);

    RasterImage focalMedian(RasterImage image, Kernel kernel);

    RasterImage focalStdDev(RasterImage image, Kernel kernel);

    /** Terrain slope in degrees from a single elevation band in metres. */
    RasterImage slope(RasterImage elevation);

    /**
     * Reduces every band over the unmasked pixels inside {@code region}.
     * Outputs that cannot be computed (no pixels) are absent from the result.
     */
    Map<String, Double> reduceRegion(RasterImage image, Reducer reducer, Geometry region, ReduceOptions options);

    /** One polygonal geometry per connected region of equal-valued unmasked pixels inside {@code region}. */
    List<Geometry> reduceToVectors(RasterImage image, Geometry region, VectorOptions options);

    /** Area of a longitude/latitude geometry in square metres. */
    double geodesicArea(Geometry geometry);

    /** Simplified copy of a longitude/latitude geometry, deviating at most {@code maxErrorMeters}. */
    Geometry simplify(Geometry geometry, double maxErrorMeters);
}
