package com.project.water.detection.engine.local;

import com.project.water.detection.engine.Geodesy;
import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.Kernel;
import com.project.water.detection.engine.RasterEngine;
import com.project.water.detection.engine.RasterEngineException;
import com.project.water.detection.engine.RasterImage;
import com.project.water.detection.engine.ReduceOptions;
import com.project.water.detection.engine.Reducer;
import com.project.water.detection.engine.SarScene;
import com.project.water.detection.engine.SceneQuery;
import com.project.water.detection.engine.VectorOptions;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * In-process {@link RasterEngine} over {@link LocalRaster} images and an in-memory scene catalog.
 * Focal filters and slope run on OpenCV, which is loaded by {@link #initialize()}.
 */
public class LocalRasterEngine implements RasterEngine {
    private static final Logger log = LoggerFactory.getLogger(LocalRasterEngine.class);

    private final GeometryFactory geometryFactory = new GeometryFactory(new PrecisionModel(), 4326);
    private final RegionTracer tracer = new RegionTracer(geometryFactory);
    private final List<SarScene> scenes = new CopyOnWriteArrayList<>();
    private volatile boolean initialized;

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        try {
            nu.pattern.OpenCV.loadLocally();
            log.info("OpenCV loaded successfully");
        } catch (RuntimeException | LinkageError e) {
            log.error("Failed to load OpenCV", e);
            throw new RasterEngineException("Raster engine initialization failed: " + e.getMessage(), e);
        }
        initialized = true;
        log.info("Local raster engine initialized with {} registered scenes", scenes.size());
    }

    @Override
    public synchronized void shutdown() {
        if (initialized) {
            initialized = false;
            log.info("Local raster engine shut down");
        }
    }

    @Override
    public boolean isInitialized() {
        return initialized;
    }

    /** Adds a scene to the catalog searched by {@link #latestScene}. */
    public void register(SarScene scene) {
        if (!(scene.image() instanceof LocalRaster)) {
            throw new RasterEngineException("Scene " + scene.id() + " is not backed by a local raster");
        }
        scenes.add(scene);
        log.debug("Registered scene {} acquired {}", scene.id(), scene.acquired());
    }

    @Override
    public Optional<SarScene> latestScene(SceneQuery query) {
        checkInitialized();
        return scenes.stream()
                .filter(query::matches)
                .max(Comparator.comparing(SarScene::acquired));
    }

    @Override
    public RasterImage select(RasterImage image, String band) {
        LocalRaster raster = local(image);
        return LocalRaster.single(raster.grid(), band, raster.band(band));
    }

    @Override
    public RasterImage rename(RasterImage image, String band) {
        LocalRaster raster = local(image);
        return LocalRaster.single(raster.grid(), band, raster.band(raster.singleBandName()));
    }

    @Override
    public RasterImage cat(RasterImage... images) {
        if (images.length == 0) {
            throw new RasterEngineException("Nothing to concatenate");
        }
        GridGeometry grid = images[0].grid();
        Map<String, float[]> bands = new LinkedHashMap<>();
        for (RasterImage image : images) {
            LocalRaster raster = local(image);
            requireSameGrid(grid, raster.grid());
            for (var entry : raster.bands().entrySet()) {
                if (bands.putIfAbsent(entry.getKey(), entry.getValue()) != null) {
                    throw new RasterEngineException("Duplicate band '" + entry.getKey() + "'");
                }
            }
        }
        return new LocalRaster(grid, bands);
    }

    @Override
    public RasterImage subtract(RasterImage a, RasterImage b) {
        return combine(a, b, (x, y) -> x - y);
    }

    @Override
    public RasterImage log10(RasterImage image) {
        return map(image, Math::log10);
    }

    @Override
    public RasterImage multiply(RasterImage image, double factor) {
        return map(image, v -> v * factor);
    }

    @Override
    public RasterImage lessThan(RasterImage image, double value) {
        return map(image, v -> v < value ? 1.0 : 0.0);
    }

    @Override
    public RasterImage and(RasterImage a, RasterImage b) {
        return combine(a, b, (x, y) -> x != 0 && y != 0 ? 1.0 : 0.0);
    }

    @Override
    public RasterImage selfMask(RasterImage image) {
        return map(image, v -> v == 0 ? Double.NaN : v);
    }

    @Override
    public RasterImage clip(RasterImage image, Geometry geometry) {
        LocalRaster raster = local(image);
        boolean[] inside = coverage(raster.grid(), geometry);
        Map<String, float[]> out = new LinkedHashMap<>();
        for (var entry : raster.bands().entrySet()) {
            float[] values = entry.getValue().clone();
            for (int i = 0; i < values.length; i++) {
                if (!inside[i]) {
                    values[i] = Float.NaN;
                }
            }
            out.put(entry.getKey(), values);
        }
        return new LocalRaster(raster.grid(), out);
    }

    @Override
    public RasterImage focalMin(RasterImage image, Kernel kernel) {
        LocalRaster raster = local(image);
        return perBand(raster, values -> FocalFilters.min(values, raster.grid(), kernel));
    }

    @Override
    public RasterImage focalMax(RasterImage image, Kernel kernel) {
        LocalRaster raster = local(image);
        return perBand(raster, values -> FocalFilters.max(values, raster.grid(), kernel));
    }

    @Override
    public RasterImage focalMedian(RasterImage image, Kernel kernel) {
        LocalRaster raster = local(image);
        return perBand(raster, values -> FocalFilters.median(values, raster.grid(), kernel));
    }

    @Override
    public RasterImage focalStdDev(RasterImage image, Kernel kernel) {
        LocalRaster raster = local(image);
        return perBand(raster, values -> FocalFilters.stdDev(values, raster.grid(), kernel));
    }

    @Override
    public RasterImage slope(RasterImage elevation) {
        LocalRaster raster = local(elevation);
        float[] slope = FocalFilters.slope(raster.band(raster.singleBandName()), raster.grid());
        return LocalRaster.single(raster.grid(), "slope", slope);
    }

    @Override
    public Map<String, Double> reduceRegion(RasterImage image, Reducer reducer, Geometry region, ReduceOptions options) {
        LocalRaster raster = local(image);
        int factor = scaleFactor(raster.grid(), options.scaleMeters());
        LocalRaster sampled = raster.resample(factor);
        boolean[] inside = coverage(sampled.grid(), region);
        long regionPixels = count(inside);

        while (regionPixels > options.maxPixels()) {
            if (!options.bestEffort()) {
                throw new RasterEngineException("Region has " + regionPixels + " pixels at scale "
                        + sampled.grid().resolutionMeters() + " m, budget is " + options.maxPixels());
            }
            factor *= 2;
            sampled = raster.resample(factor);
            inside = coverage(sampled.grid(), region);
            regionPixels = count(inside);
            log.debug("Best effort reduction: coarsened to {} m ({} pixels)", sampled.grid().resolutionMeters(), regionPixels);
        }

        Map<String, Double> result = new LinkedHashMap<>();
        for (var entry : sampled.bands().entrySet()) {
            double[] values = validValues(entry.getValue(), inside);
            String band = entry.getKey();
            if (reducer.kind() == Reducer.Kind.SUM) {
                result.put(band, Arrays.stream(values).sum());
            } else if (reducer.kind() == Reducer.Kind.COUNT) {
                result.put(band, (double) values.length);
            } else if (values.length > 0) {
                // no pixels: percentile keys stay absent
                Percentile percentile = new Percentile();
                percentile.setData(values);
                for (int p : reducer.percentiles()) {
                    double value = p == 0 ? Arrays.stream(values).min().getAsDouble() : percentile.evaluate(p);
                    result.put(Reducer.percentileKey(band, p), value);
                }
            }
        }
        return result;
    }

    @Override
    public List<Geometry> reduceToVectors(RasterImage image, Geometry region, VectorOptions options) {
        LocalRaster raster = local(image).resample(scaleFactor(image.grid(), options.scaleMeters()));
        GridGeometry grid = raster.grid();
        if (grid.pixelCount() > options.maxPixels()) {
            throw new RasterEngineException("Vectorization needs " + grid.pixelCount()
                    + " pixels, budget is " + options.maxPixels());
        }
        float[] values = raster.band(raster.bandNames().get(0));
        boolean[] inside = coverage(grid, region);

        RegionTracer.Labelling labelling = tracer.label(values, inside, grid, options.eightConnected());
        List<Geometry> polygons = new ArrayList<>(labelling.regions().size());
        for (RegionTracer.Region r : labelling.regions()) {
            polygons.add(tracer.trace(labelling, r, grid));
        }
        log.debug("Vectorized {} regions on a {}x{} grid", polygons.size(), grid.width(), grid.height());
        return polygons;
    }

    @Override
    public double geodesicArea(Geometry geometry) {
        return Geodesy.area(geometry);
    }

    @Override
    public Geometry simplify(Geometry geometry, double maxErrorMeters) {
        return TopologyPreservingSimplifier.simplify(geometry, Geodesy.metersToDegrees(maxErrorMeters));
    }

    private LocalRaster local(RasterImage image) {
        checkInitialized();
        if (!(image instanceof LocalRaster)) {
            throw new RasterEngineException("Unsupported raster implementation: "
                    + (image == null ? "null" : image.getClass().getName()));
        }
        return (LocalRaster) image;
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new RasterEngineException("Raster engine is not initialized");
        }
    }

    private RasterImage map(RasterImage image, DoubleUnaryOperator op) {
        return perBand(local(image), values -> {
            float[] out = new float[values.length];
            for (int i = 0; i < values.length; i++) {
                out[i] = Float.isNaN(values[i]) ? Float.NaN : (float) op.applyAsDouble(values[i]);
            }
            return out;
        });
    }

    private RasterImage combine(RasterImage a, RasterImage b, DoubleBinaryOperator op) {
        LocalRaster left = local(a), right = local(b);
        requireSameGrid(left.grid(), right.grid());
        String name = left.singleBandName();
        float[] x = left.band(name), y = right.band(right.singleBandName());
        float[] out = new float[x.length];
        for (int i = 0; i < x.length; i++) {
            out[i] = Float.isNaN(x[i]) || Float.isNaN(y[i]) ? Float.NaN : (float) op.applyAsDouble(x[i], y[i]);
        }
        return LocalRaster.single(left.grid(), name, out);
    }

    private interface BandFunction {
        float[] apply(float[] values);
    }

    private static LocalRaster perBand(LocalRaster raster, BandFunction function) {
        Map<String, float[]> out = new LinkedHashMap<>();
        for (var entry : raster.bands().entrySet()) {
            out.put(entry.getKey(), function.apply(entry.getValue()));
        }
        return new LocalRaster(raster.grid(), out);
    }

    private static void requireSameGrid(GridGeometry expected, GridGeometry actual) {
        if (!expected.equals(actual)) {
            throw new RasterEngineException("Images are on different grids: " + expected + " vs " + actual);
        }
    }

    private static int scaleFactor(GridGeometry grid, double scaleMeters) {
        return Math.max(1, (int) Math.round(scaleMeters / grid.resolutionMeters()));
    }

    /** Pixels whose centre is covered by {@code geometry}. */
    private boolean[] coverage(GridGeometry grid, Geometry geometry) {
        boolean[] inside = new boolean[grid.pixelCount()];
        if (geometry == null || geometry.isEmpty()) {
            return inside;
        }
        PreparedGeometry prepared = PreparedGeometryFactory.prepare(geometry);
        Envelope bounds = geometry.getEnvelopeInternal();
        for (int y = 0; y < grid.height(); y++) {
            double lat = grid.pixelCenterLat(y);
            if (lat < bounds.getMinY() || lat > bounds.getMaxY()) continue;
            for (int x = 0; x < grid.width(); x++) {
                double lon = grid.pixelCenterLon(x);
                if (lon < bounds.getMinX() || lon > bounds.getMaxX()) continue;
                inside[y * grid.width() + x] = prepared.covers(geometryFactory.createPoint(new Coordinate(lon, lat)));
            }
        }
        return inside;
    }

    private static long count(boolean[] flags) {
        long n = 0;
        for (boolean flag : flags) {
            if (flag) n++;
        }
        return n;
    }

    private static double[] validValues(float[] values, boolean[] inside) {
        double[] buffer = new double[values.length];
        int n = 0;
        for (int i = 0; i < values.length; i++) {
            if (inside[i] && !Float.isNaN(values[i]) && !Float.isInfinite(values[i])) {
                buffer[n++] = values[i];
            }
        }
        return Arrays.copyOf(buffer, n);
    }
}
