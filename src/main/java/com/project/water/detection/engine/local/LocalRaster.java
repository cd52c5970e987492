package com.project.water.detection.engine.local;

import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.RasterEngineException;
import com.project.water.detection.engine.RasterImage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory raster used by {@link LocalRasterEngine}. One {@code float[]} per band in row-major
 * order; {@code NaN} marks a masked pixel. Band arrays are never written after construction.
 */
public final class LocalRaster implements RasterImage {

    /** Value generator used by {@link Builder#band(String, PixelFunction)}. */
    @FunctionalInterface
    public interface PixelFunction {
        float valueAt(int x, int y);
    }

    private final GridGeometry grid;
    private final Map<String, float[]> bands;

    LocalRaster(GridGeometry grid, Map<String, float[]> bands) {
        if (bands.isEmpty()) {
            throw new RasterEngineException("Raster must have at least one band");
        }
        for (var entry : bands.entrySet()) {
            if (entry.getValue().length != grid.pixelCount()) {
                throw new RasterEngineException("Band " + entry.getKey() + " has " + entry.getValue().length
                        + " values, grid needs " + grid.pixelCount());
            }
        }
        this.grid = grid;
        this.bands = Collections.unmodifiableMap(new LinkedHashMap<>(bands));
    }

    static LocalRaster single(GridGeometry grid, String band, float[] values) {
        Map<String, float[]> map = new LinkedHashMap<>();
        map.put(band, values);
        return new LocalRaster(grid, map);
    }

    public static Builder builder(GridGeometry grid) {
        return new Builder(grid);
    }

    public static LocalRaster constant(GridGeometry grid, String band, float value) {
        return builder(grid).band(band, (x, y) -> value).build();
    }

    @Override
    public GridGeometry grid() {
        return grid;
    }

    @Override
    public List<String> bandNames() {
        return List.copyOf(bands.keySet());
    }

    /** Value of one pixel; {@code NaN} when masked. */
    public float valueAt(String band, int x, int y) {
        return band(band)[y * grid.width() + x];
    }

    float[] band(String name) {
        float[] values = bands.get(name);
        if (values == null) {
            throw new RasterEngineException("Band '" + name + "' not found, available: " + bands.keySet());
        }
        return values;
    }

    Map<String, float[]> bands() {
        return bands;
    }

    String singleBandName() {
        if (bands.size() != 1) {
            throw new RasterEngineException("Expected a single-band image, got " + bands.keySet());
        }
        return bands.keySet().iterator().next();
    }

    /** Nearest-neighbour resampling to every {@code factor}-th pixel, sampling each block's centre. */
    LocalRaster resample(int factor) {
        if (factor <= 1) {
            return this;
        }
        GridGeometry coarse = grid.coarsen(factor);
        Map<String, float[]> out = new LinkedHashMap<>();
        for (var entry : bands.entrySet()) {
            float[] src = entry.getValue();
            float[] dst = new float[coarse.pixelCount()];
            for (int y = 0; y < coarse.height(); y++) {
                int sy = Math.min(grid.height() - 1, y * factor + factor / 2);
                for (int x = 0; x < coarse.width(); x++) {
                    int sx = Math.min(grid.width() - 1, x * factor + factor / 2);
                    dst[y * coarse.width() + x] = src[sy * grid.width() + sx];
                }
            }
            out.put(entry.getKey(), dst);
        }
        return new LocalRaster(coarse, out);
    }

    public static final class Builder {
        private final GridGeometry grid;
        private final Map<String, float[]> bands = new LinkedHashMap<>();

        private Builder(GridGeometry grid) {
            this.grid = grid;
        }

        public Builder band(String name, float[] values) {
            bands.put(name, values.clone());
            return this;
        }

        public Builder band(String name, PixelFunction function) {
            float[] values = new float[grid.pixelCount()];
            for (int y = 0; y < grid.height(); y++) {
                for (int x = 0; x < grid.width(); x++) {
                    values[y * grid.width() + x] = function.valueAt(x, y);
                }
            }
            bands.put(name, values);
            return this;
        }

        public LocalRaster build() {
            return new LocalRaster(grid, bands);
        }
    }
}
