package com.project.water.detection.engine.local;

import com.project.water.detection.engine.GridGeometry;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.operation.linemerge.LineMerger;
import org.locationtech.jts.operation.polygonize.Polygonizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Connected-region labelling and outline tracing of a single band.
 * <p>
 * Regions are maximal groups of unmasked, equal-valued pixels. Each region's outline is built
 * from the pixel edges separating it from everything else, merged into lines and polygonized, so
 * holes and pinched corners come out as JTS topology rather than ad-hoc ring walking.
 */
final class RegionTracer {
    private static final Logger log = LoggerFactory.getLogger(RegionTracer.class);

    private static final int[][] DIRS_4 = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}};
    private static final int[][] DIRS_8 = {{0, -1}, {0, 1}, {-1, 0}, {1, 0}, {-1, -1}, {1, -1}, {-1, 1}, {1, 1}};

    private final GeometryFactory factory;

    RegionTracer(GeometryFactory factory) {
        this.factory = factory;
    }

    /** Bounding box and size of one labelled region. */
    record Region(int label, int minX, int minY, int maxX, int maxY, int pixels) {}

    /** Result of {@link #label}: per-pixel labels (0 = none) and the regions in scan order. */
    record Labelling(int[] labels, List<Region> regions) {}

    /**
     * Labels connected regions of pixels that are unmasked and inside {@code eligible}.
     */
    Labelling label(float[] values, boolean[] eligible, GridGeometry grid, boolean eightConnected) {
        int w = grid.width(), h = grid.height();
        int[] labels = new int[w * h];
        int[] queue = new int[w * h];
        int[][] dirs = eightConnected ? DIRS_8 : DIRS_4;
        List<Region> regions = new ArrayList<>();
        int nextLabel = 1;

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (labels[idx] != 0 || !eligible[idx] || Float.isNaN(values[idx])) continue;

                float value = values[idx];
                int head = 0, tail = 0;
                queue[tail++] = idx;
                labels[idx] = nextLabel;
                int minX = x, maxX = x, minY = y, maxY = y;

                while (head < tail) {
                    int p = queue[head++];
                    int px = p % w, py = p / w;
                    minX = Math.min(minX, px);
                    maxX = Math.max(maxX, px);
                    minY = Math.min(minY, py);
                    maxY = Math.max(maxY, py);

                    for (int[] dir : dirs) {
                        int nx = px + dir[0];
                        int ny = py + dir[1];
                        if (nx < 0 || nx >= w || ny < 0 || ny >= h) continue;
                        int nIdx = ny * w + nx;
                        if (labels[nIdx] == 0 && eligible[nIdx] && values[nIdx] == value) {
                            labels[nIdx] = nextLabel;
                            queue[tail++] = nIdx;
                        }
                    }
                }
                regions.add(new Region(nextLabel, minX, minY, maxX, maxY, tail));
                nextLabel++;
            }
        }
        log.debug("Labelled {} regions ({}-connected)", regions.size(), eightConnected ? 8 : 4);
        return new Labelling(labels, regions);
    }

    /** Outline of one region in longitude/latitude. */
    Geometry trace(Labelling labelling, Region region, GridGeometry grid) {
        int[] labels = labelling.labels();
        int w = grid.width();
        int label = region.label();
        List<LineString> edges = new ArrayList<>();

        // Horizontal edges lie on row boundary y, between pixel rows y-1 and y.
        for (int y = region.minY(); y <= region.maxY() + 1; y++) {
            for (int x = region.minX(); x <= region.maxX(); x++) {
                boolean above = y > region.minY() && labels[(y - 1) * w + x] == label;
                boolean below = y <= region.maxY() && labels[y * w + x] == label;
                if (above != below) {
                    edges.add(segment(x, y, x + 1, y));
                }
            }
        }
        // Vertical edges lie on column boundary x, between pixel columns x-1 and x.
        for (int x = region.minX(); x <= region.maxX() + 1; x++) {
            for (int y = region.minY(); y <= region.maxY(); y++) {
                boolean left = x > region.minX() && labels[y * w + x - 1] == label;
                boolean right = x <= region.maxX() && labels[y * w + x] == label;
                if (left != right) {
                    edges.add(segment(x, y, x, y + 1));
                }
            }
        }

        LineMerger merger = new LineMerger();
        merger.add(edges);
        Polygonizer polygonizer = new Polygonizer(true);
        polygonizer.add(merger.getMergedLineStrings());
        Geometry outline = polygonizer.getGeometry();
        outline.apply(grid.pixelToLonLat());
        outline.geometryChanged();
        outline.normalize();
        return outline;
    }

    private LineString segment(int x0, int y0, int x1, int y1) {
        return factory.createLineString(new Coordinate[]{new Coordinate(x0, y0), new Coordinate(x1, y1)});
    }
}
