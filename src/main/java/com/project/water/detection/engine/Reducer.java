package com.project.water.detection.engine;

import java.util.List;

/**
 * Region reducer. Percentile outputs are keyed {@code <band>_p<percentile>},
 * all other outputs are keyed by band name.
 */
public record Reducer(Kind kind, List<Integer> percentiles) {

    public enum Kind { PERCENTILE, SUM, COUNT }

    public Reducer {
        percentiles = percentiles == null ? List.of() : List.copyOf(percentiles);
        if (kind == Kind.PERCENTILE && percentiles.isEmpty()) {
            throw new IllegalArgumentException("Percentile reducer needs at least one percentile");
        }
        for (int p : percentiles) {
            if (p < 0 || p > 100) {
                throw new IllegalArgumentException("Percentile out of range: " + p);
            }
        }
    }

    public static Reducer percentile(Integer... percentiles) {
        return new Reducer(Kind.PERCENTILE, List.of(percentiles));
    }

    public static Reducer sum() {
        return new Reducer(Kind.SUM, List.of());
    }

    public static Reducer count() {
        return new Reducer(Kind.COUNT, List.of());
    }

    public static String percentileKey(String band, int percentile) {
        return band + "_p" + percentile;
    }
}
