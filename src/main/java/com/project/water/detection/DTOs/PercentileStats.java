package com.project.water.detection.DTOs;

/** Backscatter percentiles (dB) of one band over the AOI. */
public record PercentileStats(double p5, double p15, double p25, double p35, double p50, double p85) {

    public static final Integer[] LEVELS = {5, 15, 25, 35, 50, 85};

    /** Separation between the median and the lower quartile. */
    public double gap() {
        return p50 - p25;
    }

    public boolean isFinite() {
        return Double.isFinite(p5) && Double.isFinite(p15) && Double.isFinite(p25)
                && Double.isFinite(p35) && Double.isFinite(p50) && Double.isFinite(p85);
    }
}
