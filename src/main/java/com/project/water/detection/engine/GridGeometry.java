package com.project.water.detection.engine;

import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.util.AffineTransformation;

/**
 * North-up WGS84 pixel grid.
 *
 * @param west             longitude of the left edge
 * @param north            latitude of the top edge
 * @param stepLon          pixel width in degrees
 * @param stepLat          pixel height in degrees
 * @param width            columns
 * @param height           rows
 * @param resolutionMeters nominal ground size of a pixel
 */
public record GridGeometry(double west, double north, double stepLon, double stepLat,
                           int width, int height, double resolutionMeters) {

    public GridGeometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Grid must have at least one pixel: " + width + "x" + height);
        }
        if (stepLon <= 0 || stepLat <= 0 || resolutionMeters <= 0) {
            throw new IllegalArgumentException("Grid steps and resolution must be positive");
        }
    }

    /**
     * Grid whose top-left corner is ({@code west}, {@code north}) with square pixels of
     * {@code resolutionMeters} at the grid's centre latitude.
     */
    public static GridGeometry of(double west, double north, int width, int height, double resolutionMeters) {
        double stepLat = Geodesy.metersToDegrees(resolutionMeters);
        double centreLat = north - stepLat * height / 2.0;
        double stepLon = stepLat / Math.cos(Math.toRadians(centreLat));
        return new GridGeometry(west, north, stepLon, stepLat, width, height, resolutionMeters);
    }

    /** Smallest grid at {@code resolutionMeters} covering the envelope. */
    public static GridGeometry covering(Envelope envelope, double resolutionMeters) {
        double stepLat = Geodesy.metersToDegrees(resolutionMeters);
        double stepLon = stepLat / Math.cos(Math.toRadians(envelope.centre().y));
        int width = Math.max(1, (int) Math.ceil(envelope.getWidth() / stepLon));
        int height = Math.max(1, (int) Math.ceil(envelope.getHeight() / stepLat));
        return new GridGeometry(envelope.getMinX(), envelope.getMaxY(), stepLon, stepLat, width, height, resolutionMeters);
    }

    public int pixelCount() {
        return width * height;
    }

    public double pixelCenterLon(int x) {
        return west + (x + 0.5) * stepLon;
    }

    public double pixelCenterLat(int y) {
        return north - (y + 0.5) * stepLat;
    }

    public Envelope envelope() {
        return new Envelope(west, west + width * stepLon, north - height * stepLat, north);
    }

    /** Maps pixel-corner coordinates (x right, y down) to longitude/latitude. */
    public AffineTransformation pixelToLonLat() {
        return new AffineTransformation(stepLon, 0, west, 0, -stepLat, north);
    }

    /** Same extent sampled every {@code factor} pixels. */
    public GridGeometry coarsen(int factor) {
        if (factor <= 1) {
            return this;
        }
        int w = (width + factor - 1) / factor;
        int h = (height + factor - 1) / factor;
        return new GridGeometry(west, north, stepLon * factor, stepLat * factor, w, h, resolutionMeters * factor);
    }
}
