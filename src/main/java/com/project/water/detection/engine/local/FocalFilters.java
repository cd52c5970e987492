package com.project.water.detection.engine.local;

import com.project.water.detection.engine.GridGeometry;
import com.project.water.detection.engine.Kernel;
import org.apache.commons.math3.stat.descriptive.rank.Median;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.imgproc.Imgproc;

/**
 * Neighbourhood filters over single bands. Masked ({@code NaN}) pixels are ignored inside the
 * neighbourhood and stay masked in the output.
 */
final class FocalFilters {

    private FocalFilters() {
    }

    static float[] min(float[] src, GridGeometry grid, Kernel kernel) {
        return morphology(src, grid, kernel, true);
    }

    static float[] max(float[] src, GridGeometry grid, Kernel kernel) {
        return morphology(src, grid, kernel, false);
    }

    private static float[] morphology(float[] src, GridGeometry grid, Kernel kernel, boolean erode) {
        float neutral = erode ? Float.MAX_VALUE : -Float.MAX_VALUE;
        float[] filled = new float[src.length];
        for (int i = 0; i < src.length; i++) {
            filled[i] = Float.isNaN(src[i]) ? neutral : src[i];
        }

        Mat image = toMat(filled, grid);
        Mat element = structuringElement(offsets(kernel, grid));
        Mat result = new Mat();
        try {
            if (erode) {
                Imgproc.erode(image, result, element);
            } else {
                Imgproc.dilate(image, result, element);
            }
            float[] out = toFloats(result, grid);
            restoreMask(src, out);
            return out;
        } finally {
            image.release();
            element.release();
            result.release();
        }
    }

    static float[] median(float[] src, GridGeometry grid, Kernel kernel) {
        boolean[][] offsets = offsets(kernel, grid);
        int r = offsets.length / 2;
        int w = grid.width(), h = grid.height();
        double[] buffer = new double[offsets.length * offsets.length];
        Median median = new Median();
        float[] out = new float[src.length];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (Float.isNaN(src[idx])) {
                    out[idx] = Float.NaN;
                    continue;
                }
                int n = 0;
                for (int dy = -r; dy <= r; dy++) {
                    int yy = y + dy;
                    if (yy < 0 || yy >= h) continue;
                    for (int dx = -r; dx <= r; dx++) {
                        int xx = x + dx;
                        if (xx < 0 || xx >= w || !offsets[dy + r][dx + r]) continue;
                        float v = src[yy * w + xx];
                        if (!Float.isNaN(v)) {
                            buffer[n++] = v;
                        }
                    }
                }
                out[idx] = (float) median.evaluate(buffer, 0, n);
            }
        }
        return out;
    }

    /** Sample standard deviation of the unmasked neighbours, 0 where fewer than two exist. */
    static float[] stdDev(float[] src, GridGeometry grid, Kernel kernel) {
        int n = src.length;
        double[] values = new double[n];
        double[] squares = new double[n];
        double[] valid = new double[n];
        for (int i = 0; i < n; i++) {
            if (!Float.isNaN(src[i])) {
                values[i] = src[i];
                squares[i] = (double) src[i] * src[i];
                valid[i] = 1.0;
            }
        }

        boolean[][] offsets = offsets(kernel, grid);
        Mat weights = weightKernel(offsets);
        Mat valueMat = toMat(values, grid), squareMat = toMat(squares, grid), validMat = toMat(valid, grid);
        Mat sum = new Mat(), sumSq = new Mat(), count = new Mat();
        try {
            Point anchor = new Point(-1, -1);
            Imgproc.filter2D(valueMat, sum, CvType.CV_64F, weights, anchor, 0, Core.BORDER_CONSTANT);
            Imgproc.filter2D(squareMat, sumSq, CvType.CV_64F, weights, anchor, 0, Core.BORDER_CONSTANT);
            Imgproc.filter2D(validMat, count, CvType.CV_64F, weights, anchor, 0, Core.BORDER_CONSTANT);

            double[] s = toDoubles(sum, grid), s2 = toDoubles(sumSq, grid), c = toDoubles(count, grid);
            float[] out = new float[n];
            for (int i = 0; i < n; i++) {
                double k = Math.round(c[i]);
                if (k < 2) {
                    out[i] = 0f;
                    continue;
                }
                double variance = (s2[i] - s[i] * s[i] / k) / (k - 1);
                out[i] = (float) Math.sqrt(Math.max(0.0, variance));
            }
            restoreMask(src, out);
            return out;
        } finally {
            weights.release();
            valueMat.release();
            squareMat.release();
            validMat.release();
            sum.release();
            sumSq.release();
            count.release();
        }
    }

    /**
     * Terrain slope in degrees from a 3x3 Sobel gradient of the elevation, which is the
     * {@code (e2 + 2 e5 + e8 - e0 - 2 e3 - e6) / 8} estimate scaled by 8.
     */
    static float[] slope(float[] elevation, GridGeometry grid) {
        Mat dem = toMat(elevation, grid);
        Mat dx = new Mat(), dy = new Mat();
        try {
            Imgproc.Sobel(dem, dx, CvType.CV_32F, 1, 0, 3, 1.0, 0.0, Core.BORDER_REPLICATE);
            Imgproc.Sobel(dem, dy, CvType.CV_32F, 0, 1, 3, 1.0, 0.0, Core.BORDER_REPLICATE);
            float[] gx = toFloats(dx, grid), gy = toFloats(dy, grid);
            double run = 8.0 * grid.resolutionMeters();
            float[] out = new float[elevation.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = (float) Math.toDegrees(Math.atan(Math.hypot(gx[i], gy[i]) / run));
            }
            restoreMask(elevation, out);
            return out;
        } finally {
            dem.release();
            dx.release();
            dy.release();
        }
    }

    /** Membership table of a (2r+1)x(2r+1) neighbourhood, r being the kernel radius in whole pixels. */
    static boolean[][] offsets(Kernel kernel, GridGeometry grid) {
        double radius = kernel.radiusInPixels(grid.resolutionMeters());
        int r = (int) Math.floor(radius + 1e-9);
        int size = 2 * r + 1;
        boolean[][] inside = new boolean[size][size];
        for (int dy = -r; dy <= r; dy++) {
            for (int dx = -r; dx <= r; dx++) {
                inside[dy + r][dx + r] = kernel.shape() == Kernel.Shape.SQUARE
                        || dx * dx + dy * dy <= radius * radius + 1e-9;
            }
        }
        return inside;
    }

    private static Mat structuringElement(boolean[][] offsets) {
        int size = offsets.length;
        byte[] data = new byte[size * size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                data[y * size + x] = (byte) (offsets[y][x] ? 1 : 0);
            }
        }
        Mat element = new Mat(size, size, CvType.CV_8UC1);
        element.put(0, 0, data);
        return element;
    }

    private static Mat weightKernel(boolean[][] offsets) {
        int size = offsets.length;
        double[] data = new double[size * size];
        for (int y = 0; y < size; y++) {
            for (int x = 0; x < size; x++) {
                data[y * size + x] = offsets[y][x] ? 1.0 : 0.0;
            }
        }
        Mat weights = new Mat(size, size, CvType.CV_64FC1);
        weights.put(0, 0, data);
        return weights;
    }

    private static void restoreMask(float[] src, float[] out) {
        for (int i = 0; i < src.length; i++) {
            if (Float.isNaN(src[i])) {
                out[i] = Float.NaN;
            }
        }
    }

    private static Mat toMat(float[] data, GridGeometry grid) {
        Mat mat = new Mat(grid.height(), grid.width(), CvType.CV_32FC1);
        mat.put(0, 0, data);
        return mat;
    }

    private static Mat toMat(double[] data, GridGeometry grid) {
        Mat mat = new Mat(grid.height(), grid.width(), CvType.CV_64FC1);
        mat.put(0, 0, data);
        return mat;
    }

    private static float[] toFloats(Mat mat, GridGeometry grid) {
        float[] out = new float[grid.pixelCount()];
        mat.get(0, 0, out);
        return out;
    }

    private static double[] toDoubles(Mat mat, GridGeometry grid) {
        double[] out = new double[grid.pixelCount()];
        mat.get(0, 0, out);
        return out;
    }
}
