package com.chessvision.server.vision;

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the {@link FeatureVector} of a square image.
 *
 * Edge density is the fraction of pixels marked by OpenCV's Canny detector with
 * hysteresis thresholds 50/150.
 */
public class FeatureExtractor {
    private static final Logger logger = LoggerFactory.getLogger(FeatureExtractor.class);

    public static final int DARK_THRESHOLD = 100;
    public static final double CANNY_LOW = 50.0;
    public static final double CANNY_HIGH = 150.0;

    public FeatureVector extract(PixelImage square) {
        int[][] gray = square.toGray();
        int h = gray.length;
        int w = gray[0].length;
        int n = h * w;

        long sum = 0;
        int dark = 0;
        for (int[] row : gray) {
            for (int v : row) {
                sum += v;
                if (v < DARK_THRESHOLD) {
                    dark++;
                }
            }
        }
        double mean = (double) sum / n;

        double sq = 0.0;
        for (int[] row : gray) {
            for (int v : row) {
                double d = v - mean;
                sq += d * d;
            }
        }
        double variance = sq / n;

        // Center region [h/4, 3h/4) x [w/4, 3w/4); falls back to the whole square when degenerate
        int r0 = h / 4;
        int r1 = 3 * h / 4;
        int c0 = w / 4;
        int c1 = 3 * w / 4;
        if (r1 <= r0 || c1 <= c0) {
            r0 = 0;
            r1 = h;
            c0 = 0;
            c1 = w;
        }
        long centerSum = 0;
        int centerDark = 0;
        for (int r = r0; r < r1; r++) {
            for (int c = c0; c < c1; c++) {
                centerSum += gray[r][c];
                if (gray[r][c] < DARK_THRESHOLD) {
                    centerDark++;
                }
            }
        }
        int centerCount = (r1 - r0) * (c1 - c0);

        FeatureVector features = new FeatureVector(
                mean,
                variance,
                edgeDensity(gray),
                (double) dark / n,
                averageSaturation(square),
                (double) centerDark / centerCount,
                (double) centerSum / centerCount);

        if (logger.isTraceEnabled()) {
            logger.trace("Extracted {} from {}", features, square);
        }
        return features;
    }

    /**
     * Mean HSV saturation on the 0..255 scale. Grayscale images have zero saturation.
     */
    static double averageSaturation(PixelImage image) {
        if (image.getChannels() == 1) {
            return 0.0;
        }
        int[] s = image.samples();
        int pixels = image.getWidth() * image.getHeight();
        double total = 0.0;
        for (int i = 0; i < pixels; i++) {
            int r = s[i * 3];
            int g = s[i * 3 + 1];
            int b = s[i * 3 + 2];
            int max = Math.max(r, Math.max(g, b));
            int min = Math.min(r, Math.min(g, b));
            if (max > 0) {
                total += 255.0 * (max - min) / max;
            }
        }
        return total / pixels;
    }

    /**
     * Fraction of pixels Canny marks as edges. Squares narrower than the 3x3 aperture have none.
     */
    static double edgeDensity(int[][] gray) {
        int h = gray.length;
        int w = gray[0].length;
        if (h < 3 || w < 3) {
            return 0.0;
        }
        Mat src = OpenCvImages.toGrayMat(gray);
        Mat edges = new Mat();
        try {
            Imgproc.Canny(src, edges, CANNY_LOW, CANNY_HIGH);
            return (double) Core.countNonZero(edges) / (h * w);
        } finally {
            OpenCvImages.release(src, edges);
        }
    }
}
