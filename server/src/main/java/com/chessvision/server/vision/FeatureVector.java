package com.chessvision.server.vision;

import java.util.Arrays;

/**
 * Descriptor of one square image. Order of {@link #toArray()} is fixed and is what prototypes store.
 */
public final class FeatureVector {
    public static final int DIMENSION = 7;

    // Typical range of each component, used to put distances on a common scale.
    private static final double[] SCALES = { 255.0, 16256.0, 1.0, 1.0, 255.0, 1.0, 255.0 };

    private final double avgBrightness;
    private final double brightnessVariance;
    private final double edgeDensity;
    private final double darkPixelRatio;
    private final double avgSaturation;
    private final double centerDarkness;
    private final double centerBrightness;

    public FeatureVector(double avgBrightness, double brightnessVariance, double edgeDensity,
            double darkPixelRatio, double avgSaturation, double centerDarkness, double centerBrightness) {
        this.avgBrightness = avgBrightness;
        this.brightnessVariance = brightnessVariance;
        this.edgeDensity = edgeDensity;
        this.darkPixelRatio = darkPixelRatio;
        this.avgSaturation = avgSaturation;
        this.centerDarkness = centerDarkness;
        this.centerBrightness = centerBrightness;
    }

    public static FeatureVector fromArray(double[] values) {
        if (values == null || values.length != DIMENSION) {
            throw new IllegalArgumentException("Feature array must have " + DIMENSION + " values");
        }
        return new FeatureVector(values[0], values[1], values[2], values[3], values[4], values[5], values[6]);
    }

    public double[] toArray() {
        return new double[] { avgBrightness, brightnessVariance, edgeDensity, darkPixelRatio, avgSaturation,
                centerDarkness, centerBrightness };
    }

    /**
     * Euclidean distance after dividing each component by its typical range, averaged over dimensions.
     */
    public double normalizedDistance(FeatureVector other) {
        double[] a = toArray();
        double[] b = other.toArray();
        double sum = 0.0;
        for (int i = 0; i < DIMENSION; i++) {
            double d = (a[i] - b[i]) / SCALES[i];
            sum += d * d;
        }
        return Math.sqrt(sum / DIMENSION);
    }

    public double getAvgBrightness() {
        return avgBrightness;
    }

    public double getBrightnessVariance() {
        return brightnessVariance;
    }

    public double getEdgeDensity() {
        return edgeDensity;
    }

    public double getDarkPixelRatio() {
        return darkPixelRatio;
    }

    public double getAvgSaturation() {
        return avgSaturation;
    }

    public double getCenterDarkness() {
        return centerDarkness;
    }

    public double getCenterBrightness() {
        return centerBrightness;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FeatureVector && Arrays.equals(toArray(), ((FeatureVector) o).toArray());
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(toArray());
    }

    @Override
    public String toString() {
        return String.format(
                "FeatureVector{brightness=%.1f, variance=%.1f, edges=%.3f, dark=%.3f, sat=%.1f, centerDark=%.3f, centerBright=%.1f}",
                avgBrightness, brightnessVariance, edgeDensity, darkPixelRatio, avgSaturation, centerDarkness,
                centerBrightness);
    }
}
