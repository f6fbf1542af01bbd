package com.chessvision.server.vision;

import nu.pattern.OpenCV;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Conversions between {@link PixelImage} and OpenCV {@link Mat}s. Loading this class loads the
 * bundled native library.
 *
 * Mats returned here own native memory; callers release them.
 */
final class OpenCvImages {

    static {
        OpenCV.loadLocally();
    }

    private OpenCvImages() {
    }

    /**
     * 8-bit Mat with the image's channels, RGB order for colour images.
     */
    static Mat toMat(PixelImage image) {
        int[] samples = image.samples();
        byte[] bytes = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            bytes[i] = (byte) samples[i];
        }
        int type = image.getChannels() == 3 ? CvType.CV_8UC3 : CvType.CV_8UC1;
        Mat mat = new Mat(image.getHeight(), image.getWidth(), type);
        mat.put(0, 0, bytes);
        return mat;
    }

    static Mat toGrayMat(int[][] gray) {
        int h = gray.length;
        int w = gray[0].length;
        byte[] bytes = new byte[h * w];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                bytes[r * w + c] = (byte) gray[r][c];
            }
        }
        Mat mat = new Mat(h, w, CvType.CV_8UC1);
        mat.put(0, 0, bytes);
        return mat;
    }

    static PixelImage fromMat(Mat mat) {
        int channels = mat.channels();
        if (mat.depth() != CvType.CV_8U || (channels != 1 && channels != 3)) {
            throw new IllegalArgumentException("Expected an 8-bit 1 or 3 channel Mat, got " + mat);
        }
        byte[] bytes = new byte[(int) mat.total() * channels];
        mat.get(0, 0, bytes);
        int[] samples = new int[bytes.length];
        for (int i = 0; i < bytes.length; i++) {
            samples[i] = bytes[i] & 0xFF;
        }
        return new PixelImage(mat.cols(), mat.rows(), channels, samples);
    }

    static void release(Mat... mats) {
        for (Mat m : mats) {
            if (m != null) {
                m.release();
            }
        }
    }
}
