package com.chessvision.server.vision;

import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * An in-memory pixel buffer.
 *
 * Samples are stored row-major and channel-interleaved, each in [0, 255].
 * Three-channel images are RGB; one-channel images are grayscale.
 */
public class PixelImage {

    private final int width;
    private final int height;
    private final int channels;
    private final int[] data;

    public PixelImage(int width, int height, int channels, int[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (data.length != width * height * channels) {
            throw new IllegalArgumentException("Expected " + (width * height * channels) + " samples, got "
                    + data.length);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    public static PixelImage filled(int width, int height, int r, int g, int b) {
        int[] data = new int[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            data[i * 3] = r;
            data[i * 3 + 1] = g;
            data[i * 3 + 2] = b;
        }
        return new PixelImage(width, height, 3, data);
    }

    public static PixelImage filledGray(int width, int height, int value) {
        return filled(width, height, value, value, value);
    }

    public static PixelImage fromBufferedImage(BufferedImage bi) {
        int w = bi.getWidth();
        int h = bi.getHeight();
        int[] data = new int[w * h * 3];
        int idx = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int clr = bi.getRGB(x, y);
                data[idx++] = (clr & 0x00ff0000) >> 16;
                data[idx++] = (clr & 0x0000ff00) >> 8;
                data[idx++] = clr & 0x000000ff;
            }
        }
        return new PixelImage(w, h, 3, data);
    }

    public static PixelImage read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return read(is, path.toString());
        }
    }

    public static PixelImage decode(byte[] bytes) throws IOException {
        return read(new ByteArrayInputStream(bytes), "<in-memory>");
    }

    private static PixelImage read(InputStream is, String source) throws IOException {
        BufferedImage bi = ImageIO.read(is);
        if (bi == null) {
            throw new IOException("Unsupported or corrupt image: " + source);
        }
        return fromBufferedImage(bi);
    }

    /**
     * Writes the image losslessly as PNG.
     */
    public void writePng(Path path) throws IOException {
        if (!ImageIO.write(toBufferedImage(), "png", path.toFile())) {
            throw new IOException("No PNG writer available for " + path);
        }
    }

    public BufferedImage toBufferedImage() {
        BufferedImage bi = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = get(y, x, 0);
                int g = channels == 3 ? get(y, x, 1) : r;
                int b = channels == 3 ? get(y, x, 2) : r;
                bi.setRGB(x, y, (r << 16) | (g << 8) | b);
            }
        }
        return bi;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getChannels() {
        return channels;
    }

    public int get(int row, int col, int channel) {
        return data[(row * width + col) * channels + channel];
    }

    /**
     * Raw samples. Callers must not modify the returned array.
     */
    public int[] samples() {
        return data;
    }

    /**
     * Luma in [0, 255] per pixel, using the ITU-R BT.601 weights.
     */
    public int[][] toGray() {
        int[][] gray = new int[height][width];
        for (int r = 0; r < height; r++) {
            for (int c = 0; c < width; c++) {
                if (channels == 1) {
                    gray[r][c] = get(r, c, 0);
                } else {
                    double v = 0.299 * get(r, c, 0) + 0.587 * get(r, c, 1) + 0.114 * get(r, c, 2);
                    gray[r][c] = (int) Math.round(v);
                }
            }
        }
        return gray;
    }

    /**
     * Returns the sub-image starting at (x, y). The rectangle must lie inside the image.
     */
    public PixelImage crop(int x, int y, int w, int h) {
        if (x < 0 || y < 0 || w <= 0 || h <= 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException(
                    "Crop " + x + "," + y + " " + w + "x" + h + " outside " + width + "x" + height);
        }
        int[] out = new int[w * h * channels];
        for (int r = 0; r < h; r++) {
            System.arraycopy(data, ((y + r) * width + x) * channels, out, r * w * channels, w * channels);
        }
        return new PixelImage(w, h, channels, out);
    }

    /**
     * Area-average resample ({@code INTER_AREA}). Each target pixel is the mean of the source box it
     * covers, so downscaling is insensitive to the source resolution.
     */
    public PixelImage resize(int newWidth, int newHeight) {
        if (newWidth == width && newHeight == height) {
            return this;
        }
        Mat src = OpenCvImages.toMat(this);
        Mat dst = new Mat();
        try {
            Imgproc.resize(src, dst, new Size(newWidth, newHeight), 0, 0, Imgproc.INTER_AREA);
            return OpenCvImages.fromMat(dst);
        } finally {
            OpenCvImages.release(src, dst);
        }
    }

    /**
     * Returns a three-channel copy, replicating gray into RGB where needed.
     */
    public PixelImage toRgb() {
        if (channels == 3) {
            return this;
        }
        int[] out = new int[width * height * 3];
        for (int i = 0; i < width * height; i++) {
            out[i * 3] = data[i];
            out[i * 3 + 1] = data[i];
            out[i * 3 + 2] = data[i];
        }
        return new PixelImage(width, height, 3, out);
    }

    public double meanBrightness() {
        int[][] gray = toGray();
        long sum = 0;
        for (int[] row : gray) {
            for (int v : row) {
                sum += v;
            }
        }
        return (double) sum / (width * height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PixelImage)) {
            return false;
        }
        PixelImage other = (PixelImage) o;
        return width == other.width && height == other.height && channels == other.channels
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "PixelImage{" + width + "x" + height + "x" + channels + "}";
    }
}
