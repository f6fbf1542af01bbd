package com.chessvision.server.vision;

/**
 * Axis-aligned rectangle of a board inside a photo, in pixel coordinates.
 */
public class BoardRegion {
    private final int x;
    private final int y;
    private final int width;
    private final int height;

    public BoardRegion(int x, int y, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Region size must be positive: " + width + "x" + height);
        }
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public double aspectRatio() {
        return (double) width / height;
    }

    /**
     * Returns this region clipped to an image of the given size.
     */
    public BoardRegion clampTo(int imageWidth, int imageHeight) {
        int cx = Math.max(0, Math.min(x, imageWidth - 1));
        int cy = Math.max(0, Math.min(y, imageHeight - 1));
        int x2 = Math.min(x + width, imageWidth);
        int y2 = Math.min(y + height, imageHeight);
        return new BoardRegion(cx, cy, Math.max(1, x2 - cx), Math.max(1, y2 - cy));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof BoardRegion)) {
            return false;
        }
        BoardRegion r = (BoardRegion) o;
        return x == r.x && y == r.y && width == r.width && height == r.height;
    }

    @Override
    public int hashCode() {
        return ((x * 31 + y) * 31 + width) * 31 + height;
    }

    @Override
    public String toString() {
        return "BoardRegion{x=" + x + ", y=" + y + ", w=" + width + ", h=" + height + "}";
    }
}
