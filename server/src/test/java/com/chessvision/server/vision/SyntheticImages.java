package com.chessvision.server.vision;

/**
 * Builds small synthetic photos for tests.
 */
public final class SyntheticImages {

    private SyntheticImages() {
    }

    public static PixelImage gray(int width, int height, int value) {
        return PixelImage.filledGray(width, height, value);
    }

    /**
     * A light square with a dark bar in its center region, covering about a third of that region.
     * Reads as occupied and, with a bright background, as a white piece.
     */
    public static PixelImage pieceSquare(int size, int background, int ink) {
        int[][] g = new int[size][size];
        int r0 = size / 4;
        int r1 = 3 * size / 4;
        int c0 = size / 4;
        int c1 = c0 + size * 17 / 100;
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                g[r][c] = (r >= r0 && r < r1 && c >= c0 && c < c1) ? ink : background;
            }
        }
        return fromGray(g);
    }

    /**
     * A checkered 8x8 board, row 0 at the top; squares with odd row+col get the dark value.
     */
    public static PixelImage board(int squareSize, int light, int dark) {
        int size = squareSize * BoardGrid.SIZE;
        int[][] g = new int[size][size];
        for (int r = 0; r < size; r++) {
            for (int c = 0; c < size; c++) {
                boolean darkSquare = ((r / squareSize) + (c / squareSize)) % 2 == 1;
                g[r][c] = darkSquare ? dark : light;
            }
        }
        return fromGray(g);
    }

    /**
     * Copies a square-sized patch into a board image at the given cell.
     */
    public static PixelImage paste(PixelImage board, PixelImage patch, int row, int col) {
        int[] data = board.samples().clone();
        int w = board.getWidth();
        int x0 = col * patch.getWidth();
        int y0 = row * patch.getHeight();
        for (int r = 0; r < patch.getHeight(); r++) {
            for (int c = 0; c < patch.getWidth(); c++) {
                for (int ch = 0; ch < 3; ch++) {
                    data[((y0 + r) * w + x0 + c) * 3 + ch] = patch.get(r, c, ch);
                }
            }
        }
        return new PixelImage(board.getWidth(), board.getHeight(), 3, data);
    }

    public static PixelImage fromGray(int[][] g) {
        int h = g.length;
        int w = g[0].length;
        int[] data = new int[w * h * 3];
        for (int r = 0; r < h; r++) {
            for (int c = 0; c < w; c++) {
                int i = (r * w + c) * 3;
                data[i] = g[r][c];
                data[i + 1] = g[r][c];
                data[i + 2] = g[r][c];
            }
        }
        return new PixelImage(w, h, 3, data);
    }
}
