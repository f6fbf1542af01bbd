package com.chessvision.server.vision.orientation;

import com.chessvision.server.vision.BoardGrid;

/**
 * Converts between captured grid cells and algebraic square names.
 *
 * With white at the bottom, row 0 col 0 is a8; with black at the bottom it is h1.
 */
public final class SquareNames {

    private SquareNames() {
    }

    public static String nameOf(int row, int col, BoardOrientation orientation) {
        checkCell(row, col);
        int file;
        int rank;
        if (orientation == BoardOrientation.BLACK) {
            file = BoardGrid.SIZE - 1 - col;
            rank = row + 1;
        } else {
            file = col;
            rank = BoardGrid.SIZE - row;
        }
        return "" + (char) ('a' + file) + rank;
    }

    /**
     * @return {row, col} of the named square in the captured grid
     */
    public static int[] cellOf(String squareName, BoardOrientation orientation) {
        if (!isValid(squareName)) {
            throw new IllegalArgumentException("Invalid square name: " + squareName);
        }
        int file = Character.toLowerCase(squareName.charAt(0)) - 'a';
        int rank = squareName.charAt(1) - '0';
        if (orientation == BoardOrientation.BLACK) {
            return new int[] { rank - 1, BoardGrid.SIZE - 1 - file };
        }
        return new int[] { BoardGrid.SIZE - rank, file };
    }

    public static boolean isValid(String squareName) {
        if (squareName == null || squareName.length() != 2) {
            return false;
        }
        char f = Character.toLowerCase(squareName.charAt(0));
        char r = squareName.charAt(1);
        return f >= 'a' && f <= 'h' && r >= '1' && r <= '8';
    }

    private static void checkCell(int row, int col) {
        if (row < 0 || row >= BoardGrid.SIZE || col < 0 || col >= BoardGrid.SIZE) {
            throw new IllegalArgumentException("Cell out of range: " + row + "," + col);
        }
    }
}
