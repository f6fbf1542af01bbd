package com.chessvision.server.vision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits a board image into 64 equally sized squares.
 * Remainder pixels on the right and bottom edges are dropped.
 */
public class SquareSegmenter {
    private static final Logger logger = LoggerFactory.getLogger(SquareSegmenter.class);

    public BoardGrid<PixelImage> segment(PixelImage boardImage) {
        int squareHeight = boardImage.getHeight() / BoardGrid.SIZE;
        int squareWidth = boardImage.getWidth() / BoardGrid.SIZE;
        if (squareHeight == 0 || squareWidth == 0) {
            throw new IllegalArgumentException("Board image too small to segment: " + boardImage);
        }

        BoardGrid<PixelImage> grid = BoardGrid.generate(
                (row, col) -> boardImage.crop(col * squareWidth, row * squareHeight, squareWidth, squareHeight));

        logger.debug("Board {} divided into 8x8 squares of {}x{}", boardImage, squareWidth, squareHeight);
        return grid;
    }
}
