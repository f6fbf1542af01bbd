package com.chessvision.server.vision;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SquareSegmenterTest {

    private final SquareSegmenter segmenter = new SquareSegmenter();

    @Test
    public void testEqualPartition() {
        BoardGrid<PixelImage> grid = segmenter.segment(SyntheticImages.board(100, 220, 90));
        for (int r = 0; r < BoardGrid.SIZE; r++) {
            for (int c = 0; c < BoardGrid.SIZE; c++) {
                PixelImage sq = grid.get(r, c);
                assertEquals(100, sq.getWidth());
                assertEquals(100, sq.getHeight());
                int expected = (r + c) % 2 == 1 ? 90 : 220;
                assertEquals(expected, sq.meanBrightness(), 1e-9, "square " + r + "," + c);
            }
        }
    }

    @Test
    public void testRemainderIsTruncated() {
        BoardGrid<PixelImage> grid = segmenter.segment(PixelImage.filledGray(803, 805, 128));
        assertEquals(100, grid.get(7, 7).getWidth());
        assertEquals(100, grid.get(7, 7).getHeight());
    }

    @Test
    public void testTooSmallImageRejected() {
        assertThrows(IllegalArgumentException.class, () -> segmenter.segment(PixelImage.filledGray(7, 7, 0)));
    }
}
