package com.chessvision.server.vision.orientation;

import com.chessvision.server.vision.BoardGrid;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SquareNamesTest {

    @Test
    public void testWhiteAtBottom() {
        assertEquals("a8", SquareNames.nameOf(0, 0, BoardOrientation.WHITE));
        assertEquals("h1", SquareNames.nameOf(7, 7, BoardOrientation.WHITE));
        assertEquals("a1", SquareNames.nameOf(7, 0, BoardOrientation.WHITE));
        assertEquals("e4", SquareNames.nameOf(4, 4, BoardOrientation.WHITE));
    }

    @Test
    public void testBlackAtBottom() {
        assertEquals("h1", SquareNames.nameOf(0, 0, BoardOrientation.BLACK));
        assertEquals("a8", SquareNames.nameOf(7, 7, BoardOrientation.BLACK));
        assertEquals("h8", SquareNames.nameOf(7, 0, BoardOrientation.BLACK));
    }

    @Test
    public void testBlackNamingMatchesFlippedGrid() {
        for (int r = 0; r < BoardGrid.SIZE; r++) {
            for (int c = 0; c < BoardGrid.SIZE; c++) {
                assertEquals(SquareNames.nameOf(7 - r, 7 - c, BoardOrientation.WHITE),
                        SquareNames.nameOf(r, c, BoardOrientation.BLACK));
            }
        }
    }

    @Test
    public void testCellOfInvertsNameOf() {
        for (BoardOrientation o : BoardOrientation.values()) {
            for (int r = 0; r < BoardGrid.SIZE; r++) {
                for (int c = 0; c < BoardGrid.SIZE; c++) {
                    int[] cell = SquareNames.cellOf(SquareNames.nameOf(r, c, o), o);
                    assertArrayEquals(new int[] { r, c }, cell);
                }
            }
        }
        assertArrayEquals(new int[] { 4, 4 }, SquareNames.cellOf("E4", BoardOrientation.WHITE));
    }

    @Test
    public void testInvalidNames() {
        assertFalse(SquareNames.isValid("i1"));
        assertFalse(SquareNames.isValid("a9"));
        assertFalse(SquareNames.isValid("a10"));
        assertFalse(SquareNames.isValid(null));
        assertThrows(IllegalArgumentException.class, () -> SquareNames.cellOf("z0", BoardOrientation.WHITE));
        assertThrows(IllegalArgumentException.class, () -> SquareNames.nameOf(8, 0, BoardOrientation.WHITE));
    }
}
