package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.BoardGrid;
import com.chessvision.server.vision.PieceType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PlacementEncoderTest {

    private final PlacementEncoder encoder = new PlacementEncoder();

    private static final PieceType[] BACK_RANK_WHITE = { PieceType.WHITE_ROOK, PieceType.WHITE_KNIGHT,
            PieceType.WHITE_BISHOP, PieceType.WHITE_QUEEN, PieceType.WHITE_KING, PieceType.WHITE_BISHOP,
            PieceType.WHITE_KNIGHT, PieceType.WHITE_ROOK };

    private static BoardGrid<RecognitionResult> startingPosition() {
        return BoardGrid.generate((row, col) -> {
            PieceType t;
            if (row == 0) {
                t = PieceType.of(BACK_RANK_WHITE[col].getKind(), com.chessvision.server.vision.PieceColor.BLACK);
            } else if (row == 1) {
                t = PieceType.BLACK_PAWN;
            } else if (row == 6) {
                t = PieceType.WHITE_PAWN;
            } else if (row == 7) {
                t = BACK_RANK_WHITE[col];
            } else {
                t = PieceType.EMPTY;
            }
            return new RecognitionResult(t, 0.9);
        });
    }

    @Test
    public void testEmptyBoard() {
        BoardGrid<RecognitionResult> empty = BoardGrid.generate((r, c) -> new RecognitionResult(PieceType.EMPTY, 1.0));
        assertEquals("8/8/8/8/8/8/8/8 w KQkq - 0 1", encoder.encode(empty));
    }

    @Test
    public void testStartingPosition() {
        assertEquals("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1", encoder.encode(startingPosition()));
        assertEquals("rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR", encoder.encodePlacement(startingPosition()));
    }

    @Test
    public void testUnknownSquaresCountAsEmpty() {
        BoardGrid<RecognitionResult> grid = BoardGrid.generate((r, c) -> {
            if (r == 3 && c == 2) {
                return new RecognitionResult(PieceType.WHITE_KING, 0.8);
            }
            if (r == 3 && c == 5) {
                return RecognitionResult.unknown(0.3, List.of(), 1.0);
            }
            return new RecognitionResult(PieceType.EMPTY, 1.0);
        });
        assertEquals("8/8/8/2K5/8/8/8/8 w KQkq - 0 1", encoder.encode(grid));
    }

    @Test
    public void testAlwaysEightGroups() {
        String placement = encoder.encodePlacement(startingPosition());
        assertEquals(8, placement.split(PlacementEncoder.ROW_SEPARATOR).length);
        assertEquals(7, placement.chars().filter(ch -> ch == '/').count());
    }
}
