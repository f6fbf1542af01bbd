package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.BoardGrid;

/**
 * Writes a classified grid as a rank-based placement string.
 *
 * Empty and unknown squares are run-length encoded as digits. The trailing side-to-move, castling
 * and counter fields are a fixed placeholder and carry no information about the position.
 */
public class PlacementEncoder {

    public static final String ROW_SEPARATOR = "/";
    public static final String PLACEHOLDER_SUFFIX = " w KQkq - 0 1";

    public String encode(BoardGrid<RecognitionResult> grid) {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < BoardGrid.SIZE; r++) {
            if (r > 0) {
                sb.append(ROW_SEPARATOR);
            }
            int emptyRun = 0;
            for (RecognitionResult result : grid.row(r)) {
                if (result.isUnknown() || result.isEmptySquare()) {
                    emptyRun++;
                    continue;
                }
                if (emptyRun > 0) {
                    sb.append(emptyRun);
                    emptyRun = 0;
                }
                sb.append(result.getPieceType().getSymbol());
            }
            if (emptyRun > 0) {
                sb.append(emptyRun);
            }
        }
        return sb.append(PLACEHOLDER_SUFFIX).toString();
    }

    /**
     * The piece-placement field alone, without the placeholder suffix.
     */
    public String encodePlacement(BoardGrid<RecognitionResult> grid) {
        String full = encode(grid);
        return full.substring(0, full.length() - PLACEHOLDER_SUFFIX.length());
    }
}
