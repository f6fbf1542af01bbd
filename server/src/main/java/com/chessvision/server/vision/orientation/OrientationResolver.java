package com.chessvision.server.vision.orientation;

import com.chessvision.server.vision.BoardGrid;
import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.recognition.RecognitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Decides which side of the board faces the camera.
 *
 * Strategies run in order: corner brightness, then white-piece counts on the edge rows when a
 * classified grid is available. When neither is conclusive the board is assumed to have white at
 * the bottom; that is a bias, not an observation.
 */
public class OrientationResolver {
    private static final Logger logger = LoggerFactory.getLogger(OrientationResolver.class);

    public static final double DEFAULT_CORNER_THRESHOLD = 10.0;
    public static final int DEFAULT_PIECE_MARGIN = 2;

    private final double cornerThreshold;
    private final int pieceMargin;

    public OrientationResolver() {
        this(DEFAULT_CORNER_THRESHOLD, DEFAULT_PIECE_MARGIN);
    }

    public OrientationResolver(double cornerThreshold, int pieceMargin) {
        this.cornerThreshold = cornerThreshold;
        this.pieceMargin = pieceMargin;
    }

    /**
     * @param squares    captured squares, row 0 at the top of the photo
     * @param classified results for the same squares, or null when not classified yet
     */
    public OrientationDecision resolve(BoardGrid<PixelImage> squares, BoardGrid<RecognitionResult> classified,
            OrientationPreference preference) {
        if (preference == OrientationPreference.WHITE) {
            return new OrientationDecision(BoardOrientation.WHITE, OrientationDecision.Source.MANUAL);
        }
        if (preference == OrientationPreference.BLACK) {
            return new OrientationDecision(BoardOrientation.BLACK, OrientationDecision.Source.MANUAL);
        }

        Optional<BoardOrientation> byCorners = fromCornerColors(squares);
        if (byCorners.isPresent()) {
            logger.info("Orientation from corner colours: {} at bottom", byCorners.get().getCode());
            return new OrientationDecision(byCorners.get(), OrientationDecision.Source.CORNER_COLOR);
        }

        if (classified != null) {
            Optional<BoardOrientation> byPieces = fromPieceIdentity(classified);
            if (byPieces.isPresent()) {
                logger.info("Orientation from piece positions: {} at bottom", byPieces.get().getCode());
                return new OrientationDecision(byPieces.get(), OrientationDecision.Source.PIECE_IDENTITY);
            }
        }

        logger.info("Orientation inconclusive, assuming white at bottom");
        return new OrientationDecision(BoardOrientation.WHITE, OrientationDecision.Source.DEFAULT);
    }

    /**
     * Compares the bottom-left and top-right squares; the darker one marks white's side when the
     * difference exceeds the threshold.
     */
    public Optional<BoardOrientation> fromCornerColors(BoardGrid<PixelImage> squares) {
        double bottomLeft = squares.get(BoardGrid.SIZE - 1, 0).meanBrightness();
        double topRight = squares.get(0, BoardGrid.SIZE - 1).meanBrightness();
        logger.debug("Corner brightness: bottom-left={}, top-right={}", bottomLeft, topRight);

        if (bottomLeft < topRight - cornerThreshold) {
            return Optional.of(BoardOrientation.WHITE);
        }
        if (topRight < bottomLeft - cornerThreshold) {
            return Optional.of(BoardOrientation.BLACK);
        }
        return Optional.empty();
    }

    public Optional<BoardOrientation> fromPieceIdentity(BoardGrid<RecognitionResult> classified) {
        int bottomWhite = countWhite(classified.row(BoardGrid.SIZE - 1));
        int topWhite = countWhite(classified.row(0));
        logger.debug("White pieces: bottom row={}, top row={}", bottomWhite, topWhite);

        if (bottomWhite >= topWhite + pieceMargin) {
            return Optional.of(BoardOrientation.WHITE);
        }
        if (topWhite >= bottomWhite + pieceMargin) {
            return Optional.of(BoardOrientation.BLACK);
        }
        return Optional.empty();
    }

    private static int countWhite(List<RecognitionResult> row) {
        int n = 0;
        for (RecognitionResult r : row) {
            if (r.getPieceType() != null && r.getPieceType().getColor() == PieceColor.WHITE) {
                n++;
            }
        }
        return n;
    }

    /**
     * Rotates a grid by 180 degrees: rows reversed, then each row reversed.
     */
    public static <T> BoardGrid<T> flip(BoardGrid<T> grid) {
        int last = BoardGrid.SIZE - 1;
        return BoardGrid.generate((r, c) -> grid.get(last - r, last - c));
    }

    /**
     * Returns the grid as seen with white at the bottom.
     */
    public static <T> BoardGrid<T> toWhiteAtBottom(BoardGrid<T> grid, BoardOrientation orientation) {
        return orientation == BoardOrientation.BLACK ? flip(grid) : grid;
    }
}
