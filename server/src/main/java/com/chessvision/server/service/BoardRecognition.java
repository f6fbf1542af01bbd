package com.chessvision.server.service;

import com.chessvision.server.vision.BoardGrid;
import com.chessvision.server.vision.BoardRegion;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.orientation.OrientationDecision;
import com.chessvision.server.vision.orientation.OrientationResolver;
import com.chessvision.server.vision.orientation.SquareNames;
import com.chessvision.server.vision.recognition.RecognitionResult;

/**
 * Everything learned from one photo. Grids are kept as captured (row 0 at the top of the photo).
 */
public class BoardRecognition {
    private final String imageHash;
    private final String placement;
    private final BoardRegion region;
    private final OrientationDecision orientation;
    private final BoardGrid<PixelImage> capturedSquares;
    private final BoardGrid<RecognitionResult> capturedResults;

    public BoardRecognition(String imageHash, String placement, BoardRegion region, OrientationDecision orientation,
            BoardGrid<PixelImage> capturedSquares, BoardGrid<RecognitionResult> capturedResults) {
        this.imageHash = imageHash;
        this.placement = placement;
        this.region = region;
        this.orientation = orientation;
        this.capturedSquares = capturedSquares;
        this.capturedResults = capturedResults;
    }

    /**
     * Content hash of the photo; corrections made on this recognition are keyed by it.
     */
    public String getImageHash() {
        return imageHash;
    }

    public String getPlacement() {
        return placement;
    }

    public BoardRegion getRegion() {
        return region;
    }

    public OrientationDecision getOrientation() {
        return orientation;
    }

    public BoardGrid<PixelImage> getCapturedSquares() {
        return capturedSquares;
    }

    public BoardGrid<RecognitionResult> getCapturedResults() {
        return capturedResults;
    }

    /**
     * Results rotated so that row 0 is rank 8 and column 0 is the a-file.
     */
    public BoardGrid<RecognitionResult> standardResults() {
        return OrientationResolver.toWhiteAtBottom(capturedResults, orientation.getOrientation());
    }

    public RecognitionResult resultAt(String squareName) {
        int[] cell = SquareNames.cellOf(squareName, orientation.getOrientation());
        return capturedResults.get(cell[0], cell[1]);
    }

    public PixelImage squareAt(String squareName) {
        int[] cell = SquareNames.cellOf(squareName, orientation.getOrientation());
        return capturedSquares.get(cell[0], cell[1]);
    }
}
