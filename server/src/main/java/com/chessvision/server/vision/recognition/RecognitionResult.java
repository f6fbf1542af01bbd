package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.PieceType;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of classifying one square.
 * A null piece type means the classifier was not confident enough to name one.
 */
public class RecognitionResult {
    private final PieceType pieceType;
    private final double confidence;
    private final List<Alternative> alternatives;
    private final double occupancyConfidence;

    public RecognitionResult(PieceType pieceType, double confidence) {
        this(pieceType, confidence, Collections.emptyList());
    }

    public RecognitionResult(PieceType pieceType, double confidence, List<Alternative> alternatives) {
        this(pieceType, confidence, alternatives,
                pieceType == PieceType.EMPTY ? 1.0 - confidence : confidence);
    }

    public RecognitionResult(PieceType pieceType, double confidence, List<Alternative> alternatives,
            double occupancyConfidence) {
        this.pieceType = pieceType;
        this.confidence = clamp(confidence);
        this.alternatives = alternatives != null ? List.copyOf(alternatives) : Collections.emptyList();
        this.occupancyConfidence = clamp(occupancyConfidence);
    }

    public static RecognitionResult unknown(double confidence, List<Alternative> alternatives,
            double occupancyConfidence) {
        return new RecognitionResult(null, confidence, alternatives, occupancyConfidence);
    }

    public PieceType getPieceType() {
        return pieceType;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<Alternative> getAlternatives() {
        return alternatives;
    }

    /**
     * How sure the emptiness test was that something stands on the square.
     */
    public double getOccupancyConfidence() {
        return occupancyConfidence;
    }

    public boolean isUnknown() {
        return pieceType == null;
    }

    public boolean isEmptySquare() {
        return pieceType == PieceType.EMPTY;
    }

    /**
     * Placement character; unknown squares read as '?'.
     */
    public char symbol() {
        return pieceType != null ? pieceType.getSymbol() : '?';
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }

    @Override
    public String toString() {
        String name = pieceType != null ? pieceType.name() : "UNKNOWN";
        return String.format("%s (confidence: %.2f)", name, confidence);
    }

    public static class Alternative {
        private final PieceType pieceType;
        private final double confidence;

        public Alternative(PieceType pieceType, double confidence) {
            this.pieceType = pieceType;
            this.confidence = confidence;
        }

        public PieceType getPieceType() {
            return pieceType;
        }

        public double getConfidence() {
            return confidence;
        }

        @Override
        public String toString() {
            return String.format("%s=%.2f", pieceType, confidence);
        }
    }
}
