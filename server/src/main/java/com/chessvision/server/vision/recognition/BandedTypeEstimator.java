package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.PieceKind;
import com.chessvision.server.vision.PieceType;

/**
 * Coarse placeholder: buckets edge density into four piece kinds at a fixed confidence.
 * Bishops and kings are never produced.
 */
public class BandedTypeEstimator implements TypeEstimator {

    public static final double BAND_CONFIDENCE = 0.4;

    @Override
    public TypeEstimate estimate(FeatureVector features, PieceColor color) {
        double edges = features.getEdgeDensity();
        PieceKind kind;
        if (edges < 0.15) {
            kind = PieceKind.PAWN;
        } else if (edges < 0.25) {
            kind = PieceKind.ROOK;
        } else if (edges < 0.35) {
            kind = PieceKind.KNIGHT;
        } else {
            kind = PieceKind.QUEEN;
        }
        return new TypeEstimate(PieceType.of(kind, color), BAND_CONFIDENCE);
    }
}
