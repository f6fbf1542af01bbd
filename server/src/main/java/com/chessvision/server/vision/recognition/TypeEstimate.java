package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.PieceType;

import java.util.Collections;
import java.util.List;

public class TypeEstimate {
    private final PieceType pieceType;
    private final double confidence;
    private final List<RecognitionResult.Alternative> alternatives;

    public TypeEstimate(PieceType pieceType, double confidence) {
        this(pieceType, confidence, Collections.emptyList());
    }

    public TypeEstimate(PieceType pieceType, double confidence, List<RecognitionResult.Alternative> alternatives) {
        this.pieceType = pieceType;
        this.confidence = confidence;
        this.alternatives = alternatives;
    }

    public PieceType getPieceType() {
        return pieceType;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<RecognitionResult.Alternative> getAlternatives() {
        return alternatives;
    }
}
