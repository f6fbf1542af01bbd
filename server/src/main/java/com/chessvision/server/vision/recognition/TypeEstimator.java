package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceColor;

public interface TypeEstimator {
    /**
     * Estimate which piece of the given colour occupies a square with these features.
     */
    TypeEstimate estimate(FeatureVector features, PieceColor color);
}
