package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.learning.ClassModelStore;

/**
 * Chooses the type estimator per colour: learned prototypes when the store has any for that colour,
 * the edge-density bands otherwise.
 */
public class TypeEstimatorFactory {

    private final ClassModelStore store;
    private final TypeEstimator banded;
    private final TypeEstimator learned;

    public TypeEstimatorFactory(ClassModelStore store) {
        this.store = store;
        this.banded = new BandedTypeEstimator();
        this.learned = new PrototypeTypeEstimator(store);
    }

    public TypeEstimator forColor(PieceColor color) {
        return store.hasPrototypesFor(color) ? learned : banded;
    }
}
