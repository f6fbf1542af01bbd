package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.learning.ClassModelStore;
import com.chessvision.server.vision.learning.ClassPrototype;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Nearest learned prototype among the pieces of one colour.
 * Confidence is 1 - normalized distance, floored at 0; the remaining prototypes are returned as
 * alternatives, best first.
 */
public class PrototypeTypeEstimator implements TypeEstimator {
    private static final Logger logger = LoggerFactory.getLogger(PrototypeTypeEstimator.class);

    private final ClassModelStore store;

    public PrototypeTypeEstimator(ClassModelStore store) {
        this.store = store;
    }

    @Override
    public TypeEstimate estimate(FeatureVector features, PieceColor color) {
        List<ClassPrototype> candidates = store.prototypesFor(color);
        if (candidates.isEmpty()) {
            throw new IllegalStateException("No learned prototypes for " + color);
        }

        List<RecognitionResult.Alternative> ranked = new ArrayList<>();
        for (ClassPrototype p : candidates) {
            double distance = features.normalizedDistance(p.getDescriptor());
            ranked.add(new RecognitionResult.Alternative(p.getLabel(), Math.max(0.0, 1.0 - distance)));
        }
        ranked.sort(Comparator.comparingDouble(RecognitionResult.Alternative::getConfidence).reversed());

        RecognitionResult.Alternative best = ranked.get(0);
        logger.debug("Nearest {} prototype: {} ({} candidates)", color, best, ranked.size());
        return new TypeEstimate(best.getPieceType(), best.getConfidence(), ranked.subList(1, ranked.size()));
    }
}
