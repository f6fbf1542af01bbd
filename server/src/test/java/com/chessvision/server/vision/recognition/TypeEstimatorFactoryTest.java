package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.FeatureExtractor;
import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.SyntheticImages;
import com.chessvision.server.vision.learning.ClassModelStore;
import com.chessvision.server.vision.learning.RetrainingEngine;
import com.chessvision.server.vision.learning.TrainingSample;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypeEstimatorFactoryTest {

    @Test
    public void testSelectionFollowsLearnedColours() {
        ClassModelStore store = new ClassModelStore();
        TypeEstimatorFactory factory = new TypeEstimatorFactory(store);

        assertTrue(factory.forColor(PieceColor.WHITE) instanceof BandedTypeEstimator);
        assertTrue(factory.forColor(PieceColor.BLACK) instanceof BandedTypeEstimator);

        PixelImage sample = SyntheticImages.pieceSquare(60, 230, 20);
        new RetrainingEngine(store, new FeatureExtractor())
                .retrain(List.of(new TrainingSample(sample, PieceType.WHITE_BISHOP)));

        assertTrue(factory.forColor(PieceColor.WHITE) instanceof PrototypeTypeEstimator,
                "white has a learned prototype now");
        assertTrue(factory.forColor(PieceColor.BLACK) instanceof BandedTypeEstimator,
                "black is still unlearned");
    }

    @Test
    public void testPrototypeEstimatorRanksAlternatives() {
        ClassModelStore store = new ClassModelStore();
        FeatureExtractor extractor = new FeatureExtractor();
        PixelImage near = SyntheticImages.pieceSquare(60, 230, 20);
        PixelImage far = SyntheticImages.gray(60, 60, 40);
        new RetrainingEngine(store, extractor).retrain(List.of(
                new TrainingSample(near, PieceType.BLACK_KNIGHT),
                new TrainingSample(far, PieceType.BLACK_KING)));

        FeatureVector features = extractor.extract(near);
        TypeEstimate estimate = new PrototypeTypeEstimator(store).estimate(features, PieceColor.BLACK);
        assertEquals(PieceType.BLACK_KNIGHT, estimate.getPieceType());
        assertEquals(1.0, estimate.getConfidence(), 1e-9);
        assertEquals(1, estimate.getAlternatives().size());
        assertEquals(PieceType.BLACK_KING, estimate.getAlternatives().get(0).getPieceType());
        assertTrue(estimate.getAlternatives().get(0).getConfidence() < 1.0);
    }

    @Test
    public void testBandedEstimatorNeverNamesBishopOrKing() {
        BandedTypeEstimator banded = new BandedTypeEstimator();
        for (double edges = 0.0; edges <= 1.0; edges += 0.05) {
            FeatureVector f = new FeatureVector(150, 1000, edges, 0.3, 0, 0.5, 150);
            TypeEstimate e = banded.estimate(f, PieceColor.WHITE);
            assertNotEquals(PieceType.WHITE_BISHOP, e.getPieceType());
            assertNotEquals(PieceType.WHITE_KING, e.getPieceType());
            assertEquals(BandedTypeEstimator.BAND_CONFIDENCE, e.getConfidence(), 1e-9);
        }
    }
}
