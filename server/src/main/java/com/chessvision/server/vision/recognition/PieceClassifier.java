package com.chessvision.server.vision.recognition;

import com.chessvision.server.vision.BoardGrid;
import com.chessvision.server.vision.FeatureExtractor;
import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.learning.ClassModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Classifies square images into piece types.
 *
 * A square is first tested for emptiness with a weighted rule; occupied squares get a colour from
 * their center brightness and a type from the estimator {@link TypeEstimatorFactory} picks for that
 * colour. Squares are classified independently, so two results may claim the same unique piece.
 */
public class PieceClassifier {
    private static final Logger logger = LoggerFactory.getLogger(PieceClassifier.class);

    public static final double DEFAULT_MIN_CONFIDENCE = 0.5;

    private final FeatureExtractor extractor;
    private final TypeEstimatorFactory estimators;
    private final double minConfidence;

    public PieceClassifier(ClassModelStore store) {
        this(new FeatureExtractor(), store, DEFAULT_MIN_CONFIDENCE);
    }

    public PieceClassifier(FeatureExtractor extractor, ClassModelStore store, double minConfidence) {
        this.extractor = extractor;
        this.estimators = new TypeEstimatorFactory(store);
        this.minConfidence = minConfidence;
    }

    public RecognitionResult classify(FeatureVector features) {
        return classify(features, null);
    }

    /**
     * @param colorHint colour known by the caller, or null to estimate it
     */
    public RecognitionResult classify(FeatureVector features, PieceColor colorHint) {
        double emptyScore = emptinessScore(features);
        if (emptyScore > 0.5) {
            return new RecognitionResult(PieceType.EMPTY, emptyScore);
        }
        double occupancyConfidence = 1.0 - emptyScore;

        PieceColor color;
        double colorConfidence;
        if (colorHint != null) {
            color = colorHint;
            colorConfidence = 1.0;
        } else {
            double center = features.getCenterBrightness();
            if (center > 150) {
                color = PieceColor.WHITE;
                colorConfidence = 0.7;
            } else if (center < 100) {
                color = PieceColor.BLACK;
                colorConfidence = 0.7;
            } else {
                color = center > 125 ? PieceColor.WHITE : PieceColor.BLACK;
                colorConfidence = 0.5;
            }
        }

        TypeEstimate type = estimators.forColor(color).estimate(features, color);
        double overall = (colorConfidence + type.getConfidence()) / 2.0;

        if (overall < minConfidence) {
            logger.debug("Low confidence recognition: {} at {} (occupancy {})", type.getPieceType(),
                    String.format("%.2f", overall), String.format("%.2f", occupancyConfidence));
            List<RecognitionResult.Alternative> alternatives = new ArrayList<>();
            alternatives.add(new RecognitionResult.Alternative(type.getPieceType(), overall));
            alternatives.addAll(type.getAlternatives());
            return RecognitionResult.unknown(overall, alternatives, occupancyConfidence);
        }
        return new RecognitionResult(type.getPieceType(), overall, type.getAlternatives(), occupancyConfidence);
    }

    public RecognitionResult classifySquare(PixelImage square) {
        return classify(extractor.extract(square));
    }

    public BoardGrid<RecognitionResult> classifyBoard(BoardGrid<PixelImage> squares) {
        BoardGrid<RecognitionResult> results = squares.map(this::classifySquare);
        if (logger.isDebugEnabled()) {
            for (int r = 0; r < BoardGrid.SIZE; r++) {
                logger.debug("Row {}: {}", r, results.row(r));
            }
        }
        logger.info("Board recognition complete");
        return results;
    }

    /**
     * Weighted evidence that a square is empty: low edge density 0.4, low variance 0.3,
     * light center 0.3.
     */
    static double emptinessScore(FeatureVector f) {
        double score = 0.0;
        if (f.getEdgeDensity() < 0.1) {
            score += 0.4;
        }
        if (f.getBrightnessVariance() < 500) {
            score += 0.3;
        }
        if (f.getCenterDarkness() < 0.3) {
            score += 0.3;
        }
        return score;
    }

    public double getMinConfidence() {
        return minConfidence;
    }
}
