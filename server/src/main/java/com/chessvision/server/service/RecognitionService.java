package com.chessvision.server.service;

import com.chessvision.db.PrototypeDao;
import com.chessvision.db.SqliteInitializer;
import com.chessvision.server.config.VisionConfig;
import com.chessvision.server.feedback.CorrectionRecord;
import com.chessvision.server.feedback.FeedbackStatistics;
import com.chessvision.server.feedback.FeedbackStore;
import com.chessvision.server.feedback.SessionSummary;
import com.chessvision.server.util.DataPathResolver;
import com.chessvision.server.vision.BoardGrid;
import com.chessvision.server.vision.BoardRegion;
import com.chessvision.server.vision.BoardRegionLocator;
import com.chessvision.server.vision.FeatureExtractor;
import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.SquareSegmenter;
import com.chessvision.server.vision.learning.ClassModelStore;
import com.chessvision.server.vision.learning.RetrainReport;
import com.chessvision.server.vision.learning.RetrainingEngine;
import com.chessvision.server.vision.learning.TrainingSample;
import com.chessvision.server.vision.orientation.OrientationDecision;
import com.chessvision.server.vision.orientation.OrientationPreference;
import com.chessvision.server.vision.orientation.OrientationResolver;
import com.chessvision.server.vision.recognition.PieceClassifier;
import com.chessvision.server.vision.recognition.PlacementEncoder;
import com.chessvision.server.vision.recognition.RecognitionResult;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.File;
import java.nio.file.Path;
import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * Runs the recognition pipeline and owns the feedback and learning state.
 * Methods are synchronized; one request is processed at a time.
 */
@Service
public class RecognitionService {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionService.class);

    private final VisionConfig config;
    private final BoardRegionLocator locator;
    private final SquareSegmenter segmenter = new SquareSegmenter();
    private final FeatureExtractor extractor = new FeatureExtractor();
    private final ClassModelStore modelStore = new ClassModelStore();
    private final PieceClassifier classifier;
    private final OrientationResolver orientationResolver;
    private final PlacementEncoder encoder = new PlacementEncoder();
    private final FeedbackStore feedbackStore;
    private final String dbPath;
    private PrototypeDao prototypeDao;
    private RetrainingEngine retrainingEngine;

    private BoardRecognition lastRecognition;

    @Autowired
    public RecognitionService() {
        this(VisionConfig.load(), null, Clock.systemDefaultZone());
    }

    /**
     * @param dataDirectory where the feedback log and prototype database live, or null to resolve it
     *                      from the system property and config
     */
    public RecognitionService(VisionConfig config, Path dataDirectory, Clock clock) {
        this.config = config.withDefaults();
        String dataDir = dataDirectory != null ? dataDirectory.toString()
                : DataPathResolver.resolveDataDirectory(this.config);

        this.locator = new BoardRegionLocator(this.config.board.minBoardSizeOrDefault(),
                this.config.board.maxBoardSizeOrDefault(), this.config.board.resolutionOrDefault());
        this.classifier = new PieceClassifier(extractor, modelStore, this.config.classifier.minConfidenceOrDefault());
        this.orientationResolver = new OrientationResolver(this.config.orientation.cornerThresholdOrDefault(),
                this.config.orientation.pieceMarginOrDefault());

        this.feedbackStore = new FeedbackStore(
                Path.of(dataDir, this.config.feedback.logFileOrDefault()),
                this.config.feedback.imageDirectoryOrDefault(),
                this.config.feedback.hashSizeOrDefault(),
                null, clock);

        this.dbPath = this.config.prototypes.persistOrDefault()
                ? dataDir + File.separator + this.config.prototypes.dbFileOrDefault()
                : null;
        this.retrainingEngine = new RetrainingEngine(modelStore, extractor);
    }

    /**
     * Opens the prototype database and restores previously learned prototypes.
     */
    @PostConstruct
    public synchronized void init() {
        if (dbPath == null) {
            logger.info("Prototype persistence disabled");
            return;
        }
        try {
            File parent = new File(dbPath).getAbsoluteFile().getParentFile();
            if (parent != null && !parent.exists() && !parent.mkdirs()) {
                logger.warn("Could not create data directory {}", parent);
            }
            SqliteInitializer.initialize(dbPath);
            prototypeDao = new PrototypeDao(dbPath);
            modelStore.restore(prototypeDao);
            retrainingEngine = new RetrainingEngine(modelStore, extractor, prototypeDao);
            logger.info("Prototype database ready at {}", dbPath);
        } catch (SQLException e) {
            logger.error("Failed to open prototype database, learned prototypes will not persist", e);
            prototypeDao = null;
        }
    }

    public synchronized BoardRecognition recognize(PixelImage image, BoardRegion manualRegion,
            OrientationPreference preference) {
        BoardRegion region;
        if (manualRegion != null) {
            region = manualRegion;
            logger.info("Using manual board region {}", region);
        } else {
            Optional<BoardRegion> located = locator.locate(image);
            if (located.isEmpty()) {
                throw new BoardNotFoundException(
                        "Could not detect a chess board; supply the board region manually");
            }
            region = located.get();
        }

        PixelImage board = locator.extractBoard(image, region);
        BoardGrid<PixelImage> squares = segmenter.segment(board);
        BoardGrid<RecognitionResult> results = classifier.classifyBoard(squares);

        OrientationPreference pref = preference != null ? preference
                : OrientationPreference.parse(config.orientation.preferenceOrDefault());
        OrientationDecision orientation = orientationResolver.resolve(squares, results, pref);

        String placement = encoder.encode(OrientationResolver.toWhiteAtBottom(results, orientation.getOrientation()));
        feedbackStore.setCurrentImage(image);
        lastRecognition = new BoardRecognition(feedbackStore.getCurrentImageHash(), placement, region, orientation,
                squares, results);
        logger.info("Recognized board: {} ({})", placement, orientation);
        return lastRecognition;
    }

    /**
     * Records the user's correction of one square of the most recently recognized photo. A failed
     * recognition leaves the previous one as the correction target.
     */
    public synchronized CorrectionRecord submitCorrection(String squareName, PieceType correction) {
        if (lastRecognition == null) {
            throw new IllegalStateException("No board has been recognized yet");
        }
        RecognitionResult original = lastRecognition.resultAt(squareName);
        return feedbackStore.addCorrection(lastRecognition.getImageHash(), squareName, original.getPieceType(),
                original.getConfidence(), correction, lastRecognition.squareAt(squareName),
                lastRecognition.getOrientation().getOrientation());
    }

    public synchronized RetrainReport retrainFromFeedback() {
        List<TrainingSample> samples = feedbackStore.trainingData(true);
        return retrainingEngine.retrain(samples);
    }

    public synchronized FeedbackStatistics feedbackStatistics() {
        return feedbackStore.statistics();
    }

    public synchronized List<SessionSummary> feedbackSessions() {
        return feedbackStore.sessionSummaries();
    }

    public synchronized void clearFeedback() {
        feedbackStore.clear();
    }

    public synchronized ClassModelStore.ModelSummary modelSummary() {
        return modelStore.summary();
    }

    /**
     * Forgets all learned prototypes, in memory and in the database.
     */
    public synchronized void resetModel() {
        modelStore.reset();
        if (prototypeDao != null) {
            try {
                prototypeDao.deleteAll();
            } catch (SQLException e) {
                throw new RuntimeException("Failed to delete stored prototypes", e);
            }
        }
    }

    public synchronized BoardRecognition getLastRecognition() {
        return lastRecognition;
    }

    public String getSessionId() {
        return feedbackStore.getSessionId();
    }
}
