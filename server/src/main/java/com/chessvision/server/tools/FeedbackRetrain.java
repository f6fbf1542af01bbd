package com.chessvision.server.tools;

import com.chessvision.db.PrototypeDao;
import com.chessvision.db.SqliteInitializer;
import com.chessvision.server.feedback.FeedbackStatistics;
import com.chessvision.server.feedback.FeedbackStore;
import com.chessvision.server.feedback.SessionSummary;
import com.chessvision.server.vision.FeatureExtractor;
import com.chessvision.server.vision.learning.ClassModelStore;
import com.chessvision.server.vision.learning.RetrainReport;
import com.chessvision.server.vision.learning.RetrainingEngine;
import com.chessvision.server.vision.learning.TrainingSample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.List;

/**
 * Offline tool that rebuilds class prototypes from a feedback log.
 * Usage: FeedbackRetrain <feedbackLog> <prototypeDb> [exportFile]
 */
public class FeedbackRetrain {

    private static final Logger logger = LoggerFactory.getLogger(FeedbackRetrain.class);

    public static void main(String[] args) {
        if (args.length < 2) {
            System.err.println("Usage: FeedbackRetrain <feedbackLog> <prototypeDb> [exportFile]");
            System.exit(1);
        }

        Path logFile = Path.of(args[0]);
        if (!Files.isRegularFile(logFile)) {
            System.err.println("Feedback log not found: " + logFile);
            System.exit(1);
        }
        Path exportFile = args.length > 2 ? Path.of(args[2]) : null;

        try {
            RetrainReport report = run(logFile, args[1], exportFile);
            if (!report.isSuccess()) {
                System.exit(2);
            }
        } catch (Exception e) {
            logger.error("Retrain failed", e);
            System.exit(1);
        }
    }

    /**
     * Folds the active corrections of a feedback log into the prototypes stored at dbPath.
     *
     * @param exportFile where to write a copy of the log first, or null
     */
    public static RetrainReport run(Path logFile, String dbPath, Path exportFile) throws SQLException {
        FeedbackStore feedback = new FeedbackStore(logFile);
        FeedbackStatistics stats = feedback.statistics();
        logger.info("Feedback log: {}", stats);
        for (SessionSummary s : feedback.sessionSummaries()) {
            logger.info("Session {}: {} active of {} ({} .. {})", s.getSessionId(), s.getActiveCount(),
                    s.getTotalCount(), s.getFirstTimestamp(), s.getLastTimestamp());
        }

        if (exportFile != null) {
            feedback.export(exportFile);
        }

        File parent = new File(dbPath).getAbsoluteFile().getParentFile();
        if (parent != null && !parent.exists() && !parent.mkdirs()) {
            logger.warn("Could not create directory {}", parent);
        }
        SqliteInitializer.initialize(dbPath);
        PrototypeDao dao = new PrototypeDao(dbPath);
        ClassModelStore store = new ClassModelStore();
        store.restore(dao);

        List<TrainingSample> samples = feedback.trainingData(true);
        RetrainReport report = new RetrainingEngine(store, new FeatureExtractor(), dao).retrain(samples);
        logger.info("Retrain finished: {}", report);
        return report;
    }
}
