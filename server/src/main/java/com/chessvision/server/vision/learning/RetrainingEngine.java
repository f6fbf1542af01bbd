package com.chessvision.server.vision.learning;

import com.chessvision.db.PrototypeDao;
import com.chessvision.db.PrototypeRow;
import com.chessvision.server.vision.FeatureExtractor;
import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds labelled square images into {@link ClassModelStore}.
 *
 * Each label present in a batch gets its prototype replaced by the batch mean;
 * labels absent from the batch keep what earlier calls learned.
 */
public class RetrainingEngine {
    private static final Logger logger = LoggerFactory.getLogger(RetrainingEngine.class);

    private final ClassModelStore store;
    private final FeatureExtractor extractor;
    private final PrototypeDao prototypeDao;

    public RetrainingEngine(ClassModelStore store, FeatureExtractor extractor) {
        this(store, extractor, null);
    }

    /**
     * @param prototypeDao where updated prototypes are written, or null to keep them in memory only
     */
    public RetrainingEngine(ClassModelStore store, FeatureExtractor extractor, PrototypeDao prototypeDao) {
        this.store = store;
        this.extractor = extractor;
        this.prototypeDao = prototypeDao;
    }

    public RetrainReport retrain(List<TrainingSample> samples) {
        if (samples == null || samples.isEmpty()) {
            logger.warn("Retraining requested with an empty dataset");
            return RetrainReport.failed(RetrainReport.FailureReason.EMPTY_DATASET);
        }

        long start = System.currentTimeMillis();
        Map<PieceType, double[]> sums = new EnumMap<>(PieceType.class);
        Map<PieceType, Integer> counts = new EnumMap<>(PieceType.class);

        for (TrainingSample sample : samples) {
            double[] f = extractor.extract(sample.getImage()).toArray();
            double[] acc = sums.computeIfAbsent(sample.getLabel(), k -> new double[FeatureVector.DIMENSION]);
            for (int i = 0; i < acc.length; i++) {
                acc[i] += f[i];
            }
            counts.merge(sample.getLabel(), 1, Integer::sum);
        }

        long now = System.currentTimeMillis();
        for (Map.Entry<PieceType, double[]> e : sums.entrySet()) {
            int n = counts.get(e.getKey());
            double[] mean = e.getValue();
            for (int i = 0; i < mean.length; i++) {
                mean[i] /= n;
            }
            ClassPrototype prototype = new ClassPrototype(e.getKey(), FeatureVector.fromArray(mean), n, now);
            store.put(prototype);
            persist(prototype);
            logger.debug("Prototype {} updated from {} samples", e.getKey(), n);
        }

        RetrainReport report = RetrainReport.success(samples.size(), counts);
        logger.info("Retraining complete in {} ms: {} samples, {} piece types, {} learned in total",
                System.currentTimeMillis() - start, report.getSamplesProcessed(), report.getDistinctLabels(),
                store.size());
        return report;
    }

    private void persist(ClassPrototype prototype) {
        if (prototypeDao == null) {
            return;
        }
        try {
            prototypeDao.upsert(new PrototypeRow(prototype.getLabel().name(), prototype.getDescriptor().toArray(),
                    prototype.getSampleCount(), prototype.getUpdatedTs()));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to persist prototype " + prototype.getLabel(), e);
        }
    }
}
