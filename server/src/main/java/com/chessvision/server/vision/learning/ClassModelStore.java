package com.chessvision.server.vision.learning;

import com.chessvision.db.PrototypeDao;
import com.chessvision.db.PrototypeRow;
import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceColor;
import com.chessvision.server.vision.PieceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Holds the learned prototype of each piece type.
 *
 * Only {@link RetrainingEngine} writes prototypes; everything else reads.
 */
public class ClassModelStore {
    private static final Logger logger = LoggerFactory.getLogger(ClassModelStore.class);

    private final Map<PieceType, ClassPrototype> prototypes = new ConcurrentHashMap<>();

    public Optional<ClassPrototype> get(PieceType type) {
        return Optional.ofNullable(prototypes.get(type));
    }

    /**
     * Learned prototypes of pieces of the given colour, in piece-type order.
     */
    public List<ClassPrototype> prototypesFor(PieceColor color) {
        List<ClassPrototype> result = new ArrayList<>();
        for (ClassPrototype p : prototypes.values()) {
            if (p.getLabel().getColor() == color) {
                result.add(p);
            }
        }
        result.sort(Comparator.comparing(ClassPrototype::getLabel));
        return result;
    }

    public boolean hasPrototypesFor(PieceColor color) {
        for (PieceType t : prototypes.keySet()) {
            if (t.getColor() == color) {
                return true;
            }
        }
        return false;
    }

    public List<ClassPrototype> all() {
        List<ClassPrototype> result = new ArrayList<>(prototypes.values());
        result.sort(Comparator.comparing(ClassPrototype::getLabel));
        return result;
    }

    public boolean isTrained() {
        return !prototypes.isEmpty();
    }

    public int size() {
        return prototypes.size();
    }

    void put(ClassPrototype prototype) {
        prototypes.put(prototype.getLabel(), prototype);
    }

    /**
     * Forgets every learned prototype.
     */
    public void reset() {
        prototypes.clear();
        logger.info("Class model store reset");
    }

    /**
     * Replaces the in-memory state with the prototypes stored in the database.
     * Rows whose label or descriptor no longer match are skipped.
     */
    public void restore(PrototypeDao dao) throws SQLException {
        List<PrototypeRow> rows = dao.loadAll();
        prototypes.clear();
        for (PrototypeRow row : rows) {
            PieceType label;
            try {
                label = PieceType.valueOf(row.getLabel());
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping stored prototype with unknown label '{}'", row.getLabel());
                continue;
            }
            if (row.getDescriptor() == null || row.getDescriptor().length != FeatureVector.DIMENSION) {
                logger.warn("Skipping stored prototype {} with incompatible descriptor", row.getLabel());
                continue;
            }
            put(new ClassPrototype(label, FeatureVector.fromArray(row.getDescriptor()), row.getSampleCount(),
                    row.getUpdatedTs()));
        }
        logger.info("Restored {} class prototypes", prototypes.size());
    }

    public ModelSummary summary() {
        List<PieceType> types = new ArrayList<>();
        for (ClassPrototype p : all()) {
            types.add(p.getLabel());
        }
        return new ModelSummary(!types.isEmpty(), types);
    }

    public static class ModelSummary {
        private final boolean trained;
        private final List<PieceType> pieceTypes;

        public ModelSummary(boolean trained, List<PieceType> pieceTypes) {
            this.trained = trained;
            this.pieceTypes = List.copyOf(pieceTypes);
        }

        public boolean isTrained() {
            return trained;
        }

        public List<PieceType> getPieceTypes() {
            return pieceTypes;
        }

        public int getNumPieceTypes() {
            return pieceTypes.size();
        }
    }
}
