package com.chessvision.server.feedback;

import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.learning.TrainingSample;
import com.chessvision.server.vision.orientation.BoardOrientation;
import com.chessvision.server.vision.orientation.SquareNames;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Append-only log of user corrections, kept as a JSON array on disk.
 *
 * Each correction is keyed by the content hash of the photo it was made on plus the square name.
 * Adding a correction deactivates the previous active one with the same key, so at most one active
 * record exists per key and superseded records stay in the log for auditing. Every change rewrites
 * the whole file through a temp file and an atomic move.
 *
 * One writer per log file; callers serialize access.
 */
public class FeedbackStore {
    private static final Logger logger = LoggerFactory.getLogger(FeedbackStore.class);

    public static final String DEFAULT_IMAGE_DIRECTORY = "feedback_images";
    static final String UNKNOWN_SESSION = "unknown";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS");
    private static final DateTimeFormatter SESSION_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSSSSS");

    private final Path logFile;
    private final Path imageDirectory;
    private final String sessionId;
    private final Clock clock;
    private final int hashSize;
    private final ObjectMapper mapper;

    private final List<CorrectionRecord> records = new ArrayList<>();
    // uniqueKey -> position of the active record in records
    private final Map<String, Integer> activeIndex = new HashMap<>();
    private String currentImageHash = ImageHasher.NO_IMAGE;

    public FeedbackStore(Path logFile) {
        this(logFile, null, Clock.systemDefaultZone());
    }

    public FeedbackStore(Path logFile, String sessionId, Clock clock) {
        this(logFile, DEFAULT_IMAGE_DIRECTORY, ImageHasher.DEFAULT_HASH_SIZE, sessionId, clock);
    }

    /**
     * @param imageDirectory directory for stored square images, relative to the log's directory
     * @param sessionId      session to file new corrections under, or null to start a new one
     */
    public FeedbackStore(Path logFile, String imageDirectory, int hashSize, String sessionId, Clock clock) {
        this.logFile = logFile.toAbsolutePath();
        this.imageDirectory = baseDirectory().resolve(imageDirectory);
        this.clock = clock;
        this.hashSize = hashSize;
        this.sessionId = sessionId != null ? sessionId : newSessionId(clock);
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        load();
        logger.info("Feedback store ready: {} records, session {}", records.size(), this.sessionId);
    }

    static String newSessionId(Clock clock) {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "session_" + LocalDateTime.now(clock).format(SESSION_STAMP) + "_" + suffix;
    }

    /**
     * Registers the photo subsequent corrections refer to.
     */
    public void setCurrentImage(PixelImage image) {
        this.currentImageHash = ImageHasher.hash(image, hashSize);
        logger.debug("Current image hash {}", currentImageHash);
    }

    public String getCurrentImageHash() {
        return currentImageHash;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Path getLogFile() {
        return logFile;
    }

    /**
     * Records a correction for a square of the current image.
     *
     * @param originalPrediction what the classifier said, null when it was unknown
     * @param squareImage        pixels of the square to keep for retraining, or null
     * @param orientation        orientation the board was read with, or null
     */
    public CorrectionRecord addCorrection(String squareName, PieceType originalPrediction, double originalConfidence,
            PieceType userCorrection, PixelImage squareImage, BoardOrientation orientation) {
        return addCorrection(currentImageHash, squareName, originalPrediction, originalConfidence, userCorrection,
                squareImage, orientation);
    }

    /**
     * Records a correction for a square of the photo with the given content hash.
     * If the log cannot be written the store is left as it was and the square image is removed.
     */
    public CorrectionRecord addCorrection(String imageHash, String squareName, PieceType originalPrediction,
            double originalConfidence, PieceType userCorrection, PixelImage squareImage,
            BoardOrientation orientation) {
        if (!SquareNames.isValid(squareName)) {
            throw new IllegalArgumentException("Invalid square name: " + squareName);
        }
        if (userCorrection == null) {
            throw new IllegalArgumentException("Corrected piece type is required");
        }
        String hash = imageHash != null ? imageHash : ImageHasher.NO_IMAGE;
        String square = squareName.toLowerCase();
        LocalDateTime now = LocalDateTime.now(clock);

        String imagePath = null;
        if (squareImage != null) {
            imagePath = storeSquareImage(square, squareImage, now);
        }

        String key = CorrectionRecord.uniqueKey(hash, square);
        Integer previous = activeIndex.get(key);
        if (previous != null) {
            records.get(previous).deactivate();
        }

        CorrectionRecord record = new CorrectionRecord(square, originalPrediction, originalConfidence,
                userCorrection, now.format(TIMESTAMP), imagePath, orientation, sessionId, key, hash, true);
        records.add(record);
        activeIndex.put(key, records.size() - 1);

        try {
            save();
        } catch (FeedbackPersistenceException e) {
            records.remove(records.size() - 1);
            if (previous != null) {
                records.get(previous).reactivate();
                activeIndex.put(key, previous);
            } else {
                activeIndex.remove(key);
            }
            deleteStoredImage(imagePath, e);
            logger.error("Correction for {} not recorded", square, e);
            throw e;
        }

        if (previous != null) {
            logger.info("Superseded earlier correction for {} ({})", square, key);
        }
        logger.info("Saved correction {}: {} -> {}", square, originalPrediction, userCorrection);
        return record;
    }

    public List<CorrectionRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public int size() {
        return records.size();
    }

    public List<CorrectionRecord> recordsForSession(String session) {
        List<CorrectionRecord> out = new ArrayList<>();
        for (CorrectionRecord r : records) {
            if (session.equals(r.getSessionId())) {
                out.add(r);
            }
        }
        return out;
    }

    public FeedbackStatistics statistics() {
        Map<String, Integer> byPiece = new TreeMap<>();
        Map<String, Integer> bySession = new TreeMap<>();
        int active = 0;
        double confidenceSum = 0.0;
        for (CorrectionRecord r : records) {
            if (!r.isActive()) {
                continue;
            }
            active++;
            confidenceSum += r.getOriginalConfidence();
            byPiece.merge(r.getUserCorrection().name(), 1, Integer::sum);
            bySession.merge(sessionOf(r), 1, Integer::sum);
        }
        double mean = active > 0 ? confidenceSum / active : 0.0;
        return new FeedbackStatistics(records.size(), active, byPiece, bySession, mean);
    }

    public List<TrainingSample> trainingData() {
        return trainingData(true);
    }

    /**
     * Loads the stored square images as labelled samples. Records without an image are left out,
     * and images that are missing or unreadable are skipped with a warning.
     */
    public List<TrainingSample> trainingData(boolean activeOnly) {
        List<TrainingSample> samples = new ArrayList<>();
        int skipped = 0;
        for (CorrectionRecord r : records) {
            if (activeOnly && !r.isActive()) {
                continue;
            }
            if (r.getSquareImagePath() == null) {
                continue;
            }
            Path path = resolveStoredImage(r.getSquareImagePath());
            if (!Files.isRegularFile(path)) {
                logger.warn("Training image missing, skipping: {}", path);
                skipped++;
                continue;
            }
            try {
                samples.add(new TrainingSample(PixelImage.read(path), r.getUserCorrection()));
            } catch (IOException e) {
                logger.warn("Could not read training image {}, skipping: {}", path, e.getMessage());
                skipped++;
            }
        }
        logger.info("Prepared {} training samples ({} skipped)", samples.size(), skipped);
        return samples;
    }

    /**
     * Per-session counts in order of first appearance in the log.
     */
    public List<SessionSummary> sessionSummaries() {
        Map<String, List<CorrectionRecord>> grouped = new LinkedHashMap<>();
        for (CorrectionRecord r : records) {
            grouped.computeIfAbsent(sessionOf(r), k -> new ArrayList<>()).add(r);
        }
        List<SessionSummary> out = new ArrayList<>();
        for (Map.Entry<String, List<CorrectionRecord>> e : grouped.entrySet()) {
            List<CorrectionRecord> group = e.getValue();
            String first = null;
            String last = null;
            int active = 0;
            for (CorrectionRecord r : group) {
                String ts = r.getTimestamp();
                if (ts != null) {
                    if (first == null || ts.compareTo(first) < 0) {
                        first = ts;
                    }
                    if (last == null || ts.compareTo(last) > 0) {
                        last = ts;
                    }
                }
                if (r.isActive()) {
                    active++;
                }
            }
            out.add(new SessionSummary(e.getKey(), first, last, active, group.size()));
        }
        return out;
    }

    /**
     * Writes a copy of the whole log, superseded records included, to the given file.
     */
    public void export(Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writeValue(target.toFile(), records);
            logger.info("Exported {} corrections to {}", records.size(), target);
        } catch (IOException e) {
            throw new FeedbackPersistenceException("Failed to export feedback to " + target, e);
        }
    }

    /**
     * Drops every record, deletes the log file and all stored square images. Cannot be undone.
     */
    public void clear() {
        int count = records.size();
        records.clear();
        activeIndex.clear();
        try {
            Files.deleteIfExists(logFile);
            if (Files.isDirectory(imageDirectory)) {
                try (Stream<Path> paths = Files.walk(imageDirectory)) {
                    List<Path> toDelete = new ArrayList<>();
                    paths.sorted(Comparator.reverseOrder()).forEach(toDelete::add);
                    for (Path p : toDelete) {
                        Files.deleteIfExists(p);
                    }
                }
            }
        } catch (IOException e) {
            throw new FeedbackPersistenceException("Failed to clear feedback data under " + baseDirectory(), e);
        }
        logger.info("Cleared {} corrections", count);
    }

    private void load() {
        if (!Files.exists(logFile)) {
            logger.info("No feedback log at {}, starting empty", logFile);
            return;
        }
        JsonNode root;
        try {
            if (Files.size(logFile) == 0) {
                return;
            }
            root = mapper.readTree(logFile.toFile());
        } catch (IOException e) {
            logger.warn("Feedback log {} is unreadable, starting empty: {}", logFile, e.getMessage());
            return;
        }
        if (root == null || !root.isArray()) {
            logger.warn("Feedback log {} is not a JSON array, starting empty", logFile);
            return;
        }

        int index = 0;
        for (JsonNode node : root) {
            try {
                add(mapper.treeToValue(node, CorrectionRecord.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Skipping malformed feedback record #{}: {}", index, e.getMessage());
            }
            index++;
        }
        logger.info("Loaded {} corrections from {}", records.size(), logFile);
    }

    private void add(CorrectionRecord record) {
        records.add(record);
        if (!record.isActive() || record.getUniqueKey() == null) {
            return;
        }
        Integer previous = activeIndex.put(record.getUniqueKey(), records.size() - 1);
        if (previous != null) {
            // two active records with one key: keep the later one
            records.get(previous).deactivate();
            logger.warn("Log held more than one active record for {}, keeping the latest", record.getUniqueKey());
        }
    }

    private void save() {
        Path dir = baseDirectory();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, logFile.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), records);
            try {
                Files.move(tmp, logFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, logFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
            }
            throw new FeedbackPersistenceException("Failed to save feedback log " + logFile, e);
        }
    }

    private String storeSquareImage(String square, PixelImage image, LocalDateTime now) {
        try {
            Files.createDirectories(imageDirectory);
            String stem = square + "_" + now.format(FILE_STAMP);
            Path target = imageDirectory.resolve(stem + ".png");
            int suffix = 1;
            while (Files.exists(target)) {
                target = imageDirectory.resolve(stem + "_" + suffix + ".png");
                suffix++;
            }
            image.writePng(target);
            String relative = baseDirectory().relativize(target).toString().replace('\\', '/');
            logger.debug("Stored square image {}", relative);
            return relative;
        } catch (IOException e) {
            throw new FeedbackPersistenceException("Failed to store image for square " + square, e);
        }
    }

    private void deleteStoredImage(String storedPath, Exception cause) {
        if (storedPath == null) {
            return;
        }
        try {
            Files.deleteIfExists(resolveStoredImage(storedPath));
        } catch (IOException cleanup) {
            cause.addSuppressed(cleanup);
        }
    }

    private Path resolveStoredImage(String storedPath) {
        Path p = Path.of(storedPath);
        return p.isAbsolute() ? p : baseDirectory().resolve(p);
    }

    private Path baseDirectory() {
        Path parent = logFile.getParent();
        return parent != null ? parent : Path.of(".").toAbsolutePath();
    }

    private static String sessionOf(CorrectionRecord r) {
        return r.getSessionId() != null ? r.getSessionId() : UNKNOWN_SESSION;
    }
}
