package com.chessvision.server.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Settings read from {@code /chessvision_config.json} on the classpath.
 * Sections or keys missing from the file fall back to the defaults below.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VisionConfig {
    private static final Logger logger = LoggerFactory.getLogger(VisionConfig.class);

    public static final String RESOURCE = "/chessvision_config.json";

    @JsonProperty("data_directory")
    public String dataDirectory;
    public BoardConfig board;
    public ClassifierConfig classifier;
    public OrientationConfig orientation;
    public FeedbackConfig feedback;
    public PrototypeConfig prototypes;

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BoardConfig {
        public Integer minBoardSize;
        public Integer maxBoardSize;
        public Integer resolution;

        public int minBoardSizeOrDefault() {
            return minBoardSize != null ? minBoardSize : 200;
        }

        public int maxBoardSizeOrDefault() {
            return maxBoardSize != null ? maxBoardSize : 2000;
        }

        public int resolutionOrDefault() {
            return resolution != null ? resolution : 800;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ClassifierConfig {
        public Double minConfidence;

        public double minConfidenceOrDefault() {
            return minConfidence != null ? minConfidence : 0.5;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OrientationConfig {
        // auto, white or black
        public String preference;
        public Double cornerThreshold;
        public Integer pieceMargin;

        public String preferenceOrDefault() {
            return preference != null ? preference : "auto";
        }

        public double cornerThresholdOrDefault() {
            return cornerThreshold != null ? cornerThreshold : 10.0;
        }

        public int pieceMarginOrDefault() {
            return pieceMargin != null ? pieceMargin : 2;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class FeedbackConfig {
        public String logFile;
        public String imageDirectory;
        public Integer hashSize;

        public String logFileOrDefault() {
            return logFile != null ? logFile : "chess_feedback.json";
        }

        public String imageDirectoryOrDefault() {
            return imageDirectory != null ? imageDirectory : "feedback_images";
        }

        public int hashSizeOrDefault() {
            return hashSize != null ? hashSize : 64;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PrototypeConfig {
        public Boolean persist;
        public String dbFile;

        public boolean persistOrDefault() {
            return persist != null ? persist : true;
        }

        public String dbFileOrDefault() {
            return dbFile != null ? dbFile : "chessvision_prototypes.db";
        }
    }

    /**
     * Reads the classpath config, or returns all defaults when it is absent or unreadable.
     */
    public static VisionConfig load() {
        try (InputStream is = VisionConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", RESOURCE);
                return new VisionConfig().withDefaults();
            }
            return new ObjectMapper().readValue(is, VisionConfig.class).withDefaults();
        } catch (IOException e) {
            logger.error("Failed to read " + RESOURCE + ", using defaults", e);
            return new VisionConfig().withDefaults();
        }
    }

    /**
     * Fills in missing sections so callers never see a null section.
     */
    public VisionConfig withDefaults() {
        if (board == null) {
            board = new BoardConfig();
        }
        if (classifier == null) {
            classifier = new ClassifierConfig();
        }
        if (orientation == null) {
            orientation = new OrientationConfig();
        }
        if (feedback == null) {
            feedback = new FeedbackConfig();
        }
        if (prototypes == null) {
            prototypes = new PrototypeConfig();
        }
        return this;
    }
}
