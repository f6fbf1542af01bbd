package com.chessvision.server.feedback;

import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.orientation.BoardOrientation;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One user correction of a square's recognition, as stored in the feedback log.
 *
 * Everything but the active flag is fixed at creation. A record stops being active when a newer
 * correction for the same photo and square supersedes it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({ "square_name", "original_prediction", "original_confidence", "user_correction", "timestamp",
        "square_image_path", "board_orientation", "session_id", "unique_key", "image_hash", "is_active" })
public class CorrectionRecord {

    private final String squareName;
    private final PieceType originalPrediction;
    private final double originalConfidence;
    private final PieceType userCorrection;
    private final String timestamp;
    private final String squareImagePath;
    private final BoardOrientation boardOrientation;
    private final String sessionId;
    private final String uniqueKey;
    private final String imageHash;
    private boolean active;

    @JsonCreator
    public CorrectionRecord(
            @JsonProperty("square_name") String squareName,
            @JsonProperty("original_prediction") PieceType originalPrediction,
            @JsonProperty("original_confidence") Double originalConfidence,
            @JsonProperty("user_correction") PieceType userCorrection,
            @JsonProperty("timestamp") String timestamp,
            @JsonProperty("square_image_path") String squareImagePath,
            @JsonProperty("board_orientation") BoardOrientation boardOrientation,
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("unique_key") String uniqueKey,
            @JsonProperty("image_hash") String imageHash,
            @JsonProperty("is_active") Boolean active) {
        if (squareName == null || userCorrection == null) {
            throw new IllegalArgumentException("Correction needs a square name and a corrected piece type");
        }
        this.squareName = squareName;
        this.originalPrediction = originalPrediction;
        this.originalConfidence = originalConfidence != null ? originalConfidence : 0.0;
        this.userCorrection = userCorrection;
        this.timestamp = timestamp;
        this.squareImagePath = squareImagePath;
        this.boardOrientation = boardOrientation;
        this.sessionId = sessionId;
        this.uniqueKey = uniqueKey;
        this.imageHash = imageHash;
        this.active = active != null ? active : true;
    }

    public static String uniqueKey(String imageHash, String squareName) {
        return imageHash + "_" + squareName;
    }

    @JsonProperty("square_name")
    public String getSquareName() {
        return squareName;
    }

    @JsonProperty("original_prediction")
    public PieceType getOriginalPrediction() {
        return originalPrediction;
    }

    @JsonProperty("original_confidence")
    public double getOriginalConfidence() {
        return originalConfidence;
    }

    @JsonProperty("user_correction")
    public PieceType getUserCorrection() {
        return userCorrection;
    }

    @JsonProperty("timestamp")
    public String getTimestamp() {
        return timestamp;
    }

    @JsonProperty("square_image_path")
    public String getSquareImagePath() {
        return squareImagePath;
    }

    @JsonProperty("board_orientation")
    public BoardOrientation getBoardOrientation() {
        return boardOrientation;
    }

    @JsonProperty("session_id")
    public String getSessionId() {
        return sessionId;
    }

    @JsonProperty("unique_key")
    public String getUniqueKey() {
        return uniqueKey;
    }

    @JsonProperty("image_hash")
    public String getImageHash() {
        return imageHash;
    }

    @JsonProperty("is_active")
    public boolean isActive() {
        return active;
    }

    void deactivate() {
        this.active = false;
    }

    void reactivate() {
        this.active = true;
    }

    @Override
    public String toString() {
        return "CorrectionRecord{" + squareName + ": " + originalPrediction + " -> " + userCorrection
                + (active ? "" : " (superseded)") + "}";
    }
}
