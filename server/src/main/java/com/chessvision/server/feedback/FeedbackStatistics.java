package com.chessvision.server.feedback;

import java.util.Collections;
import java.util.Map;

/**
 * Snapshot of the feedback log. Breakdowns and mean confidence cover active records only.
 */
public class FeedbackStatistics {
    private final int totalCorrections;
    private final int activeCorrections;
    private final int supersededCorrections;
    private final Map<String, Integer> byPieceType;
    private final Map<String, Integer> bySession;
    private final double meanOriginalConfidence;

    public FeedbackStatistics(int totalCorrections, int activeCorrections, Map<String, Integer> byPieceType,
            Map<String, Integer> bySession, double meanOriginalConfidence) {
        this.totalCorrections = totalCorrections;
        this.activeCorrections = activeCorrections;
        this.supersededCorrections = totalCorrections - activeCorrections;
        this.byPieceType = Collections.unmodifiableMap(byPieceType);
        this.bySession = Collections.unmodifiableMap(bySession);
        this.meanOriginalConfidence = meanOriginalConfidence;
    }

    public int getTotalCorrections() {
        return totalCorrections;
    }

    public int getActiveCorrections() {
        return activeCorrections;
    }

    public int getSupersededCorrections() {
        return supersededCorrections;
    }

    public Map<String, Integer> getByPieceType() {
        return byPieceType;
    }

    public Map<String, Integer> getBySession() {
        return bySession;
    }

    public double getMeanOriginalConfidence() {
        return meanOriginalConfidence;
    }

    @Override
    public String toString() {
        return String.format("FeedbackStatistics{total=%d, active=%d, superseded=%d, meanConfidence=%.3f}",
                totalCorrections, activeCorrections, supersededCorrections, meanOriginalConfidence);
    }
}
