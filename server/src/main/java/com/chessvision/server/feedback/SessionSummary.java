package com.chessvision.server.feedback;

public class SessionSummary {
    private final String sessionId;
    private final String firstTimestamp;
    private final String lastTimestamp;
    private final int activeCount;
    private final int totalCount;

    public SessionSummary(String sessionId, String firstTimestamp, String lastTimestamp, int activeCount,
            int totalCount) {
        this.sessionId = sessionId;
        this.firstTimestamp = firstTimestamp;
        this.lastTimestamp = lastTimestamp;
        this.activeCount = activeCount;
        this.totalCount = totalCount;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getFirstTimestamp() {
        return firstTimestamp;
    }

    public String getLastTimestamp() {
        return lastTimestamp;
    }

    public int getActiveCount() {
        return activeCount;
    }

    public int getTotalCount() {
        return totalCount;
    }
}
