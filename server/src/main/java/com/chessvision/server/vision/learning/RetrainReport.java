package com.chessvision.server.vision.learning;

import com.chessvision.server.vision.PieceType;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class RetrainReport {

    public enum Status {
        SUCCESS,
        FAILED
    }

    public enum FailureReason {
        EMPTY_DATASET
    }

    private final Status status;
    private final FailureReason reason;
    private final int samplesProcessed;
    private final Map<PieceType, Integer> perLabelCount;

    private RetrainReport(Status status, FailureReason reason, int samplesProcessed,
            Map<PieceType, Integer> perLabelCount) {
        this.status = status;
        this.reason = reason;
        this.samplesProcessed = samplesProcessed;
        this.perLabelCount = perLabelCount;
    }

    public static RetrainReport success(int samplesProcessed, Map<PieceType, Integer> perLabelCount) {
        return new RetrainReport(Status.SUCCESS, null, samplesProcessed,
                Collections.unmodifiableMap(new EnumMap<>(perLabelCount)));
    }

    public static RetrainReport failed(FailureReason reason) {
        return new RetrainReport(Status.FAILED, reason, 0, Collections.emptyMap());
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Status getStatus() {
        return status;
    }

    /**
     * @return why the run failed, or null on success
     */
    public FailureReason getReason() {
        return reason;
    }

    public int getSamplesProcessed() {
        return samplesProcessed;
    }

    public int getDistinctLabels() {
        return perLabelCount.size();
    }

    public Map<PieceType, Integer> getPerLabelCount() {
        return perLabelCount;
    }

    @Override
    public String toString() {
        return "RetrainReport{status=" + status + ", reason=" + reason + ", samples=" + samplesProcessed
                + ", labels=" + perLabelCount + "}";
    }
}
