package com.chessvision.db;

public class PrototypeRow {
    private final String label;
    private final double[] descriptor;
    private final int sampleCount;
    private final long updatedTs;

    public PrototypeRow(String label, double[] descriptor, int sampleCount, long updatedTs) {
        this.label = label;
        this.descriptor = descriptor;
        this.sampleCount = sampleCount;
        this.updatedTs = updatedTs;
    }

    public String getLabel() {
        return label;
    }

    public double[] getDescriptor() {
        return descriptor;
    }

    public int getSampleCount() {
        return sampleCount;
    }

    public long getUpdatedTs() {
        return updatedTs;
    }

    @Override
    public String toString() {
        return "PrototypeRow{label='" + label + "', samples=" + sampleCount + "}";
    }
}
