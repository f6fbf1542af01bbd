package com.chessvision.server.vision.learning;

import com.chessvision.server.vision.FeatureVector;
import com.chessvision.server.vision.PieceType;

/**
 * Learned mean descriptor for one piece type.
 */
public class ClassPrototype {
    private final PieceType label;
    private final FeatureVector descriptor;
    private final int sampleCount;
    private final long updatedTs;

    public ClassPrototype(PieceType label, FeatureVector descriptor, int sampleCount, long updatedTs) {
        this.label = label;
        this.descriptor = descriptor;
        this.sampleCount = sampleCount;
        this.updatedTs = updatedTs;
    }

    public PieceType getLabel() {
        return label;
    }

    public FeatureVector getDescriptor() {
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
        return "ClassPrototype{" + label + ", samples=" + sampleCount + "}";
    }
}
