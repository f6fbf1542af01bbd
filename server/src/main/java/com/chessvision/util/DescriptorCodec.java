package com.chessvision.util;

import java.nio.ByteBuffer;
import java.nio.DoubleBuffer;

/**
 * Packs feature descriptors into big-endian byte blobs for storage.
 */
public class DescriptorCodec {

    public static byte[] encode(double[] descriptor) {
        if (descriptor == null) {
            return null;
        }
        ByteBuffer buffer = ByteBuffer.allocate(descriptor.length * Double.BYTES);
        buffer.asDoubleBuffer().put(descriptor);
        return buffer.array();
    }

    public static double[] decode(byte[] blob) {
        if (blob == null) {
            return null;
        }
        if (blob.length % Double.BYTES != 0) {
            throw new IllegalArgumentException("Descriptor blob length " + blob.length
                    + " is not a multiple of " + Double.BYTES);
        }
        DoubleBuffer buffer = ByteBuffer.wrap(blob).asDoubleBuffer();
        double[] descriptor = new double[buffer.remaining()];
        buffer.get(descriptor);
        return descriptor;
    }
}
