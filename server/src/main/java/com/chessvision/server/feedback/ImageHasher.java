package com.chessvision.server.feedback;

import com.chessvision.server.vision.PixelImage;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hash of a board photo: SHA-256 over the RGB bytes of a fixed-size resampled copy,
 * so re-encodings of the same photo at another size hash alike.
 */
public final class ImageHasher {

    public static final int DEFAULT_HASH_SIZE = 64;
    public static final String NO_IMAGE = "no_image";

    private ImageHasher() {
    }

    public static String hash(PixelImage image) {
        return hash(image, DEFAULT_HASH_SIZE);
    }

    public static String hash(PixelImage image, int size) {
        int[] samples = image.toRgb().resize(size, size).samples();
        byte[] bytes = new byte[samples.length];
        for (int i = 0; i < samples.length; i++) {
            bytes[i] = (byte) samples[i];
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return toHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            sb.append(Character.forDigit((b >> 4) & 0xF, 16));
            sb.append(Character.forDigit(b & 0xF, 16));
        }
        return sb.toString();
    }
}
