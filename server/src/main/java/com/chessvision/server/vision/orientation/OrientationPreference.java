package com.chessvision.server.vision.orientation;

public enum OrientationPreference {
    AUTO,
    WHITE,
    BLACK;

    /**
     * Parses "auto", "white" or "black", case-insensitively. Null and blank mean AUTO.
     */
    public static OrientationPreference parse(String value) {
        if (value == null || value.isBlank()) {
            return AUTO;
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Orientation preference must be auto, white or black: " + value);
        }
    }
}
