package com.chessvision.server.vision.orientation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which side's pieces face the camera (sit on the bottom edge of the photo).
 */
public enum BoardOrientation {
    WHITE("white"),
    BLACK("black");

    private final String code;

    BoardOrientation(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static BoardOrientation fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (BoardOrientation o : values()) {
            if (o.code.equalsIgnoreCase(code.trim())) {
                return o;
            }
        }
        throw new IllegalArgumentException("Unknown board orientation: " + code);
    }
}
