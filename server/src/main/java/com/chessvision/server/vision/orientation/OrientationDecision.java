package com.chessvision.server.vision.orientation;

public class OrientationDecision {

    public enum Source {
        MANUAL,
        CORNER_COLOR,
        PIECE_IDENTITY,
        DEFAULT
    }

    private final BoardOrientation orientation;
    private final Source source;

    public OrientationDecision(BoardOrientation orientation, Source source) {
        this.orientation = orientation;
        this.source = source;
    }

    public BoardOrientation getOrientation() {
        return orientation;
    }

    public Source getSource() {
        return source;
    }

    /**
     * False when the orientation is the fallback rather than something observed or stated.
     */
    public boolean isDetected() {
        return source != Source.DEFAULT;
    }

    @Override
    public String toString() {
        return orientation.getCode() + " (" + source + ")";
    }
}
