package com.chessvision.server.vision.learning;

import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.PieceType;

/**
 * A square image paired with its human-confirmed label.
 */
public class TrainingSample {
    private final PixelImage image;
    private final PieceType label;

    public TrainingSample(PixelImage image, PieceType label) {
        if (image == null || label == null) {
            throw new IllegalArgumentException("Training sample needs an image and a label");
        }
        this.image = image;
        this.label = label;
    }

    public PixelImage getImage() {
        return image;
    }

    public PieceType getLabel() {
        return label;
    }
}
