package com.chessvision.server.vision;

import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;

import static org.junit.jupiter.api.Assertions.*;

public class OpenCvImagesTest {

    @Test
    public void testColourImageSurvivesMatConversion() {
        PixelImage img = SyntheticImages.pieceSquare(12, 230, 20);
        Mat mat = OpenCvImages.toMat(img);
        try {
            assertEquals(CvType.CV_8UC3, mat.type());
            assertEquals(12, mat.rows());
            assertEquals(img, OpenCvImages.fromMat(mat));
        } finally {
            OpenCvImages.release(mat);
        }
    }

    @Test
    public void testGrayMatKeepsValuesAbove127() {
        Mat mat = OpenCvImages.toGrayMat(new int[][] { { 0, 128, 255 } });
        try {
            PixelImage img = OpenCvImages.fromMat(mat);
            assertEquals(1, img.getChannels());
            assertEquals(255, img.get(0, 2, 0));
            assertEquals(128, img.get(0, 1, 0));
        } finally {
            OpenCvImages.release(mat);
        }
    }

    @Test
    public void testReleaseFreesNativeDataAndSkipsNulls() {
        Mat mat = OpenCvImages.toMat(PixelImage.filledGray(4, 4, 10));
        assertFalse(mat.empty());
        OpenCvImages.release(null, mat);
        assertTrue(mat.empty());
    }

    @Test
    public void testUnsupportedMatRejected() {
        Mat mat = new Mat(2, 2, CvType.CV_32FC1);
        try {
            assertThrows(IllegalArgumentException.class, () -> OpenCvImages.fromMat(mat));
        } finally {
            mat.release();
        }
    }
}
