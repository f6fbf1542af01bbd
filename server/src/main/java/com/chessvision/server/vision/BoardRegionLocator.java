package com.chessvision.server.vision;

import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Finds the chess board in a photo.
 *
 * Pipeline: grayscale, 5x5 Gaussian blur, adaptive Gaussian threshold, contour tree,
 * then the largest contour whose area lies strictly between minSize^2 and maxSize^2 and whose
 * bounding box is roughly square.
 */
public class BoardRegionLocator {
    private static final Logger logger = LoggerFactory.getLogger(BoardRegionLocator.class);

    public static final double MIN_ASPECT = 0.8;
    public static final double MAX_ASPECT = 1.2;

    private final int minBoardSize;
    private final int maxBoardSize;
    private final int resolution;

    public BoardRegionLocator() {
        this(200, 2000, 800);
    }

    public BoardRegionLocator(int minBoardSize, int maxBoardSize, int resolution) {
        this.minBoardSize = minBoardSize;
        this.maxBoardSize = maxBoardSize;
        this.resolution = resolution;
    }

    /**
     * @return the board's bounding box, or empty when no contour passes the filters
     */
    public Optional<BoardRegion> locate(PixelImage image) {
        Mat src = OpenCvImages.toMat(image);
        Mat gray = new Mat();
        Mat blurred = new Mat();
        Mat thresh = new Mat();
        Mat hierarchy = new Mat();
        List<MatOfPoint> contours = new ArrayList<>();
        try {
            if (image.getChannels() == 3) {
                Imgproc.cvtColor(src, gray, Imgproc.COLOR_RGB2GRAY);
            } else {
                src.copyTo(gray);
            }
            Imgproc.GaussianBlur(gray, blurred, new Size(5, 5), 0);
            Imgproc.adaptiveThreshold(blurred, thresh, 255,
                    Imgproc.ADAPTIVE_THRESH_GAUSSIAN_C,
                    Imgproc.THRESH_BINARY, 11, 2);
            Imgproc.findContours(thresh, contours, hierarchy, Imgproc.RETR_TREE, Imgproc.CHAIN_APPROX_SIMPLE);
            return selectBoard(image, contours);
        } finally {
            OpenCvImages.release(src, gray, blurred, thresh, hierarchy);
            for (MatOfPoint contour : contours) {
                contour.release();
            }
        }
    }

    private Optional<BoardRegion> selectBoard(PixelImage image, List<MatOfPoint> contours) {
        double minArea = (double) minBoardSize * minBoardSize;
        double maxArea = (double) maxBoardSize * maxBoardSize;

        Rect best = null;
        double bestArea = -1;
        int candidates = 0;
        for (MatOfPoint contour : contours) {
            double area = Imgproc.contourArea(contour);
            if (area <= minArea || area >= maxArea) {
                continue;
            }
            Rect rect = Imgproc.boundingRect(contour);
            double aspect = rect.height > 0 ? (double) rect.width / rect.height : 0;
            if (aspect <= MIN_ASPECT || aspect >= MAX_ASPECT) {
                continue;
            }
            candidates++;
            if (area > bestArea) {
                bestArea = area;
                best = rect;
            }
        }

        logger.info("Found {} potential board contours out of {}", candidates, contours.size());
        if (best == null) {
            logger.warn("No board contour detected in {}", image);
            return Optional.empty();
        }
        BoardRegion region = new BoardRegion(best.x, best.y, best.width, best.height);
        logger.debug("Selected board region {} (area {})", region, bestArea);
        return Optional.of(region);
    }

    /**
     * Crops the (clamped) region and resizes it to the standard board resolution.
     */
    public PixelImage extractBoard(PixelImage image, BoardRegion region) {
        BoardRegion r = region.clampTo(image.getWidth(), image.getHeight());
        PixelImage cropped = image.crop(r.getX(), r.getY(), r.getWidth(), r.getHeight());
        return cropped.resize(resolution, resolution);
    }

    public int getResolution() {
        return resolution;
    }
}
