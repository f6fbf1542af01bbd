package com.chessvision.server.controller;

import com.chessvision.server.feedback.CorrectionRecord;
import com.chessvision.server.service.BoardNotFoundException;
import com.chessvision.server.service.BoardRecognition;
import com.chessvision.server.service.RecognitionService;
import com.chessvision.server.vision.BoardGrid;
import com.chessvision.server.vision.BoardRegion;
import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.learning.RetrainReport;
import com.chessvision.server.vision.orientation.BoardOrientation;
import com.chessvision.server.vision.orientation.OrientationPreference;
import com.chessvision.server.vision.orientation.SquareNames;
import com.chessvision.server.vision.recognition.RecognitionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

@RestController
public class RecognitionController {

    private static final Logger logger = LoggerFactory.getLogger(RecognitionController.class);
    private final RecognitionService recognitionService;

    public RecognitionController(RecognitionService recognitionService) {
        this.recognitionService = recognitionService;
    }

    public static class RegionRequest {
        public int x;
        public int y;
        public int width;
        public int height;
    }

    public static class RecognizeRequest {
        // base64 PNG or JPEG, optionally as a data URL
        public String image;
        public RegionRequest region;
        public String orientation;
    }

    public static class CorrectionRequest {
        public String square;
        public String piece;
    }

    public static class SquareResponse {
        public String square;
        public String piece;
        public char symbol;
        public double confidence;
        public double occupancyConfidence;
        public List<RecognitionResult.Alternative> alternatives;
    }

    public static class RecognizeResponse {
        public String placement;
        public BoardOrientation orientation;
        public String orientationSource;
        public BoardRegion region;
        // rank 8 first, a-file first
        public List<List<SquareResponse>> board;
    }

    @PostMapping("/recognize")
    public ResponseEntity<?> recognize(@RequestBody RecognizeRequest request) {
        if (request.image == null || request.image.isBlank()) {
            return ResponseEntity.badRequest().body("Missing image data.");
        }
        PixelImage image;
        try {
            image = PixelImage.decode(decodeBase64(request.image));
        } catch (IllegalArgumentException | IOException e) {
            return ResponseEntity.badRequest().body("Invalid image data: " + e.getMessage());
        }
        BoardRegion region = null;
        if (request.region != null) {
            region = new BoardRegion(request.region.x, request.region.y, request.region.width, request.region.height);
        }
        OrientationPreference preference = request.orientation != null
                ? OrientationPreference.parse(request.orientation)
                : null;

        logger.info("Received recognition request for {}", image);
        BoardRecognition recognition = recognitionService.recognize(image, region, preference);
        return ResponseEntity.ok(toResponse(recognition));
    }

    @PostMapping("/corrections")
    public ResponseEntity<?> correct(@RequestBody CorrectionRequest request) {
        if (request.square == null || request.piece == null) {
            return ResponseEntity.badRequest().body("Both square and piece are required.");
        }
        PieceType piece = PieceType.valueOf(request.piece.trim().toUpperCase());
        CorrectionRecord record = recognitionService.submitCorrection(request.square, piece);
        return ResponseEntity.ok(record);
    }

    @GetMapping("/feedback/stats")
    public ResponseEntity<?> feedbackStats() {
        return ResponseEntity.ok(recognitionService.feedbackStatistics());
    }

    @GetMapping("/feedback/sessions")
    public ResponseEntity<?> feedbackSessions() {
        return ResponseEntity.ok(recognitionService.feedbackSessions());
    }

    @DeleteMapping("/feedback")
    public ResponseEntity<?> clearFeedback() {
        recognitionService.clearFeedback();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/retrain")
    public ResponseEntity<?> retrain() {
        RetrainReport report = recognitionService.retrainFromFeedback();
        return ResponseEntity.ok(report);
    }

    @GetMapping("/model")
    public ResponseEntity<?> model() {
        return ResponseEntity.ok(recognitionService.modelSummary());
    }

    @DeleteMapping("/model")
    public ResponseEntity<?> resetModel() {
        recognitionService.resetModel();
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(BoardNotFoundException.class)
    public ResponseEntity<?> handleBoardNotFound(BoardNotFoundException e) {
        return ResponseEntity.unprocessableEntity().body(e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleBadArgument(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<?> handleBadState(IllegalStateException e) {
        return ResponseEntity.status(409).body(e.getMessage());
    }

    static byte[] decodeBase64(String data) {
        int comma = data.indexOf(',');
        String payload = data.startsWith("data:") && comma >= 0 ? data.substring(comma + 1) : data;
        return Base64.getMimeDecoder().decode(payload);
    }

    static RecognizeResponse toResponse(BoardRecognition recognition) {
        RecognizeResponse response = new RecognizeResponse();
        response.placement = recognition.getPlacement();
        response.orientation = recognition.getOrientation().getOrientation();
        response.orientationSource = recognition.getOrientation().getSource().name();
        response.region = recognition.getRegion();

        BoardGrid<RecognitionResult> standard = recognition.standardResults();
        response.board = new ArrayList<>();
        for (int r = 0; r < BoardGrid.SIZE; r++) {
            List<SquareResponse> row = new ArrayList<>();
            for (int c = 0; c < BoardGrid.SIZE; c++) {
                RecognitionResult result = standard.get(r, c);
                SquareResponse sq = new SquareResponse();
                sq.square = SquareNames.nameOf(r, c, BoardOrientation.WHITE);
                sq.piece = result.getPieceType() != null ? result.getPieceType().name() : null;
                sq.symbol = result.symbol();
                sq.confidence = result.getConfidence();
                sq.occupancyConfidence = result.getOccupancyConfidence();
                sq.alternatives = result.getAlternatives();
                row.add(sq);
            }
            response.board.add(row);
        }
        return response;
    }
}
