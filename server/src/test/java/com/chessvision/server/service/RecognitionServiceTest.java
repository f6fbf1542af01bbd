package com.chessvision.server.service;

import com.chessvision.server.config.VisionConfig;
import com.chessvision.server.feedback.CorrectionRecord;
import com.chessvision.server.feedback.ImageHasher;
import com.chessvision.server.vision.BoardRegion;
import com.chessvision.server.vision.PieceType;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.SyntheticImages;
import com.chessvision.server.vision.learning.RetrainReport;
import com.chessvision.server.vision.orientation.BoardOrientation;
import com.chessvision.server.vision.orientation.OrientationDecision;
import com.chessvision.server.vision.orientation.OrientationPreference;
import com.chessvision.server.vision.recognition.PlacementEncoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

public class RecognitionServiceTest {

    private static final BoardRegion FULL_BOARD = new BoardRegion(0, 0, 800, 800);

    @TempDir
    Path tempDir;

    private RecognitionService newService(boolean persist) {
        VisionConfig config = new VisionConfig().withDefaults();
        config.prototypes.persist = persist;
        RecognitionService service = new RecognitionService(config, tempDir, Clock.systemDefaultZone());
        service.init();
        return service;
    }

    /** Checkered 800x800 board with one piece on captured cell (6, 4). */
    private static PixelImage boardWithPawn() {
        return SyntheticImages.paste(SyntheticImages.board(100, 220, 90),
                SyntheticImages.pieceSquare(100, 230, 20), 6, 4);
    }

    private static PixelImage withCorners(PixelImage board, int bottomLeft, int topRight) {
        PixelImage b = SyntheticImages.paste(board, PixelImage.filledGray(100, 100, bottomLeft), 7, 0);
        return SyntheticImages.paste(b, PixelImage.filledGray(100, 100, topRight), 0, 7);
    }

    @Test
    public void testRecognizeProducesPlacement() {
        RecognitionService service = newService(false);
        BoardRecognition result = service.recognize(boardWithPawn(), FULL_BOARD, OrientationPreference.AUTO);

        assertEquals("8/8/8/8/8/8/4P3/8 w KQkq - 0 1", result.getPlacement());
        String placement = result.getPlacement().substring(0,
                result.getPlacement().length() - PlacementEncoder.PLACEHOLDER_SUFFIX.length());
        assertEquals(7, placement.chars().filter(ch -> ch == '/').count());
        assertEquals(8, placement.split("/").length);

        // checkered corners are both dark and no piece sits on an edge row
        assertEquals(BoardOrientation.WHITE, result.getOrientation().getOrientation());
        assertEquals(OrientationDecision.Source.DEFAULT, result.getOrientation().getSource());
        assertEquals(PieceType.WHITE_PAWN, result.resultAt("e2").getPieceType());
        assertSame(result, service.getLastRecognition());
    }

    @Test
    public void testBlackAtBottomIsRotated() {
        RecognitionService service = newService(false);
        BoardRecognition result = service.recognize(withCorners(boardWithPawn(), 230, 40), FULL_BOARD,
                OrientationPreference.AUTO);

        assertEquals(BoardOrientation.BLACK, result.getOrientation().getOrientation());
        assertEquals(OrientationDecision.Source.CORNER_COLOR, result.getOrientation().getSource());
        assertEquals("8/3P4/8/8/8/8/8/8 w KQkq - 0 1", result.getPlacement());
        assertEquals(PieceType.WHITE_PAWN, result.resultAt("d7").getPieceType());
        assertEquals(PieceType.WHITE_PAWN, result.standardResults().get(1, 3).getPieceType());
    }

    @Test
    public void testCornerColoursDetectWhite() {
        RecognitionService service = newService(false);
        BoardRecognition result = service.recognize(withCorners(boardWithPawn(), 40, 230), FULL_BOARD, null);
        assertEquals(BoardOrientation.WHITE, result.getOrientation().getOrientation());
        assertEquals(OrientationDecision.Source.CORNER_COLOR, result.getOrientation().getSource());
    }

    @Test
    public void testManualOrientation() {
        RecognitionService service = newService(false);
        BoardRecognition result = service.recognize(boardWithPawn(), FULL_BOARD, OrientationPreference.BLACK);
        assertEquals(OrientationDecision.Source.MANUAL, result.getOrientation().getSource());
        assertEquals("8/3P4/8/8/8/8/8/8 w KQkq - 0 1", result.getPlacement());
    }

    @Test
    public void testNoBoardFound() {
        RecognitionService service = newService(false);
        assertThrows(BoardNotFoundException.class,
                () -> service.recognize(PixelImage.filledGray(900, 500, 128), null, OrientationPreference.AUTO));
    }

    @Test
    public void testFailedRecognitionKeepsPreviousPhotoForCorrections() {
        RecognitionService service = newService(false);
        PixelImage photo = boardWithPawn();
        BoardRecognition recognized = service.recognize(photo, FULL_BOARD, OrientationPreference.AUTO);
        assertEquals(ImageHasher.hash(photo), recognized.getImageHash());

        PixelImage blank = PixelImage.filledGray(900, 500, 128);
        assertThrows(BoardNotFoundException.class, () -> service.recognize(blank, null, OrientationPreference.AUTO));
        assertSame(recognized, service.getLastRecognition());

        CorrectionRecord record = service.submitCorrection("e2", PieceType.WHITE_PAWN);
        assertEquals(recognized.getImageHash(), record.getImageHash());
        assertNotEquals(ImageHasher.hash(blank), record.getImageHash());
        assertEquals(recognized.getImageHash() + "_e2", record.getUniqueKey());
    }

    @Test
    public void testCorrectionRequiresRecognition() {
        RecognitionService service = newService(false);
        assertThrows(IllegalStateException.class, () -> service.submitCorrection("e2", PieceType.WHITE_KING));
    }

    @Test
    public void testCorrectionRetrainLoop() {
        RecognitionService service = newService(false);
        PixelImage photo = boardWithPawn();
        service.recognize(photo, FULL_BOARD, OrientationPreference.AUTO);

        CorrectionRecord record = service.submitCorrection("e2", PieceType.WHITE_KING);
        assertEquals(PieceType.WHITE_PAWN, record.getOriginalPrediction());
        assertEquals(0.55, record.getOriginalConfidence(), 1e-9);
        assertEquals(BoardOrientation.WHITE, record.getBoardOrientation());
        assertNotNull(record.getSquareImagePath());
        assertEquals(service.getSessionId(), record.getSessionId());

        assertEquals(1, service.feedbackStatistics().getActiveCorrections());
        assertEquals(1, service.feedbackSessions().size());

        RetrainReport report = service.retrainFromFeedback();
        assertTrue(report.isSuccess());
        assertEquals(1, report.getSamplesProcessed());
        assertTrue(service.modelSummary().isTrained());
        assertEquals(PieceType.WHITE_KING, service.modelSummary().getPieceTypes().get(0));

        BoardRecognition again = service.recognize(photo, FULL_BOARD, OrientationPreference.AUTO);
        assertEquals("8/8/8/8/8/8/4K3/8 w KQkq - 0 1", again.getPlacement());
        assertEquals(0.85, again.resultAt("e2").getConfidence(), 1e-9);
    }

    @Test
    public void testRetrainWithoutFeedbackFails() {
        RecognitionService service = newService(false);
        RetrainReport report = service.retrainFromFeedback();
        assertFalse(report.isSuccess());
        assertEquals(RetrainReport.FailureReason.EMPTY_DATASET, report.getReason());
    }

    @Test
    public void testClearFeedback() {
        RecognitionService service = newService(false);
        service.recognize(boardWithPawn(), FULL_BOARD, OrientationPreference.AUTO);
        service.submitCorrection("e2", PieceType.WHITE_KING);
        service.clearFeedback();
        assertEquals(0, service.feedbackStatistics().getTotalCorrections());
        assertFalse(service.retrainFromFeedback().isSuccess());
    }

    @Test
    public void testPrototypesSurviveRestart() {
        RecognitionService first = newService(true);
        first.recognize(boardWithPawn(), FULL_BOARD, OrientationPreference.AUTO);
        first.submitCorrection("e2", PieceType.WHITE_KING);
        assertTrue(first.retrainFromFeedback().isSuccess());

        RecognitionService second = newService(true);
        assertTrue(second.modelSummary().isTrained());
        assertEquals(1, second.feedbackStatistics().getTotalCorrections());

        second.resetModel();
        assertFalse(second.modelSummary().isTrained());
        assertFalse(newService(true).modelSummary().isTrained());
    }
}
