package com.chessvision.server.controller;

import com.chessvision.server.config.VisionConfig;
import com.chessvision.server.service.BoardNotFoundException;
import com.chessvision.server.service.RecognitionService;
import com.chessvision.server.vision.PixelImage;
import com.chessvision.server.vision.SyntheticImages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.ResponseEntity;

import javax.imageio.ImageIO;
import java.io.ByteArrayOutputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Base64;

import static org.junit.jupiter.api.Assertions.*;

public class RecognitionControllerTest {

    @TempDir
    Path tempDir;

    private RecognitionController controller;

    @BeforeEach
    public void setup() {
        VisionConfig config = new VisionConfig().withDefaults();
        config.prototypes.persist = false;
        controller = new RecognitionController(new RecognitionService(config, tempDir, Clock.systemDefaultZone()));
    }

    private static String toBase64Png(PixelImage image) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image.toBufferedImage(), "png", out);
        return Base64.getEncoder().encodeToString(out.toByteArray());
    }

    private RecognitionController.RecognizeRequest boardRequest() throws Exception {
        PixelImage photo = SyntheticImages.paste(SyntheticImages.board(100, 220, 90),
                SyntheticImages.pieceSquare(100, 230, 20), 6, 4);
        RecognitionController.RecognizeRequest request = new RecognitionController.RecognizeRequest();
        request.image = "data:image/png;base64," + toBase64Png(photo);
        request.region = new RecognitionController.RegionRequest();
        request.region.width = 800;
        request.region.height = 800;
        request.orientation = "white";
        return request;
    }

    @Test
    public void testDecodeBase64StripsDataUrl() {
        assertArrayEquals(new byte[] { 0, 1, 2 }, RecognitionController.decodeBase64("data:image/png;base64,AAEC"));
        assertArrayEquals(new byte[] { 0, 1, 2 }, RecognitionController.decodeBase64("AAEC"));
    }

    @Test
    public void testRecognizeReturnsBoard() throws Exception {
        ResponseEntity<?> response = controller.recognize(boardRequest());
        assertEquals(200, response.getStatusCode().value());

        RecognitionController.RecognizeResponse body = (RecognitionController.RecognizeResponse) response.getBody();
        assertNotNull(body);
        assertEquals("8/8/8/8/8/8/4P3/8 w KQkq - 0 1", body.placement);
        assertEquals("MANUAL", body.orientationSource);
        assertEquals(8, body.board.size());
        assertEquals("a8", body.board.get(0).get(0).square);
        assertEquals("e2", body.board.get(6).get(4).square);
        assertEquals("WHITE_PAWN", body.board.get(6).get(4).piece);
        assertEquals('P', body.board.get(6).get(4).symbol);
    }

    @Test
    public void testCorrectionAfterRecognition() throws Exception {
        controller.recognize(boardRequest());
        RecognitionController.CorrectionRequest correction = new RecognitionController.CorrectionRequest();
        correction.square = "e2";
        correction.piece = "white_king";
        assertEquals(200, controller.correct(correction).getStatusCode().value());
        assertEquals(200, controller.feedbackStats().getStatusCode().value());
        assertEquals(200, controller.retrain().getStatusCode().value());
        assertEquals(204, controller.clearFeedback().getStatusCode().value());
    }

    @Test
    public void testBadRequests() {
        RecognitionController.RecognizeRequest empty = new RecognitionController.RecognizeRequest();
        assertEquals(400, controller.recognize(empty).getStatusCode().value());

        RecognitionController.RecognizeRequest garbage = new RecognitionController.RecognizeRequest();
        garbage.image = "AAEC";
        assertEquals(400, controller.recognize(garbage).getStatusCode().value());

        assertEquals(400, controller.correct(new RecognitionController.CorrectionRequest()).getStatusCode().value());
    }

    @Test
    public void testExceptionMapping() {
        assertEquals(422, controller.handleBoardNotFound(new BoardNotFoundException("none")).getStatusCode().value());
        assertEquals(400, controller.handleBadArgument(new IllegalArgumentException("bad")).getStatusCode().value());
        assertEquals(409, controller.handleBadState(new IllegalStateException("early")).getStatusCode().value());
    }
}
