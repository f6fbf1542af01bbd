package com.chessvision.server.feedback;

/**
 * Raised when the feedback log or its stored images cannot be written or removed.
 */
public class FeedbackPersistenceException extends RuntimeException {

    public FeedbackPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
