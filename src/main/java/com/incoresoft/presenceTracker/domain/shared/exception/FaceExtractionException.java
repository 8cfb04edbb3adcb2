package com.incoresoft.presenceTracker.domain.shared.exception;

/**
 * The detector could not produce a usable feature vector.
 */
public class FaceExtractionException extends RuntimeException {
    public FaceExtractionException(String message) {
        super(message);
    }

    public FaceExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
