package com.phillippitts.trackembed.exception;

/**
 * Base exception for all track-embed application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TrackEmbedException extends RuntimeException {

    public TrackEmbedException(String message) {
        super(message);
    }

    public TrackEmbedException(String message, Throwable cause) {
        super(message, cause);
    }

    public TrackEmbedException(Throwable cause) {
        super(cause);
    }
}
