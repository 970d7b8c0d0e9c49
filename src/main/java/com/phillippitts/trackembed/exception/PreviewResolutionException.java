package com.phillippitts.trackembed.exception;

/**
 * Thrown when the external preview resolver cannot be reached at all.
 * Individual tracks without a preview are not an error.
 */
public class PreviewResolutionException extends TrackEmbedException {

    public PreviewResolutionException(String message) {
        super(message);
    }

    public PreviewResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
