package com.phillippitts.trackembed.exception;

/**
 * Thrown when a vector index operation still fails after the retry policy was exhausted,
 * or fails with a non-transient error.
 */
public class VectorIndexException extends TrackEmbedException {

    private final String operation;
    private final int attempts;

    public VectorIndexException(String operation, int attempts, Throwable cause) {
        super(operation + " failed after " + attempts + " attempt(s): "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.operation = operation;
        this.attempts = attempts;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }
}
