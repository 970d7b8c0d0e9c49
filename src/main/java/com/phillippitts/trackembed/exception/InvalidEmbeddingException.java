package com.phillippitts.trackembed.exception;

/**
 * Thrown when an embedding vector does not have the dimensionality the index collection
 * was created with, or holds a NaN or infinite component. Raised locally, before any
 * network call.
 */
public class InvalidEmbeddingException extends TrackEmbedException {

    private final int expectedDimension;
    private final int actualDimension;

    public InvalidEmbeddingException(int expectedDimension, int actualDimension) {
        this("Embedding size must be " + expectedDimension + ", got " + actualDimension,
                expectedDimension, actualDimension);
    }

    private InvalidEmbeddingException(String message, int expectedDimension, int actualDimension) {
        super(message);
        this.expectedDimension = expectedDimension;
        this.actualDimension = actualDimension;
    }

    /**
     * A correctly sized vector with a non-finite component at {@code position}.
     */
    public static InvalidEmbeddingException nonFinite(int dimension, int position, float value) {
        return new InvalidEmbeddingException(
                "Embedding component " + position + " is not finite: " + value, dimension, dimension);
    }

    public int getExpectedDimension() {
        return expectedDimension;
    }

    public int getActualDimension() {
        return actualDimension;
    }
}
