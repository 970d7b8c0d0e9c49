package com.phillippitts.trackembed.exception;

/**
 * Thrown when the vector index cannot be connected to, or its collection cannot be
 * prepared, within the retry budget. The pipeline cannot run without a working index.
 */
public class VectorIndexConnectionException extends VectorIndexException {

    private final String url;

    public VectorIndexConnectionException(String operation, String url, int attempts, Throwable cause) {
        super(operation + " (" + url + ")", attempts, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
