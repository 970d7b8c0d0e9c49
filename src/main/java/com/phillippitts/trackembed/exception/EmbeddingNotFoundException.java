package com.phillippitts.trackembed.exception;

/**
 * Thrown when a track has no stored embedding to search with.
 */
public class EmbeddingNotFoundException extends TrackEmbedException {

    private final String trackId;

    public EmbeddingNotFoundException(String trackId) {
        super("No embedding stored for track: " + trackId);
        this.trackId = trackId;
    }

    public String getTrackId() {
        return trackId;
    }
}
