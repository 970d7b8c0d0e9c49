package com.phillippitts.trackembed.domain;

import java.util.Map;

/**
 * One nearest-neighbor hit from the vector index.
 *
 * @param trackId  external track id
 * @param score    cosine similarity
 * @param metadata stored payload (without the track id)
 */
public record SimilarTrack(String trackId, double score, Map<String, Object> metadata) {

    public SimilarTrack {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
