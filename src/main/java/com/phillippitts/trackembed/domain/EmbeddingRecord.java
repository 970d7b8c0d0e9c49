package com.phillippitts.trackembed.domain;

import java.util.Map;
import java.util.Objects;

/**
 * A stored track embedding.
 *
 * @param trackId  external track id
 * @param vector   embedding, length equal to the index dimensionality (may be empty when
 *                 retrieved without vectors)
 * @param metadata scalar payload stored with the vector
 */
public record EmbeddingRecord(String trackId, float[] vector, Map<String, Object> metadata) {

    public EmbeddingRecord {
        Objects.requireNonNull(trackId, "trackId");
        vector = vector == null ? new float[0] : vector;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
