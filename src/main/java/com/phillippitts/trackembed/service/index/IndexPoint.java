package com.phillippitts.trackembed.service.index;

import java.util.Map;
import java.util.Objects;

/**
 * A point as stored in the index.
 *
 * @param id      point id (UUID string)
 * @param vector  vector, empty when fetched without vectors
 * @param payload scalar payload
 */
public record IndexPoint(String id, float[] vector, Map<String, Object> payload) {

    public IndexPoint {
        Objects.requireNonNull(id, "id");
        vector = vector == null ? new float[0] : vector;
        payload = payload == null ? Map.of() : payload;
    }
}
