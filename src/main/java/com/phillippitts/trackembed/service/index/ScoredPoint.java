package com.phillippitts.trackembed.service.index;

import java.util.Map;

/**
 * A search hit.
 *
 * @param id      point id
 * @param score   similarity score
 * @param payload stored payload
 */
public record ScoredPoint(String id, double score, Map<String, Object> payload) {

    public ScoredPoint {
        payload = payload == null ? Map.of() : payload;
    }
}
