package com.phillippitts.trackembed.service.index;

/**
 * Similarity metric a collection is created with.
 */
public enum DistanceMetric {
    COSINE("Cosine");

    private final String wireName;

    DistanceMetric(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return name used by the index REST API
     */
    public String wireName() {
        return wireName;
    }
}
