package com.phillippitts.trackembed.service.index;

import java.util.List;

/**
 * One connection handle to the vector index service. Each method is a single round-trip
 * without retries; failures surface as {@link TransportFailureException}.
 */
public interface VectorIndexTransport extends AutoCloseable {

    /** Lightweight liveness round-trip. */
    void ping();

    List<String> listCollections();

    void createCollection(String name, int dimension, DistanceMetric metric);

    void deleteCollection(String name);

    void upsert(String collection, List<IndexPoint> points);

    /**
     * @return hits ordered by descending score, at most {@code limit}, each scoring at least
     *         {@code scoreThreshold}
     */
    List<ScoredPoint> search(String collection, float[] vector, int limit, double scoreThreshold);

    /**
     * @return the points that exist; missing ids are omitted
     */
    List<IndexPoint> retrieve(String collection, List<String> ids, boolean withVectors);

    void delete(String collection, List<String> ids);

    @Override
    void close();
}
