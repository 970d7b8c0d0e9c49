package com.phillippitts.trackembed.service.index;

import com.phillippitts.trackembed.config.properties.VectorIndexProperties;
import com.phillippitts.trackembed.domain.EmbeddingRecord;
import com.phillippitts.trackembed.domain.SimilarTrack;
import com.phillippitts.trackembed.exception.InvalidEmbeddingException;
import com.phillippitts.trackembed.exception.VectorIndexConnectionException;
import com.phillippitts.trackembed.exception.VectorIndexException;
import com.phillippitts.trackembed.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Fault-tolerant facade over the vector index service.
 *
 * <p>Construction connects (liveness round-trip) and ensures the collection exists; both are
 * retried under the {@link RetryPolicy} and raise {@link VectorIndexConnectionException} once
 * the attempts are exhausted.
 *
 * <p>Every later operation runs under the same policy. Only transient
 * {@link TransportFailureException.Kind kinds} are retried; after a {@code CONNECTION} failure
 * the current transport handle is discarded and a fresh one is created before the next attempt.
 * Single-item operations never raise after exhaustion: store and delete return {@code false},
 * search returns an empty list, retrieval returns empty.
 *
 * <p><b>Thread Safety:</b> one handle is live at a time; replacing it is guarded by a
 * {@link ReentrantLock} so concurrent callers never race on recreation.
 */
public class VectorIndexClient implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(VectorIndexClient.class);

    /** Payload key carrying the external track id; point ids are derived UUIDs. */
    public static final String TRACK_ID_KEY = "track_id";

    private final VectorIndexTransportFactory transportFactory;
    private final RetryPolicy retryPolicy;
    private final PipelineMetrics metrics;
    private final String collection;
    private final int dimension;
    private final String url;

    private final Lock handleLock = new ReentrantLock();
    private VectorIndexTransport transport;

    /**
     * Connects and prepares the collection.
     *
     * @throws VectorIndexConnectionException if the service stays unreachable or the collection
     *         cannot be prepared within the retry budget
     */
    public VectorIndexClient(VectorIndexTransportFactory transportFactory, RetryPolicy retryPolicy,
                             VectorIndexProperties props, PipelineMetrics metrics) {
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        Objects.requireNonNull(props, "props");
        this.collection = props.collectionName();
        this.dimension = props.dimension();
        this.url = props.url();

        connect();
        ensureCollection(props.recreateCollection());
    }

    private void connect() {
        handleLock.lock();
        try {
            transport = transportFactory.create();
        } finally {
            handleLock.unlock();
        }
        try {
            withRetry("connect", t -> {
                t.ping();
                return null;
            });
        } catch (VectorIndexException e) {
            LOG.error("Failed to connect to vector index at {} after {} attempts", url, e.getAttempts());
            throw new VectorIndexConnectionException("connect", url, e.getAttempts(), e.getCause());
        }
        LOG.info("Connected to vector index at {}", url);
    }

    /**
     * Creates the collection if it is missing. With {@code recreate} an existing collection is
     * dropped first (destructive). The list-check-act sequence is retried as a whole and is
     * idempotent: every attempt lists the collections again.
     *
     * @throws VectorIndexConnectionException if the sequence keeps failing
     */
    public void ensureCollection(boolean recreate) {
        try {
            withRetry("ensure_collection", t -> {
                List<String> existing = t.listCollections();
                boolean present = existing.contains(collection);
                if (recreate && present) {
                    LOG.warn("Dropping existing collection '{}' (recreate requested)", collection);
                    t.deleteCollection(collection);
                    present = false;
                }
                if (!present) {
                    t.createCollection(collection, dimension, DistanceMetric.COSINE);
                    LOG.info("Created collection '{}' (dimension={}, metric={})",
                            collection, dimension, DistanceMetric.COSINE.wireName());
                }
                return null;
            });
        } catch (VectorIndexException e) {
            throw new VectorIndexConnectionException("ensure_collection", url, e.getAttempts(), e.getCause());
        }
    }

    /**
     * Upserts one embedding.
     *
     * @return {@code true} once stored; {@code false} if the service kept failing
     * @throws InvalidEmbeddingException if the vector length differs from the collection dimension
     *         or a component is NaN or infinite; nothing is sent in that case
     */
    public boolean storeEmbedding(String trackId, float[] vector, Map<String, ?> metadata) {
        requireTrackId(trackId);
        requireDimension(vector);

        Map<String, Object> payload = new HashMap<>();
        if (metadata != null) {
            metadata.forEach((k, v) -> {
                if (k != null && v != null) {
                    payload.put(k, v);
                }
            });
        }
        payload.put(TRACK_ID_KEY, trackId);
        IndexPoint point = new IndexPoint(pointId(trackId), vector, payload);

        try {
            withRetry("store", t -> {
                t.upsert(collection, List.of(point));
                return null;
            });
            LOG.debug("Stored embedding for track {}", trackId);
            return true;
        } catch (VectorIndexException e) {
            LOG.error("Error storing embedding for track {}: {}", trackId, e.getMessage());
            return false;
        }
    }

    /**
     * Nearest-neighbor search.
     *
     * @return hits sorted by descending score, each at least {@code minScore}, at most
     *         {@code limit}; empty if the service kept failing
     * @throws InvalidEmbeddingException if the query length differs from the collection dimension
     *         or a component is not finite
     */
    public List<SimilarTrack> searchSimilar(float[] query, int limit, double minScore) {
        requireDimension(query);
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive, got: " + limit);
        }
        List<ScoredPoint> hits;
        try {
            hits = withRetry("search", t -> t.search(collection, query, limit, minScore));
        } catch (VectorIndexException e) {
            LOG.error("Error finding similar tracks (limit={}, minScore={}): {}", limit, minScore, e.getMessage());
            return List.of();
        }

        List<SimilarTrack> out = new ArrayList<>(hits.size());
        for (ScoredPoint hit : hits) {
            if (hit.score() < minScore) {
                continue;
            }
            Map<String, Object> meta = new HashMap<>(hit.payload());
            Object trackId = meta.remove(TRACK_ID_KEY);
            out.add(new SimilarTrack(trackId == null ? hit.id() : trackId.toString(), hit.score(), meta));
        }
        out.sort(Comparator.comparingDouble(SimilarTrack::score).reversed());
        return out.size() > limit ? List.copyOf(out.subList(0, limit)) : out;
    }

    /**
     * @return the stored embedding, or empty if absent or the service kept failing
     */
    public Optional<EmbeddingRecord> getEmbedding(String trackId) {
        requireTrackId(trackId);
        try {
            List<IndexPoint> points = withRetry("retrieve",
                    t -> t.retrieve(collection, List.of(pointId(trackId)), true));
            if (points.isEmpty()) {
                LOG.debug("No embedding found for track {}", trackId);
                return Optional.empty();
            }
            IndexPoint p = points.get(0);
            Map<String, Object> meta = new HashMap<>(p.payload());
            meta.remove(TRACK_ID_KEY);
            return Optional.of(new EmbeddingRecord(trackId, p.vector(), meta));
        } catch (VectorIndexException e) {
            LOG.error("Error retrieving embedding for track {}: {}", trackId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Existence check; vectors are not transferred.
     *
     * @return {@code false} if absent or the service kept failing
     */
    public boolean hasEmbedding(String trackId) {
        requireTrackId(trackId);
        try {
            return !withRetry("exists", t -> t.retrieve(collection, List.of(pointId(trackId)), false)).isEmpty();
        } catch (VectorIndexException e) {
            LOG.error("Error checking embedding for track {}: {}", trackId, e.getMessage());
            return false;
        }
    }

    /**
     * @return {@code true} once the delete was acknowledged; {@code false} if the service kept failing
     */
    public boolean deleteEmbedding(String trackId) {
        requireTrackId(trackId);
        try {
            withRetry("delete", t -> {
                t.delete(collection, List.of(pointId(trackId)));
                return null;
            });
            LOG.info("Deleted embedding for track {}", trackId);
            return true;
        } catch (VectorIndexException e) {
            LOG.error("Error deleting embedding for track {}: {}", trackId, e.getMessage());
            return false;
        }
    }

    /**
     * Single liveness round-trip without retries, for health checks.
     */
    public boolean isHealthy() {
        try {
            currentTransport().ping();
            return true;
        } catch (TransportFailureException e) {
            LOG.debug("Vector index health check failed: {}", e.getMessage());
            return false;
        }
    }

    public String getCollection() {
        return collection;
    }

    public int getDimension() {
        return dimension;
    }

    public String getUrl() {
        return url;
    }

    @Override
    public void close() {
        handleLock.lock();
        try {
            if (transport != null) {
                transport.close();
                transport = null;
            }
        } finally {
            handleLock.unlock();
        }
    }

    /**
     * Index point id for a track: name-based UUID of the track id.
     */
    public static String pointId(String trackId) {
        return UUID.nameUUIDFromBytes(trackId.getBytes(StandardCharsets.UTF_8)).toString();
    }

    <T> T withRetry(String operation, Function<VectorIndexTransport, T> call) {
        TransportFailureException last = null;
        int max = retryPolicy.maxAttempts();
        for (int attempt = 1; attempt <= max; attempt++) {
            VectorIndexTransport handle = currentTransport();
            try {
                return call.apply(handle);
            } catch (TransportFailureException e) {
                last = e;
                if (!e.isTransient()) {
                    throw new VectorIndexException(operation, attempt, e);
                }
                if (!retryPolicy.hasAttemptsLeft(attempt)) {
                    break;
                }
                LOG.warn("Vector index {} failed (attempt {}/{}), retrying in {} ms: {}",
                        operation, attempt, max, retryPolicy.delayAfter(attempt).toMillis(), e.getMessage());
                metrics.incrementIndexRetry(operation, e.getKind().name());
                try {
                    retryPolicy.backoff(attempt);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new VectorIndexException(operation, attempt, ie);
                }
                if (e.getKind() == TransportFailureException.Kind.CONNECTION) {
                    replaceTransport(handle);
                }
            }
        }
        LOG.error("Vector index {} failed after {} attempts", operation, max);
        throw new VectorIndexException(operation, max, last);
    }

    private VectorIndexTransport currentTransport() {
        handleLock.lock();
        try {
            if (transport == null) {
                transport = transportFactory.create();
            }
            return transport;
        } finally {
            handleLock.unlock();
        }
    }

    /**
     * Replaces {@code stale} with a fresh handle unless another caller already did.
     */
    private void replaceTransport(VectorIndexTransport stale) {
        handleLock.lock();
        try {
            if (transport == stale) {
                LOG.info("Recreating vector index connection to {}", url);
                stale.close();
                transport = transportFactory.create();
            }
        } finally {
            handleLock.unlock();
        }
    }

    private void requireDimension(float[] vector) {
        Objects.requireNonNull(vector, "vector");
        if (vector.length != dimension) {
            throw new InvalidEmbeddingException(dimension, vector.length);
        }
        for (int i = 0; i < vector.length; i++) {
            if (!Float.isFinite(vector[i])) {
                throw InvalidEmbeddingException.nonFinite(dimension, i, vector[i]);
            }
        }
    }

    private static void requireTrackId(String trackId) {
        if (trackId == null || trackId.isBlank()) {
            throw new IllegalArgumentException("trackId must not be blank");
        }
    }
}
