package com.phillippitts.trackembed.presentation.controller;

import com.phillippitts.trackembed.domain.EmbeddingRecord;
import com.phillippitts.trackembed.domain.SimilarTrack;
import com.phillippitts.trackembed.exception.EmbeddingNotFoundException;
import com.phillippitts.trackembed.presentation.dto.SimilarTrackResponse;
import com.phillippitts.trackembed.service.index.VectorIndexClient;
import com.phillippitts.trackembed.service.index.VectorIndexClientProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lookups against stored track embeddings.
 */
@RestController
@RequestMapping("/api/tracks/{trackId}")
class SimilarityController {

    static final int MAX_LIMIT = 100;

    private final VectorIndexClientProvider indexClient;

    SimilarityController(VectorIndexClientProvider indexClient) {
        this.indexClient = indexClient;
    }

    /**
     * Tracks most similar to {@code trackId}, excluding the track itself.
     */
    @GetMapping("/similar")
    ResponseEntity<List<SimilarTrackResponse>> similar(@PathVariable String trackId,
                                                       @RequestParam(defaultValue = "10") int limit,
                                                       @RequestParam(defaultValue = "0.7") double minScore) {
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        if (minScore < -1.0 || minScore > 1.0) {
            throw new IllegalArgumentException("minScore must be between -1 and 1");
        }
        VectorIndexClient client = indexClient.get();
        EmbeddingRecord record = client.getEmbedding(trackId)
                .orElseThrow(() -> new EmbeddingNotFoundException(trackId));

        // one extra hit because the track itself is normally the best match
        List<SimilarTrackResponse> out = new ArrayList<>();
        for (SimilarTrack hit : client.searchSimilar(record.vector(), limit + 1, minScore)) {
            if (!hit.trackId().equals(trackId) && out.size() < limit) {
                out.add(SimilarTrackResponse.from(hit));
            }
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/embedding")
    ResponseEntity<Map<String, Object>> exists(@PathVariable String trackId) {
        return ResponseEntity.ok(Map.of(
                "track_id", trackId,
                "exists", indexClient.get().hasEmbedding(trackId)));
    }

    @DeleteMapping("/embedding")
    ResponseEntity<Map<String, Object>> delete(@PathVariable String trackId) {
        boolean deleted = indexClient.get().deleteEmbedding(trackId);
        return ResponseEntity.status(deleted ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE)
                .body(Map.of("track_id", trackId, "deleted", deleted));
    }
}
