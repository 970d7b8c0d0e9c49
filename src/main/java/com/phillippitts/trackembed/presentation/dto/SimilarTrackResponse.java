package com.phillippitts.trackembed.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.trackembed.domain.SimilarTrack;

import java.util.Map;

/**
 * One similarity hit.
 */
public record SimilarTrackResponse(
        @JsonProperty("track_id") String trackId,
        double score,
        Map<String, Object> metadata
) {

    public static SimilarTrackResponse from(SimilarTrack hit) {
        return new SimilarTrackResponse(hit.trackId(), hit.score(), hit.metadata());
    }
}
