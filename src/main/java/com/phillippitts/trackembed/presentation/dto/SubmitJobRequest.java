package com.phillippitts.trackembed.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Job submission body. Track entries are kept as decoded JSON and normalized by the pipeline,
 * so malformed entries drop out individually instead of rejecting the request.
 *
 * @param userId owner of the saved tracks
 * @param tracks saved-track payloads (may be empty; the job then fails with a message)
 */
public record SubmitJobRequest(
        @JsonProperty("user_id") @NotBlank(message = "user_id must not be blank") String userId,
        @NotNull(message = "tracks must be present") List<Object> tracks
) {
}
