package com.phillippitts.trackembed.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.trackembed.domain.JobResult;
import com.phillippitts.trackembed.domain.JobStatus;

/**
 * Polled job status.
 *
 * @param state    stage name
 * @param status   status message
 * @param progress percentage 0-100
 * @param result   present once the job completed
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(String state, String status, int progress, Result result) {

    /**
     * Completed-job payload.
     */
    public record Result(
            @JsonProperty("tracks_processed") int tracksProcessed,
            @JsonProperty("embeddings_generated") int embeddingsGenerated,
            @JsonProperty("embeddings_path") String embeddingsPath
    ) {}

    public static JobStatusResponse from(JobStatus status) {
        JobResult r = status.result();
        return new JobStatusResponse(
                status.stage().name(),
                status.message(),
                status.progress(),
                r == null ? null : new Result(r.tracksProcessed(), r.embeddingsGenerated(), r.artifactPath()));
    }
}
