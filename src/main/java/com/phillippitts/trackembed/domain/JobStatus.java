package com.phillippitts.trackembed.domain;

import java.util.Objects;

/**
 * Point-in-time view of a job for external polling.
 *
 * @param stage    current stage
 * @param message  free-form status message
 * @param progress percentage derived from the stage
 * @param result   result payload, present only once the job completed
 */
public record JobStatus(JobStage stage, String message, int progress, JobResult result) {

    public JobStatus {
        Objects.requireNonNull(stage, "stage");
    }

    public static JobStatus of(JobStage stage, String message, JobResult result) {
        return new JobStatus(stage, message, stage.progress(), result);
    }

    public boolean isTerminal() {
        return stage.isTerminal();
    }
}
