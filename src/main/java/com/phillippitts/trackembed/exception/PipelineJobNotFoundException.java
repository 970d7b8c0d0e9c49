package com.phillippitts.trackembed.exception;

/**
 * Thrown when a job token is unknown, or the job was already released after its terminal
 * state was observed.
 */
public class PipelineJobNotFoundException extends TrackEmbedException {

    private final String jobToken;

    public PipelineJobNotFoundException(String jobToken) {
        super("No pipeline job for token: " + jobToken);
        this.jobToken = jobToken;
    }

    public String getJobToken() {
        return jobToken;
    }
}
