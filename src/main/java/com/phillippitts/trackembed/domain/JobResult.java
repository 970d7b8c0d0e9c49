package com.phillippitts.trackembed.domain;

/**
 * Result payload of a completed job.
 *
 * @param tracksProcessed     tracks that entered the pipeline
 * @param embeddingsGenerated vectors produced and stored; never more than {@code tracksProcessed}
 * @param artifactPath        location of the persisted embeddings artifact
 */
public record JobResult(int tracksProcessed, int embeddingsGenerated, String artifactPath) {

    public JobResult {
        if (tracksProcessed < 0 || embeddingsGenerated < 0) {
            throw new IllegalArgumentException("Counts must not be negative");
        }
        if (embeddingsGenerated > tracksProcessed) {
            throw new IllegalArgumentException("embeddingsGenerated (" + embeddingsGenerated
                    + ") exceeds tracksProcessed (" + tracksProcessed + ")");
        }
    }
}
