package com.phillippitts.trackembed.service.embedding;

import com.phillippitts.trackembed.exception.EmbeddingModelException;

import java.nio.file.Path;

/**
 * Audio embedding model: turns one normalized clip into layer-wise hidden states.
 *
 * <p>One instance is created at startup and shared by all concurrent jobs. Implementations
 * must be safe for concurrent {@link #infer(Path)} calls and must not mutate shared state per call.
 */
public interface EmbeddingModel {

    /**
     * Runs inference on a normalized clip.
     *
     * @param normalizedWav mono clip at the model sample rate
     * @return hidden states shaped {@code layers x time x features}
     * @throws EmbeddingModelException if inference fails for this clip
     */
    HiddenStates infer(Path normalizedWav);

    /**
     * @return model identifier for logs and artifacts
     */
    String name();
}
