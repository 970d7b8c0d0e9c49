package com.phillippitts.trackembed.service.embedding;

import java.nio.file.Path;

/**
 * Per-track pipeline output persisted in the user's embeddings artifact.
 *
 * @param trackId external track id
 * @param audioFile normalized clip the embedding was computed from
 * @param embedding reduced output
 * @param shape hidden-state shape {@code [layers, time, features]} reported by the model
 */
public record EmbeddingArtifactEntry(String trackId, Path audioFile, ReducedEmbedding embedding, int[] shape) {
}
