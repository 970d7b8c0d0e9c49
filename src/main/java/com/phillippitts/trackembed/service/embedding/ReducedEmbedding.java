package com.phillippitts.trackembed.service.embedding;

/**
 * Output of {@link EmbeddingReducer}.
 *
 * @param frames one row for {@link ReductionPolicy#MEAN} and {@link ReductionPolicy#MAX},
 *               every time step for {@link ReductionPolicy#NONE}
 * @param layer resolved (non-negative) layer index the frames were taken from
 * @param policy reduction that produced the frames
 */
public record ReducedEmbedding(float[][] frames, int layer, ReductionPolicy policy) {

    public boolean isReduced() {
        return policy != ReductionPolicy.NONE;
    }

    /**
     * @return the single reduced vector
     * @throws IllegalStateException if the time axis was not reduced
     */
    public float[] vector() {
        if (!isReduced()) {
            throw new IllegalStateException("Embedding was not reduced (policy NONE); no single vector available");
        }
        return frames[0];
    }
}
