package com.phillippitts.trackembed.service.embedding;

import java.util.Arrays;
import java.util.Objects;

/**
 * Selects one hidden-state layer and collapses its time axis into a fixed-length vector.
 *
 * <p>Pure computation: no I/O, no shared state, and identical input always yields an
 * identical result. Means are accumulated in double precision.
 */
public class EmbeddingReducer {

    /**
     * Reduces the given layer of {@code states}.
     *
     * @param states model output for one clip
     * @param layer layer index; negative counts from the last layer
     * @param policy time-axis reduction
     * @return reduced frames
     * @throws IllegalArgumentException if the layer is out of range, or the policy reduces a
     *         layer without time steps
     */
    public ReducedEmbedding reduce(HiddenStates states, int layer, ReductionPolicy policy) {
        Objects.requireNonNull(states, "states");
        Objects.requireNonNull(policy, "policy");
        int resolved = states.resolveLayer(layer);
        float[][] frames = states.layer(resolved);

        if (policy == ReductionPolicy.NONE) {
            float[][] copy = new float[frames.length][];
            for (int t = 0; t < frames.length; t++) {
                copy[t] = frames[t].clone();
            }
            return new ReducedEmbedding(copy, resolved, policy);
        }
        if (frames.length == 0) {
            throw new IllegalArgumentException("Cannot reduce a layer with no time steps");
        }
        float[] vector = policy == ReductionPolicy.MEAN ? mean(frames) : max(frames);
        return new ReducedEmbedding(new float[][] {vector}, resolved, policy);
    }

    /**
     * Reduces with {@link ReductionPolicy#MEAN} over the last layer.
     */
    public float[] reduce(HiddenStates states) {
        return reduce(states, -1, ReductionPolicy.MEAN).vector();
    }

    private static float[] mean(float[][] frames) {
        int width = frames[0].length;
        double[] sum = new double[width];
        for (float[] frame : frames) {
            for (int i = 0; i < width; i++) {
                sum[i] += frame[i];
            }
        }
        float[] out = new float[width];
        for (int i = 0; i < width; i++) {
            out[i] = (float) (sum[i] / frames.length);
        }
        return out;
    }

    private static float[] max(float[][] frames) {
        float[] out = Arrays.copyOf(frames[0], frames[0].length);
        for (int t = 1; t < frames.length; t++) {
            float[] frame = frames[t];
            for (int i = 0; i < out.length; i++) {
                if (frame[i] > out[i]) {
                    out[i] = frame[i];
                }
            }
        }
        return out;
    }
}
