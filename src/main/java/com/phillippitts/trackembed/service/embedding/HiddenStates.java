package com.phillippitts.trackembed.service.embedding;

import java.util.Objects;

/**
 * Layer-wise hidden-state output of the embedding model for one clip,
 * shaped {@code layers x timeSteps x featureWidth}.
 *
 * <p>Instances are read-only after construction; the backing array is not copied, so callers
 * must not mutate it once handed over.
 */
public final class HiddenStates {

    private final float[][][] values;
    private final int timeSteps;
    private final int featureWidth;

    public HiddenStates(float[][][] values) {
        Objects.requireNonNull(values, "values");
        if (values.length == 0) {
            throw new IllegalArgumentException("Hidden states must contain at least one layer");
        }
        this.timeSteps = values[0].length;
        this.featureWidth = timeSteps == 0 ? 0 : values[0][0].length;
        for (int l = 0; l < values.length; l++) {
            if (values[l].length != timeSteps) {
                throw new IllegalArgumentException("Layer " + l + " has " + values[l].length
                        + " time steps, expected " + timeSteps);
            }
            for (float[] frame : values[l]) {
                if (frame.length != featureWidth) {
                    throw new IllegalArgumentException("Layer " + l + " has a frame of width " + frame.length
                            + ", expected " + featureWidth);
                }
            }
        }
        this.values = values;
    }

    public int layers() {
        return values.length;
    }

    public int timeSteps() {
        return timeSteps;
    }

    public int featureWidth() {
        return featureWidth;
    }

    /**
     * Returns one layer. Negative indices count from the end, so {@code -1} is the last layer.
     *
     * @throws IllegalArgumentException if the index is out of range
     */
    public float[][] layer(int index) {
        return values[resolveLayer(index)];
    }

    int resolveLayer(int index) {
        int resolved = index < 0 ? values.length + index : index;
        if (resolved < 0 || resolved >= values.length) {
            throw new IllegalArgumentException("Layer " + index + " out of range for " + values.length + " layers");
        }
        return resolved;
    }

    /**
     * @return shape as {@code [layers, timeSteps, featureWidth]}
     */
    public int[] shape() {
        return new int[] {values.length, timeSteps, featureWidth};
    }
}
