package com.phillippitts.trackembed.service.embedding;

/**
 * How the time axis of one hidden-state layer is collapsed.
 */
public enum ReductionPolicy {
    /** Elementwise average across time steps. */
    MEAN,
    /** Elementwise maximum across time steps. */
    MAX,
    /** No reduction; the caller receives every time step. */
    NONE
}
