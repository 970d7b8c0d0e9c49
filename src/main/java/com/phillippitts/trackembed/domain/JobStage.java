package com.phillippitts.trackembed.domain;

/**
 * Stages of a pipeline job, in execution order, with the fixed progress percentage reported
 * for each.
 *
 * <pre>
 * PENDING → STARTED → PROCESSING → DOWNLOADING → CONVERTING → EMBEDDING → COMPLETED
 * </pre>
 * {@link #FAILED} is reachable from every non-terminal stage and is absorbing.
 */
public enum JobStage {
    PENDING(0),
    STARTED(5),
    PROCESSING(20),
    DOWNLOADING(40),
    CONVERTING(60),
    EMBEDDING(80),
    COMPLETED(100),
    FAILED(100);

    private final int progress;

    JobStage(int progress) {
        this.progress = progress;
    }

    public int progress() {
        return progress;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Whether a job may move from this stage to {@code next}: forward along the main line
     * without skipping, or to {@link #FAILED} from any non-terminal stage.
     */
    public boolean canAdvanceTo(JobStage next) {
        if (isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        // PENDING may go straight to PROCESSING when no runner marks STARTED
        if (this == PENDING && next == PROCESSING) {
            return true;
        }
        return next.ordinal() == ordinal() + 1;
    }
}
