package com.phillippitts.trackembed.service.pipeline;

import com.phillippitts.trackembed.domain.JobResult;
import com.phillippitts.trackembed.domain.JobStage;
import com.phillippitts.trackembed.domain.JobStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe state of one pipeline run for one user.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * PENDING → STARTED → PROCESSING → DOWNLOADING → CONVERTING → EMBEDDING → COMPLETED
 *     any non-terminal stage → FAILED
 * </pre>
 * Once terminal, further transitions are ignored. The worker and the timeout watchdog may race
 * on the final transition; the first one wins.
 */
public final class PipelineJob {

    private final String token;
    private final String userId;
    private final List<?> rawTracks;
    private final Instant createdAt;
    private final Clock clock;

    private final Lock lock = new ReentrantLock();
    private JobStage stage = JobStage.PENDING;
    private String message = "Pending...";
    private JobResult result;
    private Instant startedAt;
    private Instant finishedAt;
    private boolean softLimitReported;
    private Future<?> future;

    PipelineJob(String token, String userId, List<?> rawTracks, Clock clock) {
        this.token = Objects.requireNonNull(token, "token");
        this.userId = Objects.requireNonNull(userId, "userId");
        // entries may be null or malformed; they are filtered during PROCESSING
        this.rawTracks = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(rawTracks, "rawTracks")));
        this.clock = Objects.requireNonNull(clock, "clock");
        this.createdAt = clock.instant();
    }

    /**
     * Moves the job to {@code next}.
     *
     * @return {@code false} if the job is already terminal (e.g. cancelled by the watchdog)
     * @throws IllegalStateException if {@code next} would skip or revisit a stage
     */
    public boolean advance(JobStage next, String statusMessage) {
        if (next == JobStage.FAILED) {
            return fail(statusMessage);
        }
        lock.lock();
        try {
            if (stage.isTerminal()) {
                return false;
            }
            if (!stage.canAdvanceTo(next)) {
                throw new IllegalStateException("Illegal job transition " + stage + " -> " + next);
            }
            stage = next;
            message = statusMessage;
            if (next == JobStage.STARTED || (next == JobStage.PROCESSING && startedAt == null)) {
                startedAt = clock.instant();
            }
            if (next.isTerminal()) {
                finishedAt = clock.instant();
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Completes the job with its result payload.
     *
     * @return {@code false} if the job was already terminal
     */
    public boolean complete(JobResult jobResult, String statusMessage) {
        Objects.requireNonNull(jobResult, "jobResult");
        lock.lock();
        try {
            if (!advance(JobStage.COMPLETED, statusMessage)) {
                return false;
            }
            result = jobResult;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves the job to {@link JobStage#FAILED}.
     *
     * @return {@code false} if the job was already terminal
     */
    public boolean fail(String statusMessage) {
        lock.lock();
        try {
            if (stage.isTerminal()) {
                return false;
            }
            stage = JobStage.FAILED;
            message = statusMessage;
            finishedAt = clock.instant();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public JobStatus status() {
        lock.lock();
        try {
            return JobStatus.of(stage, message, result);
        } finally {
            lock.unlock();
        }
    }

    public JobStage stage() {
        lock.lock();
        try {
            return stage;
        } finally {
            lock.unlock();
        }
    }

    public boolean isTerminal() {
        return stage().isTerminal();
    }

    /**
     * @return when a worker began the job, or {@code null} while it is queued
     */
    public Instant startedAt() {
        lock.lock();
        try {
            return startedAt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return when the job reached a terminal stage, or {@code null} while it is still open
     */
    public Instant finishedAt() {
        lock.lock();
        try {
            return finishedAt;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Marks the soft time limit as reported.
     *
     * @return {@code true} only for the first call
     */
    boolean markSoftLimitReported() {
        lock.lock();
        try {
            if (softLimitReported) {
                return false;
            }
            softLimitReported = true;
            return true;
        } finally {
            lock.unlock();
        }
    }

    void attach(Future<?> runningTask) {
        lock.lock();
        try {
            this.future = runningTask;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Interrupts the worker running this job, if any.
     */
    void cancelExecution() {
        Future<?> f;
        lock.lock();
        try {
            f = future;
        } finally {
            lock.unlock();
        }
        if (f != null) {
            f.cancel(true);
        }
    }

    public String token() {
        return token;
    }

    public String userId() {
        return userId;
    }

    public List<?> rawTracks() {
        return rawTracks;
    }

    public Instant createdAt() {
        return createdAt;
    }
}
