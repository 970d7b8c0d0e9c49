package com.phillippitts.trackembed.service.index;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff: up to {@code maxAttempts} attempts; the delay after failed
 * attempt {@code k} (1-based) is {@code baseDelay * 2^(k-1)}. No delay follows the last attempt.
 */
public final class RetryPolicy {

    /**
     * Blocking wait between attempts; replaced in tests to record delays without sleeping.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public static final Sleeper THREAD_SLEEPER = d -> Thread.sleep(d.toMillis());

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Sleeper sleeper;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(baseDelay, "baseDelay");
        if (baseDelay.isNegative()) {
            throw new IllegalArgumentException("baseDelay must not be negative");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay) {
        this(maxAttempts, baseDelay, THREAD_SLEEPER);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * @param failedAttempt 1-based number of the attempt that just failed
     * @return delay before the next attempt
     */
    public Duration delayAfter(int failedAttempt) {
        if (failedAttempt < 1) {
            throw new IllegalArgumentException("failedAttempt must be >= 1, got: " + failedAttempt);
        }
        return baseDelay.multipliedBy(1L << Math.min(failedAttempt - 1, 30));
    }

    public boolean hasAttemptsLeft(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }

    /**
     * Waits {@link #delayAfter(int)}.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public void backoff(int failedAttempt) throws InterruptedException {
        sleeper.sleep(delayAfter(failedAttempt));
    }
}
