package com.phillippitts.trackembed.util;

import java.time.Duration;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} measurements and readable durations in
 * log messages.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos value of {@link System#nanoTime()} taken at the start
     * @return whole milliseconds since {@code startNanos}
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Formats a duration for logs: {@code 850ms}, {@code 42s}, {@code 26m 5s}.
     */
    public static String describe(Duration duration) {
        if (duration.isNegative()) {
            duration = Duration.ZERO;
        }
        if (duration.compareTo(Duration.ofSeconds(1)) < 0) {
            return duration.toMillis() + "ms";
        }
        long minutes = duration.toMinutes();
        int seconds = duration.toSecondsPart();
        return minutes == 0 ? seconds + "s" : minutes + "m " + seconds + "s";
    }
}
