package com.phillippitts.ellie.util;

/**
 * Elapsed-time helpers for {@link System#nanoTime()} based timing.
 *
 * @since 1.0
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds left until a deadline, never negative.
     *
     * @param deadlineNanos deadline expressed in {@link System#nanoTime()} units
     */
    public static long remainingMillis(long deadlineNanos) {
        return Math.max(0L, (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI);
    }
}
