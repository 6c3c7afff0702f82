package com.phillippitts.talkback.util;

import java.time.Duration;
import java.util.Locale;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Turn timing is measured with {@link System#nanoTime()} so that latency samples
 * are monotonic and unaffected by wall-clock adjustments.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds.
     *
     * @param nanos time in nanoseconds
     * @return time in milliseconds (truncated)
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
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
     * Elapsed time since a nanosecond timestamp, never negative.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed duration
     */
    public static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(Math.max(0L, System.nanoTime() - startNanos));
    }

    /**
     * Formats a duration as seconds with millisecond precision, e.g. {@code 1.234s}.
     */
    public static String formatSeconds(Duration duration) {
        return String.format(Locale.ROOT, "%.3fs", duration.toMillis() / 1000.0);
    }
}
