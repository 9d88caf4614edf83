package com.phillippitts.serverwarden.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed-time calculations and human readable durations.
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
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns whole minutes from {@code since} to {@code now}; {@link Long#MAX_VALUE} when
     * {@code since} is null (nothing happened yet, so any cooldown has elapsed).
     */
    public static long minutesSince(Instant since, Instant now) {
        if (since == null) {
            return Long.MAX_VALUE;
        }
        return Duration.between(since, now).toMinutes();
    }

    /**
     * Formats a minute count for notifications, e.g. {@code "1 minute"}, {@code "10 minutes"}.
     */
    public static String formatMinutes(long minutes) {
        return minutes == 1 ? "1 minute" : minutes + " minutes";
    }
}
