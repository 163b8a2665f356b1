package com.phillippitts.hugdimon.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for elapsed time and idle-time calculations.
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
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns true when more than {@code ttl} has passed between {@code lastActive} and {@code now}.
     * Exactly {@code ttl} of idle time is not yet expired.
     */
    public static boolean idleLongerThan(Instant lastActive, Instant now, Duration ttl) {
        return Duration.between(lastActive, now).compareTo(ttl) > 0;
    }
}
