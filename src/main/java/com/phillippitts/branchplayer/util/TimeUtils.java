package com.phillippitts.branchplayer.util;

/**
 * Conversions between the seconds-based media timeline and JVM timer units.
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one second.
     */
    public static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Seconds elapsed since a {@link System#nanoTime()} reading.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed seconds since startNanos
     */
    public static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_SECOND;
    }

    /**
     * Converts seconds to whole milliseconds, rounding to nearest. Negative input yields 0.
     */
    public static long secondsToMillis(double seconds) {
        if (!(seconds > 0)) {
            return 0L;
        }
        return Math.round(seconds * 1000.0);
    }
}
