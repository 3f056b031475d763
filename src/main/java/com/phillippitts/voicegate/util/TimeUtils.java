package com.phillippitts.voicegate.util;

/**
 * Elapsed-time helpers over {@link System#nanoTime()}.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Whole milliseconds, for processing times and metric samples.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds, truncated
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Fractional milliseconds, for health probe latencies that are often well below one millisecond.
     */
    public static double elapsedMillisPrecise(long startNanos) {
        return (System.nanoTime() - startNanos) / (double) NANOS_PER_MILLI;
    }
}
