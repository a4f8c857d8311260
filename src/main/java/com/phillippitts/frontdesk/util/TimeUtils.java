package com.phillippitts.frontdesk.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Provides conversions between nanoseconds and milliseconds, commonly used for
 * latency timing with {@link System#nanoTime()}, plus audio playout durations.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

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
     * Playout duration of {@code samples} samples at {@code sampleRate} Hz.
     *
     * @param samples number of audio samples
     * @param sampleRate samples per second, must be positive
     * @return duration in nanoseconds
     */
    public static long playoutNanos(long samples, int sampleRate) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        return samples * NANOS_PER_SECOND / sampleRate;
    }
}
