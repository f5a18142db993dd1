package com.phillippitts.plantdx.util;

/**
 * Monotonic-clock helpers for diagnosis timing.
 *
 * <p>Request deadlines, provider latencies and the processing times reported in provenance
 * are all taken from {@link System#nanoTime()}; this class turns those readings into the
 * millisecond values the domain records carry and the nanosecond budgets that
 * {@code Future.get} waits on.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
    }

    /**
     * Truncates a nanosecond duration, such as a provider call latency, to milliseconds.
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * Milliseconds spent since {@code startNanos}, used for processing times in provenance and
     * provider result metadata.
     *
     * @param startNanos reading from {@link System#nanoTime()} taken when the work began
     */
    public static long elapsedMillis(long startNanos) {
        return nanosToMillis(System.nanoTime() - startNanos);
    }

    /**
     * Absolute deadline for a request that started at {@code startNanos} and may run for
     * {@code timeoutMs}.
     */
    public static long deadlineNanos(long startNanos, long timeoutMs) {
        return startNanos + timeoutMs * NANOS_PER_MILLI;
    }

    /**
     * Budget left before a request deadline, never negative, so a late caller still polls
     * finished futures instead of blocking.
     *
     * @param deadlineNanos value from {@link #deadlineNanos(long, long)}
     */
    public static long remainingNanos(long deadlineNanos) {
        return Math.max(0L, deadlineNanos - System.nanoTime());
    }
}
