package com.gametree.core.ai;

import java.time.Duration;

/**
 * {@link TimeBudget} backed by a fixed {@link System#nanoTime()} deadline.
 */
final class Deadline implements TimeBudget {

    private static final double NANOS_PER_MILLI = 1_000_000.0;
    private static final Duration MAX_REPRESENTABLE = Duration.ofNanos(Long.MAX_VALUE);

    private final long deadlineNanos;

    Deadline(long startNanos, Duration limit) {
        if (limit.compareTo(MAX_REPRESENTABLE) >= 0) {
            this.deadlineNanos = Long.MAX_VALUE;
        } else {
            this.deadlineNanos = saturatingAdd(startNanos, limit.toNanos());
        }
    }

    @Override
    public double millisRemaining() {
        if (deadlineNanos == Long.MAX_VALUE) {
            return Double.POSITIVE_INFINITY;
        }
        return (deadlineNanos - System.nanoTime()) / NANOS_PER_MILLI;
    }

    private static long saturatingAdd(long a, long b) {
        long result = a + b;
        if (((a ^ result) & (b ^ result)) < 0) {
            return Long.MAX_VALUE;
        }
        return result;
    }
}
