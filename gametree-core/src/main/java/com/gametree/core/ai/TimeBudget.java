package com.gametree.core.ai;

import java.time.Duration;
import java.util.Objects;

/**
 * Oracle reporting how much of the current turn is left. The engine polls it while searching and
 * aborts once the remaining time drops below the configured threshold.
 */
@FunctionalInterface
public interface TimeBudget {

    /**
     * Returns the milliseconds left in the current turn; negative once the turn is over.
     */
    double millisRemaining();

    static TimeBudget unlimited() {
        return () -> Double.POSITIVE_INFINITY;
    }

    /**
     * Returns a budget that expires {@code limit} after this call, measured with
     * {@link System#nanoTime()}. A zero limit means no limit at all.
     */
    static TimeBudget startingNow(Duration limit) {
        Objects.requireNonNull(limit, "limit");
        if (limit.isNegative()) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (limit.isZero()) {
            return unlimited();
        }
        return new Deadline(System.nanoTime(), limit);
    }
}
