package com.gametree.core.ai;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class TimeBudgetTest {

    @Test
    void unlimitedNeverRunsOut() {
        assertEquals(Double.POSITIVE_INFINITY, TimeBudget.unlimited().millisRemaining());
        assertEquals(Double.POSITIVE_INFINITY, TimeBudget.startingNow(Duration.ZERO).millisRemaining());
        assertEquals(Double.POSITIVE_INFINITY,
                TimeBudget.startingNow(Duration.ofSeconds(Long.MAX_VALUE)).millisRemaining());
    }

    @Test
    void countsDownFromLimit() throws InterruptedException {
        double remaining = TimeBudget.startingNow(Duration.ofMinutes(1)).millisRemaining();
        assertTrue(remaining > 0.0 && remaining <= 60_000.0);

        TimeBudget expiring = TimeBudget.startingNow(Duration.ofNanos(1));
        Thread.sleep(2);
        assertTrue(expiring.millisRemaining() < 0.0);
    }

    @Test
    void rejectsNegativeLimit() {
        assertThrows(IllegalArgumentException.class, () -> TimeBudget.startingNow(Duration.ofMillis(-1)));
        assertThrows(NullPointerException.class, () -> TimeBudget.startingNow(null));
    }

    @Test
    void contextRaisesBelowThreshold() {
        SearchContext relaxed = new SearchContext(() -> 10.0, 10.0, 4);
        relaxed.checkTime();

        SearchContext tight = new SearchContext(() -> 9.5, 10.0, 4);
        SearchTimeoutException ex = assertThrows(SearchTimeoutException.class, tight::checkTime);
        assertEquals(4, ex.getDepth());

        assertThrows(IllegalArgumentException.class, () -> new SearchContext(() -> 1.0, -1.0, 1));
    }
}
