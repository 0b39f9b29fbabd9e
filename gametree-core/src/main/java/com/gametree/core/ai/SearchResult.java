package com.gametree.core.ai;

import com.gametree.core.Move;
import java.util.Objects;

/**
 * Utility of a searched node paired with the move that achieves it. Leaves carry
 * {@link Move#NONE}.
 */
public record SearchResult(double utility, Move move) {

    public SearchResult {
        Objects.requireNonNull(move, "move");
    }

    static SearchResult leaf(double utility) {
        return new SearchResult(utility, Move.NONE);
    }

    public boolean hasMove() {
        return !move.isNone();
    }

    /**
     * Returns {@code true} if {@code candidate} should replace {@code best} at a maximizing node.
     * NaN never wins against a number and always loses to one.
     */
    static boolean exceeds(double candidate, double best) {
        if (Double.isNaN(candidate)) {
            return false;
        }
        return Double.isNaN(best) || candidate > best;
    }

    /**
     * Minimizing counterpart of {@link #exceeds(double, double)}.
     */
    static boolean undercuts(double candidate, double best) {
        if (Double.isNaN(candidate)) {
            return false;
        }
        return Double.isNaN(best) || candidate < best;
    }
}
