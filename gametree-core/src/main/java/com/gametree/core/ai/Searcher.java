package com.gametree.core.ai;

import com.gametree.core.GameState;

/**
 * Generic interface for depth-limited game tree search implementations.
 *
 * @param <P> the type identifying a player
 */
public interface Searcher<P> {

    /**
     * Searches {@code state} to {@code depth} plies on behalf of its active player.
     *
     * @param state the position to analyse
     * @param depth the number of plies to look ahead, at least 1
     * @param context time budget and counters for this search
     * @return the root utility and the move achieving it, or utility 0 and {@code Move.NONE} when
     *         the active player has no legal move
     * @throws SearchTimeoutException if the time budget runs out before the search completes
     */
    SearchResult search(GameState<P> state, int depth, SearchContext context);
}
