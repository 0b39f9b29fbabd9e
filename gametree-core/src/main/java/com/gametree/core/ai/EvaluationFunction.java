package com.gametree.core.ai;

import com.gametree.core.GameState;

/**
 * Heuristic scoring of a position from the point of view of one player.
 *
 * <p>Implementations must be side-effect free and return {@link Double#POSITIVE_INFINITY} when
 * {@code player} has won in {@code state} and {@link Double#NEGATIVE_INFINITY} when it has lost.
 *
 * @param <P> the type identifying a player
 */
@FunctionalInterface
public interface EvaluationFunction<P> {

    double score(GameState<P> state, P player);
}
