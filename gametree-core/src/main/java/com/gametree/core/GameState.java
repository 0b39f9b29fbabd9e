package com.gametree.core;

import java.util.List;

/**
 * Immutable snapshot of a two-player, zero-sum, perfect-information game.
 * The search engine only reads states and asks them for forecasts; it never mutates one.
 *
 * @param <P> the type identifying a player
 */
public interface GameState<P> {

    /**
     * Returns the moves available to the active player, in a deterministic order.
     */
    List<Move> legalMoves();

    /**
     * Returns the moves available to the provided player in this position.
     */
    List<Move> legalMoves(P player);

    /**
     * Applies the provided move and returns the resulting state. The receiver is left untouched.
     */
    GameState<P> forecast(Move move);

    /**
     * Returns the player to move.
     */
    P activePlayer();

    /**
     * Returns the player who moved last.
     */
    P inactivePlayer();

    /**
     * Returns the opponent of the provided player.
     */
    P opponentOf(P player);

    boolean isWinner(P player);

    boolean isLoser(P player);

    /**
     * Returns the number of plies played so far, zero on an empty board.
     */
    int moveCount();

    int height();

    int width();

    /**
     * Returns {@code true} if either player has already won or lost, whether or not moves are still
     * listed. A state is terminal when it is decided or the active player has no legal move.
     */
    default boolean isDecided() {
        P active = activePlayer();
        P inactive = inactivePlayer();
        return isWinner(active) || isLoser(active) || isWinner(inactive) || isLoser(inactive);
    }
}
