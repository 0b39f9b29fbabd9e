package com.gametree.core.ai;

import com.gametree.core.GameState;

/**
 * Mobility heuristic: the player's own move count minus a weighted count of the opponent's moves.
 * With the default weight of two, restricting the opponent is worth twice as much as keeping
 * options open.
 */
public final class MobilityEvaluation<P> implements EvaluationFunction<P> {

    public static final double DEFAULT_OPPONENT_WEIGHT = 2.0;

    private final double opponentWeight;

    public MobilityEvaluation() {
        this(DEFAULT_OPPONENT_WEIGHT);
    }

    public MobilityEvaluation(double opponentWeight) {
        if (!Double.isFinite(opponentWeight) || opponentWeight < 0.0) {
            throw new IllegalArgumentException("opponentWeight must be finite and non-negative");
        }
        this.opponentWeight = opponentWeight;
    }

    public static <P> MobilityEvaluation<P> create() {
        return new MobilityEvaluation<>();
    }

    @Override
    public double score(GameState<P> state, P player) {
        if (state.isLoser(player)) {
            return Double.NEGATIVE_INFINITY;
        }
        if (state.isWinner(player)) {
            return Double.POSITIVE_INFINITY;
        }
        int ownMoves = state.legalMoves(player).size();
        int opponentMoves = state.legalMoves(state.opponentOf(player)).size();
        return ownMoves - opponentWeight * opponentMoves;
    }
}
