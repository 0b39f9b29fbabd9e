package com.gametree.core.ai;

import com.gametree.core.GameState;
import com.gametree.core.Move;
import java.util.List;

/**
 * Depth-limited minimax with alpha-beta pruning. Produces the same root utility as
 * {@link MinimaxSearcher}; the chosen move is threaded up through the recursion rather than
 * recovered afterwards.
 *
 * <p>{@code alpha} is the value the maximizer is already guaranteed, {@code beta} the value the
 * minimizer is already guaranteed. Both are passed by value so each branch narrows its own window.
 */
public final class AlphaBetaSearcher<P> extends AbstractSearcher<P> {

    public AlphaBetaSearcher(EvaluationFunction<P> evaluation) {
        super(evaluation);
    }

    @Override
    SearchResult searchRoot(GameState<P> state, int depth, SearchContext context) {
        return maxValue(state, depth, Double.NEGATIVE_INFINITY, Double.POSITIVE_INFINITY, true, context);
    }

    private SearchResult maxValue(GameState<P> state, int depth, double alpha, double beta, boolean root,
            SearchContext context) {
        context.checkTime();
        context.enterNode();

        List<Move> moves = state.legalMoves();
        SearchResult leaf = scoreLeaf(state, moves, depth, state.activePlayer(), root, context);
        if (leaf != null) {
            return leaf;
        }

        double best = Double.NEGATIVE_INFINITY;
        Move bestMove = Move.NONE;
        for (Move move : moves) {
            double utility = minValue(state.forecast(move), depth - 1, alpha, beta, context).utility();
            if (bestMove.isNone() || SearchResult.exceeds(utility, best)) {
                best = utility;
                bestMove = move;
            }
            if (best >= beta) {
                context.recordCutoff();
                return new SearchResult(best, bestMove);
            }
            if (best > alpha) {
                alpha = best;
            }
        }
        return new SearchResult(best, bestMove);
    }

    private SearchResult minValue(GameState<P> state, int depth, double alpha, double beta,
            SearchContext context) {
        context.checkTime();
        context.enterNode();

        List<Move> moves = state.legalMoves();
        SearchResult leaf = scoreLeaf(state, moves, depth, state.inactivePlayer(), false, context);
        if (leaf != null) {
            return leaf;
        }

        double best = Double.POSITIVE_INFINITY;
        Move bestMove = Move.NONE;
        for (Move move : moves) {
            double utility = maxValue(state.forecast(move), depth - 1, alpha, beta, false, context).utility();
            if (bestMove.isNone() || SearchResult.undercuts(utility, best)) {
                best = utility;
                bestMove = move;
            }
            if (best <= alpha) {
                context.recordCutoff();
                return new SearchResult(best, bestMove);
            }
            if (best < beta) {
                beta = best;
            }
        }
        return new SearchResult(best, bestMove);
    }
}
