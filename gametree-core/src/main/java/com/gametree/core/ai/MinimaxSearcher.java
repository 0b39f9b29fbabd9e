package com.gametree.core.ai;

import com.gametree.core.GameState;
import com.gametree.core.Move;
import java.util.List;

/**
 * Exhaustive depth-limited minimax without pruning.
 *
 * <p>Leaves below a maximizing node are scored for that node's active player; leaves below a
 * minimizing node are scored for its inactive player, i.e. the player who is maximizing one ply up.
 * Among equally good moves the first one enumerated is kept.
 */
public final class MinimaxSearcher<P> extends AbstractSearcher<P> {

    public MinimaxSearcher(EvaluationFunction<P> evaluation) {
        super(evaluation);
    }

    @Override
    SearchResult searchRoot(GameState<P> state, int depth, SearchContext context) {
        return maxValue(state, depth, true, context);
    }

    private SearchResult maxValue(GameState<P> state, int depth, boolean root, SearchContext context) {
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
            double utility = minValue(state.forecast(move), depth - 1, context).utility();
            if (bestMove.isNone() || SearchResult.exceeds(utility, best)) {
                best = utility;
                bestMove = move;
            }
        }
        return new SearchResult(best, bestMove);
    }

    private SearchResult minValue(GameState<P> state, int depth, SearchContext context) {
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
            double utility = maxValue(state.forecast(move), depth - 1, false, context).utility();
            if (bestMove.isNone() || SearchResult.undercuts(utility, best)) {
                best = utility;
                bestMove = move;
            }
        }
        return new SearchResult(best, bestMove);
    }
}
