package com.gametree.core.ai;

import com.gametree.core.GameState;
import com.gametree.core.Move;
import java.util.List;
import java.util.Objects;

/**
 * Shared plumbing for the minimax family: argument checks, the empty-root convention and leaf
 * scoring.
 */
abstract class AbstractSearcher<P> implements Searcher<P> {

    private final EvaluationFunction<P> evaluation;

    AbstractSearcher(EvaluationFunction<P> evaluation) {
        this.evaluation = Objects.requireNonNull(evaluation, "evaluation");
    }

    @Override
    public final SearchResult search(GameState<P> state, int depth, SearchContext context) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(context, "context");
        if (depth < 1) {
            throw new IllegalArgumentException("Depth must be at least 1");
        }
        if (state.legalMoves().isEmpty()) {
            return new SearchResult(0.0, Move.NONE);
        }
        return searchRoot(state, depth, context);
    }

    /**
     * Searches a root that has at least one legal move.
     */
    abstract SearchResult searchRoot(GameState<P> state, int depth, SearchContext context);

    /**
     * Scores {@code state} for {@code perspective} if the node is a leaf, either because the depth
     * limit is reached or because the game is over: decided, or nothing left to play. Returns
     * {@code null} for interior nodes; {@code moves} is the node's legal move list. The root is
     * expanded even when decided so that a legal move is always chosen.
     */
    final SearchResult scoreLeaf(GameState<P> state, List<Move> moves, int depth, P perspective, boolean root,
            SearchContext context) {
        boolean terminal = moves.isEmpty() || (!root && state.isDecided());
        if (depth > 0 && !terminal) {
            return null;
        }
        context.recordEvaluation(!terminal);
        return SearchResult.leaf(evaluation.score(state, perspective));
    }
}
