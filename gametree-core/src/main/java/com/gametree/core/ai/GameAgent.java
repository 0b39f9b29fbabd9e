package com.gametree.core.ai;

import com.gametree.core.GameState;
import com.gametree.core.Move;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Move-selection driver. Picks a move for the active player of a {@link GameState} before the
 * supplied {@link TimeBudget} runs out, either with a single fixed-depth search or with iterative
 * deepening.
 *
 * <p>The agent keeps nothing between calls apart from its configuration and the last
 * {@link Decision}, which is exposed for instrumentation only.
 */
public final class GameAgent<P> {

    private static final Logger LOGGER = Logger.getLogger(GameAgent.class.getName());

    private final AgentConfig<P> config;
    private final Searcher<P> searcher;

    // instrumentation only, never consulted when selecting a move
    private Decision lastDecision;

    public GameAgent(AgentConfig<P> config) {
        this.config = Objects.requireNonNull(config, "config");
        this.searcher = config.algorithm().newSearcher(config.evaluation());
    }

    /**
     * Returns the outcome of the most recent {@link #decide} call, or {@code null} before the first
     * one. Searches never read it.
     */
    public Decision getLastDecision() {
        return lastDecision;
    }

    /**
     * Returns the move to play, or {@link Move#NONE} if the active player has no legal move or no
     * search completed in time.
     */
    public Move getMove(GameState<P> state, TimeBudget budget) {
        return decide(state, budget).move();
    }

    /**
     * Selects a move and reports how it was found. Never throws {@link SearchTimeoutException}.
     */
    public Decision decide(GameState<P> state, TimeBudget budget) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(budget, "budget");

        Decision decision = selectMove(state, budget);
        lastDecision = decision;
        LOGGER.info(() -> String.format("Selected %s via %s (algorithm=%s, depth=%d, nodes=%d, timedOut=%s)",
                decision.move(), decision.source(), config.algorithm(), decision.depthCompleted(),
                decision.telemetry().totalNodes(), decision.timedOut()));
        return decision;
    }

    private Decision selectMove(GameState<P> state, TimeBudget budget) {
        List<Move> legalMoves = state.legalMoves();
        if (legalMoves.isEmpty()) {
            return Decision.noLegalMoves();
        }

        if (config.openingShortcut() && state.moveCount() == 0) {
            Move centre = Move.of(state.height() / 2, state.width() / 2);
            if (legalMoves.contains(centre)) {
                return Decision.opening(centre);
            }
        }

        if (config.iterativeDeepening()) {
            return iterativeDeepening(state, budget);
        }
        return fixedDepth(state, budget);
    }

    private Decision fixedDepth(GameState<P> state, TimeBudget budget) {
        int depth = config.depth();
        SearchContext context = newContext(budget, depth);
        long start = System.nanoTime();
        try {
            SearchResult result = searcher.search(state, depth, context);
            SearchTelemetry.Iteration iteration = SearchTelemetry.Iteration.of(context, System.nanoTime() - start,
                    result);
            return new Decision(result.move(), result.utility(), depth, false, Decision.Source.SEARCH,
                    new SearchTelemetry(List.of(iteration)));
        } catch (SearchTimeoutException ex) {
            logAbort(ex, context);
            return new Decision(Move.NONE, 0.0, 0, true, Decision.Source.SEARCH, SearchTelemetry.empty());
        }
    }

    private Decision iterativeDeepening(GameState<P> state, TimeBudget budget) {
        List<SearchTelemetry.Iteration> iterations = new ArrayList<>();
        Move bestMove = Move.NONE;
        double bestUtility = 0.0;
        int depthCompleted = 0;
        boolean timedOut = false;

        SearchContext context = null;
        try {
            for (int depth = 1; depth <= config.maxIterativeDepth(); depth++) {
                context = newContext(budget, depth);
                long start = System.nanoTime();
                SearchResult result = searcher.search(state, depth, context);
                long elapsed = System.nanoTime() - start;

                depthCompleted = depth;
                iterations.add(SearchTelemetry.Iteration.of(context, elapsed, result));
                if (result.hasMove()) {
                    bestMove = result.move();
                    bestUtility = result.utility();
                }
                logIteration(depth, result, context, elapsed);

                if (!context.isHorizonReached()) {
                    // every line ended in a terminal position, deeper searches would repeat this one
                    break;
                }
                context.checkTime();
            }
        } catch (SearchTimeoutException ex) {
            timedOut = true;
            logAbort(ex, context);
        }

        return new Decision(bestMove, bestUtility, depthCompleted, timedOut, Decision.Source.SEARCH,
                new SearchTelemetry(iterations));
    }

    private SearchContext newContext(TimeBudget budget, int depth) {
        return new SearchContext(budget, config.timeoutThresholdMillis(), depth);
    }

    private void logIteration(int depth, SearchResult result, SearchContext context, long elapsedNanos) {
        LOGGER.fine(() -> String.format("Depth %d complete: move=%s utility=%s nodes=%d cutoffs=%d (%.3f ms)",
                depth, result.move(), result.utility(), context.getVisitedNodes(), context.getCutoffs(),
                elapsedNanos / 1_000_000.0));
    }

    private void logAbort(SearchTimeoutException ex, SearchContext context) {
        long nodes = context == null ? 0L : context.getVisitedNodes();
        LOGGER.fine(() -> String.format("%s after %d nodes", ex.getMessage(), nodes));
    }
}
