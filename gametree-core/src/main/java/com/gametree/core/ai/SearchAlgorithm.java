package com.gametree.core.ai;

import java.util.Locale;
import java.util.Objects;

/**
 * The tree search algorithms a {@link GameAgent} can be configured with.
 */
public enum SearchAlgorithm {

    MINIMAX {
        @Override
        public <P> Searcher<P> newSearcher(EvaluationFunction<P> evaluation) {
            return new MinimaxSearcher<>(evaluation);
        }
    },
    ALPHA_BETA {
        @Override
        public <P> Searcher<P> newSearcher(EvaluationFunction<P> evaluation) {
            return new AlphaBetaSearcher<>(evaluation);
        }
    };

    public abstract <P> Searcher<P> newSearcher(EvaluationFunction<P> evaluation);

    /**
     * Parses a configuration name such as {@code minimax} or {@code alphabeta}.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SearchAlgorithm fromName(String name) {
        Objects.requireNonNull(name, "name");
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace("-", "").replace("_", "");
        switch (normalized) {
            case "minimax":
                return MINIMAX;
            case "alphabeta":
                return ALPHA_BETA;
            default:
                throw new IllegalArgumentException("Unknown search algorithm: " + name);
        }
    }
}
