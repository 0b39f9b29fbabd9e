package com.gametree.core.ai;

import java.util.Locale;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable configuration of a {@link GameAgent}. Invalid values are rejected here so that a
 * misconfigured agent fails at construction rather than in the middle of a game.
 *
 * @param depth search depth in plies used when iterative deepening is disabled
 * @param algorithm tree search algorithm
 * @param iterativeDeepening whether to search depth 1, 2, 3, ... until time runs short
 * @param evaluation heuristic used at the leaves
 * @param timeoutThresholdMillis remaining time below which a search is abandoned
 * @param openingShortcut whether to answer an empty board with its centre cell without searching
 * @param maxIterativeDepth deepest iteration attempted when iterative deepening is enabled
 */
public record AgentConfig<P>(
        int depth,
        SearchAlgorithm algorithm,
        boolean iterativeDeepening,
        EvaluationFunction<P> evaluation,
        double timeoutThresholdMillis,
        boolean openingShortcut,
        int maxIterativeDepth) {

    public static final int DEFAULT_DEPTH = 3;
    public static final double DEFAULT_TIMEOUT_THRESHOLD_MILLIS = 10.0;

    static final String DEPTH_KEY = "search.depth";
    static final String ALGORITHM_KEY = "search.algorithm";
    static final String ITERATIVE_KEY = "search.iterative";
    static final String THRESHOLD_KEY = "search.timeoutThresholdMillis";
    static final String OPENING_KEY = "search.openingShortcut";
    static final String MAX_ITERATIVE_DEPTH_KEY = "search.maxIterativeDepth";

    public AgentConfig {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(evaluation, "evaluation");
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1");
        }
        if (maxIterativeDepth < 1) {
            throw new IllegalArgumentException("maxIterativeDepth must be at least 1");
        }
        if (!Double.isFinite(timeoutThresholdMillis) || timeoutThresholdMillis < 0.0) {
            throw new IllegalArgumentException("timeoutThresholdMillis must be finite and non-negative");
        }
    }

    /**
     * Depth 3 minimax with iterative deepening, a 10 ms safety margin and the opening shortcut.
     */
    public static <P> AgentConfig<P> defaults(EvaluationFunction<P> evaluation) {
        return new AgentConfig<>(DEFAULT_DEPTH, SearchAlgorithm.MINIMAX, true, evaluation,
                DEFAULT_TIMEOUT_THRESHOLD_MILLIS, true, Integer.MAX_VALUE);
    }

    /**
     * Reads a configuration from {@code search.*} properties, using {@link #defaults} for absent
     * keys.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static <P> AgentConfig<P> fromProperties(Properties properties, EvaluationFunction<P> evaluation) {
        Objects.requireNonNull(properties, "properties");
        AgentConfig<P> defaults = defaults(evaluation);

        String algorithmName = properties.getProperty(ALGORITHM_KEY);
        SearchAlgorithm algorithm = algorithmName == null
                ? defaults.algorithm()
                : SearchAlgorithm.fromName(algorithmName);

        return new AgentConfig<>(
                parseInt(properties, DEPTH_KEY, defaults.depth()),
                algorithm,
                parseBoolean(properties, ITERATIVE_KEY, defaults.iterativeDeepening()),
                evaluation,
                parseDouble(properties, THRESHOLD_KEY, defaults.timeoutThresholdMillis()),
                parseBoolean(properties, OPENING_KEY, defaults.openingShortcut()),
                parseInt(properties, MAX_ITERATIVE_DEPTH_KEY, defaults.maxIterativeDepth()));
    }

    public AgentConfig<P> withDepth(int depth) {
        return new AgentConfig<>(depth, algorithm, iterativeDeepening, evaluation, timeoutThresholdMillis,
                openingShortcut, maxIterativeDepth);
    }

    public AgentConfig<P> withAlgorithm(SearchAlgorithm algorithm) {
        return new AgentConfig<>(depth, algorithm, iterativeDeepening, evaluation, timeoutThresholdMillis,
                openingShortcut, maxIterativeDepth);
    }

    public AgentConfig<P> withIterativeDeepening(boolean iterativeDeepening) {
        return new AgentConfig<>(depth, algorithm, iterativeDeepening, evaluation, timeoutThresholdMillis,
                openingShortcut, maxIterativeDepth);
    }

    public AgentConfig<P> withTimeoutThresholdMillis(double timeoutThresholdMillis) {
        return new AgentConfig<>(depth, algorithm, iterativeDeepening, evaluation, timeoutThresholdMillis,
                openingShortcut, maxIterativeDepth);
    }

    public AgentConfig<P> withOpeningShortcut(boolean openingShortcut) {
        return new AgentConfig<>(depth, algorithm, iterativeDeepening, evaluation, timeoutThresholdMillis,
                openingShortcut, maxIterativeDepth);
    }

    public AgentConfig<P> withMaxIterativeDepth(int maxIterativeDepth) {
        return new AgentConfig<>(depth, algorithm, iterativeDeepening, evaluation, timeoutThresholdMillis,
                openingShortcut, maxIterativeDepth);
    }

    private static int parseInt(Properties properties, String key, int fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, ex);
        }
    }

    private static double parseDouble(Properties properties, String key, double fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for " + key + ": " + value, ex);
        }
    }

    private static boolean parseBoolean(Properties properties, String key, boolean fallback) {
        String value = properties.getProperty(key);
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + value);
    }
}
