package com.gametree.core.ai;

import java.util.Objects;

/**
 * Mutable bookkeeping for a single depth-limited search: the time budget polled at every node and
 * the counters reported through {@link SearchTelemetry}. A context is never reused across searches.
 */
public final class SearchContext {

    private final TimeBudget budget;
    private final double thresholdMillis;
    private final int depthLimit;

    private long visitedNodes;
    private long evaluations;
    private long cutoffs;
    private boolean horizonReached;

    public SearchContext(TimeBudget budget, double thresholdMillis, int depthLimit) {
        this.budget = Objects.requireNonNull(budget, "budget");
        if (Double.isNaN(thresholdMillis) || thresholdMillis < 0.0) {
            throw new IllegalArgumentException("thresholdMillis must be non-negative");
        }
        this.thresholdMillis = thresholdMillis;
        this.depthLimit = depthLimit;
    }

    /**
     * Context without any time pressure, mostly useful for analysis and tests.
     */
    public static SearchContext unbounded(int depthLimit) {
        return new SearchContext(TimeBudget.unlimited(), 0.0, depthLimit);
    }

    /**
     * Polls the time budget.
     *
     * @throws SearchTimeoutException if less than the threshold is left
     */
    public void checkTime() {
        if (budget.millisRemaining() < thresholdMillis) {
            throw new SearchTimeoutException(depthLimit);
        }
    }

    void enterNode() {
        visitedNodes++;
    }

    void recordEvaluation(boolean atHorizon) {
        evaluations++;
        if (atHorizon) {
            horizonReached = true;
        }
    }

    void recordCutoff() {
        cutoffs++;
    }

    public int getDepthLimit() {
        return depthLimit;
    }

    public long getVisitedNodes() {
        return visitedNodes;
    }

    public long getEvaluations() {
        return evaluations;
    }

    public long getCutoffs() {
        return cutoffs;
    }

    /**
     * Returns {@code true} if some leaf was scored only because the depth limit was reached. When
     * a completed search never hit its horizon, searching deeper cannot change the result.
     */
    public boolean isHorizonReached() {
        return horizonReached;
    }
}
