package com.gametree.core.ai;

import com.gametree.core.Move;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Instrumentation captured during a single {@link GameAgent#decide} call, one entry per completed
 * depth.
 */
public final class SearchTelemetry {

    private static final SearchTelemetry EMPTY = new SearchTelemetry(List.of());

    private final List<Iteration> iterations;

    public SearchTelemetry(List<Iteration> iterations) {
        if (iterations == null || iterations.isEmpty()) {
            this.iterations = List.of();
        } else {
            this.iterations = Collections.unmodifiableList(new ArrayList<>(iterations));
        }
    }

    public static SearchTelemetry empty() {
        return EMPTY;
    }

    public List<Iteration> iterations() {
        return iterations;
    }

    public Iteration latest() {
        return iterations.isEmpty() ? null : iterations.get(iterations.size() - 1);
    }

    public long totalNodes() {
        return iterations.stream().mapToLong(Iteration::nodes).sum();
    }

    public long totalEvaluations() {
        return iterations.stream().mapToLong(Iteration::evaluations).sum();
    }

    public long totalCutoffs() {
        return iterations.stream().mapToLong(Iteration::cutoffs).sum();
    }

    public record Iteration(
            int depth,
            long nodes,
            long evaluations,
            long cutoffs,
            long elapsedNanos,
            Move move,
            double utility) {

        public Iteration {
            Objects.requireNonNull(move, "move");
        }

        static Iteration of(SearchContext context, long elapsedNanos, SearchResult result) {
            return new Iteration(context.getDepthLimit(), context.getVisitedNodes(), context.getEvaluations(),
                    context.getCutoffs(), elapsedNanos, result.move(), result.utility());
        }
    }
}
