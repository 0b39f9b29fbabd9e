package com.gametree.core.ai;

import com.gametree.core.Move;
import java.util.Objects;

/**
 * Outcome of a {@link GameAgent#decide} call.
 *
 * @param move the move to play, or {@link Move#NONE}
 * @param utility root utility of the deepest completed search, 0 when no search completed
 * @param depthCompleted deepest search depth that ran to completion, 0 if none did
 * @param timedOut whether the time budget cut the search short
 * @param source how the move was obtained
 * @param telemetry per-depth instrumentation
 */
public record Decision(Move move, double utility, int depthCompleted, boolean timedOut, Source source,
        SearchTelemetry telemetry) {

    public Decision {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(source, "source");
        telemetry = telemetry == null ? SearchTelemetry.empty() : telemetry;
    }

    static Decision noLegalMoves() {
        return new Decision(Move.NONE, 0.0, 0, false, Source.NO_LEGAL_MOVES, SearchTelemetry.empty());
    }

    static Decision opening(Move move) {
        return new Decision(move, 0.0, 0, false, Source.OPENING, SearchTelemetry.empty());
    }

    public enum Source {
        NO_LEGAL_MOVES,
        OPENING,
        SEARCH
    }
}
