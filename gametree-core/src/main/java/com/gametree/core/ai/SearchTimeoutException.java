package com.gametree.core.ai;

/**
 * Raised inside a search once the time budget falls below the configured threshold. It unwinds
 * every frame of the depth being searched and is recovered by {@link GameAgent}, which falls back
 * to the last fully completed depth.
 */
public final class SearchTimeoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int depth;

    public SearchTimeoutException(int depth) {
        super("Time budget exhausted while searching depth " + depth, null, false, false);
        this.depth = depth;
    }

    /**
     * Returns the depth limit of the search that was aborted.
     */
    public int getDepth() {
        return depth;
    }
}
