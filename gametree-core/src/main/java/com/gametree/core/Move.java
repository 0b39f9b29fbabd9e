package com.gametree.core;

/**
 * Immutable board coordinate identifying a transition available from a {@link GameState}.
 * The special value {@link #NONE} signals that no move could be selected.
 */
public record Move(int row, int column) {

    /**
     * Sentinel returned when there is no legal move to play.
     */
    public static final Move NONE = new Move(-1, -1);

    public static Move of(int row, int column) {
        return new Move(row, column);
    }

    /**
     * Returns {@code true} if this is the {@link #NONE} sentinel.
     */
    public boolean isNone() {
        return row == -1 && column == -1;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}
