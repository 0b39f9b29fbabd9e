package com.gametree.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Hand-written game tree. Every node carries a value, expressed for the player who moves at the
 * root, that the test evaluation returns when the node is scored. The moves out of a node with
 * children {@code c0, c1, ...} are {@code (ply, 0), (ply, 1), ...}.
 */
public final class ScriptedGameState implements GameState<Side> {

    private final Node node;
    private final Side rootPlayer;
    private final Side active;
    private final int ply;
    private final int moveCount;
    private final Side winner;

    private ScriptedGameState(Node node, Side rootPlayer, Side active, int ply, int moveCount, Side winner) {
        this.node = node;
        this.rootPlayer = rootPlayer;
        this.active = active;
        this.ply = ply;
        this.moveCount = moveCount;
        this.winner = winner;
    }

    /**
     * Root state with {@link Side#FIRST} to move, one ply already played.
     */
    public static ScriptedGameState root(Node node) {
        return new ScriptedGameState(node, Side.FIRST, Side.FIRST, 0, 1, null);
    }

    public static Node leaf(double value) {
        return new Node(value, List.of(), null);
    }

    public static Node node(double value, Node... children) {
        return new Node(value, List.of(children), null);
    }

    /**
     * Node where {@code winner} has already won although {@code children} are still listed as moves.
     */
    public static Node decided(Side winner, Node... children) {
        return new Node(0.0, List.of(children), winner);
    }

    public static Node node(Node... children) {
        return node(0.0, children);
    }

    /**
     * Marks the whole game as already decided in favour of {@code winner}.
     */
    public ScriptedGameState withWinner(Side winner) {
        return new ScriptedGameState(node, rootPlayer, active, ply, moveCount, winner);
    }

    /**
     * Returns the node value for {@code player}; the opponent of the root player sees it negated.
     */
    public double valueFor(Side player) {
        return player == rootPlayer ? node.value() : -node.value();
    }

    /**
     * Evaluation for scripted trees: decisive sentinels for decided games, otherwise the node value.
     */
    public static double score(GameState<Side> state, Side player) {
        if (state.isLoser(player)) {
            return Double.NEGATIVE_INFINITY;
        }
        if (state.isWinner(player)) {
            return Double.POSITIVE_INFINITY;
        }
        return ((ScriptedGameState) state).valueFor(player);
    }

    @Override
    public List<Move> legalMoves() {
        List<Move> moves = new ArrayList<>(node.children().size());
        for (int i = 0; i < node.children().size(); i++) {
            moves.add(Move.of(ply, i));
        }
        return Collections.unmodifiableList(moves);
    }

    @Override
    public List<Move> legalMoves(Side player) {
        return player == active ? legalMoves() : List.of();
    }

    @Override
    public ScriptedGameState forecast(Move move) {
        Objects.requireNonNull(move, "move");
        if (move.row() != ply || move.column() < 0 || move.column() >= node.children().size()) {
            throw new IllegalArgumentException("Illegal move " + move + " at ply " + ply);
        }
        return new ScriptedGameState(node.children().get(move.column()), rootPlayer, active.opponent(), ply + 1,
                moveCount + 1, winner);
    }

    @Override
    public Side activePlayer() {
        return active;
    }

    @Override
    public Side inactivePlayer() {
        return active.opponent();
    }

    @Override
    public Side opponentOf(Side player) {
        return player.opponent();
    }

    @Override
    public boolean isWinner(Side player) {
        Side decidedFor = decidedFor();
        return decidedFor != null && decidedFor == player;
    }

    @Override
    public boolean isLoser(Side player) {
        Side decidedFor = decidedFor();
        return decidedFor != null && decidedFor != player;
    }

    private Side decidedFor() {
        return winner != null ? winner : node.winner();
    }

    @Override
    public int moveCount() {
        return moveCount;
    }

    @Override
    public int height() {
        return 3;
    }

    @Override
    public int width() {
        return 3;
    }

    public record Node(double value, List<Node> children, Side winner) {
    }
}
