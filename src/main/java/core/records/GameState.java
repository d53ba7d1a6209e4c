package core.records;

import core.constants.Player;
import core.constants.Rank;
import core.impl.BoardGraph;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a game: occupancy, side to move, completed move count and an
 * unfinished capture chain, if any. Every transition produces a new instance, so states
 * can be shared freely between threads.
 */
public final class GameState {

    private final GameConfig config;
    private final BoardGraph board;
    private final Piece[] cells;          // indexed by node id, null = empty
    private final Player turn;
    private final int moveCount;
    private final PendingChain pendingChain;

    private GameState(GameConfig config, Piece[] cells, Player turn, int moveCount, PendingChain pendingChain) {
        this.config = config;
        this.board = config.topology().graph();
        this.cells = cells;
        this.turn = turn;
        this.moveCount = moveCount;
        this.pendingChain = pendingChain;
    }

    /**
     * Creates a state from a copy of {@code occupancy}.
     *
     * @param pendingChain unfinished capture chain or {@code null}; its piece must stand on its
     *                     node, belong to {@code turn} and have a capture available
     * @throws IllegalArgumentException if the pieces do not fit the board or the chain is inconsistent
     */
    public static GameState of(GameConfig config, Piece[] occupancy, Player turn, int moveCount,
                               PendingChain pendingChain) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(turn, "turn");
        BoardGraph board = config.topology().graph();
        if (occupancy.length != board.size()) {
            throw new IllegalArgumentException("occupancy has " + occupancy.length + " cells, board has " + board.size());
        }
        if (moveCount < 0) throw new IllegalArgumentException("negative move count " + moveCount);
        if (pendingChain != null) {
            Piece p = occupancy[pendingChain.node().id()];
            if (p == null || p.rank() != pendingChain.rank() || p.owner() != pendingChain.owner()) {
                throw new IllegalArgumentException("pending chain at " + pendingChain.node() + " does not match the piece there");
            }
            if (pendingChain.owner() != turn) {
                throw new IllegalArgumentException("pending chain belongs to " + pendingChain.owner() + " but " + turn + " is to move");
            }
            if (!hasCaptureFrom(board, occupancy, pendingChain.node())) {
                throw new IllegalArgumentException("pending chain at " + pendingChain.node() + " has no capture left");
            }
        }
        return new GameState(config, occupancy.clone(), turn, moveCount, pendingChain);
    }

    private static boolean hasCaptureFrom(BoardGraph board, Piece[] occupancy, Node from) {
        Piece attacker = occupancy[from.id()];
        for (Node over : board.adjacent(from)) {
            Piece target = occupancy[over.id()];
            if (target == null || !attacker.canCapture(target)) continue;
            Optional<Node> to = board.captureLanding(from, over);
            if (to.isPresent() && occupancy[to.get().id()] == null) return true;
        }
        return false;
    }

    public GameConfig config() { return config; }
    public BoardGraph board() { return board; }
    public Player turn() { return turn; }
    public int moveCount() { return moveCount; }

    public Optional<PendingChain> pendingChain() {
        return Optional.ofNullable(pendingChain);
    }

    public boolean inChain() {
        return pendingChain != null;
    }

    public Optional<Piece> pieceAt(Node node) {
        return Optional.ofNullable(cells[node.id()]);
    }

    /** Piece on node {@code id}, or {@code null}. */
    public Piece at(int id) {
        return cells[id];
    }

    /** Copy of the occupancy array. */
    public Piece[] occupancy() {
        return cells.clone();
    }

    public int count(Player owner) {
        int n = 0;
        for (Piece p : cells) if (p != null && p.owner() == owner) n++;
        return n;
    }

    public int count(Player owner, Rank rank) {
        int n = 0;
        for (Piece p : cells) if (p != null && p.owner() == owner && p.rank() == rank) n++;
        return n;
    }

    public Optional<Node> kingOf(Player owner) {
        for (int i = 0; i < cells.length; i++) {
            Piece p = cells[i];
            if (p != null && p.owner() == owner && p.rank() == Rank.KING) return Optional.of(board.node(i));
        }
        return Optional.empty();
    }

    public boolean hasKing(Player owner) {
        return count(owner, Rank.KING) > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GameState other)) return false;
        return moveCount == other.moveCount
                && turn == other.turn
                && config.equals(other.config)
                && Objects.equals(pendingChain, other.pendingChain)
                && Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Objects.hash(config, turn, moveCount, pendingChain) * 31 + Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "GameState{" + turn + " to move, move " + moveCount
                + (pendingChain != null ? ", chain at " + pendingChain.node() : "") + "}";
    }
}
