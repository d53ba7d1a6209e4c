package core.impl;

import core.constants.Player;
import core.contracts.MoveGenerator;
import core.contracts.OutcomeEvaluator;
import core.errors.IllegalMoveException;
import core.errors.PreconditionException;
import core.records.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Table-driven move generator over a {@link BoardGraph}.
 * <p>
 * Captures are compulsory for the whole side, and a piece that has captured keeps jumping
 * while it can: the successor state carries a {@link PendingChain} and the turn does not
 * pass until the chain runs dry.
 * </p>
 */
public final class MoveGeneratorImpl implements MoveGenerator {

  private final OutcomeEvaluator outcomes;

  public MoveGeneratorImpl() {
    this.outcomes = new OutcomeEvaluatorImpl(this);
  }

  /* ── generation ─────────────────────────────────────────────── */

  @Override
  public List<Move> legalMoves(GameState state) {
    PendingChain chain = state.pendingChain().orElse(null);
    if (chain != null) {
      List<Move> legs = new ArrayList<>(4);
      addCaptures(state.board(), state::at, chain.node().id(), true, legs);
      return legs;
    }
    List<Move> caps = captures(state, state.turn());
    return caps.isEmpty() ? quietMoves(state, state.turn()) : caps;
  }

  @Override
  public List<Move> captures(GameState state, Player side) {
    BoardGraph board = state.board();
    List<Move> out = new ArrayList<>();
    for (int id = 0; id < board.size(); id++) {
      Piece p = state.at(id);
      if (p != null && p.owner() == side) addCaptures(board, state::at, id, false, out);
    }
    return out;
  }

  @Override
  public List<Move> quietMoves(GameState state, Player side) {
    BoardGraph board = state.board();
    List<Move> out = new ArrayList<>();
    for (int id = 0; id < board.size(); id++) {
      Piece p = state.at(id);
      if (p == null || p.owner() != side) continue;
      for (int to : board.forwardIds(id, side)) {
        if (state.at(to) == null) out.add(Move.quiet(board.node(id), board.node(to)));
      }
    }
    return out;
  }

  @Override
  public boolean isAttacked(GameState state, Node node, Player by) {
    Piece target = state.at(node.id());
    if (target == null || target.owner() == by) return false;
    BoardGraph board = state.board();
    for (int from : board.adjacentIds(node.id())) {
      Piece attacker = state.at(from);
      if (attacker == null || attacker.owner() != by || !attacker.canCapture(target)) continue;
      int to = board.landingId(from, node.id());
      if (to >= 0 && state.at(to) == null) return true;
    }
    return false;
  }

  /** Occupancy lookup shared by states and the scratch array of a move in progress. */
  @FunctionalInterface
  private interface Cells {
    Piece at(int id);
  }

  private static void addCaptures(BoardGraph board, Cells cells, int from, boolean chain, List<Move> out) {
    Piece attacker = cells.at(from);
    for (int over : board.adjacentIds(from)) {
      Piece target = cells.at(over);
      if (target == null || !attacker.canCapture(target)) continue;
      int to = board.landingId(from, over);
      if (to < 0 || cells.at(to) != null) continue;
      out.add(Move.capture(board.node(from), board.node(to), board.node(over), chain));
    }
  }

  private static boolean canContinue(BoardGraph board, Piece[] cells, int from) {
    List<Move> legs = new ArrayList<>(4);
    addCaptures(board, id -> cells[id], from, true, legs);
    return !legs.isEmpty();
  }

  /* ── make move ──────────────────────────────────────────────── */

  @Override
  public GameState applyMove(GameState state, Move move) {
    List<Move> legal = legalMoves(state);
    if (!state.inChain()) {
      Outcome outcome = outcomes.evaluate(state, legal.isEmpty());
      if (!outcome.isOngoing()) throw new PreconditionException("game is over: " + outcome);
    }
    if (!legal.contains(move)) {
      throw new IllegalMoveException(move, "not a legal move for " + state.turn() + " in " + state);
    }
    return play(state, move);
  }

  /** Applies a move already known to be legal. */
  private static GameState play(GameState state, Move move) {
    Piece[] cells = state.occupancy();
    int from = move.mover().id();
    int to = move.destination().id();
    Piece piece = cells[from];

    cells[from] = null;
    cells[to] = piece;
    if (move.isCapture()) {
      cells[move.captured().id()] = null;
      if (canContinue(state.board(), cells, to)) {
        return GameState.of(state.config(), cells, state.turn(), state.moveCount(),
                new PendingChain(move.destination(), piece.rank(), piece.owner()));
      }
    }
    return GameState.of(state.config(), cells, state.turn().opponent(), state.moveCount() + 1, null);
  }

  /* ── perft ──────────────────────────────────────────────────── */

  @Override
  public long perft(GameState state, int depth) {
    if (depth == 0) return 1;
    List<Move> moves = legalMoves(state);
    if (!state.inChain() && !outcomes.evaluate(state, moves.isEmpty()).isOngoing()) return 0;
    if (depth == 1) return moves.size();

    long nodes = 0;
    for (Move m : moves) {
      nodes += perft(play(state, m), depth - 1);
    }
    return nodes;
  }
}
