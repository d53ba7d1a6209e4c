package core.contracts;

import core.constants.Player;
import core.records.GameState;
import core.records.Move;
import core.records.Node;

import java.util.List;

/**
 * Rules of movement: what may be played from a position, and what playing it does.
 */
public interface MoveGenerator {

  /**
   * Every legal move for the side to move, in board order. Mid-chain only further jumps of the
   * chaining piece; otherwise all captures of the side if it has any, else its forward steps.
   */
  List<Move> legalMoves(GameState state);

  /** All jumps available to {@code side}, ignoring turn and any pending chain. */
  List<Move> captures(GameState state, Player side);

  /** All forward steps available to {@code side}, ignoring turn, chain and capture duty. */
  List<Move> quietMoves(GameState state, Player side);

  /** Whether some piece of {@code by} could jump the piece on {@code node} right now. */
  boolean isAttacked(GameState state, Node node, Player by);

  /**
   * Plays {@code move} and returns the successor; {@code state} itself is never modified.
   *
   * @throws core.errors.PreconditionException if the game in {@code state} is already decided
   * @throws core.errors.IllegalMoveException  if {@code move} is not in {@link #legalMoves}
   */
  GameState applyMove(GameState state, Move move);

  /** Number of move sequences of {@code depth} legs; finished games have no successors. */
  long perft(GameState state, int depth);
}
