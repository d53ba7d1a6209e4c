package core.contracts;

import core.records.GameState;
import core.records.Outcome;

public interface OutcomeEvaluator {

  /** Judges {@code state}, generating the side to move's legal moves if the verdict needs them. */
  Outcome evaluate(GameState state);

  /**
   * Judges {@code state} trusting the caller's knowledge of whether the side to move has any
   * legal move. A state with a pending chain is always ongoing.
   */
  Outcome evaluate(GameState state, boolean sideToMoveHasNoMoves);
}
