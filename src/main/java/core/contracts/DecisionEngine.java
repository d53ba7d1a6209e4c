package core.contracts;

import core.records.Decision;
import core.records.GameState;
import core.records.Move;
import core.records.NpcProfile;
import core.records.ScoredMove;

import java.util.List;

/**
 * Computer opponent: picks one of the legal moves of a position under a style and difficulty.
 */
public interface DecisionEngine {

  /**
   * @throws core.errors.PreconditionException if the side to move has no legal move or the
   *         game is already decided
   */
  default Move selectMove(GameState state, NpcProfile profile) {
    return decide(state, profile).move();
  }

  /** Like {@link #selectMove} but also reports the score, ranking and whether chance decided. */
  Decision decide(GameState state, NpcProfile profile);

  /**
   * Legal moves scored with {@code profile}'s weights, best first, ties in generation order.
   *
   * @throws core.errors.PreconditionException under the same conditions as {@link #selectMove}
   */
  List<ScoredMove> rank(GameState state, NpcProfile profile);
}
