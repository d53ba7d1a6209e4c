package core.contracts;

import core.records.GameState;
import core.records.Move;
import core.records.StyleWeights;

/**
 * Heuristic judgement of a single move, from the point of view of the side that made it.
 */
public interface Evaluator {

  /**
   * @param before  position the move was played in
   * @param move    the move
   * @param after   position after the move
   * @param weights style weights to apply
   * @return higher is better for {@code before.turn()}
   */
  double score(GameState before, Move move, GameState after, StyleWeights weights);
}
