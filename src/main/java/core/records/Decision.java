package core.records;

import java.util.List;

/**
 * The outcome of one call to the decision engine.
 *
 * @param move       chosen move
 * @param score      heuristic score of the chosen move (0 if nothing was scored)
 * @param randomPick {@code true} if chance, not the ranking, chose the move
 * @param ranked     candidates best first; empty when no ranking was made
 */
public record Decision(Move move, double score, boolean randomPick, List<ScoredMove> ranked) {

    public Decision {
        ranked = List.copyOf(ranked);
    }
}
