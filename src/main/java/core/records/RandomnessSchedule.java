package core.records;

import java.util.List;

/**
 * How a difficulty level turns a ranking into a choice.
 *
 * @param randomMoveProbability chance of ignoring the ranking and playing any legal move
 * @param topCandidates         how many of the best-ranked moves are eligible otherwise
 * @param selectionWeights      relative odds of the eligible moves, best first
 */
public record RandomnessSchedule(double randomMoveProbability, int topCandidates, List<Integer> selectionWeights) {

    public RandomnessSchedule {
        if (randomMoveProbability < 0.0 || randomMoveProbability > 1.0) {
            throw new IllegalArgumentException("random move probability outside [0,1]: " + randomMoveProbability);
        }
        if (topCandidates < 1) throw new IllegalArgumentException("topCandidates must be >= 1");
        if (selectionWeights.size() != topCandidates) {
            throw new IllegalArgumentException("need one selection weight per candidate");
        }
        for (int w : selectionWeights) {
            if (w < 1) throw new IllegalArgumentException("selection weights must be positive");
        }
        selectionWeights = List.copyOf(selectionWeights);
    }

    /** Linearly decreasing odds: top 3 gives weights 3, 2, 1. */
    public static RandomnessSchedule linear(double randomMoveProbability, int topCandidates) {
        Integer[] w = new Integer[Math.max(topCandidates, 0)];
        for (int i = 0; i < w.length; i++) w[i] = topCandidates - i;
        return new RandomnessSchedule(randomMoveProbability, topCandidates, List.of(w));
    }

    public boolean isDeterministic() {
        return randomMoveProbability == 0.0 && topCandidates == 1;
    }
}
