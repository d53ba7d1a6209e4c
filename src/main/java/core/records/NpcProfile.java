package core.records;

import core.constants.Difficulty;
import core.constants.Style;
import core.constants.TuningParams;

import java.util.Objects;

/**
 * Everything that shapes a computer opponent's choices.
 *
 * Use the nested {@link Builder}; schedule and weights default to the tuning values of the
 * chosen difficulty and style.
 */
public record NpcProfile(Style style, Difficulty difficulty, RandomnessSchedule schedule, StyleWeights weights) {

    public NpcProfile {
        Objects.requireNonNull(style, "style");
        Objects.requireNonNull(difficulty, "difficulty");
        Objects.requireNonNull(schedule, "schedule");
        Objects.requireNonNull(weights, "weights");
    }

    public static NpcProfile of(Style style, Difficulty difficulty) {
        return new Builder().style(style).difficulty(difficulty).build();
    }

    public static class Builder {
        private Style style = Style.SMART;
        private Difficulty difficulty = Difficulty.MEDIUM;
        private RandomnessSchedule schedule = null;
        private StyleWeights weights = null;
        private TuningParams tuning = null;

        public Builder style(Style style) { this.style = style; return this; }
        public Builder difficulty(Difficulty difficulty) { this.difficulty = difficulty; return this; }
        public Builder schedule(RandomnessSchedule schedule) { this.schedule = schedule; return this; }
        public Builder weights(StyleWeights weights) { this.weights = weights; return this; }
        public Builder tuning(TuningParams tuning) { this.tuning = tuning; return this; }

        public NpcProfile build() {
            TuningParams tp = (tuning != null) ? tuning : new TuningParams();
            return new NpcProfile(style, difficulty,
                    schedule != null ? schedule : tp.schedule(difficulty),
                    weights != null ? weights : tp.weights(style));
        }
    }
}
