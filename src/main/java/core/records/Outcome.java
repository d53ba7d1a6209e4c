package core.records;

import core.constants.Player;

/**
 * Result of judging a position.
 *
 * @param kind   ongoing, won or drawn
 * @param winner winning side, {@code null} unless {@code kind == WIN}
 * @param reason why the game ended, {@code null} while ongoing
 */
public record Outcome(Kind kind, Player winner, Reason reason) {

    public enum Kind { ONGOING, WIN, DRAW }

    public enum Reason {
        KING_CAPTURED("King captured"),
        LONE_KING("Only the king remains"),
        STALEMATE("No legal moves"),
        BOTH_KINGS_ONLY("Both sides reduced to their kings"),
        MOVE_LIMIT("Move limit reached");

        private final String description;

        Reason(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    private static final Outcome ONGOING = new Outcome(Kind.ONGOING, null, null);

    public Outcome {
        if ((kind == Kind.WIN) != (winner != null)) {
            throw new IllegalArgumentException("winner must be set exactly for wins");
        }
        if ((kind == Kind.ONGOING) != (reason == null)) {
            throw new IllegalArgumentException("reason must be set exactly for finished games");
        }
    }

    public static Outcome ongoing() {
        return ONGOING;
    }

    public static Outcome win(Player winner, Reason reason) {
        return new Outcome(Kind.WIN, winner, reason);
    }

    public static Outcome draw(Reason reason) {
        return new Outcome(Kind.DRAW, null, reason);
    }

    public boolean isOngoing() {
        return kind == Kind.ONGOING;
    }

    public boolean isWinFor(Player p) {
        return kind == Kind.WIN && winner == p;
    }

    @Override
    public String toString() {
        return switch (kind) {
            case ONGOING -> "ongoing";
            case WIN -> winner + " wins (" + reason.description() + ")";
            case DRAW -> "draw (" + reason.description() + ")";
        };
    }
}
