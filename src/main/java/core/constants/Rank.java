package core.constants;

/**
 * Piece ranks in ascending order of strength. A piece may capture an opposing piece of the
 * same or a lower rank.
 */
public enum Rank {
    WARRIOR('w'),
    PRINCE('p'),
    KING('k');

    /* attacker ordinal x target ordinal */
    private static final boolean[][] CAN_CAPTURE = {
            /*             W      P      K   */
            /* WARRIOR */ {true,  false, false},
            /* PRINCE  */ {true,  true,  false},
            /* KING    */ {true,  true,  true }
    };

    private final char letter;

    Rank(char letter) {
        this.letter = letter;
    }

    public boolean canCapture(Rank target) {
        return CAN_CAPTURE[ordinal()][target.ordinal()];
    }

    /** Lower-case letter; upper case marks {@link Player#PLAYER_A} in position text. */
    public char letter() {
        return letter;
    }

    public static Rank fromLetter(char c) {
        char lc = Character.toLowerCase(c);
        for (Rank r : values()) {
            if (r.letter == lc) return r;
        }
        throw new IllegalArgumentException("Invalid piece letter: " + c);
    }
}
