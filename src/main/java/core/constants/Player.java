package core.constants;

/**
 * The two sides. {@link #PLAYER_A} starts at the bottom of the board (high rows) and moves
 * first; {@link #PLAYER_B} starts at the top.
 */
public enum Player {
    PLAYER_A('a', -1),
    PLAYER_B('b', +1);

    private final char symbol;
    private final int forwardStep;   // sign of the row delta of a forward move

    Player(char symbol, int forwardStep) {
        this.symbol = symbol;
        this.forwardStep = forwardStep;
    }

    public Player opponent() {
        return this == PLAYER_A ? PLAYER_B : PLAYER_A;
    }

    /** {@code true} if going from {@code fromRow2} to {@code toRow2} is a step forward for this side. */
    public boolean isForward(int fromRow2, int toRow2) {
        return Integer.signum(toRow2 - fromRow2) == forwardStep;
    }

    /** Signed number of half rows advanced from {@code fromRow2} to {@code toRow2}. */
    public int progress(int fromRow2, int toRow2) {
        return (toRow2 - fromRow2) * forwardStep;
    }

    /** Side-to-move letter used by the position text format. */
    public char symbol() {
        return symbol;
    }

    public static Player fromSymbol(char c) {
        for (Player p : values()) {
            if (p.symbol == c) return p;
        }
        throw new IllegalArgumentException("Invalid side to move: " + c);
    }
}
