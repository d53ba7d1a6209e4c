package core.records;

import core.constants.Player;
import core.constants.Rank;

/**
 * A piece on the board. Instances are interned, so {@code ==} and {@code equals} agree.
 */
public record Piece(Rank rank, Player owner) {

    private static final Piece[][] CACHE = new Piece[Player.values().length][Rank.values().length];

    static {
        for (Player p : Player.values()) {
            for (Rank r : Rank.values()) {
                CACHE[p.ordinal()][r.ordinal()] = new Piece(r, p);
            }
        }
    }

    public static Piece of(Rank rank, Player owner) {
        return CACHE[owner.ordinal()][rank.ordinal()];
    }

    /** Parses a position-text letter: upper case for {@link Player#PLAYER_A}, lower case for B. */
    public static Piece fromSymbol(char c) {
        Player owner = Character.isUpperCase(c) ? Player.PLAYER_A : Player.PLAYER_B;
        return of(Rank.fromLetter(c), owner);
    }

    public char symbol() {
        char c = rank.letter();
        return owner == Player.PLAYER_A ? Character.toUpperCase(c) : c;
    }

    /** Whether this piece may jump {@code target}: opposing side and no higher rank. */
    public boolean canCapture(Piece target) {
        return owner != target.owner && rank.canCapture(target.rank);
    }
}
