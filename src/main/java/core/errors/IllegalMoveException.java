package core.errors;

import core.records.Move;

/**
 * A move was submitted that is not among the legal moves of the state it was applied to.
 * The state is left untouched; the caller may pick another move.
 */
public class IllegalMoveException extends IllegalArgumentException {

    private final transient Move move;

    public IllegalMoveException(Move move, String message) {
        super(message + ": " + move);
        this.move = move;
    }

    /** The rejected move. */
    public Move move() {
        return move;
    }
}
