package core.errors;

/**
 * An operation was invoked on a state it is not defined for: moving in a finished game,
 * or asking for a move when none exists.
 */
public class PreconditionException extends IllegalStateException {

    public PreconditionException(String message) {
        super(message);
    }
}
