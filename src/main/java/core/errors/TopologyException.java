package core.errors;

/**
 * Raised while building a board graph from a malformed topology definition.
 * A board that fails validation is never handed out, so this is fatal for the caller.
 */
public class TopologyException extends IllegalStateException {

    public TopologyException(String message) {
        super(message);
    }
}
