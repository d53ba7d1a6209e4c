package core.records;

import java.util.Optional;

/**
 * One leg of play: a forward step, or a jump over {@code captured}.
 *
 * @param mover               node the moving piece starts on
 * @param destination         node it ends on
 * @param captured            node of the jumped piece, {@code null} for a quiet move
 * @param isChainContinuation {@code true} for the second and later legs of a multi-capture
 */
public record Move(Node mover, Node destination, Node captured, boolean isChainContinuation) {

    public Move {
        if (mover == null || destination == null) throw new IllegalArgumentException("move needs both ends");
        if (mover.equals(destination)) throw new IllegalArgumentException("null move at " + mover);
    }

    public static Move quiet(Node from, Node to) {
        return new Move(from, to, null, false);
    }

    public static Move capture(Node from, Node to, Node over, boolean chain) {
        return new Move(from, to, over, chain);
    }

    public Optional<Node> capturedNode() {
        return Optional.ofNullable(captured);
    }

    public boolean isCapture() {
        return captured != null;
    }

    @Override
    public String toString() {
        return mover.label() + (captured == null ? "-" : "x") + destination.label();
    }
}
