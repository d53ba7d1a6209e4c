package core.records;

import core.constants.Player;
import core.constants.Rank;

/**
 * Marks an unfinished multi-capture: the piece on {@code node} has just captured and must
 * capture again before the turn passes.
 */
public record PendingChain(Node node, Rank rank, Player owner) {

    public PendingChain {
        if (node == null || rank == null || owner == null) {
            throw new IllegalArgumentException("incomplete pending chain");
        }
    }
}
