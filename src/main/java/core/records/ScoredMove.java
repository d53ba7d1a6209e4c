package core.records;

/**
 * A legal move with its heuristic score; {@code order} is its index in generation order.
 */
public record ScoredMove(Move move, double score, int order) {}
