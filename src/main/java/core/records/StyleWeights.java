package core.records;

/**
 * Multipliers for the features of a move score.
 *
 * @param material    material balance after the move
 * @param capture     value of the piece captured by the move
 * @param chainBonus  flat bonus for a capture that can be continued
 * @param kingSafety  safety of the mover's own king
 * @param protection  penalty for valuable own pieces left capturable
 * @param threat      captures the mover will have available next
 * @param advancement forward progress of non-king pieces
 * @param center      landing in the centre of the board
 */
public record StyleWeights(
        double material,
        double capture,
        double chainBonus,
        double kingSafety,
        double protection,
        double threat,
        double advancement,
        double center
) {
    public StyleWeights {
        if (material < 0 || capture < 0 || chainBonus < 0 || kingSafety < 0
                || protection < 0 || threat < 0 || advancement < 0 || center < 0) {
            throw new IllegalArgumentException("style weights must not be negative");
        }
    }

    /** All features off. */
    public static StyleWeights none() {
        return new StyleWeights(0, 0, 0, 0, 0, 0, 0, 0);
    }
}
