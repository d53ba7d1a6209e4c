package core.impl;

import core.constants.Player;
import core.contracts.MoveGenerator;
import core.contracts.OutcomeEvaluator;
import core.records.GameState;
import core.records.Outcome;

import java.util.function.BooleanSupplier;

/**
 * Decides whether a game is over. Checks run in a fixed order and the first that applies
 * wins: a missing king, lone kings, no legal move, then the move limit.
 */
public final class OutcomeEvaluatorImpl implements OutcomeEvaluator {

    private final MoveGenerator moves;

    public OutcomeEvaluatorImpl(MoveGenerator moves) {
        this.moves = moves;
    }

    @Override
    public Outcome evaluate(GameState state) {
        return judge(state, () -> moves.legalMoves(state).isEmpty());
    }

    @Override
    public Outcome evaluate(GameState state, boolean sideToMoveHasNoMoves) {
        return judge(state, () -> sideToMoveHasNoMoves);
    }

    private static Outcome judge(GameState state, BooleanSupplier noMoves) {
        if (state.inChain()) return Outcome.ongoing();

        Player stm = state.turn();
        Player other = stm.opponent();

        if (!state.hasKing(stm)) return Outcome.win(other, Outcome.Reason.KING_CAPTURED);
        if (!state.hasKing(other)) return Outcome.win(stm, Outcome.Reason.KING_CAPTURED);

        boolean stmLone = state.count(stm) == 1;
        boolean otherLone = state.count(other) == 1;
        if (stmLone && otherLone) return Outcome.draw(Outcome.Reason.BOTH_KINGS_ONLY);
        if (stmLone) return Outcome.win(other, Outcome.Reason.LONE_KING);
        if (otherLone) return Outcome.win(stm, Outcome.Reason.LONE_KING);

        if (noMoves.getAsBoolean()) return Outcome.win(other, Outcome.Reason.STALEMATE);

        if (state.moveCount() >= state.config().moveLimit()) return Outcome.draw(Outcome.Reason.MOVE_LIMIT);

        return Outcome.ongoing();
    }
}
