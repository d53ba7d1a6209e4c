package core.impl;

import core.constants.Player;
import core.constants.Rank;
import core.constants.TuningParams;
import core.contracts.Evaluator;
import core.contracts.MoveGenerator;
import core.contracts.OutcomeEvaluator;
import core.records.*;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

import static core.constants.CoreConstants.*;

/**
 * One-ply move scoring. A move that ends the game scores {@link core.constants.CoreConstants#SCORE_WIN},
 * {@link core.constants.CoreConstants#SCORE_LOSS} or {@link core.constants.CoreConstants#SCORE_DRAW};
 * otherwise the score is a weighted sum of tactical and positional features of the position
 * the move leaves behind.
 */
public final class EvaluatorImpl implements Evaluator {

    private final MoveGenerator moves;
    private final OutcomeEvaluator outcomes;
    private final TuningParams tuning;

    public EvaluatorImpl(MoveGenerator moves, TuningParams tuning) {
        this(moves, new OutcomeEvaluatorImpl(moves), tuning);
    }

    public EvaluatorImpl(MoveGenerator moves, OutcomeEvaluator outcomes, TuningParams tuning) {
        this.moves = moves;
        this.outcomes = outcomes;
        this.tuning = tuning;
    }

    @Override
    public double score(GameState before, Move move, GameState after, StyleWeights w) {
        Player me = before.turn();
        Player opp = me.opponent();

        // a chain leg that takes the king wins even though the chain is still open
        if (!after.hasKing(opp)) return SCORE_WIN;

        Outcome outcome = outcomes.evaluate(after);
        switch (outcome.kind()) {
            case WIN:
                return outcome.winner() == me ? SCORE_WIN : SCORE_LOSS;
            case DRAW:
                return SCORE_DRAW;
            default:
                break;
        }

        double s = 0.0;

        /* ── tactics ─────────────────────────────────────────── */
        if (move.isCapture()) {
            Piece taken = before.at(move.captured().id());
            if (taken != null) s += w.capture() * value(taken);
            if (after.inChain()) s += w.chainBonus() + w.capture() * bestFollowUp(after);
        }
        s += w.material() * (material(after, me) - material(after, opp));
        s += w.threat() * threat(after, me);
        s -= w.protection() * exposure(after, me, opp);

        /* ── king ────────────────────────────────────────────── */
        s += w.kingSafety() * kingSafety(after, me, opp);

        /* ── positional ──────────────────────────────────────── */
        Piece mover = before.at(move.mover().id());
        if (mover != null && mover.rank() != Rank.KING) {
            s += w.advancement() * me.progress(move.mover().row2(), move.destination().row2()) / 2.0;
        }
        s += w.center() * centerBonus(after.board(), move.destination());
        return s;
    }

    static int value(Piece p) {
        return PIECE_VALUE[p.rank().ordinal()];
    }

    static int material(GameState state, Player side) {
        int sum = 0;
        for (int id = 0; id < state.board().size(); id++) {
            Piece p = state.at(id);
            if (p != null && p.owner() == side) sum += value(p);
        }
        return sum;
    }

    /** Most valuable piece the chaining piece can take on its next leg. */
    private int bestFollowUp(GameState state) {
        int best = 0;
        for (Move leg : moves.legalMoves(state)) {
            best = Math.max(best, value(state.at(leg.captured().id())));
        }
        return best;
    }

    /** Value of the distinct pieces {@code side} could capture next, scaled and capped. */
    double threat(GameState state, Player side) {
        Set<Integer> targets = new HashSet<>();
        int sum = 0;
        for (Move m : moves.captures(state, side)) {
            if (targets.add(m.captured().id())) sum += value(state.at(m.captured().id()));
        }
        return Math.min(sum * tuning.threatScaleFactor(), tuning.threatCapValue());
    }

    /** Value of {@code side}'s worthwhile pieces that {@code opp} could capture. */
    double exposure(GameState state, Player side, Player opp) {
        int sum = 0;
        for (Node n : state.board().nodes()) {
            Piece p = state.at(n.id());
            if (p == null || p.owner() != side || value(p) < PROTECTION_MIN_VALUE) continue;
            if (moves.isAttacked(state, n, opp)) sum += value(p);
        }
        return sum;
    }

    double kingSafety(GameState state, Player side, Player opp) {
        Optional<Node> king = state.kingOf(side);
        if (king.isEmpty()) return KING_MISSING_PENALTY;

        double s = 0.0;
        if (moves.isAttacked(state, king.get(), opp)) s += KING_EN_PRISE_PENALTY;

        double nearest = Double.POSITIVE_INFINITY;
        for (Node n : state.board().nodes()) {
            Piece p = state.at(n.id());
            if (p != null && p.owner() == opp) nearest = Math.min(nearest, BoardGraph.distance(king.get(), n));
        }
        if (nearest < KING_DANGER_NEAR) s += KING_NEAR_PENALTY;
        else if (nearest < KING_DANGER_MID) s += KING_MID_PENALTY;
        else if (nearest < KING_DANGER_FAR) s += KING_FAR_BONUS;
        else s += KING_SAFE_BONUS;
        return s;
    }

    static double centerBonus(BoardGraph board, Node n) {
        double s = 0.0;
        if (Math.abs(n.row2() - board.maxRow2() / 2) <= CENTER_RADIUS2) s += CENTER_BONUS;
        if (Math.abs(n.col2() - board.maxCol2() / 2) <= CENTER_RADIUS2) s += CENTER_BONUS;
        return s;
    }
}
