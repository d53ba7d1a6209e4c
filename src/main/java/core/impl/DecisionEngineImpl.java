package core.impl;

import core.constants.Style;
import core.contracts.DecisionEngine;
import core.contracts.Evaluator;
import core.contracts.MoveGenerator;
import core.contracts.OutcomeEvaluator;
import core.contracts.TaskPool;
import core.errors.PreconditionException;
import core.records.*;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * One-ply decision engine. Every legal move is played on a private copy of the position and
 * scored by the {@link Evaluator}; the difficulty schedule then decides between a random
 * legal move and a weighted pick among the best-ranked ones.
 * <p>
 * With a {@link TaskPool} attached, candidates are scored concurrently. Scoring only reads
 * immutable states, so the ranking is the same as the sequential one.
 * </p>
 */
public final class DecisionEngineImpl implements DecisionEngine {

    private static final Comparator<ScoredMove> BEST_FIRST =
            Comparator.comparingDouble(ScoredMove::score).reversed()
                    .thenComparingInt(ScoredMove::order);

    private final MoveGenerator moves;
    private final Evaluator evaluator;
    private final OutcomeEvaluator outcomes;
    private final Random random;
    private final TaskPool pool;     // null = score on the calling thread

    public DecisionEngineImpl(MoveGenerator moves, Evaluator evaluator, Random random) {
        this(moves, evaluator, random, null);
    }

    public DecisionEngineImpl(MoveGenerator moves, Evaluator evaluator, Random random, TaskPool pool) {
        this.moves = moves;
        this.evaluator = evaluator;
        this.outcomes = new OutcomeEvaluatorImpl(moves);
        this.random = random;
        this.pool = pool;
    }

    @Override
    public Decision decide(GameState state, NpcProfile profile) {
        List<Move> legal = playable(state);

        RandomnessSchedule schedule = profile.schedule();
        if (profile.style() == Style.RANDOM
                || (schedule.randomMoveProbability() > 0.0 && random.nextDouble() < schedule.randomMoveProbability())) {
            return new Decision(legal.get(random.nextInt(legal.size())), 0.0, true, List.of());
        }

        List<ScoredMove> ranked = score(state, legal, profile.weights());
        ScoredMove pick = pick(ranked, schedule);
        return new Decision(pick.move(), pick.score(), false, ranked);
    }

    @Override
    public List<ScoredMove> rank(GameState state, NpcProfile profile) {
        return score(state, playable(state), profile.weights());
    }

    /** Legal moves of a game that is still on; a decided position has nothing to choose. */
    private List<Move> playable(GameState state) {
        List<Move> legal = moves.legalMoves(state);
        if (legal.isEmpty()) {
            throw new PreconditionException("no legal moves for " + state.turn() + " in " + state);
        }
        Outcome outcome = outcomes.evaluate(state, false);
        if (!outcome.isOngoing()) {
            throw new PreconditionException("game is already decided (" + outcome + ") in " + state);
        }
        return legal;
    }

    /* ── scoring ────────────────────────────────────────────────── */

    private List<ScoredMove> score(GameState state, List<Move> legal, StyleWeights weights) {
        List<ScoredMove> out = new ArrayList<>(legal.size());
        if (pool == null || legal.size() < 2) {
            for (int i = 0; i < legal.size(); i++) out.add(scoreOne(state, legal.get(i), i, weights));
        } else {
            List<Future<ScoredMove>> pending = new ArrayList<>(legal.size());
            for (int i = 0; i < legal.size(); i++) {
                final int order = i;
                pending.add(pool.submit(() -> scoreOne(state, legal.get(order), order, weights)));
            }
            for (Future<ScoredMove> f : pending) out.add(await(f));
        }
        out.sort(BEST_FIRST);
        return List.copyOf(out);
    }

    private ScoredMove scoreOne(GameState state, Move move, int order, StyleWeights weights) {
        GameState after = moves.applyMove(state, move);
        return new ScoredMove(move, evaluator.score(state, move, after, weights), order);
    }

    private static ScoredMove await(Future<ScoredMove> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while scoring moves", e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new IllegalStateException("move scoring failed", e.getCause());
        }
    }

    /* ── selection ──────────────────────────────────────────────── */

    private ScoredMove pick(List<ScoredMove> ranked, RandomnessSchedule schedule) {
        int n = Math.min(schedule.topCandidates(), ranked.size());
        if (n == 1) return ranked.get(0);

        List<Integer> weights = schedule.selectionWeights();
        int total = 0;
        for (int i = 0; i < n; i++) total += weights.get(i);
        int r = random.nextInt(total);
        for (int i = 0; i < n; i++) {
            r -= weights.get(i);
            if (r < 0) return ranked.get(i);
        }
        return ranked.get(n - 1);
    }
}
