// File: Main.java
package main;

import core.constants.Player;
import core.constants.TuningParams;
import core.contracts.*;
import core.impl.*;
import core.records.*;

import java.util.Random;

/**
 * Developer entry point.
 * <ul>
 *   <li>{@code bench [depth]} counts perft nodes from the start position and reports speed;</li>
 *   <li>{@code selfplay [Name=Value ...]} plays one computer-vs-computer game, options as in
 *       {@code setoption}, printing every move and the result.</li>
 * </ul>
 */
public final class Main {

    private static final int DEFAULT_BENCH_DEPTH = 6;

    public static void main(String[] args) {
        if (args.length > 0 && "bench".equalsIgnoreCase(args[0])) {
            int depth = (args.length > 1) ? Integer.parseInt(args[1]) : DEFAULT_BENCH_DEPTH;
            runPerftBench(depth);
            return;
        }

        System.out.println("Dablo Engine");

        TuningParams tp = new TuningParams();
        try (TaskPool pool = new TaskPoolImpl(1)) {
            EngineOptions opts = new EngineOptionsImpl(pool, tp);
            int first = (args.length > 0 && "selfplay".equalsIgnoreCase(args[0])) ? 1 : 0;
            for (int i = first; i < args.length; i++) {
                String[] kv = args[i].split("=", 2);
                opts.setOption("setoption name " + kv[0] + " value " + (kv.length > 1 ? kv[1] : ""));
            }
            selfPlay(opts, pool);
        }
    }

    private static void selfPlay(EngineOptions opts, TaskPool pool) {
        PositionFactory pf = new PositionFactoryImpl();
        MoveGenerator mg = new MoveGeneratorImpl();
        OutcomeEvaluator oe = new OutcomeEvaluatorImpl(mg);
        DecisionEngine npc = new DecisionEngineImpl(mg, new EvaluatorImpl(mg, oe, opts.tuning()),
                new Random(opts.seed()), pool);

        NpcProfile a = opts.profileFor(Player.PLAYER_A);
        NpcProfile b = opts.profileFor(Player.PLAYER_B);
        System.out.printf("A: %s/%s  B: %s/%s  limit %d%n",
                a.style(), a.difficulty(), b.style(), b.difficulty(), opts.gameConfig().moveLimit());

        GameState state = pf.newGame(opts.gameConfig());
        Outcome outcome = oe.evaluate(state);
        long t0 = System.nanoTime();
        while (outcome.isOngoing()) {
            Move m = npc.selectMove(state, state.turn() == Player.PLAYER_A ? a : b);
            System.out.printf("%4d %s %s%n", state.moveCount() + 1, state.turn().symbol(), m);
            state = mg.applyMove(state, m);
            outcome = oe.evaluate(state);
        }
        long ms = (System.nanoTime() - t0) / 1_000_000;

        System.out.println(pf.toText(state));
        System.out.printf("result: %s after %d moves (%d ms)%n", outcome, state.moveCount(), ms);
    }

    private static void runPerftBench(int depth) {
        PositionFactory pf = new PositionFactoryImpl();
        MoveGenerator mg = new MoveGeneratorImpl();
        GameState root = pf.newGame(GameConfig.defaults());

        long t0 = System.nanoTime();
        long nodes = mg.perft(root, depth);
        long ms = (System.nanoTime() - t0) / 1_000_000;

        long nps = ms > 0 ? (1000L * nodes) / ms : 0;
        System.out.printf("Nodes searched: %d%n", nodes);
        System.out.printf("nps: %d%n", nps);
        System.out.println("benchok");
    }
}
