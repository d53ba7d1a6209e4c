package core;

import core.contracts.MoveGenerator;
import core.contracts.PositionFactory;
import core.impl.MoveGeneratorImpl;
import core.impl.PositionFactoryImpl;
import core.records.GameConfig;
import core.records.GameState;
import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.util.*;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;

/**
 * Throughput benchmark that performs exactly the same perft
 * as {@link MoveGeneratorPerftTest}, but under the JMH harness.
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@State(Scope.Thread)
public class PerftBenchmark {

  /* ── engine wiring ─────────────────────────────────────────── */
  private static final PositionFactory FACT = new PositionFactoryImpl();
  private static final MoveGenerator  GEN  = new MoveGeneratorImpl();
  private static final GameConfig     CFG  = GameConfig.defaults();

  /* perft cases loaded once per fork --------------------------- */
  private record Case(GameState root, int depth) {}
  private List<Case> cases;

  /* simple node counter so JMH can report throughput ----------- */
  @AuxCounters(AuxCounters.Type.EVENTS)
  @State(Scope.Thread)
  public static class Metrics { public long nodes; }

  /* ── load /perft/dablo.txt at trial start ──────────────────── */
  @Setup(Level.Trial)
  public void init() throws Exception {
    cases = new ArrayList<>();

    try (var is = getClass().getResourceAsStream("/perft/dablo.txt");
         var br = new BufferedReader(new InputStreamReader(Objects.requireNonNull(is)))) {

      br.lines()
              .map(String::trim)
              .filter(l -> !(l.isEmpty() || l.startsWith("#")))
              .forEach(l -> {
                String[] p = l.split(";");
                int depth = Integer.parseInt(p[1].replaceAll("[^0-9]", ""));
                cases.add(new Case(FACT.fromText(p[0].trim(), CFG), depth));
              });
    }
    if (cases.isEmpty())
      throw new IllegalStateException("no perft vectors found");
  }

  /* ── the benchmark ─────────────────────────────────────────── */
  @Benchmark
  public long perftAll(Metrics m) {
    long total = 0;
    for (Case c : cases) total += GEN.perft(c.root, c.depth);
    m.nodes += total;
    return total;
  }
}
