package core;

import core.constants.CoreConstants;
import core.constants.TuningParams;
import core.contracts.Evaluator;
import core.contracts.MoveGenerator;
import core.contracts.PositionFactory;
import core.impl.EvaluatorImpl;
import core.impl.MoveGeneratorImpl;
import core.impl.PositionFactoryImpl;
import core.records.*;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluatorTest {

    private static final double EPS = 1e-9;

    private static final PositionFactory PF = new PositionFactoryImpl();
    private static final MoveGenerator GEN = new MoveGeneratorImpl();
    private static final Evaluator EVAL = new EvaluatorImpl(GEN, new TuningParams());
    private static final GameConfig CFG = GameConfig.defaults();

    private static final StyleWeights KING_ONLY = new StyleWeights(0, 0, 0, 1, 0, 0, 0, 0);
    private static final StyleWeights CENTER_ONLY = new StyleWeights(0, 0, 0, 0, 0, 0, 0, 1);
    private static final StyleWeights ADVANCE_ONLY = new StyleWeights(0, 0, 0, 0, 0, 0, 1, 0);

    private static Move find(GameState s, String name) {
        return GEN.legalMoves(s).stream()
                .filter(m -> m.toString().equals(name))
                .findFirst()
                .orElseThrow(() -> new AssertionError("no move " + name));
    }

    private double scoreOf(GameState s, String move, StyleWeights w) {
        Move m = find(s, move);
        return EVAL.score(s, m, GEN.applyMove(s, m), w);
    }

    @Test
    void capturingTheKingWins() {
        GameState s = PF.fromText("w4/4/5/4/2k2/4/2Kw1/4/5/4/W4 a 0 -", CFG);
        StyleWeights any = new TuningParams().weights(core.constants.Style.DEFENSIVE);
        assertEquals(CoreConstants.SCORE_WIN, scoreOf(s, "e7xe3", any), EPS);
        assertTrue(scoreOf(s, "e7xi7", any) < CoreConstants.SCORE_WIN);
    }

    @Test
    void takingTheKingWinsEvenWhenTheChainGoesOn() {
        // after e7xe3 the king can still jump the warrior on g3
        GameState s = PF.fromText("5/4/3w1/4/2k2/4/2K2/4/5/4/W4 a 0 -", CFG);
        Move m = find(s, "e7xe3");
        assertTrue(GEN.applyMove(s, m).inChain());
        StyleWeights any = new TuningParams().weights(core.constants.Style.SMART);
        assertEquals(CoreConstants.SCORE_WIN, scoreOf(s, "e7xe3", any), EPS);
    }

    @Test
    void kingNextToACapturingEnemyIsUnsafe() {
        // A to move in "before"; B to move in the positions being judged
        GameState before = PF.fromText("4w/4/5/4/2k2/4/2K2/4/5/4/W4 a 0 -", CFG);
        GameState danger = PF.fromText("4w/4/5/4/2k2/4/2K2/4/5/4/W4 b 1 -", CFG);
        GameState safe = PF.fromText("k3w/4/5/4/5/4/5/4/5/4/W3K b 1 -", CFG);
        Move any = Move.quiet(before.board().node("a11"), before.board().node("a9"));

        // en prise (-5) and an enemy one step away (-4)
        assertEquals(-9.0, EVAL.score(before, any, danger, KING_ONLY), EPS);
        // nearest enemy five units away
        assertEquals(0.5, EVAL.score(before, any, safe, KING_ONLY), EPS);
    }

    @Test
    void centreControl() {
        GameState start = PF.newGame(CFG);
        assertEquals(0.6, scoreOf(start, "e9-e7", CENTER_ONLY), EPS);
        assertEquals(0.3, scoreOf(start, "a9-a7", CENTER_ONLY), EPS);
        assertEquals(0.0, scoreOf(start, "a9-b8", CENTER_ONLY), EPS);
    }

    @Test
    void advancementCountsWholeRowsAndIgnoresTheKing() {
        GameState start = PF.newGame(CFG);
        assertEquals(1.0, scoreOf(start, "e9-e7", ADVANCE_ONLY), EPS);
        assertEquals(0.5, scoreOf(start, "a9-b8", ADVANCE_ONLY), EPS);
        assertEquals(0.0, scoreOf(start, "i7-i5", ADVANCE_ONLY), EPS);
    }

    @Test
    void continuingChainEarnsBonusAndFollowUp() {
        GameState s = PF.fromText("k4/4/5/4/5/2w1/5/1w2/1W3/4/W3K a 0 -", CFG);
        StyleWeights captureAndChain = new StyleWeights(0, 1, 6, 0, 0, 0, 0, 0);
        // warrior taken (1) + chain bonus (6) + best follow-up warrior (1)
        assertEquals(8.0, scoreOf(s, "c9xe7", captureAndChain), EPS);
    }

    @Test
    void noWeightsNoScore() {
        GameState start = PF.newGame(CFG);
        for (Move m : GEN.legalMoves(start)) {
            assertEquals(0.0, EVAL.score(start, m, GEN.applyMove(start, m), StyleWeights.none()), EPS);
        }
    }
}
