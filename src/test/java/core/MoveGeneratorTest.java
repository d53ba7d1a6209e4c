package core;

import core.constants.Player;
import core.contracts.MoveGenerator;
import core.contracts.OutcomeEvaluator;
import core.contracts.PositionFactory;
import core.errors.IllegalMoveException;
import core.errors.PreconditionException;
import core.impl.MoveGeneratorImpl;
import core.impl.OutcomeEvaluatorImpl;
import core.impl.PositionFactoryImpl;
import core.records.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class MoveGeneratorTest {

    /* ── wiring ───────────────────────────────────────────────────── */
    private static final PositionFactory PF = new PositionFactoryImpl();
    private static final MoveGenerator GEN = new MoveGeneratorImpl();
    private static final OutcomeEvaluator OUTCOME = new OutcomeEvaluatorImpl(GEN);
    private static final GameConfig CFG = GameConfig.defaults();

    /* ── positions ────────────────────────────────────────────────── */
    // A warrior c9 can jump B warrior d8 onto e7
    private static final String SINGLE_CAPTURE = "k4/4/5/4/5/4/5/1w2/1W3/4/W3K a 0 -";
    // as above, plus a second B warrior on f6 that the same warrior can take from e7
    private static final String DOUBLE_CAPTURE = "k4/4/5/4/5/2w1/5/1w2/1W3/4/W3K a 0 -";
    // A warrior c9 faces a B prince on d8
    private static final String WARRIOR_VS_PRINCE = "k4/4/5/4/5/4/5/1p2/1W3/4/W3K a 0 -";
    // A king c9 faces a B prince on d8
    private static final String KING_VS_PRINCE = "k4/4/5/4/5/4/5/1p2/1K3/4/W3W a 0 -";
    // B warrior f8 stands behind A warrior e7
    private static final String CAPTURE_BACKWARDS = "k4/4/5/4/5/4/2W2/2w1/5/4/4K a 0 -";

    private static GameState pos(String text) {
        return PF.fromText(text, CFG);
    }

    private static List<String> names(List<Move> moves) {
        return moves.stream().map(Move::toString).collect(Collectors.toList());
    }

    @Test
    void startPositionHasOnlyForwardSteps() {
        GameState start = PF.newGame(CFG);
        List<Move> moves = GEN.legalMoves(start);
        assertEquals(13, moves.size());
        for (Move m : moves) {
            assertFalse(m.isCapture());
            assertTrue(Player.PLAYER_A.isForward(m.mover().row2(), m.destination().row2()), m.toString());
            assertTrue(start.pieceAt(m.destination()).isEmpty());
        }
        assertTrue(names(moves).containsAll(List.of("i7-i5", "i7-h6", "h8-g7", "a9-a7", "a9-b8")));
    }

    @Test
    void captureIsCompulsoryForTheWholeSide() {
        GameState s = pos(SINGLE_CAPTURE);
        assertEquals(List.of("c9xe7"), names(GEN.legalMoves(s)));
        assertEquals("d8", GEN.legalMoves(s).get(0).capturedNode().orElseThrow().label());
        // the other pieces could step forward if capturing were optional
        assertEquals(6, GEN.quietMoves(s, Player.PLAYER_A).size());
    }

    @Test
    void singleCapturePassesTheTurn() {
        GameState s = pos(SINGLE_CAPTURE);
        GameState after = GEN.applyMove(s, GEN.legalMoves(s).get(0));
        assertEquals("k4/4/5/4/5/4/2W2/4/5/4/W3K b 1 -", PF.toText(after));
        assertEquals(SINGLE_CAPTURE, PF.toText(s), "input state must not change");
    }

    @Test
    void warriorCannotTakePrince() {
        GameState s = pos(WARRIOR_VS_PRINCE);
        List<Move> moves = GEN.legalMoves(s);
        assertEquals(6, moves.size());
        assertTrue(moves.stream().noneMatch(Move::isCapture));
        assertFalse(GEN.isAttacked(s, s.board().node("d8"), Player.PLAYER_A));
        // while the prince may take the warrior, landing on b10
        assertTrue(GEN.isAttacked(s, s.board().node("c9"), Player.PLAYER_B));
        assertEquals(List.of("d8xb10"), names(GEN.captures(s, Player.PLAYER_B)));
    }

    @Test
    void kingTakesPrince() {
        GameState s = pos(KING_VS_PRINCE);
        assertEquals(List.of("c9xe7"), names(GEN.legalMoves(s)));
    }

    @Test
    void capturesMayGoBackwards() {
        GameState s = pos(CAPTURE_BACKWARDS);
        assertEquals(List.of("e7xg9"), names(GEN.legalMoves(s)));
    }

    @Test
    void chainCaptureKeepsTheTurnUntilExhausted() {
        GameState s = pos(DOUBLE_CAPTURE);
        List<Move> first = GEN.legalMoves(s);
        assertEquals(List.of("c9xe7"), names(first));
        assertFalse(first.get(0).isChainContinuation());

        GameState mid = GEN.applyMove(s, first.get(0));
        assertTrue(mid.inChain());
        assertEquals("e7", mid.pendingChain().orElseThrow().node().label());
        assertEquals(Player.PLAYER_A, mid.turn());
        assertEquals(0, mid.moveCount());
        assertTrue(OUTCOME.evaluate(mid).isOngoing());

        List<Move> second = GEN.legalMoves(mid);
        assertEquals(List.of("e7xg5"), names(second));
        assertTrue(second.get(0).isChainContinuation());
        assertEquals("f6", second.get(0).capturedNode().orElseThrow().label());

        GameState done = GEN.applyMove(mid, second.get(0));
        assertFalse(done.inChain());
        assertEquals(Player.PLAYER_B, done.turn());
        assertEquals(1, done.moveCount());
        assertEquals(1, done.count(Player.PLAYER_B));
        assertEquals(Outcome.win(Player.PLAYER_A, Outcome.Reason.LONE_KING), OUTCOME.evaluate(done));
    }

    @Test
    void otherPiecesMayNotMoveMidChain() {
        GameState mid = pos("k4/4/5/4/5/2w1/2W2/4/5/4/W3K a 0 e7");
        Move step = Move.quiet(mid.board().node("a11"), mid.board().node("a9"));
        IllegalMoveException e = assertThrows(IllegalMoveException.class, () -> GEN.applyMove(mid, step));
        assertEquals(step, e.move());
    }

    @Test
    void illegalMoveIsRejectedWithoutSideEffects() {
        GameState start = PF.newGame(CFG);
        Move backwards = Move.quiet(start.board().node("a9"), start.board().node("a11"));
        assertThrows(IllegalMoveException.class, () -> GEN.applyMove(start, backwards));
        Move sideways = Move.quiet(start.board().node("i7"), start.board().node("g7"));
        assertThrows(IllegalMoveException.class, () -> GEN.applyMove(start, sideways));
        assertEquals(PositionFactory.START_TEXT, PF.toText(start));
    }

    @Test
    void finishedGameRefusesMoves() {
        GameState kingsOnly = pos("k4/4/5/4/5/4/5/4/5/4/4K a 10 -");
        List<Move> moves = GEN.legalMoves(kingsOnly);
        assertFalse(moves.isEmpty());
        assertThrows(PreconditionException.class, () -> GEN.applyMove(kingsOnly, moves.get(0)));
    }

    @Test
    void quietMoveFlipsTurnAndCounts() {
        GameState start = PF.newGame(CFG);
        Move m = GEN.legalMoves(start).get(0);
        GameState next = GEN.applyMove(start, m);
        assertEquals(Player.PLAYER_B, next.turn());
        assertEquals(1, next.moveCount());
        assertTrue(next.pieceAt(m.mover()).isEmpty());
        assertEquals(start.pieceAt(m.mover()), next.pieceAt(m.destination()));
    }
}
