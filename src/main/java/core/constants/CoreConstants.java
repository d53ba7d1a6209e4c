package core.constants;

/**
 * Central place for engine-wide compile-time constants.
 */
public final class CoreConstants {

    private CoreConstants() {}

    /* ────────────── Game length ────────────── */
    public static final int MOVE_LIMIT_MIN = 50;
    public static final int MOVE_LIMIT_MAX = 2000;
    public static final int MOVE_LIMIT_DEFAULT = 500;
    public static final int MOVE_LIMIT_QUICK = 200;
    public static final int MOVE_LIMIT_TEST = 100;

    public static final String DEFAULT_TOPOLOGY = "standard";

    /* ────────────── Material ────────────── */
    // indexed by Rank.ordinal(): WARRIOR, PRINCE, KING
    public static final int[] PIECE_VALUE = {1, 3, 10};

    /** Pieces worth less than this are not worth guarding. */
    public static final int PROTECTION_MIN_VALUE = 2;

    /* ─────────────── Evaluation score space ───────────── */
    public static final double SCORE_WIN = 10_000.0;
    public static final double SCORE_LOSS = -SCORE_WIN;
    public static final double SCORE_DRAW = 0.0;

    /* ─────────────── King safety ───────────── */
    public static final double KING_MISSING_PENALTY = -50.0;
    public static final double KING_EN_PRISE_PENALTY = -5.0;
    // distances in whole board units (two half steps)
    public static final double KING_DANGER_NEAR = 1.1;
    public static final double KING_DANGER_MID = 1.6;
    public static final double KING_DANGER_FAR = 2.5;
    public static final double KING_NEAR_PENALTY = -4.0;
    public static final double KING_MID_PENALTY = -2.0;
    public static final double KING_FAR_BONUS = 0.2;
    public static final double KING_SAFE_BONUS = 0.5;

    /* ─────────────── Positional ───────────── */
    public static final double CENTER_BONUS = 0.3;
    /** Half-step radius around the board middle counted as centre. */
    public static final int CENTER_RADIUS2 = 1;

    /* ─────────────── Decision engine ───────────── */
    public static final int MAX_TOP_CANDIDATES = 10;
    public static final int DEFAULT_THREADS = 1;
    public static final int MAX_THREADS = 128;
}
