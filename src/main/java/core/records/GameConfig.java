package core.records;

import core.constants.BoardTopology;

import static core.constants.CoreConstants.*;

/**
 * Per-game settings.
 *
 * @param moveLimit     completed moves after which the game is drawn, within [50, 2000]
 * @param boardTopology identifier of a registered {@link BoardTopology}
 */
public record GameConfig(int moveLimit, String boardTopology) {

    public GameConfig {
        if (moveLimit < MOVE_LIMIT_MIN || moveLimit > MOVE_LIMIT_MAX) {
            throw new IllegalArgumentException(
                    "Move limit must be between " + MOVE_LIMIT_MIN + " and " + MOVE_LIMIT_MAX + ", got " + moveLimit);
        }
        BoardTopology.byId(boardTopology); // rejects unknown identifiers
    }

    public static GameConfig defaults() {
        return new GameConfig(MOVE_LIMIT_DEFAULT, DEFAULT_TOPOLOGY);
    }

    public static GameConfig quickGame() {
        return new GameConfig(MOVE_LIMIT_QUICK, DEFAULT_TOPOLOGY);
    }

    public static GameConfig testGame() {
        return new GameConfig(MOVE_LIMIT_TEST, DEFAULT_TOPOLOGY);
    }

    public GameConfig withMoveLimit(int limit) {
        return new GameConfig(limit, boardTopology);
    }

    public BoardTopology topology() {
        return BoardTopology.byId(boardTopology);
    }
}
