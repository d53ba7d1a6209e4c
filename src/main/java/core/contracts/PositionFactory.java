package core.contracts;

import core.records.GameConfig;
import core.records.GameState;

/**
 * Creates positions. The text form lists the rows top to bottom separated by {@code /}, each
 * row left to right with {@code W P K} for player A, {@code w p k} for player B and digits
 * for runs of empty nodes, followed by the side to move ({@code a}/{@code b}), the completed
 * move count and the pending chain node or {@code -}.
 */
public interface PositionFactory {

  String START_TEXT = "wwwww/wwww/wwwww/p3/k4/4/4K/3P/WWWWW/WWWW/WWWWW a 0 -";

  GameState newGame(GameConfig config);

  /** @throws IllegalArgumentException naming the first malformed field */
  GameState fromText(String text, GameConfig config);

  String toText(GameState state);
}
