package core.contracts;

import core.constants.Player;
import core.constants.TuningParams;
import core.records.GameConfig;
import core.records.NpcProfile;

/**
 * Named, textually settable engine options ({@code setoption name X value Y}).
 */
public interface EngineOptions {

  /** Applies a {@code setoption} line; problems are reported as {@code info string} output. */
  void setOption(String command);

  /** Current value of option {@code name}, or {@code null} if there is no such option. */
  String getOptionValue(String name);

  /** Prints one {@code option name ...} line per option. */
  void printOptions();

  GameConfig gameConfig();

  NpcProfile profileFor(Player player);

  TuningParams tuning();

  long seed();
}
