package core.impl;

import core.constants.*;
import core.contracts.EngineOptions;
import core.contracts.TaskPool;
import core.records.GameConfig;
import core.records.NpcProfile;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Implements the EngineOptions contract: game settings, computer-player profiles, pool size
 * and every tuning parameter as a named option.
 */
public class EngineOptionsImpl implements EngineOptions {

    private final TaskPool pool;
    private final TuningParams tp;

    private GameConfig config = GameConfig.defaults();
    private final Map<Player, Style> styles = new EnumMap<>(Player.class);
    private final Map<Player, Difficulty> difficulties = new EnumMap<>(Player.class);
    private long seed = 0;

    private record Option(String type, String defaultValue, String min, String max, List<String> vars,
                          Consumer<String> onSet) {
        void print(String name) {
            System.out.print("option name " + name + " type " + type);
            if (defaultValue != null) System.out.print(" default " + defaultValue);
            if (min != null) System.out.print(" min " + min);
            if (max != null) System.out.print(" max " + max);
            for (String v : vars) System.out.print(" var " + v);
            System.out.println();
        }
    }

    private final Map<String, Option> options = new LinkedHashMap<>();
    private final Map<String, String> current = new LinkedHashMap<>();

    /**
     * @param pool resized by the {@code Threads} option; may be {@code null}
     * @param tp   tuning parameters edited in place
     */
    public EngineOptionsImpl(TaskPool pool, TuningParams tp) {
        this.pool = pool;
        this.tp = tp;
        for (Player p : Player.values()) {
            styles.put(p, Style.SMART);
            difficulties.put(p, Difficulty.MEDIUM);
        }
        initializeOptions();
        registerTuningOptions();
        options.forEach((name, o) -> current.put(name, o.defaultValue()));
    }

    private static Option spin(int def, int min, int max, Consumer<String> onSet) {
        return new Option("spin", Integer.toString(def), Integer.toString(min), Integer.toString(max), List.of(), onSet);
    }

    private static Option combo(String def, List<String> vars, Consumer<String> onSet) {
        return new Option("combo", def, null, null, vars, onSet);
    }

    private void initializeOptions() {
        options.put("MoveLimit", spin(CoreConstants.MOVE_LIMIT_DEFAULT,
                CoreConstants.MOVE_LIMIT_MIN, CoreConstants.MOVE_LIMIT_MAX,
                v -> config = config.withMoveLimit(Integer.parseInt(v))));
        options.put("Topology", combo(CoreConstants.DEFAULT_TOPOLOGY,
                Arrays.stream(BoardTopology.values()).map(BoardTopology::id).collect(Collectors.toList()),
                v -> config = new GameConfig(config.moveLimit(), BoardTopology.byId(v).id())));
        options.put("Threads", spin(CoreConstants.DEFAULT_THREADS, 1, CoreConstants.MAX_THREADS,
                v -> {
                    int n = Integer.parseInt(v);
                    if (n < 1 || n > CoreConstants.MAX_THREADS) throw new IllegalArgumentException("threads " + n);
                    if (pool != null) pool.setParallelism(n);
                }));
        options.put("Seed", spin(0, 0, Integer.MAX_VALUE, v -> seed = Long.parseLong(v)));

        List<String> styleNames = Arrays.stream(Style.values()).map(Style::displayName).collect(Collectors.toList());
        List<String> levelNames = Arrays.stream(Difficulty.values()).map(Difficulty::displayName).collect(Collectors.toList());
        for (Player p : Player.values()) {
            String side = p == Player.PLAYER_A ? "PlayerA" : "PlayerB";
            options.put(side + "Style", combo(Style.SMART.displayName(), styleNames,
                    v -> styles.put(p, Style.fromName(v))));
            options.put(side + "Difficulty", combo(Difficulty.MEDIUM.displayName(), levelNames,
                    v -> difficulties.put(p, Difficulty.fromName(v))));
        }
    }

    private void registerTuningOptions() {
        for (String name : tp.names()) {
            int[] range = tp.range(name);
            options.put(name, spin(tp.get(name), range[0], range[1],
                    v -> tp.set(name, Integer.parseInt(v))));
        }
    }

    @Override
    public void setOption(String line) {
        try {
            String[] parts = line.split(" value ");
            String namePart = parts[0].replace("setoption name ", "").trim();
            String valuePart = parts.length > 1 ? parts[1].trim() : "";

            Option option = options.get(namePart);
            if (option != null) {
                option.onSet().accept(valuePart);
                current.put(namePart, tp.names().contains(namePart)
                        ? Integer.toString(tp.get(namePart)) : valuePart);
            } else {
                System.out.println("info string Unknown option: " + namePart);
            }
        } catch (RuntimeException e) {
            System.out.println("info string Error setting option: " + line + " (" + e.getMessage() + ")");
        }
    }

    @Override
    public String getOptionValue(String name) {
        return current.get(name);
    }

    @Override
    public void printOptions() {
        for (Map.Entry<String, Option> entry : options.entrySet()) {
            entry.getValue().print(entry.getKey());
        }
    }

    @Override
    public GameConfig gameConfig() {
        return config;
    }

    @Override
    public NpcProfile profileFor(Player player) {
        return new NpcProfile.Builder()
                .style(styles.get(player))
                .difficulty(difficulties.get(player))
                .tuning(tp)
                .build();
    }

    @Override
    public TuningParams tuning() {
        return tp;
    }

    @Override
    public long seed() {
        return seed;
    }
}
