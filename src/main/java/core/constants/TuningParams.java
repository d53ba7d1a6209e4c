// File: core/constants/TuningParams.java
package core.constants;

import core.records.RandomnessSchedule;
import core.records.StyleWeights;

import java.util.*;
import java.util.function.Consumer;
import java.util.function.IntSupplier;

public final class TuningParams {

    /* ========== PASTE YOUR TUNED VALUES HERE ========== */
    // Format: one "Name, value" per line. Comments/blank lines are ignored.
    // Values are hundredths: "SmartCapture, 100" is a weight of 1.00.
    public static final String PASTED_TUNING = """
SmartChain, 600
SmartThreat, 70
AggressiveChain, 800
AggressiveThreat, 100
DefensiveKingSafety, 150
DefensiveProtection, 80
ThreatScale, 30
ThreatCap, 300
""";
    /* =================================================== */

    /** Score features, in {@link StyleWeights} component order. */
    public enum Feature {
        MATERIAL("Material"),
        CAPTURE("Capture"),
        CHAIN("Chain"),
        KING_SAFETY("KingSafety"),
        PROTECTION("Protection"),
        THREAT("Threat"),
        ADVANCE("Advance"),
        CENTER("Center");

        private final String paramName;

        Feature(String paramName) { this.paramName = paramName; }

        public String paramName() { return paramName; }
    }

    private static final int[] WEIGHT_BOUNDS = {0, 2000};

    // ---- Defaults (will be overridden by PASTED_TUNING on construction) ----
    //                                       Mat  Cap  Chain KSaf Prot Thr  Adv  Ctr
    private final int[] smart      = new int[]{100, 100, 600,  70,  30,  70,  80,  20};
    private final int[] aggressive = new int[]{150, 150, 800,  30,  15, 100, 100,  20};
    private final int[] defensive  = new int[]{100,  50, 400, 150,  80,  40,  20,  30};

    private int easyRandomPct   = 40;  // [0..100]
    private int mediumRandomPct = 20;  // [0..100]
    private int hardRandomPct   = 0;   // [0..100]

    private int easyTop   = 3;  // [1..10]
    private int mediumTop = 2;  // [1..10]
    private int hardTop   = 1;  // [1..10]

    private int threatScale = 30;   // [0..200]
    private int threatCap   = 300;  // [0..2000]

    /* name -> setter / getter / bounds, in registration order */
    private final Map<String, Consumer<Integer>> setters = new LinkedHashMap<>();
    private final Map<String, IntSupplier> getters = new LinkedHashMap<>();
    private final Map<String, int[]> bounds = new HashMap<>();

    // === Auto-apply pasted tuning on construction ===
    public TuningParams() {
        for (Style s : List.of(Style.SMART, Style.AGGRESSIVE, Style.DEFENSIVE)) {
            int[] w = table(s);
            for (Feature f : Feature.values()) {
                int i = f.ordinal();
                register(s.displayName() + f.paramName(), () -> w[i], v -> w[i] = v, WEIGHT_BOUNDS);
            }
        }
        register("EasyRandomPct", this::getEasyRandomPct, this::setEasyRandomPct, new int[]{0, 100});
        register("MediumRandomPct", this::getMediumRandomPct, this::setMediumRandomPct, new int[]{0, 100});
        register("HardRandomPct", this::getHardRandomPct, this::setHardRandomPct, new int[]{0, 100});
        register("EasyTop", this::getEasyTop, this::setEasyTop, new int[]{1, CoreConstants.MAX_TOP_CANDIDATES});
        register("MediumTop", this::getMediumTop, this::setMediumTop, new int[]{1, CoreConstants.MAX_TOP_CANDIDATES});
        register("HardTop", this::getHardTop, this::setHardTop, new int[]{1, CoreConstants.MAX_TOP_CANDIDATES});
        register("ThreatScale", this::getThreatScale, this::setThreatScale, new int[]{0, 200});
        register("ThreatCap", this::getThreatCap, this::setThreatCap, new int[]{0, 2000});

        if (PASTED_TUNING != null && !PASTED_TUNING.isBlank()) {
            applyFromBlob(PASTED_TUNING);
        }
    }

    private void register(String name, IntSupplier getter, Consumer<Integer> setter, int[] range) {
        getters.put(name, getter);
        setters.put(name, setter);
        bounds.put(name, range);
    }

    // === Parser: applies "Name, value" lines using setters (with clamping) ===
    public void applyFromBlob(String blob) {
        for (String raw : blob.split("\\R")) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith("//")) continue;
            String[] parts = line.split(",");
            if (parts.length < 2) continue;
            String name = parts[0].trim();
            if (!setters.containsKey(name)) continue; // unknown key → skip

            try {
                set(name, (int) Math.round(Double.parseDouble(parts[1].trim()))); // tolerate “12.0”
            } catch (NumberFormatException ignored) { /* skip bad line */ }
        }
    }

    /**
     * Sets a parameter by name, clamped to its range.
     *
     * @return {@code false} if there is no parameter {@code name}
     */
    public boolean set(String name, int value) {
        Consumer<Integer> setter = setters.get(name);
        if (setter == null) return false;
        setter.accept(clamp(name, value));
        return true;
    }

    private int clamp(String name, int value) {
        int[] b = bounds.get(name);
        return Math.max(b[0], Math.min(b[1], value));
    }

    /** @throws IllegalArgumentException for an unknown parameter */
    public int get(String name) {
        IntSupplier getter = getters.get(name);
        if (getter == null) throw new IllegalArgumentException("Unknown tuning parameter: " + name);
        return getter.getAsInt();
    }

    /** Parameter names in registration order. */
    public Set<String> names() {
        return Collections.unmodifiableSet(getters.keySet());
    }

    /** {@code [min, max]} of a parameter. */
    public int[] range(String name) {
        int[] b = bounds.get(name);
        if (b == null) throw new IllegalArgumentException("Unknown tuning parameter: " + name);
        return b.clone();
    }

    /* ======= Derived views ======= */

    public StyleWeights weights(Style style) {
        if (style == Style.RANDOM) return StyleWeights.none();
        int[] w = table(style);
        return new StyleWeights(
                w[0] / 100.0, w[1] / 100.0, w[2] / 100.0, w[3] / 100.0,
                w[4] / 100.0, w[5] / 100.0, w[6] / 100.0, w[7] / 100.0);
    }

    public RandomnessSchedule schedule(Difficulty difficulty) {
        return switch (difficulty) {
            case EASY -> RandomnessSchedule.linear(easyRandomPct / 100.0, easyTop);
            case MEDIUM -> RandomnessSchedule.linear(mediumRandomPct / 100.0, mediumTop);
            case HARD -> RandomnessSchedule.linear(hardRandomPct / 100.0, hardTop);
        };
    }

    public double threatScaleFactor() { return threatScale / 100.0; }
    public double threatCapValue() { return threatCap / 100.0; }

    private int[] table(Style style) {
        return switch (style) {
            case SMART -> smart;
            case AGGRESSIVE -> aggressive;
            case DEFENSIVE -> defensive;
            case RANDOM -> throw new IllegalArgumentException("Random style has no weights");
        };
    }

    /* ======= Getters / Setters ======= */
    public int getEasyRandomPct() { return easyRandomPct; }
    public void setEasyRandomPct(int v) { easyRandomPct = clamp("EasyRandomPct", v); }

    public int getMediumRandomPct() { return mediumRandomPct; }
    public void setMediumRandomPct(int v) { mediumRandomPct = clamp("MediumRandomPct", v); }

    public int getHardRandomPct() { return hardRandomPct; }
    public void setHardRandomPct(int v) { hardRandomPct = clamp("HardRandomPct", v); }

    public int getEasyTop() { return easyTop; }
    public void setEasyTop(int v) { easyTop = clamp("EasyTop", v); }

    public int getMediumTop() { return mediumTop; }
    public void setMediumTop(int v) { mediumTop = clamp("MediumTop", v); }

    public int getHardTop() { return hardTop; }
    public void setHardTop(int v) { hardTop = clamp("HardTop", v); }

    public int getThreatScale() { return threatScale; }
    public void setThreatScale(int v) { threatScale = clamp("ThreatScale", v); }

    public int getThreatCap() { return threatCap; }
    public void setThreatCap(int v) { threatCap = clamp("ThreatCap", v); }
}
