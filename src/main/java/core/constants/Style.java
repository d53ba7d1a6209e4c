package core.constants;

/** Play style of a computer opponent. */
public enum Style {
    SMART("Smart"),
    AGGRESSIVE("Aggressive"),
    DEFENSIVE("Defensive"),
    RANDOM("Random");

    private final String displayName;

    Style(String displayName) {
        this.displayName = displayName;
    }

    /** Name used as the prefix of this style's tuning parameters. */
    public String displayName() {
        return displayName;
    }

    public static Style fromName(String name) {
        for (Style s : values()) {
            if (s.name().equalsIgnoreCase(name) || s.displayName.equalsIgnoreCase(name)) return s;
        }
        throw new IllegalArgumentException("Unknown style: " + name);
    }
}
