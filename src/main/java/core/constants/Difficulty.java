package core.constants;

/** How often a computer opponent deviates from its best-ranked move. */
public enum Difficulty {
    EASY("Easy"),
    MEDIUM("Medium"),
    HARD("Hard");

    private final String displayName;

    Difficulty(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    public static Difficulty fromName(String name) {
        for (Difficulty d : values()) {
            if (d.name().equalsIgnoreCase(name) || d.displayName.equalsIgnoreCase(name)) return d;
        }
        throw new IllegalArgumentException("Unknown difficulty: " + name);
    }
}
