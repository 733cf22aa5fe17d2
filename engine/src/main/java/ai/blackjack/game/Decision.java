package ai.blackjack.game;

/**
 * The actions a participant may take on one of their hands.
 */
public enum Decision {
    HIT("hit", 'h'),
    STAND("stand", 's'),
    DOUBLE_DOWN("double-down", 'd'),
    SPLIT("split", 'p'),
    SURRENDER("surrender", 'r');

    private final String label;
    private final char key;

    Decision(String label, char key) {
        this.label = label;
        this.key = key;
    }

    /**
     * @return the lowercase wire label, e.g. {@code "double-down"}
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return the single-letter console shortcut, e.g. {@code 'p'} for split
     */
    public char getKey() {
        return key;
    }

    /**
     * Resolves a decision from its label, enum name or console key, ignoring case,
     * surrounding whitespace and underscores vs. hyphens.
     *
     * @param text free-form text such as "Double Down", "double_down" or "d"
     * @return the matching decision, or {@code null} if nothing matches
     */
    public static Decision parse(String text) {
        if (text == null) {
            return null;
        }
        String normalised = text.trim().toLowerCase().replace('_', '-').replace(' ', '-');
        if (normalised.isEmpty()) {
            return null;
        }
        for (Decision decision : values()) {
            if (decision.label.equals(normalised)) {
                return decision;
            }
        }
        if (normalised.length() == 1) {
            for (Decision decision : values()) {
                if (decision.key == normalised.charAt(0)) {
                    return decision;
                }
            }
        }
        if (normalised.equals("double")) {
            return DOUBLE_DOWN;
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
