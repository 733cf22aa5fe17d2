package ai.blackjack.game;

/**
 * Final result of a single hand, assigned exactly once per round.
 */
public enum Outcome {
    WIN,
    LOSS,
    PUSH,
    BLACKJACK,
    BUST,
    SURRENDER;

    /**
     * Outcomes counted as a won hand in statistics.
     */
    public boolean isWin() {
        return this == WIN || this == BLACKJACK;
    }

    /**
     * Outcomes counted as a lost hand in statistics.
     */
    public boolean isLoss() {
        return this == LOSS || this == BUST || this == SURRENDER;
    }
}
