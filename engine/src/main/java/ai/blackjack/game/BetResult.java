package ai.blackjack.game;

/**
 * Result of asking a {@link Seat} to stake a bet. Rejections leave the seat untouched.
 */
public enum BetResult {
    ACCEPTED,
    /** The amount was null, zero or negative. */
    NON_POSITIVE,
    /** The amount exceeds the seat's chips. */
    INSUFFICIENT_CHIPS;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
