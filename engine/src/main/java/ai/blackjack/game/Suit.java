package ai.blackjack.game;

/**
 * Card suit. Suits never change a hand's value; they tell the copies of a rank apart
 * inside a multi-deck shoe and pick the terminal colour of a card.
 */
public enum Suit {
    HEARTS("♥", true),
    DIAMONDS("♦", true),
    CLUBS("♣", false),
    SPADES("♠", false);

    private static final String ANSI_RED = "\u001B[31m";
    private static final String ANSI_RESET = "\u001B[0m";

    private final String symbol;
    private final boolean red;

    Suit(String symbol, boolean red) {
        this.symbol = symbol;
        this.red = red;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Wraps {@code text} in ANSI red for Hearts and Diamonds; black suits return it unchanged.
     */
    public String colour(String text) {
        return red ? ANSI_RED + text + ANSI_RESET : text;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
