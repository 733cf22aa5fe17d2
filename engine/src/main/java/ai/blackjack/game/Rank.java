package ai.blackjack.game;

/**
 * Card rank with its Blackjack point value. Number cards count their face value,
 * Jack, Queen and King count 10, and the Ace counts 11 until {@link Hand#value()}
 * demotes it to 1.
 */
public enum Rank {
    TWO(2, "2"),
    THREE(3, "3"),
    FOUR(4, "4"),
    FIVE(5, "5"),
    SIX(6, "6"),
    SEVEN(7, "7"),
    EIGHT(8, "8"),
    NINE(9, "9"),
    TEN(10, "10"),
    JACK(10, "J"),
    QUEEN(10, "Q"),
    KING(10, "K"),
    ACE(11, "A");

    private final int value;
    private final String label;

    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * @return 2 to 10 for number and face ranks, 11 for the Ace
     */
    public int getValue() {
        return value;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Ten, Jack, Queen and King: the cards that complete an Ace into a Blackjack.
     */
    public boolean isTenValued() {
        return value == 10;
    }

    @Override
    public String toString() {
        return label;
    }
}
