package ai.blackjack.game;

import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Cards are immutable once dealt. Two cards are equal when they share rank and
 * suit, so a multi-deck shoe contains several equal cards.
 */
public class Card {
    /** The rank (Two through Ace) of this card. */
    private final Rank rank;
    /** The suit (Hearts, Diamonds, Clubs, Spades) of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /** @return the rank of this card */
    public Rank getRank() {
        return rank;
    }

    /** @return the suit of this card */
    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns the Blackjack point value of this card, counting an Ace as 11.
     *
     * @return the card value (2 to 11)
     */
    public int getValue() {
        return rank.getValue();
    }

    public boolean isAce() {
        return rank == Rank.ACE;
    }

    /** Ten, Jack, Queen and King all count ten. */
    public boolean isTenValued() {
        return rank.isTenValued();
    }

    /**
     * Returns a short, non-coloured string representation of this card
     * (e.g., "Q♠", "10♦", "A♣"). Used in prompts and round records.
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.toString() + suit.getSymbol();
    }

    /**
     * Returns the short name, coloured red for Diamonds and Hearts.
     */
    @Override
    public String toString() {
        return suit.colour(shortName());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
