package ai.blackjack.game;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Random;

/**
 * The working deck(s) for one round.
 * <p>
 * A {@code Shoe} holds {@code decks × 52} cards and deals from the front. The
 * round engine builds a brand-new shoe at the start of every round, so a shoe
 * is never reused once its round is over.
 */
public class Shoe {
    /** Number of cards in a single standard deck. */
    public static final int CARDS_PER_DECK = 52;

    /** Cards still in the shoe; the first element is dealt next. */
    private final Deque<Card> cards;

    private Shoe(List<Card> dealOrder) {
        this.cards = new ArrayDeque<>(dealOrder);
    }

    /**
     * Builds a full shoe of the given number of decks, shuffled with the supplied random source.
     *
     * @param decks number of 52-card decks (must be positive)
     * @param random source of randomness; pass a seeded instance for reproducible rounds
     * @return a freshly shuffled shoe
     */
    public static Shoe shuffled(int decks, Random random) {
        List<Card> tmp = fullDeckOrder(decks);
        Collections.shuffle(tmp, random);
        return new Shoe(tmp);
    }

    /**
     * Builds an unshuffled shoe holding all cards of the given number of decks.
     * Used as the reference population for hole-card probabilities.
     *
     * @param decks number of 52-card decks (must be positive)
     * @return a full shoe in suit-major, rank-minor order
     */
    public static Shoe unshuffled(int decks) {
        return new Shoe(fullDeckOrder(decks));
    }

    /**
     * Builds a shoe that deals exactly the given cards in the given order.
     * Intended for replays and tests that need a known deal.
     *
     * @param dealOrder cards in the order they will be dealt
     * @return a shoe dealing {@code dealOrder} front to back
     */
    public static Shoe ofDealOrder(List<Card> dealOrder) {
        return new Shoe(dealOrder);
    }

    private static List<Card> fullDeckOrder(int decks) {
        if (decks <= 0) {
            throw new IllegalArgumentException("A shoe needs at least one deck, got " + decks);
        }
        List<Card> tmp = new ArrayList<>(decks * CARDS_PER_DECK);
        for (int d = 0; d < decks; d++) {
            for (Suit suit : Suit.values()) {
                for (Rank rank : Rank.values()) {
                    tmp.add(new Card(rank, suit));
                }
            }
        }
        return tmp;
    }

    /**
     * Deals and removes the next card.
     *
     * @return the dealt card
     * @throws IllegalStateException if the shoe is exhausted
     */
    public Card deal() {
        Card card = cards.pollFirst();
        if (card == null) {
            throw new IllegalStateException("Shoe is exhausted");
        }
        return card;
    }

    public int size() {
        return cards.size();
    }

    public boolean isEmpty() {
        return cards.isEmpty();
    }

    /**
     * Returns a snapshot of the remaining cards in deal order.
     *
     * @return an unmodifiable copy of the shoe's cards
     */
    public List<Card> asUnmodifiableList() {
        return Collections.unmodifiableList(new ArrayList<>(cards));
    }

    @Override
    public String toString() {
        return "Shoe(size=" + cards.size() + ")";
    }
}
