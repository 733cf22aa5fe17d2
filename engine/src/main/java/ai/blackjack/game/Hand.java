package ai.blackjack.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered set of cards belonging to one bet.
 * <p>
 * Cards keep their deal order. The hand value is derived on demand: every card
 * is summed at its face value (Ace = 11), then Aces are downgraded to 1 one at a
 * time while the total exceeds the hand's target: {@link #BLACKJACK_VALUE} unless the
 * table is configured with another value.
 * <p>
 * Only the round engine (same package) adds or removes cards; decision
 * providers receive a read-only view.
 */
public class Hand {
    /** Default target total of the game. */
    public static final int BLACKJACK_VALUE = 21;

    private final List<Card> cards = new ArrayList<>();
    private final int target;
    private boolean fromSplit;

    public Hand() {
        this(BLACKJACK_VALUE);
    }

    Hand(int target) {
        this.target = target;
    }

    /**
     * Builds a hand holding the given cards in order, e.g. for strategy look-ups and tests.
     *
     * @param cards cards in deal order
     * @return a new non-split hand
     */
    public static Hand of(Card... cards) {
        Hand hand = new Hand();
        for (Card card : cards) {
            hand.cards.add(Objects.requireNonNull(card, "card"));
        }
        return hand;
    }

    void addCard(Card card) {
        cards.add(card);
    }

    /**
     * Removes the second card of a two-card pair so it can seed a new hand.
     * Both this hand and the hand built from the returned card are marked as split hands.
     *
     * @return the removed card
     * @throws IllegalStateException if the hand is not a two-card pair
     */
    Card splitOff() {
        if (!isPair()) {
            throw new IllegalStateException("Only a two-card pair can be split: " + this);
        }
        fromSplit = true;
        return cards.remove(1);
    }

    void markFromSplit() {
        this.fromSplit = true;
    }

    public List<Card> getCards() {
        return Collections.unmodifiableList(cards);
    }

    public int size() {
        return cards.size();
    }

    public boolean isFromSplit() {
        return fromSplit;
    }

    /**
     * @return the total this hand aims for and busts above
     */
    public int getTarget() {
        return target;
    }

    /**
     * Calculates the best total of the hand: Aces count 11 unless that would
     * bust the hand, in which case they are downgraded to 1 one at a time.
     *
     * @return the hand value
     */
    public int value() {
        int sum = 0;
        int aces = 0;
        for (Card c : cards) {
            sum += c.getValue();
            if (c.isAce()) {
                aces++;
            }
        }
        while (sum > target && aces > 0) {
            sum -= 10;
            aces--;
        }
        return sum;
    }

    /**
     * A hand is soft when at least one Ace is still counted as 11 and the total does not exceed the target.
     */
    public boolean isSoft() {
        int hard = 0;
        boolean hasAce = false;
        for (Card c : cards) {
            hard += c.isAce() ? 1 : c.getValue();
            hasAce |= c.isAce();
        }
        return hasAce && hard + 10 <= target;
    }

    /**
     * A natural: two cards worth the target that were dealt as such. A split hand
     * reaching the target on two cards is an ordinary total.
     */
    public boolean isBlackjack() {
        return cards.size() == 2 && value() == target && !fromSplit;
    }

    public boolean isBust() {
        return value() > target;
    }

    /**
     * @return {@code true} if the hand holds exactly two cards of the same rank
     */
    public boolean isPair() {
        return cards.size() == 2 && cards.get(0).getRank() == cards.get(1).getRank();
    }

    /**
     * Short names of the cards in deal order, e.g. {@code ["A♠", "9♦"]}.
     */
    public List<String> shortNames() {
        return cards.stream().map(Card::shortName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        if (cards.isEmpty()) {
            return "Empty Hand";
        }
        return cards.stream().map(Card::shortName).collect(Collectors.joining(", "));
    }
}
