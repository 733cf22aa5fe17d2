package ai.blackjack.game;

import java.util.Collections;
import java.util.List;

/**
 * The house hand. The first card dealt to the dealer is the upcard, the second the hole card.
 */
public class Dealer {
    private final int target;
    private Hand hand;
    private List<String> initialCards = Collections.emptyList();

    public Dealer() {
        this(Hand.BLACKJACK_VALUE);
    }

    Dealer(int target) {
        this.target = target;
        this.hand = new Hand(target);
    }

    public Hand getHand() {
        return hand;
    }

    /**
     * @return the face-up card
     * @throws IllegalStateException before the deal
     */
    public Card getUpcard() {
        if (hand.size() == 0) {
            throw new IllegalStateException("Dealer has no upcard yet");
        }
        return hand.getCards().get(0);
    }

    /**
     * Hits until the hand reaches the stand value. Soft totals are treated like hard ones.
     */
    void play(Shoe shoe, int standValue) {
        while (hand.value() < standValue) {
            hand.addCard(shoe.deal());
        }
    }

    void addCard(Card card) {
        hand.addCard(card);
    }

    public List<String> getInitialCards() {
        return initialCards;
    }

    void captureInitialCards() {
        initialCards = Collections.unmodifiableList(hand.shortNames());
    }

    void reset() {
        hand = new Hand(target);
        initialCards = Collections.emptyList();
    }

    @Override
    public String toString() {
        return "Dealer: " + hand + " (" + hand.value() + ")";
    }
}
