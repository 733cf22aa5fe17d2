package ai.blackjack.game;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.List;

/**
 * One hand together with the bet that funds it.
 * <p>
 * Keeping hand and bet in the same object means a split can never leave the two
 * out of step. The outcome is assigned exactly once; the payout is the gross amount
 * returned to the seat for this hand (the half refund for a surrender, the
 * settlement credit otherwise).
 */
public class SeatHand {
    private final Hand hand;
    private BigDecimal bet;
    private Outcome outcome;
    private BigDecimal payout = BigDecimal.ZERO;
    private List<String> initialCards = Collections.emptyList();
    private boolean frozen;

    SeatHand(Hand hand, BigDecimal bet) {
        this.hand = hand;
        this.bet = bet;
    }

    /** The cards of this hand. */
    public Hand getHand() {
        return hand;
    }

    /** Current stake on this hand, including any double-down top-up. */
    public BigDecimal getBet() {
        return bet;
    }

    void setBet(BigDecimal bet) {
        this.bet = bet;
    }

    /**
     * @return the outcome, or {@code null} while the hand is unresolved
     */
    public Outcome getOutcome() {
        return outcome;
    }

    public boolean hasOutcome() {
        return outcome != null;
    }

    /**
     * Assigns the hand's outcome.
     *
     * @throws IllegalStateException if an outcome was already assigned
     */
    void resolve(Outcome outcome) {
        if (this.outcome != null) {
            throw new IllegalStateException("Outcome already assigned (" + this.outcome + "), cannot assign " + outcome);
        }
        this.outcome = outcome;
    }

    /**
     * @return gross amount credited back to the seat for this hand so far
     */
    public BigDecimal getPayout() {
        return payout;
    }

    void addPayout(BigDecimal amount) {
        this.payout = this.payout.add(amount);
    }

    /**
     * @return net result of the hand: payout minus the (final) bet
     */
    public BigDecimal getNet() {
        return payout.subtract(bet);
    }

    /**
     * @return short names of the cards the hand held when it first became playable
     */
    public List<String> getInitialCards() {
        return initialCards;
    }

    void captureInitialCards() {
        this.initialCards = Collections.unmodifiableList(hand.shortNames());
    }

    /**
     * Split aces receive a single card each and take no further decisions.
     */
    public boolean isFrozen() {
        return frozen;
    }

    void freeze() {
        this.frozen = true;
    }

    @Override
    public String toString() {
        return hand + " (bet " + bet + (outcome == null ? "" : ", " + outcome) + ")";
    }
}
