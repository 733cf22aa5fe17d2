package ai.blackjack.game;

import ai.blackjack.player.Player;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A participant at the table: a name, a chip balance, the decision provider
 * that plays for it, and the hands (each with its own bet) it holds this round.
 * <p>
 * All chip movements go through this class. Bets are debited when staked,
 * doubled or split; the round engine credits payouts at settlement. Operations
 * the seat cannot fund are refused and leave the state unchanged.
 */
public class Seat {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private final int seatNumber;
    private final String name;
    private final Player player;
    private BigDecimal chips;
    private final List<SeatHand> hands = new ArrayList<>();
    private BigDecimal insuranceBet = BigDecimal.ZERO;
    private BigDecimal insurancePayout = BigDecimal.ZERO;
    private int handTarget = Hand.BLACKJACK_VALUE;

    public Seat(int seatNumber, String name, BigDecimal chips, Player player) {
        if (chips == null || chips.signum() < 0) {
            throw new IllegalArgumentException("Chips must be non-negative: " + chips);
        }
        this.seatNumber = seatNumber;
        this.name = Objects.requireNonNull(name, "name");
        this.chips = chips;
        this.player = Objects.requireNonNull(player, "player");
    }

    /** Position at the table; seats act in ascending order. */
    public int getSeatNumber() {
        return seatNumber;
    }

    /** Display name used in logs and round records. */
    public String getName() {
        return name;
    }

    /** The decision provider playing this seat. */
    public Player getPlayer() {
        return player;
    }

    /**
     * Current balance. Bets, doubles, splits and insurance are debited as they are placed.
     */
    public BigDecimal getChips() {
        return chips;
    }

    /**
     * Sets the target total for hands opened from now on. The table calls this with its configured value.
     */
    void useHandTarget(int target) {
        this.handTarget = target;
    }

    /**
     * @return the hands held this round, in play order; empty when the seat sits out
     */
    public List<SeatHand> getHands() {
        return Collections.unmodifiableList(hands);
    }

    /**
     * @throws IndexOutOfBoundsException if the seat holds no hand at {@code index}
     */
    public SeatHand getHand(int index) {
        return hands.get(index);
    }

    public boolean isInRound() {
        return !hands.isEmpty();
    }

    /** Zero unless insurance was taken this round. */
    public BigDecimal getInsuranceBet() {
        return insuranceBet;
    }

    public BigDecimal getInsurancePayout() {
        return insurancePayout;
    }

    /**
     * @return the bet on the first hand, or zero when the seat has no hand
     */
    public BigDecimal getPrimaryBet() {
        return hands.isEmpty() ? BigDecimal.ZERO : hands.get(0).getBet();
    }

    /**
     * Stakes a bet and opens the seat's first (empty) hand.
     *
     * @param amount stake to debit
     * @return {@link BetResult#ACCEPTED} or the reason the bet was refused
     * @throws IllegalStateException if the seat already holds a hand this round
     */
    public BetResult placeBet(BigDecimal amount) {
        if (!hands.isEmpty()) {
            throw new IllegalStateException(name + " already placed a bet this round");
        }
        if (amount == null || amount.signum() <= 0) {
            return BetResult.NON_POSITIVE;
        }
        if (amount.compareTo(chips) > 0) {
            return BetResult.INSUFFICIENT_CHIPS;
        }
        chips = chips.subtract(amount);
        hands.add(new SeatHand(new Hand(handTarget), amount));
        return BetResult.ACCEPTED;
    }

    /**
     * A split is allowed on a two-card pair, once per round, when the seat can
     * match the hand's bet.
     */
    public boolean canSplit(int index) {
        if (hands.size() != 1 || index != 0) {
            return false;
        }
        SeatHand seatHand = hands.get(0);
        return seatHand.getHand().isPair() && canAfford(seatHand.getBet());
    }

    /**
     * Moves the second card of the pair into a new hand carrying an equal,
     * newly debited bet. The new hand is appended after the existing ones.
     *
     * @return {@code false} (and no change) if the split is not allowed
     */
    boolean split(int index) {
        if (!canSplit(index)) {
            return false;
        }
        SeatHand original = hands.get(index);
        Card moved = original.getHand().splitOff();
        Hand second = new Hand(original.getHand().getTarget());
        second.addCard(moved);
        second.markFromSplit();
        chips = chips.subtract(original.getBet());
        hands.add(new SeatHand(second, original.getBet()));
        return true;
    }

    /**
     * Doubling is allowed on a two-card hand when the seat can match its bet.
     */
    public boolean canDoubleDown(int index) {
        SeatHand seatHand = hands.get(index);
        return seatHand.getHand().size() == 2 && canAfford(seatHand.getBet());
    }

    /**
     * Debits a second stake equal to the hand's bet and doubles the bet.
     *
     * @return {@code false} (and no change) if the double is not allowed
     */
    boolean doubleDown(int index) {
        if (!canDoubleDown(index)) {
            return false;
        }
        SeatHand seatHand = hands.get(index);
        chips = chips.subtract(seatHand.getBet());
        seatHand.setBet(seatHand.getBet().multiply(TWO));
        return true;
    }

    /**
     * Gives up the hand and refunds half of its bet immediately.
     *
     * @return the refunded amount
     */
    BigDecimal surrender(int index) {
        SeatHand seatHand = hands.get(index);
        BigDecimal refund = seatHand.getBet().divide(TWO);
        seatHand.resolve(Outcome.SURRENDER);
        seatHand.addPayout(refund);
        chips = chips.add(refund);
        return refund;
    }

    /**
     * Insurance costs half the primary bet.
     */
    public BigDecimal insuranceCost() {
        return getPrimaryBet().divide(TWO);
    }

    public boolean canInsure() {
        return isInRound() && insuranceBet.signum() == 0 && canAfford(insuranceCost());
    }

    /**
     * Debits the insurance side bet.
     *
     * @return {@code false} (and no change) if the seat cannot afford it or is already insured
     */
    boolean placeInsurance() {
        if (!canInsure()) {
            return false;
        }
        insuranceBet = insuranceCost();
        chips = chips.subtract(insuranceBet);
        return true;
    }

    void payInsurance(BigDecimal amount) {
        insurancePayout = insurancePayout.add(amount);
        chips = chips.add(amount);
    }

    /**
     * Credits a hand's settlement to the chip balance and records it on the hand.
     */
    void settle(SeatHand seatHand, BigDecimal amount) {
        seatHand.addPayout(amount);
        chips = chips.add(amount);
    }

    /**
     * Clears hands and insurance ahead of a new round. Chips carry over.
     */
    void resetForRound() {
        hands.clear();
        insuranceBet = BigDecimal.ZERO;
        insurancePayout = BigDecimal.ZERO;
    }

    private boolean canAfford(BigDecimal amount) {
        return chips.compareTo(amount) >= 0;
    }

    @Override
    public String toString() {
        return "Seat " + seatNumber + " (" + name + ", chips " + chips + ")";
    }
}
