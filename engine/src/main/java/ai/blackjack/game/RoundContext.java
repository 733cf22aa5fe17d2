package ai.blackjack.game;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Immutable snapshot of what a participant may see when asked for a decision.
 * <p>
 * The round engine rebuilds the snapshot for every question it asks, so the
 * visible cards include everything dealt face up so far (every participant's
 * cards plus the dealer's upcard) and the hand count reflects completed splits.
 * The hole-card probability is only present while insurance is being offered.
 */
public final class RoundContext {
    private final int numParticipants;
    private final List<Card> cardsVisible;
    private final int numHands;
    private final BigDecimal seatChips;
    private final BigDecimal primaryBet;
    private final OptionalDouble probHoleCardIsTen;

    public RoundContext(
            int numParticipants,
            List<Card> cardsVisible,
            int numHands,
            BigDecimal seatChips,
            BigDecimal primaryBet,
            OptionalDouble probHoleCardIsTen) {
        this.numParticipants = numParticipants;
        this.cardsVisible = Collections.unmodifiableList(new ArrayList<>(cardsVisible));
        this.numHands = numHands;
        this.seatChips = seatChips;
        this.primaryBet = primaryBet;
        this.probHoleCardIsTen = probHoleCardIsTen == null ? OptionalDouble.empty() : probHoleCardIsTen;
    }

    /**
     * @return number of participants dealt into the round (the dealer excluded)
     */
    public int getNumParticipants() {
        return numParticipants;
    }

    /**
     * @return face-up cards in the order they became visible
     */
    public List<Card> getCardsVisible() {
        return cardsVisible;
    }

    /**
     * @return number of hands the asked participant currently holds (2 after a split)
     */
    public int getNumHands() {
        return numHands;
    }

    /**
     * @return the asked participant's chip balance at the time of the question
     */
    public BigDecimal getSeatChips() {
        return seatChips;
    }

    /**
     * @return the bet on the asked participant's first hand
     */
    public BigDecimal getPrimaryBet() {
        return primaryBet;
    }

    /**
     * @return chance that the dealer's hole card is ten-valued; present during insurance only
     */
    public OptionalDouble getProbHoleCardIsTen() {
        return probHoleCardIsTen;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("participants=").append(numParticipants);
        sb.append(", hands=").append(numHands);
        sb.append(", chips=").append(seatChips);
        sb.append(", primaryBet=").append(primaryBet);
        sb.append(", cardsVisible=[");
        for (int i = 0; i < cardsVisible.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(cardsVisible.get(i).shortName());
        }
        sb.append(']');
        if (probHoleCardIsTen.isPresent()) {
            sb.append(String.format(", probHoleCardIsTen=%.3f", probHoleCardIsTen.getAsDouble()));
        }
        return sb.toString();
    }
}
