package ai.blackjack.player.ai.policy;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.RoundContext;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * DTO sent to the policy service's {@code /evaluate} endpoint: the hand, the dealer's
 * upcard, the decisions the engine will accept and what the seat can see of the round.
 * Cards are short names such as {@code "A♠"}; decisions are their labels.
 */
public class PolicyRequest {
    private final List<String> hand;
    private final int handValue;
    private final boolean soft;
    private final String dealerUpcard;
    private final List<String> legalDecisions;
    private final List<String> cardsVisible;
    private final int numHands;
    private final int numParticipants;
    private final BigDecimal seatChips;
    private final BigDecimal primaryBet;

    public PolicyRequest(
            List<String> hand,
            int handValue,
            boolean soft,
            String dealerUpcard,
            List<String> legalDecisions,
            List<String> cardsVisible,
            int numHands,
            int numParticipants,
            BigDecimal seatChips,
            BigDecimal primaryBet) {
        this.hand = hand;
        this.handValue = handValue;
        this.soft = soft;
        this.dealerUpcard = dealerUpcard;
        this.legalDecisions = legalDecisions;
        this.cardsVisible = cardsVisible;
        this.numHands = numHands;
        this.numParticipants = numParticipants;
        this.seatChips = seatChips;
        this.primaryBet = primaryBet;
    }

    @JsonProperty("hand")
    public List<String> getHand() {
        return hand;
    }

    @JsonProperty("hand_value")
    public int getHandValue() {
        return handValue;
    }

    @JsonProperty("is_soft")
    public boolean isSoft() {
        return soft;
    }

    @JsonProperty("dealer_upcard")
    public String getDealerUpcard() {
        return dealerUpcard;
    }

    @JsonProperty("legal_decisions")
    public List<String> getLegalDecisions() {
        return legalDecisions;
    }

    @JsonProperty("cards_visible")
    public List<String> getCardsVisible() {
        return cardsVisible;
    }

    @JsonProperty("num_hands")
    public int getNumHands() {
        return numHands;
    }

    @JsonProperty("num_participants")
    public int getNumParticipants() {
        return numParticipants;
    }

    @JsonProperty("seat_chips")
    public BigDecimal getSeatChips() {
        return seatChips;
    }

    @JsonProperty("primary_bet")
    public BigDecimal getPrimaryBet() {
        return primaryBet;
    }

    public static PolicyRequest fromState(Hand hand, Card dealerUpcard, RoundContext context,
            List<Decision> legalDecisions) {
        List<String> legal = new ArrayList<>(legalDecisions.size());
        for (Decision decision : legalDecisions) {
            legal.add(decision.getLabel());
        }
        List<String> visible = new ArrayList<>(context.getCardsVisible().size());
        for (Card card : context.getCardsVisible()) {
            visible.add(card.shortName());
        }
        return new PolicyRequest(
                hand.shortNames(),
                hand.value(),
                hand.isSoft(),
                dealerUpcard.shortName(),
                legal,
                visible,
                context.getNumHands(),
                context.getNumParticipants(),
                context.getSeatChips(),
                context.getPrimaryBet());
    }
}
