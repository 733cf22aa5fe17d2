package ai.blackjack.game.record;

import ai.blackjack.game.Outcome;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Final state of one participant hand.
 */
@JsonPropertyOrder({"initial_hand", "final_hand", "final_value", "bet", "outcome", "payout", "net",
        "is_blackjack", "is_busted"})
public final class HandRecord {
    private final List<String> initialHand;
    private final List<String> finalHand;
    private final int finalValue;
    private final BigDecimal bet;
    private final Outcome outcome;
    private final BigDecimal payout;
    private final boolean blackjack;
    private final boolean busted;

    public HandRecord(List<String> initialHand, List<String> finalHand, int finalValue, BigDecimal bet,
            Outcome outcome, BigDecimal payout, boolean blackjack, boolean busted) {
        this.initialHand = Collections.unmodifiableList(new ArrayList<>(initialHand));
        this.finalHand = Collections.unmodifiableList(new ArrayList<>(finalHand));
        this.finalValue = finalValue;
        this.bet = bet;
        this.outcome = outcome;
        this.payout = payout;
        this.blackjack = blackjack;
        this.busted = busted;
    }

    @JsonProperty("initial_hand")
    public List<String> getInitialHand() {
        return initialHand;
    }

    @JsonProperty("final_hand")
    public List<String> getFinalHand() {
        return finalHand;
    }

    @JsonProperty("final_value")
    public int getFinalValue() {
        return finalValue;
    }

    @JsonProperty("bet")
    public BigDecimal getBet() {
        return bet;
    }

    @JsonProperty("outcome")
    public Outcome getOutcome() {
        return outcome;
    }

    /**
     * @return gross amount returned for the hand, including a surrender refund
     */
    @JsonProperty("payout")
    public BigDecimal getPayout() {
        return payout;
    }

    @JsonProperty("net")
    public BigDecimal getNet() {
        return payout.subtract(bet);
    }

    @JsonProperty("is_blackjack")
    public boolean isBlackjack() {
        return blackjack;
    }

    @JsonProperty("is_busted")
    public boolean isBusted() {
        return busted;
    }
}
