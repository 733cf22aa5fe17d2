package ai.blackjack.game.record;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The dealer's hand as dealt and as finished.
 */
@JsonPropertyOrder({"initial_hand", "final_hand", "final_value", "is_blackjack", "is_busted"})
public final class DealerRecord {
    private final List<String> initialHand;
    private final List<String> finalHand;
    private final int finalValue;
    private final boolean blackjack;
    private final boolean busted;

    public DealerRecord(List<String> initialHand, List<String> finalHand, int finalValue, boolean blackjack,
            boolean busted) {
        this.initialHand = Collections.unmodifiableList(new ArrayList<>(initialHand));
        this.finalHand = Collections.unmodifiableList(new ArrayList<>(finalHand));
        this.finalValue = finalValue;
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

    @JsonProperty("is_blackjack")
    public boolean isBlackjack() {
        return blackjack;
    }

    @JsonProperty("is_busted")
    public boolean isBusted() {
        return busted;
    }
}
