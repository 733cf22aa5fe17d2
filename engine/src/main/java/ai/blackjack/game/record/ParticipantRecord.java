package ai.blackjack.game.record;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One seat's round: chips before and after, insurance, and every hand it played.
 * A seat that sat the round out has no hands and unchanged chips.
 */
@JsonPropertyOrder({"name", "seat", "chips_before", "chips_after", "insurance_bet", "insurance_payout", "hands"})
public final class ParticipantRecord {
    private final String name;
    private final int seat;
    private final BigDecimal chipsBefore;
    private final BigDecimal chipsAfter;
    private final BigDecimal insuranceBet;
    private final BigDecimal insurancePayout;
    private final List<HandRecord> hands;

    public ParticipantRecord(String name, int seat, BigDecimal chipsBefore, BigDecimal chipsAfter,
            BigDecimal insuranceBet, BigDecimal insurancePayout, List<HandRecord> hands) {
        this.name = name;
        this.seat = seat;
        this.chipsBefore = chipsBefore;
        this.chipsAfter = chipsAfter;
        this.insuranceBet = insuranceBet;
        this.insurancePayout = insurancePayout;
        this.hands = Collections.unmodifiableList(new ArrayList<>(hands));
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("seat")
    public int getSeat() {
        return seat;
    }

    @JsonProperty("chips_before")
    public BigDecimal getChipsBefore() {
        return chipsBefore;
    }

    @JsonProperty("chips_after")
    public BigDecimal getChipsAfter() {
        return chipsAfter;
    }

    @JsonProperty("insurance_bet")
    public BigDecimal getInsuranceBet() {
        return insuranceBet;
    }

    @JsonProperty("insurance_payout")
    public BigDecimal getInsurancePayout() {
        return insurancePayout;
    }

    @JsonProperty("hands")
    public List<HandRecord> getHands() {
        return hands;
    }
}
