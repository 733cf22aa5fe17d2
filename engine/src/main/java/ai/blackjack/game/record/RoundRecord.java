package ai.blackjack.game.record;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable summary of one completed round, as returned by the table and written to the history file.
 */
@JsonPropertyOrder({"round_number", "dealer", "participants"})
public final class RoundRecord {
    private final int roundNumber;
    private final DealerRecord dealer;
    private final List<ParticipantRecord> participants;

    public RoundRecord(int roundNumber, DealerRecord dealer, List<ParticipantRecord> participants) {
        this.roundNumber = roundNumber;
        this.dealer = dealer;
        this.participants = Collections.unmodifiableList(new ArrayList<>(participants));
    }

    @JsonProperty("round_number")
    public int getRoundNumber() {
        return roundNumber;
    }

    @JsonProperty("dealer")
    public DealerRecord getDealer() {
        return dealer;
    }

    @JsonProperty("participants")
    public List<ParticipantRecord> getParticipants() {
        return participants;
    }

    /**
     * @return the participant record for the named seat, or {@code null} if there is none
     */
    public ParticipantRecord participant(String name) {
        for (ParticipantRecord p : participants) {
            if (p.getName().equals(name)) {
                return p;
            }
        }
        return null;
    }
}
