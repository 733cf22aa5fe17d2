package ai.blackjack.player.ai.policy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * DTO for the policy service's reply: the decision it recommends, its value estimate for the
 * hand, and optionally a score per legal decision.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PolicyResponse {

    @JsonProperty("chosen_decision")
    private String chosenDecision;

    /** Expected net result of the hand in units of the bet. */
    @JsonProperty("expected_value")
    private double expectedValue;

    @JsonProperty("decision_scores")
    private List<DecisionScore> decisionScores;

    public PolicyResponse() {
        // for JSON binding
    }

    public String getChosenDecision() {
        return chosenDecision;
    }

    public void setChosenDecision(String chosenDecision) {
        this.chosenDecision = chosenDecision;
    }

    public double getExpectedValue() {
        return expectedValue;
    }

    public void setExpectedValue(double expectedValue) {
        this.expectedValue = expectedValue;
    }

    public List<DecisionScore> getDecisionScores() {
        return decisionScores;
    }

    public void setDecisionScores(List<DecisionScore> decisionScores) {
        this.decisionScores = decisionScores;
    }

    /**
     * Policy output for one legal decision.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class DecisionScore {
        private String decision;
        private double probability;

        public String getDecision() {
            return decision;
        }

        public void setDecision(String decision) {
            this.decision = decision;
        }

        public double getProbability() {
            return probability;
        }

        public void setProbability(double probability) {
            this.probability = probability;
        }
    }
}
