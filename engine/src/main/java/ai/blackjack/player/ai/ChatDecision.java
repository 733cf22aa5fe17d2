package ai.blackjack.player.ai;

/**
 * Structured answer expected from a chat model when asked for a hand decision.
 */
public class ChatDecision {
    /** One of the offered decision labels, e.g. "hit" or "double-down". */
    private String decision;
    private String reasoning;

    public ChatDecision() {
    }

    public ChatDecision(String decision, String reasoning) {
        this.decision = decision;
        this.reasoning = reasoning;
    }

    public String getDecision() {
        return decision;
    }

    public void setDecision(String decision) {
        this.decision = decision;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }
}
