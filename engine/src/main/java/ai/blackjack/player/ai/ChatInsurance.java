package ai.blackjack.player.ai;

/**
 * Structured answer expected from a chat model when offered insurance.
 */
public class ChatInsurance {
    private boolean takeInsurance;
    private String reasoning;

    public ChatInsurance() {
    }

    public ChatInsurance(boolean takeInsurance, String reasoning) {
        this.takeInsurance = takeInsurance;
        this.reasoning = reasoning;
    }

    public boolean isTakeInsurance() {
        return takeInsurance;
    }

    public void setTakeInsurance(boolean takeInsurance) {
        this.takeInsurance = takeInsurance;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }
}
