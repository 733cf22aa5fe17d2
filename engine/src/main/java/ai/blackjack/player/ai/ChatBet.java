package ai.blackjack.player.ai;

import java.math.BigDecimal;

/**
 * Structured answer expected from a chat model when asked for a stake.
 */
public class ChatBet {
    private BigDecimal betAmount;
    private String reasoning;

    public ChatBet() {
    }

    public ChatBet(BigDecimal betAmount, String reasoning) {
        this.betAmount = betAmount;
        this.reasoning = reasoning;
    }

    public BigDecimal getBetAmount() {
        return betAmount;
    }

    public void setBetAmount(BigDecimal betAmount) {
        this.betAmount = betAmount;
    }

    public String getReasoning() {
        return reasoning;
    }

    public void setReasoning(String reasoning) {
        this.reasoning = reasoning;
    }
}
