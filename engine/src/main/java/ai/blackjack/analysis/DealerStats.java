package ai.blackjack.analysis;

import java.math.BigDecimal;

/**
 * Dealer-side totals across a round history. House profit is the negated sum of the players' net results.
 */
public class DealerStats {
    private int rounds;
    private int busts;
    private int blackjacks;
    private BigDecimal houseProfit = BigDecimal.ZERO;

    void addRound(boolean busted, boolean blackjack) {
        rounds++;
        if (busted) {
            busts++;
        }
        if (blackjack) {
            blackjacks++;
        }
    }

    void addPlayerNet(BigDecimal net) {
        houseProfit = houseProfit.subtract(net);
    }

    public int getRounds() {
        return rounds;
    }

    public int getBusts() {
        return busts;
    }

    public int getBlackjacks() {
        return blackjacks;
    }

    public double getBustRate() {
        return rounds == 0 ? 0.0 : (double) busts / rounds;
    }

    public double getBlackjackRate() {
        return rounds == 0 ? 0.0 : (double) blackjacks / rounds;
    }

    public BigDecimal getHouseProfit() {
        return houseProfit;
    }
}
