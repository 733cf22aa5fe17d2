package ai.blackjack.analysis;

import ai.blackjack.game.Outcome;
import ai.blackjack.game.record.HandRecord;
import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * Aggregated results for one player across a round history.
 * Blackjacks count as wins; busts and surrenders count as losses.
 */
public class PlayerStats {
    private final String name;
    private final int seat;
    private int handsPlayed;
    private BigDecimal totalWagered = BigDecimal.ZERO;
    private BigDecimal totalReturned = BigDecimal.ZERO;
    private BigDecimal finalChips = BigDecimal.ZERO;
    private int wins;
    private int losses;
    private int pushes;
    private int blackjacks;
    private int busts;
    private int surrenders;
    private final List<BigDecimal> handNets = new ArrayList<>();

    PlayerStats(String name, int seat) {
        this.name = name;
        this.seat = seat;
    }

    void add(HandRecord hand) {
        handsPlayed++;
        totalWagered = totalWagered.add(hand.getBet());
        totalReturned = totalReturned.add(hand.getPayout());
        handNets.add(hand.getNet());
        Outcome outcome = hand.getOutcome();
        if (outcome == null) {
            return;
        }
        switch (outcome) {
            case BLACKJACK:
                blackjacks++;
                break;
            case BUST:
                busts++;
                break;
            case SURRENDER:
                surrenders++;
                break;
            case PUSH:
                pushes++;
                break;
            default:
                break;
        }
        if (outcome.isWin()) {
            wins++;
        } else if (outcome.isLoss()) {
            losses++;
        }
    }

    void setFinalChips(BigDecimal finalChips) {
        this.finalChips = finalChips;
    }

    public String getName() {
        return name;
    }

    public int getSeat() {
        return seat;
    }

    public int getHandsPlayed() {
        return handsPlayed;
    }

    public BigDecimal getTotalWagered() {
        return totalWagered;
    }

    public BigDecimal getTotalReturned() {
        return totalReturned;
    }

    public BigDecimal getNetProfit() {
        return totalReturned.subtract(totalWagered);
    }

    public BigDecimal getFinalChips() {
        return finalChips;
    }

    public int getWins() {
        return wins;
    }

    public int getLosses() {
        return losses;
    }

    public int getPushes() {
        return pushes;
    }

    public int getBlackjacks() {
        return blackjacks;
    }

    public int getBusts() {
        return busts;
    }

    public int getSurrenders() {
        return surrenders;
    }

    public double getWinRate() {
        return rate(wins);
    }

    public double getLossRate() {
        return rate(losses);
    }

    public double getPushRate() {
        return rate(pushes);
    }

    public double getBlackjackRate() {
        return rate(blackjacks);
    }

    public double getBustRate() {
        return rate(busts);
    }

    public double getSurrenderRate() {
        return rate(surrenders);
    }

    /**
     * Return to player: total returned divided by total wagered, 0 when nothing was wagered.
     */
    public double getReturnToPlayer() {
        if (totalWagered.signum() == 0) {
            return 0.0;
        }
        return totalReturned.divide(totalWagered, MathContext.DECIMAL64).doubleValue();
    }

    /**
     * Population variance of the per-hand net results.
     */
    public double getNetVariance() {
        if (handNets.isEmpty()) {
            return 0.0;
        }
        double mean = 0.0;
        for (BigDecimal net : handNets) {
            mean += net.doubleValue();
        }
        mean /= handNets.size();
        double sumSquares = 0.0;
        for (BigDecimal net : handNets) {
            double d = net.doubleValue() - mean;
            sumSquares += d * d;
        }
        return sumSquares / handNets.size();
    }

    private double rate(int count) {
        return handsPlayed == 0 ? 0.0 : (double) count / handsPlayed;
    }
}
