package ai.blackjack.analysis;

import ai.blackjack.game.record.HandRecord;
import ai.blackjack.game.record.ParticipantRecord;
import ai.blackjack.game.record.RoundRecord;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Aggregates a round history into per-player and dealer statistics and renders them
 * as a markdown report.
 */
public class ResultsAnalyzer {
    private static final String PLAYER_HEADER =
            "| Player | Seat | Hands | Wagered | Returned | Net | Final Chips | Win % | Loss % | Push % | Blackjack % | Bust % | Surrender % | RTP | Net Variance |";
    private static final String PLAYER_DIVIDER =
            "|--------|------|-------|---------|----------|-----|-------------|-------|--------|--------|-------------|--------|-------------|-----|--------------|";

    private final int totalRounds;
    private final Map<String, PlayerStats> playerStats = new LinkedHashMap<>();
    private final DealerStats dealerStats = new DealerStats();
    private BigDecimal totalWagered = BigDecimal.ZERO;
    private int totalHands;

    public ResultsAnalyzer(List<RoundRecord> history) {
        this.totalRounds = history.size();
        for (RoundRecord round : history) {
            dealerStats.addRound(round.getDealer().isBusted(), round.getDealer().isBlackjack());
            for (ParticipantRecord participant : round.getParticipants()) {
                PlayerStats stats = playerStats.computeIfAbsent(participant.getName(),
                        name -> new PlayerStats(name, participant.getSeat()));
                stats.setFinalChips(participant.getChipsAfter());
                for (HandRecord hand : participant.getHands()) {
                    stats.add(hand);
                    totalHands++;
                    totalWagered = totalWagered.add(hand.getBet());
                    dealerStats.addPlayerNet(hand.getNet());
                }
            }
        }
    }

    public int getTotalRounds() {
        return totalRounds;
    }

    public int getTotalHands() {
        return totalHands;
    }

    public BigDecimal getTotalWagered() {
        return totalWagered;
    }

    public DealerStats getDealerStats() {
        return dealerStats;
    }

    /**
     * @return stats per player, in order of first appearance
     */
    public List<PlayerStats> getPlayerStats() {
        return Collections.unmodifiableList(new ArrayList<>(playerStats.values()));
    }

    /**
     * @return stats for the named player, or {@code null} if the player never appeared
     */
    public PlayerStats getPlayerStats(String name) {
        return playerStats.get(name);
    }

    public String formatReport(Duration duration) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Blackjack simulation report\n\n");
        sb.append("| Rounds | Hands | Total Wagered | Duration |\n");
        sb.append("|--------|-------|---------------|----------|\n");
        sb.append(String.format(Locale.ROOT, "| %d | %d | %s | %.3fs |%n%n",
                totalRounds, totalHands, totalWagered.toPlainString(), duration.toMillis() / 1000.0));

        sb.append("### Dealer\n\n");
        sb.append("| Rounds | Busts | Bust % | Blackjacks | Blackjack % | House Profit |\n");
        sb.append("|--------|-------|--------|------------|-------------|--------------|\n");
        sb.append(String.format(Locale.ROOT, "| %d | %d | %.2f%% | %d | %.2f%% | %s |%n%n",
                dealerStats.getRounds(),
                dealerStats.getBusts(),
                dealerStats.getBustRate() * 100.0,
                dealerStats.getBlackjacks(),
                dealerStats.getBlackjackRate() * 100.0,
                dealerStats.getHouseProfit().toPlainString()));

        sb.append("### Players\n\n");
        sb.append(PLAYER_HEADER).append('\n');
        sb.append(PLAYER_DIVIDER).append('\n');
        for (PlayerStats p : playerStats.values()) {
            sb.append(String.format(Locale.ROOT,
                    "| %s | %d | %d | %s | %s | %s | %s | %.2f%% | %.2f%% | %.2f%% | %.2f%% | %.2f%% | %.2f%% | %.2f%% | %.2f |%n",
                    p.getName(),
                    p.getSeat(),
                    p.getHandsPlayed(),
                    p.getTotalWagered().toPlainString(),
                    p.getTotalReturned().toPlainString(),
                    p.getNetProfit().toPlainString(),
                    p.getFinalChips().toPlainString(),
                    p.getWinRate() * 100.0,
                    p.getLossRate() * 100.0,
                    p.getPushRate() * 100.0,
                    p.getBlackjackRate() * 100.0,
                    p.getBustRate() * 100.0,
                    p.getSurrenderRate() * 100.0,
                    p.getReturnToPlayer() * 100.0,
                    p.getNetVariance()));
        }
        return sb.toString();
    }
}
