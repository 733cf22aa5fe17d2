package ai.blackjack.player;

import ai.blackjack.game.Decision;
import ai.blackjack.game.RoundContext;
import java.math.BigDecimal;
import java.util.List;

/**
 * Base class for automated players with the safe defaults every provider falls back on:
 * the smallest offered bet, no insurance, and Stand (or the first legal decision when
 * Stand is not on offer).
 */
public abstract class AIPlayer implements Player {

    @Override
    public BigDecimal chooseBet(List<BigDecimal> availableBets) {
        return minimumBet(availableBets);
    }

    @Override
    public boolean decideInsurance(RoundContext context) {
        return false;
    }

    protected BigDecimal minimumBet(List<BigDecimal> availableBets) {
        if (availableBets == null || availableBets.isEmpty()) {
            return null;
        }
        return availableBets.get(0);
    }

    protected Decision safeDefault(List<Decision> legalDecisions) {
        if (legalDecisions == null || legalDecisions.isEmpty() || legalDecisions.contains(Decision.STAND)) {
            return Decision.STAND;
        }
        return legalDecisions.get(0);
    }

    /**
     * @return {@code candidate} if it is legal, otherwise the safe default
     */
    protected Decision legalOrDefault(Decision candidate, List<Decision> legalDecisions) {
        if (candidate != null && legalDecisions.contains(candidate)) {
            return candidate;
        }
        return safeDefault(legalDecisions);
    }
}
