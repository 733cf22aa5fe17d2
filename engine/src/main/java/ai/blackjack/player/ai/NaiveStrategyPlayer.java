package ai.blackjack.player.ai;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.RoundContext;
import ai.blackjack.player.AIPlayer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Random;

/**
 * Baseline player that picks uniformly at random: any legal decision, any offered bet,
 * and a coin flip for insurance. A seeded {@link Random} makes runs reproducible.
 */
public class NaiveStrategyPlayer extends AIPlayer {
    private final Random random;

    public NaiveStrategyPlayer() {
        this(new Random());
    }

    public NaiveStrategyPlayer(Random random) {
        this.random = random;
    }

    @Override
    public BigDecimal chooseBet(List<BigDecimal> availableBets) {
        if (availableBets == null || availableBets.isEmpty()) {
            return null;
        }
        return availableBets.get(random.nextInt(availableBets.size()));
    }

    @Override
    public boolean decideInsurance(RoundContext context) {
        return random.nextBoolean();
    }

    @Override
    public Decision decide(Hand hand, Card dealerUpcard, RoundContext context, List<Decision> legalDecisions) {
        if (legalDecisions == null || legalDecisions.isEmpty()) {
            return Decision.STAND;
        }
        return legalDecisions.get(random.nextInt(legalDecisions.size()));
    }
}
