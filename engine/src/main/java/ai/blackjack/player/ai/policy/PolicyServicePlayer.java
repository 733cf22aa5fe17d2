package ai.blackjack.player.ai.policy;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.RoundContext;
import ai.blackjack.player.AIPlayer;
import ai.blackjack.player.ai.BasicStrategyPlayer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Player that delegates hand decisions to an external policy/value model service.
 * <p>
 * When the service is unavailable or recommends something the engine would not accept,
 * the player falls back to the safe default. Insurance uses the same probability threshold
 * as {@link BasicStrategyPlayer}; bets are always the smallest offered size.
 */
public class PolicyServicePlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(PolicyServicePlayer.class);

    private final PolicyServiceClient client;

    public PolicyServicePlayer(PolicyServiceClient client) {
        this.client = client;
    }

    @Override
    public boolean decideInsurance(RoundContext context) {
        return context.getProbHoleCardIsTen().isPresent()
                && context.getProbHoleCardIsTen().getAsDouble() >= BasicStrategyPlayer.INSURANCE_THRESHOLD;
    }

    @Override
    public Decision decide(Hand hand, Card dealerUpcard, RoundContext context, List<Decision> legalDecisions) {
        PolicyResponse response = client.evaluate(PolicyRequest.fromState(hand, dealerUpcard, context, legalDecisions));
        if (response == null) {
            return safeDefault(legalDecisions);
        }
        Decision decision = Decision.parse(response.getChosenDecision());
        if (decision == null || !legalDecisions.contains(decision)) {
            log.warn("Policy service chose '{}', which is not among {}; falling back",
                    response.getChosenDecision(), legalDecisions);
            return safeDefault(legalDecisions);
        }
        return decision;
    }
}
