package ai.blackjack.player.ai;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.Rank;
import ai.blackjack.game.RoundContext;
import ai.blackjack.player.AIPlayer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic basic-strategy player.
 * <p>
 * The chart is applied in three stages: pairs (only when a split is on offer), soft totals,
 * then hard totals. Doubles and surrenders are only chosen when legal; otherwise the chart's
 * fallback (hit or stand) is played. Insurance is taken when the chance of a ten-valued hole
 * card reaches {@link #INSURANCE_THRESHOLD}. Always bets the smallest offered size.
 */
public class BasicStrategyPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(BasicStrategyPlayer.class);

    /** Minimum chance of a ten-valued hole card for insurance to be taken. */
    public static final double INSURANCE_THRESHOLD = 0.3;

    @Override
    public boolean decideInsurance(RoundContext context) {
        if (context == null || context.getProbHoleCardIsTen().isEmpty()) {
            return false;
        }
        return context.getProbHoleCardIsTen().getAsDouble() >= INSURANCE_THRESHOLD;
    }

    @Override
    public Decision decide(Hand hand, Card dealerUpcard, RoundContext context, List<Decision> legalDecisions) {
        Decision decision = legalOrDefault(chart(hand, dealerUpcard.getValue(), legalDecisions), legalDecisions);
        if (log.isDebugEnabled()) {
            log.debug("Basic strategy: {} ({}) vs {} -> {}", hand, hand.value(), dealerUpcard.shortName(), decision);
        }
        return decision;
    }

    private Decision chart(Hand hand, int dealer, List<Decision> legal) {
        if (legal.contains(Decision.SPLIT)) {
            Decision pair = pair(hand.getCards().get(0).getRank(), dealer);
            if (pair != null) {
                return pair;
            }
        }
        int total = hand.value();
        if (hand.isSoft()) {
            return soft(total, dealer, legal);
        }
        return hard(total, dealer, legal);
    }

    /**
     * @return the pair decision, or {@code null} to play the hand as an ordinary total
     */
    private Decision pair(Rank rank, int dealer) {
        switch (rank) {
            case ACE:
            case EIGHT:
                return Decision.SPLIT;
            case TEN:
            case JACK:
            case QUEEN:
            case KING:
                return Decision.STAND;
            case NINE:
                return (dealer <= 6 || dealer == 8 || dealer == 9) ? Decision.SPLIT : Decision.STAND;
            case SEVEN:
                return dealer <= 7 ? Decision.SPLIT : Decision.HIT;
            case SIX:
                return dealer <= 6 ? Decision.SPLIT : Decision.HIT;
            case TWO:
            case THREE:
                return dealer <= 7 ? Decision.SPLIT : Decision.HIT;
            case FOUR:
            case FIVE:
            default:
                return null;
        }
    }

    private Decision soft(int total, int dealer, List<Decision> legal) {
        boolean canDouble = legal.contains(Decision.DOUBLE_DOWN);
        if (total >= 19) {
            return Decision.STAND;
        }
        if (total == 18) {
            if (canDouble && dealer >= 3 && dealer <= 6) {
                return Decision.DOUBLE_DOWN;
            }
            return (dealer >= 9) ? Decision.HIT : Decision.STAND;
        }
        if (total == 17) {
            return (canDouble && dealer >= 3 && dealer <= 6) ? Decision.DOUBLE_DOWN : Decision.HIT;
        }
        if (total == 15 || total == 16) {
            return (canDouble && dealer >= 4 && dealer <= 6) ? Decision.DOUBLE_DOWN : Decision.HIT;
        }
        return (canDouble && (dealer == 5 || dealer == 6)) ? Decision.DOUBLE_DOWN : Decision.HIT;
    }

    private Decision hard(int total, int dealer, List<Decision> legal) {
        boolean canDouble = legal.contains(Decision.DOUBLE_DOWN);
        boolean canSurrender = legal.contains(Decision.SURRENDER);
        if (total >= 17) {
            return Decision.STAND;
        }
        if (total >= 13) {
            if (canSurrender && ((total == 16 && dealer >= 9) || (total == 15 && dealer == 10))) {
                return Decision.SURRENDER;
            }
            return dealer <= 6 ? Decision.STAND : Decision.HIT;
        }
        if (total == 12) {
            return (dealer >= 4 && dealer <= 6) ? Decision.STAND : Decision.HIT;
        }
        if (total == 11) {
            return (canDouble && dealer != 11) ? Decision.DOUBLE_DOWN : Decision.HIT;
        }
        if (total == 10) {
            return (canDouble && dealer <= 9) ? Decision.DOUBLE_DOWN : Decision.HIT;
        }
        if (total == 9) {
            return (canDouble && dealer >= 3 && dealer <= 6) ? Decision.DOUBLE_DOWN : Decision.HIT;
        }
        return Decision.HIT;
    }
}
