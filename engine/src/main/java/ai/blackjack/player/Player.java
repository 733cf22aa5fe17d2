package ai.blackjack.player;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.RoundContext;
import java.math.BigDecimal;
import java.util.List;

/**
 * Decision provider for one seat at the table.
 * <p>
 * The round engine asks three kinds of question: how much to bet, whether to
 * take insurance, and what to do with a hand. Implementations may be interactive,
 * rule-based, random, or backed by a remote model; the engine treats them alike
 * and validates every answer itself, so a provider never has to be trusted.
 */
public interface Player {

    /**
     * Chooses the stake for the coming round.
     *
     * @param availableBets the configured bet sizes the seat can currently afford, ascending
     * @return the stake; a value the engine cannot accept is replaced by the smallest available bet
     */
    BigDecimal chooseBet(List<BigDecimal> availableBets);

    /**
     * Chooses the next action for a hand.
     *
     * @param hand           the hand being played (read-only)
     * @param dealerUpcard   the dealer's face-up card
     * @param context        snapshot of the round as seen from this seat
     * @param legalDecisions decisions the engine will accept right now
     * @return the requested decision; {@code null} or an illegal decision is treated as stand
     */
    Decision decide(Hand hand, Card dealerUpcard, RoundContext context, List<Decision> legalDecisions);

    /**
     * Asked once per round of every seat in play when the dealer shows an Ace. A {@code true}
     * answer is ignored if the seat cannot cover the insurance.
     * {@link RoundContext#getProbHoleCardIsTen()} is populated for this call.
     *
     * @return {@code true} to buy insurance for half the primary bet
     */
    boolean decideInsurance(RoundContext context);
}
