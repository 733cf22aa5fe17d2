package ai.blackjack.game;

import ai.blackjack.config.TableConfig;
import java.math.BigDecimal;

/**
 * Settlement arithmetic. All amounts are gross: the stake is included in what is returned.
 */
public final class Payouts {
    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    private Payouts() {
    }

    /**
     * Gross amount credited for a settled hand.
     * <ul>
     * <li>Blackjack: {@code bet * ratio + bet}, where the ratio is the split ratio for a split hand</li>
     * <li>Win: {@code 2 * bet}</li>
     * <li>Push: {@code bet}</li>
     * <li>Loss, Bust: nothing</li>
     * <li>Surrender: nothing here, the half refund is paid when the hand is surrendered</li>
     * </ul>
     */
    public static BigDecimal forOutcome(Outcome outcome, BigDecimal bet, boolean fromSplit, TableConfig config) {
        switch (outcome) {
            case BLACKJACK:
                BigDecimal ratio = fromSplit ? config.getSplitBlackjackPayoutRatio() : config.getBlackjackPayoutRatio();
                return bet.multiply(ratio).add(bet);
            case WIN:
                return bet.multiply(TWO);
            case PUSH:
                return bet;
            case LOSS:
            case BUST:
            case SURRENDER:
            default:
                return BigDecimal.ZERO;
        }
    }

    /**
     * Gross amount credited for an insurance side bet when the dealer has Blackjack.
     */
    public static BigDecimal forInsurance(BigDecimal insuranceBet, TableConfig config) {
        return insuranceBet.multiply(config.getInsurancePayoutRatio());
    }

    /**
     * Outcome of a live (not bust, not surrendered) hand compared against the dealer's final hand.
     */
    public static Outcome compare(Hand player, Hand dealer) {
        if (dealer.isBust()) {
            return Outcome.WIN;
        }
        int playerValue = player.value();
        int dealerValue = dealer.value();
        if (playerValue > dealerValue) {
            return Outcome.WIN;
        }
        if (playerValue < dealerValue) {
            return Outcome.LOSS;
        }
        return Outcome.PUSH;
    }
}
