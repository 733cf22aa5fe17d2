package ai.blackjack.game;

/**
 * Phases a round moves through, in order. Insurance is skipped unless the dealer shows an Ace;
 * player turns and the dealer turn are skipped when a Blackjack ends the round early.
 */
public enum RoundPhase {
    SETUP,
    DEAL,
    INSURANCE,
    BLACKJACK_CHECK,
    PLAYER_TURNS,
    DEALER_TURN,
    OUTCOMES,
    SETTLEMENT,
    DONE
}
