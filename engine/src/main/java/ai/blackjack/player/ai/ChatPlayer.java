package ai.blackjack.player.ai;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.RoundContext;
import ai.blackjack.player.AIPlayer;
import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;

/**
 * Base class for players backed by a chat model through Spring AI's {@link ChatClient}.
 * <p>
 * Every question is sent with a system prompt describing the table rules and a user prompt
 * describing the situation; the model replies with a structured object ({@link ChatBet},
 * {@link ChatInsurance} or {@link ChatDecision}). Answers that fail, cannot be parsed or are
 * not among the offered options fall back to the safe defaults of {@link AIPlayer}.
 */
public abstract class ChatPlayer extends AIPlayer {
    private static final Logger log = LoggerFactory.getLogger(ChatPlayer.class);

    static final String SYSTEM_PROMPT = """
            # Role and Objective
            - You are an expert Blackjack player. Your goal is to maximise winnings over many rounds.
            - Answer only with the JSON object requested; keep the reasoning to one short sentence.

            # Table Rules
            - Cards 2-10 count face value, J/Q/K count 10, an Ace counts 11 or 1.
            - A Blackjack is an Ace with a ten-valued card as the first two cards; it pays 3:2.
              Two cards totalling 21 after a split are an ordinary 21.
            - The dealer hits below 17 and stands on 17 or more, soft 17 included.
            - Double down: double the bet, receive exactly one more card.
            - Split: a pair becomes two hands with equal bets; only one split per round.
              Split Aces receive one card each and cannot be played further.
            - Surrender: give up the hand and get half the bet back.
              Double down, split and surrender are only possible as the first action on a hand.
            - Insurance costs half the bet and pays 2:1 when the dealer has Blackjack.

            # Instructions
            - When a list of options is given, choose exactly one of them, spelled as listed.
            """;

    private final ChatClient chatClient;
    private final String providerName;

    protected ChatPlayer(ChatClient chatClient, String providerName) {
        this.chatClient = chatClient;
        this.providerName = providerName;
    }

    @Override
    public BigDecimal chooseBet(List<BigDecimal> availableBets) {
        BigDecimal fallback = minimumBet(availableBets);
        if (fallback == null) {
            return null;
        }
        String options = availableBets.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", "));
        String prompt = "Choose your bet for the next round.\n"
                + "Options: " + options + "\n"
                + "Use sensible bankroll management.";
        try {
            ChatBet answer = ask(prompt, ChatBet.class);
            if (answer != null && answer.getBetAmount() != null) {
                for (BigDecimal offered : availableBets) {
                    if (offered.compareTo(answer.getBetAmount()) == 0) {
                        logReasoning("bet " + offered, answer.getReasoning());
                        return offered;
                    }
                }
                log.warn("{} chose a bet that was not offered: {}", providerName, answer.getBetAmount());
            }
        } catch (RuntimeException e) {
            log.warn("{} bet request failed, using minimum bet: {}", providerName, e.toString());
        }
        return fallback;
    }

    @Override
    public boolean decideInsurance(RoundContext context) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("The dealer shows an Ace. Do you take insurance?\n");
        prompt.append("- Your primary bet: ").append(context.getPrimaryBet().toPlainString()).append('\n');
        prompt.append("- Insurance would cost: ")
                .append(context.getPrimaryBet().divide(BigDecimal.valueOf(2)).toPlainString()).append('\n');
        prompt.append("- Your chips: ").append(context.getSeatChips().toPlainString()).append('\n');
        if (context.getProbHoleCardIsTen().isPresent()) {
            prompt.append(String.format(Locale.ROOT, "- Chance the hole card is ten-valued: %.3f%n",
                    context.getProbHoleCardIsTen().getAsDouble()));
        }
        prompt.append("- Visible cards: ").append(shortNames(context.getCardsVisible()));
        try {
            ChatInsurance answer = ask(prompt.toString(), ChatInsurance.class);
            if (answer != null) {
                logReasoning("insurance " + answer.isTakeInsurance(), answer.getReasoning());
                return answer.isTakeInsurance();
            }
        } catch (RuntimeException e) {
            log.warn("{} insurance request failed, declining: {}", providerName, e.toString());
        }
        return false;
    }

    @Override
    public Decision decide(Hand hand, Card dealerUpcard, RoundContext context, List<Decision> legalDecisions) {
        String prompt = buildDecisionPrompt(hand, dealerUpcard, context, legalDecisions);
        if (log.isTraceEnabled()) {
            log.trace("{} prompt (user): {}", providerName, prompt);
        }
        try {
            ChatDecision answer = ask(prompt, ChatDecision.class);
            if (answer != null) {
                Decision decision = Decision.parse(answer.getDecision());
                if (decision != null && legalDecisions.contains(decision)) {
                    logReasoning(decision.getLabel(), answer.getReasoning());
                    return decision;
                }
                log.warn("{} chose an unavailable decision '{}', falling back", providerName, answer.getDecision());
            }
        } catch (RuntimeException e) {
            log.warn("{} decision request failed, falling back: {}", providerName, e.toString());
        }
        return safeDefault(legalDecisions);
    }

    static String buildDecisionPrompt(Hand hand, Card dealerUpcard, RoundContext context,
            List<Decision> legalDecisions) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Current situation:\n");
        prompt.append("- Your hand: ").append(shortNames(hand.getCards()))
                .append(" (total ").append(hand.value()).append(hand.isSoft() ? ", soft" : "").append(")\n");
        prompt.append("- Dealer's upcard: ").append(dealerUpcard.shortName()).append('\n');
        prompt.append("- Hands you hold: ").append(context.getNumHands()).append('\n');
        prompt.append("- Players at the table: ").append(context.getNumParticipants()).append('\n');
        prompt.append("- Visible cards: ").append(shortNames(context.getCardsVisible())).append('\n');
        prompt.append("Options: ")
                .append(legalDecisions.stream().map(Decision::getLabel).collect(Collectors.joining(", ")));
        return prompt.toString();
    }

    /**
     * Sends one question to the model and maps the reply onto {@code type}.
     * Subclasses may wrap this with provider-specific retry handling.
     */
    protected <T> T ask(String userPrompt, Class<T> type) {
        return chatClient.prompt()
                .system(SYSTEM_PROMPT)
                .user(userPrompt)
                .call()
                .entity(type);
    }

    private void logReasoning(String choice, String reasoning) {
        if (log.isDebugEnabled()) {
            log.debug("{} chose {}: {}", providerName, choice, reasoning);
        }
    }

    private static String shortNames(List<Card> cards) {
        return cards.stream().map(Card::shortName).collect(Collectors.joining(" "));
    }
}
