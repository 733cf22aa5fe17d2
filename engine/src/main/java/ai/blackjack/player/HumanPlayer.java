package ai.blackjack.player;

import ai.blackjack.game.Card;
import ai.blackjack.game.Decision;
import ai.blackjack.game.Hand;
import ai.blackjack.game.RoundContext;
import java.io.InputStream;
import java.io.PrintStream;
import java.math.BigDecimal;
import java.util.List;
import java.util.Scanner;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Human player that answers the engine's questions from the console.
 * Invalid answers are re-prompted; when input ends the safe defaults apply
 * (smallest bet, no insurance, stand).
 */
public class HumanPlayer implements Player {
    private static final Pattern AMOUNT = Pattern.compile("\\d+(\\.\\d+)?");

    private final Scanner scanner;
    private final PrintStream out;

    public HumanPlayer() {
        this(System.in, System.out);
    }

    public HumanPlayer(InputStream in, PrintStream out) {
        this(new Scanner(in), out);
    }

    public HumanPlayer(Scanner scanner, PrintStream out) {
        this.scanner = scanner;
        this.out = out;
    }

    @Override
    public BigDecimal chooseBet(List<BigDecimal> availableBets) {
        String options = availableBets.stream().map(BigDecimal::toPlainString).collect(Collectors.joining(", "));
        while (true) {
            out.print("Place your bet (" + options + "): ");
            String line = readLine();
            if (line == null) {
                return availableBets.isEmpty() ? null : availableBets.get(0);
            }
            if (AMOUNT.matcher(line).matches()) {
                BigDecimal amount = new BigDecimal(line);
                for (BigDecimal offered : availableBets) {
                    if (offered.compareTo(amount) == 0) {
                        return offered;
                    }
                }
            }
            out.println("Please enter one of: " + options);
        }
    }

    @Override
    public Decision decide(Hand hand, Card dealerUpcard, RoundContext context, List<Decision> legalDecisions) {
        String cards = hand.getCards().stream().map(Card::toString).collect(Collectors.joining(" "));
        out.println("Dealer shows " + dealerUpcard + ". Your hand: " + cards + " (" + hand.value()
                + (hand.isSoft() ? " soft" : "") + ")");
        String options = legalDecisions.stream()
                .map(d -> d.getLabel() + " (" + d.getKey() + ")")
                .collect(Collectors.joining(", "));
        while (true) {
            out.print("Choose: " + options + ": ");
            String line = readLine();
            if (line == null) {
                return Decision.STAND;
            }
            Decision decision = Decision.parse(line);
            if (decision != null && legalDecisions.contains(decision)) {
                return decision;
            }
            out.println("Not a legal choice: " + line);
        }
    }

    @Override
    public boolean decideInsurance(RoundContext context) {
        while (true) {
            out.print("Dealer shows an Ace. Take insurance for " + context.getPrimaryBet()
                    .divide(BigDecimal.valueOf(2)).toPlainString() + "? (y/n): ");
            String line = readLine();
            if (line == null) {
                return false;
            }
            if (line.equalsIgnoreCase("y") || line.equalsIgnoreCase("yes")) {
                return true;
            }
            if (line.equalsIgnoreCase("n") || line.equalsIgnoreCase("no")) {
                return false;
            }
        }
    }

    private String readLine() {
        if (!scanner.hasNextLine()) {
            return null;
        }
        return scanner.nextLine().trim();
    }
}
