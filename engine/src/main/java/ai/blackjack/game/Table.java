package ai.blackjack.game;

import ai.blackjack.config.TableConfig;
import ai.blackjack.game.record.DealerRecord;
import ai.blackjack.game.record.HandRecord;
import ai.blackjack.game.record.ParticipantRecord;
import ai.blackjack.game.record.RoundRecord;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The round engine: one dealer, an ordered list of seats and the house rules.
 * <p>
 * {@link #playRound()} runs a complete round through the phases in {@link RoundPhase}
 * and returns its {@link RoundRecord}. Every round deals from a brand-new shoe; only
 * chip balances carry over from one round to the next. All decisions are delegated to
 * each seat's {@link ai.blackjack.player.Player} and checked against the legal
 * decisions before they are applied.
 */
public class Table {
    private static final Logger log = LoggerFactory.getLogger(Table.class);

    private final TableConfig config;
    private final List<Seat> seats;
    private final ShoeFactory shoeFactory;
    private final Dealer dealer;

    private int roundNumber;
    private RoundPhase phase = RoundPhase.DONE;
    private Shoe shoe;
    private final List<Seat> activeSeats = new ArrayList<>();
    private final List<Card> visibleCards = new ArrayList<>();

    public Table(TableConfig config, List<Seat> seats, Random random) {
        this(config, seats, ShoeFactory.shuffled(config.getDecks(), random));
    }

    /**
     * @throws IllegalArgumentException if there are no seats or two seats share a number
     */
    public Table(TableConfig config, List<Seat> seats, ShoeFactory shoeFactory) {
        this.config = Objects.requireNonNull(config, "config");
        this.shoeFactory = Objects.requireNonNull(shoeFactory, "shoeFactory");
        if (seats == null || seats.isEmpty()) {
            throw new IllegalArgumentException("A table needs at least one seat");
        }
        Set<Integer> numbers = new HashSet<>();
        for (Seat seat : seats) {
            if (!numbers.add(seat.getSeatNumber())) {
                throw new IllegalArgumentException("Duplicate seat number " + seat.getSeatNumber());
            }
        }
        this.seats = List.copyOf(seats);
        this.dealer = new Dealer(config.getBlackjackValue());
        for (Seat seat : this.seats) {
            seat.useHandTarget(config.getBlackjackValue());
        }
    }

    public TableConfig getConfig() {
        return config;
    }

    public List<Seat> getSeats() {
        return seats;
    }

    public Dealer getDealer() {
        return dealer;
    }

    public RoundPhase getPhase() {
        return phase;
    }

    /**
     * @return number of rounds started so far
     */
    public int getRoundNumber() {
        return roundNumber;
    }

    /**
     * @return {@code true} if at least one seat has enough chips to take part in a round
     */
    public boolean canPlayRound() {
        for (Seat seat : seats) {
            if (canSeatPlay(seat)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Plays one full round.
     *
     * @return the record of the round
     * @throws IllegalStateException if no seat can afford to play
     */
    public RoundRecord playRound() {
        if (!canPlayRound()) {
            throw new IllegalStateException("No seat has enough chips to play a round");
        }
        roundNumber++;
        Map<Seat, BigDecimal> chipsBefore = new IdentityHashMap<>();
        for (Seat seat : seats) {
            chipsBefore.put(seat, seat.getChips());
        }

        setup();
        deal();
        if (dealer.getUpcard().isAce()) {
            offerInsurance();
        }
        boolean dealerBlackjack = checkBlackjacks();
        if (!dealerBlackjack) {
            playerTurns();
            if (anyUnresolvedHand()) {
                dealerTurn();
            }
            determineOutcomes();
        }
        settle();
        enter(RoundPhase.DONE);
        return buildRecord(chipsBefore);
    }

    private void setup() {
        enter(RoundPhase.SETUP);
        shoe = shoeFactory.newShoe();
        dealer.reset();
        visibleCards.clear();
        activeSeats.clear();
        for (Seat seat : seats) {
            seat.resetForRound();
            if (!canSeatPlay(seat)) {
                if (log.isDebugEnabled()) {
                    log.debug("{} sits out round {} with {} chips", seat.getName(), roundNumber, seat.getChips());
                }
                continue;
            }
            takeBet(seat);
            activeSeats.add(seat);
        }
    }

    private boolean canSeatPlay(Seat seat) {
        return seat.getChips().compareTo(config.getMinChipsToPlay()) >= 0
                && !config.availableBets(seat.getChips()).isEmpty();
    }

    private void takeBet(Seat seat) {
        List<BigDecimal> offered = config.availableBets(seat.getChips());
        BigDecimal requested = seat.getPlayer().chooseBet(offered);
        BetResult result = null;
        if (requested != null && containsAmount(offered, requested)) {
            result = seat.placeBet(requested);
        }
        if (result == null || !result.isAccepted()) {
            BigDecimal fallback = offered.get(0);
            log.warn("{} requested bet {} ({}); using {}", seat.getName(), requested,
                    result == null ? "not offered" : result, fallback);
            result = seat.placeBet(fallback);
            if (!result.isAccepted()) {
                throw new IllegalStateException("Minimum offered bet rejected for " + seat.getName() + ": " + result);
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("{} bets {}", seat.getName(), seat.getPrimaryBet());
        }
    }

    private static boolean containsAmount(List<BigDecimal> amounts, BigDecimal amount) {
        for (BigDecimal a : amounts) {
            if (a.compareTo(amount) == 0) {
                return true;
            }
        }
        return false;
    }

    private void deal() {
        enter(RoundPhase.DEAL);
        for (Seat seat : activeSeats) {
            seat.getHand(0).getHand().addCard(shoe.deal());
        }
        dealer.addCard(shoe.deal());
        for (Seat seat : activeSeats) {
            seat.getHand(0).getHand().addCard(shoe.deal());
        }
        dealer.addCard(shoe.deal());
        dealer.captureInitialCards();

        for (Seat seat : activeSeats) {
            SeatHand first = seat.getHand(0);
            first.captureInitialCards();
            visibleCards.addAll(first.getHand().getCards());
        }
        visibleCards.add(dealer.getUpcard());
        if (log.isDebugEnabled()) {
            log.debug("Round {}: dealer shows {}", roundNumber, dealer.getUpcard());
            for (Seat seat : activeSeats) {
                log.debug("{} holds {} ({})", seat.getName(), seat.getHand(0).getHand(),
                        seat.getHand(0).getHand().value());
            }
        }
    }

    private void offerInsurance() {
        enter(RoundPhase.INSURANCE);
        OptionalDouble probTen = OptionalDouble.of(probHoleCardIsTen());
        for (Seat seat : activeSeats) {
            if (!seat.getPlayer().decideInsurance(context(seat, probTen))) {
                continue;
            }
            if (seat.placeInsurance()) {
                if (log.isDebugEnabled()) {
                    log.debug("{} takes insurance for {}", seat.getName(), seat.getInsuranceBet());
                }
            } else if (log.isDebugEnabled()) {
                log.debug("{} cannot cover insurance of {}", seat.getName(), seat.insuranceCost());
            }
        }
    }

    /**
     * Chance that the hole card is ten-valued given the visible cards: the visible cards are
     * removed from a fresh, full reference shoe and the ten-valued share of the rest is taken.
     */
    double probHoleCardIsTen() {
        List<Card> unseen = new ArrayList<>(Shoe.unshuffled(config.getDecks()).asUnmodifiableList());
        for (Card card : visibleCards) {
            unseen.remove(card);
        }
        if (unseen.isEmpty()) {
            return 0.0;
        }
        long tens = unseen.stream().filter(Card::isTenValued).count();
        return (double) tens / unseen.size();
    }

    private boolean checkBlackjacks() {
        enter(RoundPhase.BLACKJACK_CHECK);
        if (dealer.getHand().isBlackjack()) {
            if (log.isDebugEnabled()) {
                log.debug("Dealer has Blackjack: {}", dealer.getHand());
            }
            for (Seat seat : activeSeats) {
                if (seat.getInsuranceBet().signum() > 0) {
                    seat.payInsurance(Payouts.forInsurance(seat.getInsuranceBet(), config));
                }
                SeatHand first = seat.getHand(0);
                first.resolve(first.getHand().isBlackjack() ? Outcome.PUSH : Outcome.LOSS);
            }
            return true;
        }
        for (Seat seat : activeSeats) {
            SeatHand first = seat.getHand(0);
            if (first.getHand().isBlackjack()) {
                first.resolve(Outcome.BLACKJACK);
                if (log.isDebugEnabled()) {
                    log.debug("{} has Blackjack", seat.getName());
                }
            }
        }
        return false;
    }

    private void playerTurns() {
        enter(RoundPhase.PLAYER_TURNS);
        for (Seat seat : activeSeats) {
            if (seat.getHand(0).hasOutcome()) {
                continue;
            }
            int index = 0;
            while (index < seat.getHands().size()) {
                SeatHand seatHand = seat.getHand(index);
                if (!seatHand.hasOutcome() && !seatHand.isFrozen()) {
                    playHand(seat, index);
                }
                index++;
            }
        }
    }

    private void playHand(Seat seat, int index) {
        Card upcard = dealer.getUpcard();
        while (true) {
            SeatHand seatHand = seat.getHand(index);
            Hand hand = seatHand.getHand();
            List<Decision> legal = LegalDecisions.forHand(seat, index);
            if (legal.isEmpty()) {
                seatHand.resolve(Outcome.BUST);
                return;
            }
            Decision requested = seat.getPlayer().decide(hand, upcard, context(seat, OptionalDouble.empty()), legal);
            Decision decision = enforceLegality(seat, hand, requested, legal);
            if (log.isDebugEnabled()) {
                log.debug("{} hand {} [{}] ({}): {}", seat.getName(), index + 1, hand, hand.value(), decision);
            }
            switch (decision) {
                case SURRENDER:
                    seat.surrender(index);
                    return;
                case SPLIT:
                    boolean aces = hand.getCards().get(0).isAce();
                    if (!seat.split(index)) {
                        throw new IllegalStateException("Split of hand " + index + " rejected for " + seat.getName());
                    }
                    SeatHand second = seat.getHand(seat.getHands().size() - 1);
                    dealTo(seatHand);
                    dealTo(second);
                    seatHand.captureInitialCards();
                    second.captureInitialCards();
                    if (aces) {
                        seatHand.freeze();
                        second.freeze();
                        return;
                    }
                    break;
                case DOUBLE_DOWN:
                    if (!seat.doubleDown(index)) {
                        throw new IllegalStateException(
                                "Double down of hand " + index + " rejected for " + seat.getName());
                    }
                    dealTo(seatHand);
                    if (hand.isBust()) {
                        seatHand.resolve(Outcome.BUST);
                    }
                    return;
                case HIT:
                    dealTo(seatHand);
                    if (hand.isBust()) {
                        seatHand.resolve(Outcome.BUST);
                        return;
                    }
                    break;
                case STAND:
                default:
                    return;
            }
        }
    }

    private Decision enforceLegality(Seat seat, Hand hand, Decision requested, List<Decision> legal) {
        if (requested == null) {
            log.warn("{} returned no decision; standing", seat.getName());
            return Decision.STAND;
        }
        if (legal.contains(requested)) {
            return requested;
        }
        if (requested == Decision.DOUBLE_DOWN && LegalDecisions.isFirstAction(hand)) {
            log.warn("{} cannot afford to double down; hitting instead", seat.getName());
            return Decision.HIT;
        }
        log.warn("{} requested illegal decision {} (legal: {}); standing", seat.getName(), requested, legal);
        return Decision.STAND;
    }

    private void dealTo(SeatHand seatHand) {
        Card card = shoe.deal();
        seatHand.getHand().addCard(card);
        visibleCards.add(card);
    }

    private boolean anyUnresolvedHand() {
        for (Seat seat : activeSeats) {
            for (SeatHand seatHand : seat.getHands()) {
                if (!seatHand.hasOutcome()) {
                    return true;
                }
            }
        }
        return false;
    }

    private void dealerTurn() {
        enter(RoundPhase.DEALER_TURN);
        dealer.play(shoe, config.getDealerStandValue());
        if (log.isDebugEnabled()) {
            log.debug("{}", dealer);
        }
    }

    private void determineOutcomes() {
        enter(RoundPhase.OUTCOMES);
        for (Seat seat : activeSeats) {
            for (SeatHand seatHand : seat.getHands()) {
                if (seatHand.hasOutcome()) {
                    continue;
                }
                if (seatHand.getHand().isBust()) {
                    seatHand.resolve(Outcome.BUST);
                } else {
                    seatHand.resolve(Payouts.compare(seatHand.getHand(), dealer.getHand()));
                }
            }
        }
    }

    private void settle() {
        enter(RoundPhase.SETTLEMENT);
        for (Seat seat : activeSeats) {
            for (SeatHand seatHand : seat.getHands()) {
                BigDecimal amount = Payouts.forOutcome(seatHand.getOutcome(), seatHand.getBet(),
                        seatHand.getHand().isFromSplit(), config);
                if (amount.signum() > 0) {
                    seat.settle(seatHand, amount);
                }
                if (log.isDebugEnabled()) {
                    log.debug("{} {} -> {} (net {})", seat.getName(), seatHand, seatHand.getPayout(),
                            seatHand.getNet());
                }
            }
        }
    }

    private RoundContext context(Seat seat, OptionalDouble probTen) {
        return new RoundContext(activeSeats.size(), visibleCards, seat.getHands().size(), seat.getChips(),
                seat.getPrimaryBet(), probTen);
    }

    private void enter(RoundPhase next) {
        phase = next;
        if (log.isTraceEnabled()) {
            log.trace("Round {} -> {}", roundNumber, next);
        }
    }

    private RoundRecord buildRecord(Map<Seat, BigDecimal> chipsBefore) {
        Hand dealerHand = dealer.getHand();
        DealerRecord dealerRecord = new DealerRecord(dealer.getInitialCards(), dealerHand.shortNames(),
                dealerHand.value(), dealerHand.isBlackjack(), dealerHand.isBust());
        List<ParticipantRecord> participants = new ArrayList<>();
        for (Seat seat : seats) {
            List<HandRecord> hands = new ArrayList<>();
            for (SeatHand seatHand : seat.getHands()) {
                Hand hand = seatHand.getHand();
                hands.add(new HandRecord(seatHand.getInitialCards(), hand.shortNames(), hand.value(),
                        seatHand.getBet(), seatHand.getOutcome(), seatHand.getPayout(), hand.isBlackjack(),
                        hand.isBust()));
            }
            participants.add(new ParticipantRecord(seat.getName(), seat.getSeatNumber(), chipsBefore.get(seat),
                    seat.getChips(), seat.getInsuranceBet(), seat.getInsurancePayout(), hands));
        }
        return new RoundRecord(roundNumber, dealerRecord, participants);
    }
}
