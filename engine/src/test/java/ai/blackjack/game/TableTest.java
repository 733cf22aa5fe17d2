package ai.blackjack.game;

import static ai.blackjack.game.Rank.ACE;
import static ai.blackjack.game.Rank.EIGHT;
import static ai.blackjack.game.Rank.FIVE;
import static ai.blackjack.game.Rank.FOUR;
import static ai.blackjack.game.Rank.JACK;
import static ai.blackjack.game.Rank.KING;
import static ai.blackjack.game.Rank.NINE;
import static ai.blackjack.game.Rank.QUEEN;
import static ai.blackjack.game.Rank.SEVEN;
import static ai.blackjack.game.Rank.SIX;
import static ai.blackjack.game.Rank.TEN;
import static ai.blackjack.game.Rank.THREE;
import static ai.blackjack.game.Rank.TWO;
import static ai.blackjack.game.TableTestHelper.assertChips;
import static ai.blackjack.game.TableTestHelper.card;
import static ai.blackjack.game.TableTestHelper.seat;
import static ai.blackjack.game.TableTestHelper.singleSeatTable;
import static ai.blackjack.game.TableTestHelper.stacked;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.blackjack.config.TableConfig;
import ai.blackjack.game.record.HandRecord;
import ai.blackjack.game.record.ParticipantRecord;
import ai.blackjack.game.record.RoundRecord;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Round engine scenarios on stacked shoes.
 * <p>
 * With one seat the deal order is: seat card 1, dealer upcard, seat card 2, dealer hole card,
 * then cards in the order they are drawn during play.
 */
class TableTest {

    @Test
    void playerBlackjackPaysThreeToTwo() {
        ScriptedPlayer player = ScriptedPlayer.betting(20);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(ACE, NINE, KING, EIGHT));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(Outcome.BLACKJACK, hand.getOutcome());
        assertTrue(hand.isBlackjack());
        assertChips("50", hand.getPayout());
        assertChips("30", hand.getNet());
        assertChips("1030", seat.getChips());
        // A Blackjack resolves the hand before any decision is asked.
        assertEquals(0, player.decisionCount());
        // No hand left to compare, so the dealer keeps two cards.
        assertEquals(2, record.getDealer().getFinalHand().size());
        assertEquals(RoundPhase.DONE, table.getPhase());
    }

    @Test
    void insuranceAgainstDealerBlackjackNetsMinusTen() {
        ScriptedPlayer player = ScriptedPlayer.insuring(20);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, ACE, NINE, KING));

        RoundRecord record = table.playRound();

        ParticipantRecord alice = record.participant("Alice");
        assertChips("10", alice.getInsuranceBet());
        assertChips("20", alice.getInsurancePayout());
        assertEquals(Outcome.LOSS, alice.getHands().get(0).getOutcome());
        assertTrue(record.getDealer().isBlackjack());
        assertChips("990", seat.getChips());
        assertChips("-10", alice.getChipsAfter().subtract(alice.getChipsBefore()));
        assertEquals(0, player.decisionCount());
    }

    @Test
    void dealerBlackjackPushesPlayerBlackjack() {
        ScriptedPlayer player = ScriptedPlayer.betting(20);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(ACE, ACE, KING, QUEEN));

        RoundRecord record = table.playRound();

        assertEquals(Outcome.PUSH, record.participant("Alice").getHands().get(0).getOutcome());
        assertChips("1000", seat.getChips());
        // Insurance was offered (upcard Ace) but declined.
        assertEquals(1, player.insuranceContexts.size());
        assertChips("0", seat.getInsuranceBet());
    }

    @Test
    void insuranceIsForfeitedWhenDealerHasNoBlackjack() {
        ScriptedPlayer player = ScriptedPlayer.insuring(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        // Player 19 against dealer soft 18.
        Table table = singleSeatTable(seat, stacked(TEN, ACE, NINE, SEVEN));

        RoundRecord record = table.playRound();

        ParticipantRecord alice = record.participant("Alice");
        assertChips("10", alice.getInsuranceBet());
        assertChips("0", alice.getInsurancePayout());
        assertEquals(Outcome.WIN, alice.getHands().get(0).getOutcome());
        assertChips("1010", seat.getChips());
    }

    @Test
    void seatThatCannotCoverInsuranceIsStillAsked() {
        ScriptedPlayer player = ScriptedPlayer.insuring(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 20, player);
        // Player 19 against dealer soft 18; nothing left to insure with after the bet.
        Table table = singleSeatTable(seat, stacked(TEN, ACE, NINE, SEVEN));

        RoundRecord record = table.playRound();

        assertEquals(1, player.insuranceContexts.size());
        ParticipantRecord alice = record.participant("Alice");
        assertChips("0", alice.getInsuranceBet());
        assertChips("0", alice.getInsurancePayout());
        assertEquals(Outcome.WIN, alice.getHands().get(0).getOutcome());
        assertChips("40", seat.getChips());
    }

    @Test
    void configuredBlackjackValueAppliesToEveryHand() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.HIT, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        TableConfig config = TableConfig.builder().blackjackValue(24).build();
        // Player 10, 9 then 5 reaches 24 against dealer 17.
        Table table = new Table(config, List.of(seat), stacked(TEN, TEN, NINE, SEVEN, FIVE));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(Outcome.WIN, hand.getOutcome());
        assertChips("1020", seat.getChips());
        assertEquals(17, record.getDealer().getFinalValue());
    }

    @Test
    void insuranceOnlyOfferedAgainstAnAce() {
        ScriptedPlayer player = ScriptedPlayer.insuring(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, KING, NINE, SEVEN));

        table.playRound();

        assertTrue(player.insuranceContexts.isEmpty());
        assertChips("0", seat.getInsuranceBet());
    }

    @Test
    void holeCardProbabilityCountsUnseenTens() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        TableConfig oneDeck = TableConfig.builder().decks(1).build();
        Table table = new Table(oneDeck, List.of(seat), stacked(KING, ACE, QUEEN, FIVE, TWO));

        table.playRound();

        // Visible: K, Q and the Ace. 16 tens in a deck, 2 seen; 49 cards unseen.
        RoundContext context = player.insuranceContexts.get(0);
        assertEquals(14.0 / 49.0, context.getProbHoleCardIsTen().getAsDouble(), 1e-9);
        assertEquals(3, context.getCardsVisible().size());
        // Only the insurance question carries the probability.
        assertFalse(player.decisionContexts.get(0).getProbHoleCardIsTen().isPresent());
    }

    @Test
    void splitEightsPlaysTwoHandsWithEqualBets() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.SPLIT, Decision.STAND, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(
                card(EIGHT, Suit.SPADES), card(TEN), card(EIGHT, Suit.HEARTS), card(SEVEN),
                card(THREE), card(TEN, Suit.CLUBS)));

        RoundRecord record = table.playRound();

        List<HandRecord> hands = record.participant("Alice").getHands();
        assertEquals(2, hands.size());
        assertEquals(List.of("8♠", "3♠"), hands.get(0).getFinalHand());
        assertEquals(List.of("8♥", "10♣"), hands.get(1).getFinalHand());
        assertEquals(List.of("8♠", "3♠"), hands.get(0).getInitialHand());
        assertChips("20", hands.get(0).getBet());
        assertChips("20", hands.get(1).getBet());
        assertEquals(Outcome.LOSS, hands.get(0).getOutcome());
        assertEquals(Outcome.WIN, hands.get(1).getOutcome());
        assertChips("1000", seat.getChips());
        // After the split the context reports two hands, and no second split is offered.
        assertEquals(2, player.decisionContexts.get(1).getNumHands());
        assertFalse(player.legalDecisionsSeen.get(1).contains(Decision.SPLIT));
    }

    @Test
    void splitAcesGetOneCardEachAndNeverScoreBlackjack() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.SPLIT, Decision.HIT, Decision.HIT);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(
                card(ACE, Suit.SPADES), card(NINE), card(ACE, Suit.HEARTS), card(EIGHT),
                card(KING), card(FIVE)));

        RoundRecord record = table.playRound();

        List<HandRecord> hands = record.participant("Alice").getHands();
        assertEquals(1, player.decisionCount());
        assertEquals(2, hands.get(0).getFinalHand().size());
        assertEquals(2, hands.get(1).getFinalHand().size());
        assertEquals(21, hands.get(0).getFinalValue());
        assertFalse(hands.get(0).isBlackjack());
        assertEquals(Outcome.WIN, hands.get(0).getOutcome());
        assertChips("40", hands.get(0).getPayout());
        assertEquals(Outcome.LOSS, hands.get(1).getOutcome());
        assertChips("1000", seat.getChips());
    }

    @Test
    void doubleDownDrawsOneCardAndDoublesTheBet() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.DOUBLE_DOWN);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(SIX, TEN, FIVE, SEVEN, TEN));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(3, hand.getFinalHand().size());
        assertEquals(21, hand.getFinalValue());
        assertChips("40", hand.getBet());
        assertEquals(Outcome.WIN, hand.getOutcome());
        assertChips("80", hand.getPayout());
        assertChips("1040", seat.getChips());
        assertEquals(1, player.decisionCount());
    }

    @Test
    void doubleDownBustLosesDoubledBet() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.DOUBLE_DOWN);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, TWO, SEVEN, KING));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(Outcome.BUST, hand.getOutcome());
        assertTrue(hand.isBusted());
        assertChips("40", hand.getBet());
        assertChips("960", seat.getChips());
    }

    @Test
    void surrenderRefundsHalfTheBet() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.SURRENDER);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, SIX, NINE));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(Outcome.SURRENDER, hand.getOutcome());
        assertChips("10", hand.getPayout());
        assertChips("-10", hand.getNet());
        assertChips("990", seat.getChips());
    }

    @Test
    void illegalSplitIsTreatedAsStand() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.SPLIT);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, NINE, SEVEN, NINE));

        RoundRecord record = table.playRound();

        List<HandRecord> hands = record.participant("Alice").getHands();
        assertEquals(1, hands.size());
        assertEquals(2, hands.get(0).getFinalHand().size());
        assertEquals(Outcome.LOSS, hands.get(0).getOutcome());
        assertEquals(1, player.decisionCount());
        assertChips("980", seat.getChips());
    }

    @Test
    void surrenderAfterHitIsTreatedAsStand() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.HIT, Decision.SURRENDER);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(FIVE, TEN, SIX, SEVEN, FOUR));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(List.of(Decision.HIT, Decision.STAND), player.legalDecisionsSeen.get(1));
        assertEquals(15, hand.getFinalValue());
        assertEquals(Outcome.LOSS, hand.getOutcome());
        assertChips("0", hand.getPayout());
    }

    @Test
    void unaffordableDoubleDownBecomesHit() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.DOUBLE_DOWN, Decision.STAND);
        Seat seat = seat(1, "Alice", 30, player);
        Table table = singleSeatTable(seat, stacked(FIVE, TEN, SIX, SEVEN, FOUR));

        RoundRecord record = table.playRound();

        assertFalse(player.legalDecisionsSeen.get(0).contains(Decision.DOUBLE_DOWN));
        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(3, hand.getFinalHand().size());
        assertChips("20", hand.getBet());
        assertEquals(2, player.decisionCount());
        assertEquals(Outcome.LOSS, hand.getOutcome());
        assertChips("10", seat.getChips());
    }

    @Test
    void nullDecisionIsTreatedAsStand() {
        ScriptedPlayer player = new ScriptedPlayer(TableTestHelper.chips("20"), false, (Decision) null);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, EIGHT, EIGHT));

        RoundRecord record = table.playRound();

        assertEquals(Outcome.PUSH, record.participant("Alice").getHands().get(0).getOutcome());
        assertChips("1000", seat.getChips());
    }

    @Test
    void dealerHitsUntilSeventeen() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, FIVE, NINE, SIX, THREE, TWO, FOUR));

        RoundRecord record = table.playRound();

        assertEquals(List.of("5♠", "6♠"), record.getDealer().getInitialHand());
        assertEquals(5, record.getDealer().getFinalHand().size());
        assertEquals(20, record.getDealer().getFinalValue());
        assertEquals(Outcome.LOSS, record.participant("Alice").getHands().get(0).getOutcome());
    }

    @Test
    void dealerBustPaysStandingHands() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, EIGHT, SIX, KING));

        RoundRecord record = table.playRound();

        assertTrue(record.getDealer().isBusted());
        assertEquals(Outcome.WIN, record.participant("Alice").getHands().get(0).getOutcome());
        assertChips("1020", seat.getChips());
    }

    @Test
    void playerBustLosesEvenWhenDealerBusts() {
        ScriptedPlayer buster = ScriptedPlayer.betting(20, Decision.HIT);
        ScriptedPlayer stander = ScriptedPlayer.betting(20, Decision.STAND);
        Seat alice = seat(1, "Alice", 1000, buster);
        Seat bob = seat(2, "Bob", 1000, stander);
        Table table = new Table(TableConfig.defaults(), List.of(alice, bob),
                // Alice 10+6, Bob 10+8, dealer 10+6; Alice draws K, dealer draws Q.
                stacked(TEN, TEN, TEN, SIX, EIGHT, SIX, KING, QUEEN));

        RoundRecord record = table.playRound();

        assertTrue(record.getDealer().isBusted());
        assertEquals(Outcome.BUST, record.participant("Alice").getHands().get(0).getOutcome());
        assertEquals(Outcome.WIN, record.participant("Bob").getHands().get(0).getOutcome());
        assertChips("980", alice.getChips());
        assertChips("1020", bob.getChips());
    }

    @Test
    void equalTotalsPush() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, EIGHT, EIGHT));

        RoundRecord record = table.playRound();

        HandRecord hand = record.participant("Alice").getHands().get(0);
        assertEquals(Outcome.PUSH, hand.getOutcome());
        assertChips("20", hand.getPayout());
        assertChips("0", hand.getNet());
        assertChips("1000", seat.getChips());
    }

    @Test
    void dealsOneCardAtATimeInSeatOrder() {
        Seat alice = seat(1, "Alice", 1000, ScriptedPlayer.betting(10));
        Seat bob = seat(2, "Bob", 1000, ScriptedPlayer.betting(10));
        Table table = new Table(TableConfig.defaults(), List.of(alice, bob),
                stacked(TWO, THREE, FOUR, FIVE, SIX, SEVEN, KING, KING));

        RoundRecord record = table.playRound();

        assertEquals(List.of("2♠", "5♠"), record.participant("Alice").getHands().get(0).getInitialHand());
        assertEquals(List.of("3♠", "6♠"), record.participant("Bob").getHands().get(0).getInitialHand());
        assertEquals(List.of("4♠", "7♠"), record.getDealer().getInitialHand());
    }

    @Test
    void betsOutsideTheOfferedSizesFallBackToTheMinimum() {
        ScriptedPlayer greedy = ScriptedPlayer.betting(37, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, greedy);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, EIGHT, SEVEN));

        RoundRecord record = table.playRound();

        assertChips("10", record.participant("Alice").getHands().get(0).getBet());
        assertEquals(4, greedy.betOptionsSeen.get(0).size());
        assertChips("1010", seat.getChips());
    }

    @Test
    void offeredBetsAreLimitedByChips() {
        ScriptedPlayer player = ScriptedPlayer.betting(100, Decision.STAND);
        Seat seat = seat(1, "Alice", 45, player);
        Table table = singleSeatTable(seat, stacked(TEN, TEN, EIGHT, SEVEN));

        RoundRecord record = table.playRound();

        assertEquals(2, player.betOptionsSeen.get(0).size());
        assertChips("10", record.participant("Alice").getHands().get(0).getBet());
    }

    @Test
    void seatBelowMinimumChipsSitsOut() {
        ScriptedPlayer broke = ScriptedPlayer.betting(10);
        Seat alice = seat(1, "Alice", 1000, ScriptedPlayer.betting(20, Decision.STAND));
        Seat bob = seat(2, "Bob", 5, broke);
        Table table = new Table(TableConfig.defaults(), List.of(alice, bob), stacked(TEN, TEN, EIGHT, SEVEN));

        RoundRecord record = table.playRound();

        ParticipantRecord bobRecord = record.participant("Bob");
        assertTrue(bobRecord.getHands().isEmpty());
        assertChips("5", bobRecord.getChipsBefore());
        assertChips("5", bobRecord.getChipsAfter());
        assertTrue(broke.betOptionsSeen.isEmpty());
        assertEquals(Outcome.WIN, record.participant("Alice").getHands().get(0).getOutcome());
    }

    @Test
    void noRoundWhenEverySeatIsBroke() {
        Seat seat = seat(1, "Alice", 5, ScriptedPlayer.betting(10));
        Table table = singleSeatTable(seat, stacked(TEN, TEN, EIGHT, SEVEN));

        assertFalse(table.canPlayRound());
        assertThrows(IllegalStateException.class, table::playRound);
    }

    @Test
    void everyRoundDealsFromAFreshShoeAndChipsCarryOver() {
        AtomicInteger shoesBuilt = new AtomicInteger();
        ShoeFactory stackedShoe = stacked(TEN, TEN, EIGHT, SEVEN);
        Seat seat = seat(1, "Alice", 1000, ScriptedPlayer.betting(20));
        Table table = singleSeatTable(seat, () -> {
            shoesBuilt.incrementAndGet();
            return stackedShoe.newShoe();
        });

        RoundRecord first = table.playRound();
        RoundRecord second = table.playRound();

        assertEquals(2, shoesBuilt.get());
        assertEquals(1, first.getRoundNumber());
        assertEquals(2, second.getRoundNumber());
        assertChips("1020", first.participant("Alice").getChipsAfter());
        assertChips("1020", second.participant("Alice").getChipsBefore());
        assertChips("1040", seat.getChips());
    }

    @Test
    void rejectsEmptyOrDuplicateSeats() {
        ShoeFactory shoe = stacked(TEN, TEN, EIGHT, SEVEN);
        assertThrows(IllegalArgumentException.class, () -> new Table(TableConfig.defaults(), List.of(), shoe));
        Seat one = seat(1, "Alice", 100, ScriptedPlayer.betting(10));
        Seat alsoOne = seat(1, "Bob", 100, ScriptedPlayer.betting(10));
        assertThrows(IllegalArgumentException.class,
                () -> new Table(TableConfig.defaults(), List.of(one, alsoOne), shoe));
    }

    @Test
    void visibleCardsGrowAsCardsAreDealt() {
        ScriptedPlayer player = ScriptedPlayer.betting(20, Decision.HIT, Decision.STAND);
        Seat seat = seat(1, "Alice", 1000, player);
        Table table = singleSeatTable(seat, stacked(TWO, TEN, THREE, SEVEN, JACK));

        table.playRound();

        assertEquals(3, player.decisionContexts.get(0).getCardsVisible().size());
        assertEquals(4, player.decisionContexts.get(1).getCardsVisible().size());
        assertEquals(1, player.decisionContexts.get(0).getNumParticipants());
        assertChips("980", player.decisionContexts.get(0).getSeatChips());
        assertChips("20", player.decisionContexts.get(0).getPrimaryBet());
    }
}
