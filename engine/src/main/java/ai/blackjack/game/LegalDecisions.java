package ai.blackjack.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Works out which decisions a seat may take for one of its hands.
 * <p>
 * Hit and Stand are always offered while the hand is live. Double Down and
 * Surrender are first-action options (the hand still holds exactly two cards);
 * Double Down additionally requires the chips to match the bet. Split is
 * offered on a two-card pair while the seat holds a single hand and can
 * match the bet.
 */
public final class LegalDecisions {

    private LegalDecisions() {
    }

    /**
     * @return legal decisions in a stable order, or an empty list if the hand is
     *         already resolved, frozen or bust
     */
    public static List<Decision> forHand(Seat seat, int index) {
        SeatHand seatHand = seat.getHand(index);
        Hand hand = seatHand.getHand();
        if (seatHand.hasOutcome() || seatHand.isFrozen() || hand.isBust()) {
            return Collections.emptyList();
        }
        List<Decision> legal = new ArrayList<>();
        legal.add(Decision.HIT);
        legal.add(Decision.STAND);
        if (isFirstAction(hand)) {
            if (seat.canDoubleDown(index)) {
                legal.add(Decision.DOUBLE_DOWN);
            }
            if (canPairSplit(seat, index)) {
                legal.add(Decision.SPLIT);
            }
            legal.add(Decision.SURRENDER);
        }
        return legal;
    }

    /**
     * A hand may be split when it is a two-card pair, the seat holds exactly one
     * hand and its chips cover a second bet of the same size.
     */
    public static boolean canPairSplit(Seat seat, int index) {
        return seat.canSplit(index);
    }

    static boolean isFirstAction(Hand hand) {
        return hand.size() == 2;
    }
}
