package ai.blackjack.game;

import java.util.Random;

/**
 * Supplies the fresh shoe the round engine deals from at the start of each round.
 */
@FunctionalInterface
public interface ShoeFactory {

    /**
     * @return a new, full shoe ready for dealing
     */
    Shoe newShoe();

    /**
     * Factory producing {@code decks}-deck shoes shuffled with the given random source.
     * Seed the random source to make a whole simulation reproducible.
     */
    static ShoeFactory shuffled(int decks, Random random) {
        return () -> Shoe.shuffled(decks, random);
    }
}
