package ai.blackjack.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable table rules handed to the round engine at construction.
 * <p>
 * Built through {@link #builder()} (or {@link TableProperties#toConfig()} when
 * running under Spring). Every value is validated once, on {@link Builder#build()}.
 */
public final class TableConfig {
    private final int decks;
    private final int blackjackValue;
    private final int dealerStandValue;
    private final BigDecimal blackjackPayoutRatio;
    private final BigDecimal splitBlackjackPayoutRatio;
    private final BigDecimal insurancePayoutRatio;
    private final BigDecimal minBet;
    private final BigDecimal maxBet;
    private final List<BigDecimal> betSizes;
    private final BigDecimal minChipsToPlay;

    private TableConfig(Builder b) {
        this.decks = b.decks;
        this.blackjackValue = b.blackjackValue;
        this.dealerStandValue = b.dealerStandValue;
        this.blackjackPayoutRatio = b.blackjackPayoutRatio;
        this.splitBlackjackPayoutRatio = b.splitBlackjackPayoutRatio;
        this.insurancePayoutRatio = b.insurancePayoutRatio;
        this.minBet = b.minBet;
        this.maxBet = b.maxBet;
        List<BigDecimal> sizes = new ArrayList<>(b.betSizes);
        Collections.sort(sizes);
        this.betSizes = Collections.unmodifiableList(sizes);
        this.minChipsToPlay = b.minChipsToPlay;
    }

    /**
     * @return a builder pre-filled with the default house rules
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return the default house rules: 2 decks, Blackjack at 21, dealer stands on 17, 3:2 Blackjack,
     *         even-money split Blackjack, 2:1 insurance, bets 10/20/50/100 within 2 to 500
     */
    public static TableConfig defaults() {
        return builder().build();
    }

    public int getDecks() {
        return decks;
    }

    /**
     * @return the target total: a two-card hand worth this much is a Blackjack, anything above busts
     */
    public int getBlackjackValue() {
        return blackjackValue;
    }

    public int getDealerStandValue() {
        return dealerStandValue;
    }

    public BigDecimal getBlackjackPayoutRatio() {
        return blackjackPayoutRatio;
    }

    public BigDecimal getSplitBlackjackPayoutRatio() {
        return splitBlackjackPayoutRatio;
    }

    public BigDecimal getInsurancePayoutRatio() {
        return insurancePayoutRatio;
    }

    public BigDecimal getMinBet() {
        return minBet;
    }

    public BigDecimal getMaxBet() {
        return maxBet;
    }

    /**
     * @return the offered bet denominations in ascending order
     */
    public List<BigDecimal> getBetSizes() {
        return betSizes;
    }

    public BigDecimal getMinChipsToPlay() {
        return minChipsToPlay;
    }

    /**
     * Bet sizes a seat holding {@code chips} may choose from this round: the
     * configured denominations inside {@code [minBet, maxBet]} that the seat can cover.
     *
     * @param chips the seat's current balance
     * @return affordable sizes in ascending order; empty when the seat cannot bet
     */
    public List<BigDecimal> availableBets(BigDecimal chips) {
        List<BigDecimal> available = new ArrayList<>();
        for (BigDecimal size : betSizes) {
            if (size.compareTo(minBet) >= 0
                    && size.compareTo(maxBet) <= 0
                    && size.compareTo(chips) <= 0) {
                available.add(size);
            }
        }
        return available;
    }

    @Override
    public String toString() {
        return "TableConfig{decks=" + decks
                + ", blackjackValue=" + blackjackValue
                + ", dealerStandValue=" + dealerStandValue
                + ", blackjackPayoutRatio=" + blackjackPayoutRatio
                + ", splitBlackjackPayoutRatio=" + splitBlackjackPayoutRatio
                + ", insurancePayoutRatio=" + insurancePayoutRatio
                + ", minBet=" + minBet
                + ", maxBet=" + maxBet
                + ", betSizes=" + betSizes
                + ", minChipsToPlay=" + minChipsToPlay + '}';
    }

    /**
     * Mutable builder for {@link TableConfig}.
     */
    public static final class Builder {
        private int decks = 2;
        private int blackjackValue = 21;
        private int dealerStandValue = 17;
        private BigDecimal blackjackPayoutRatio = new BigDecimal("1.5");
        private BigDecimal splitBlackjackPayoutRatio = BigDecimal.ONE;
        private BigDecimal insurancePayoutRatio = new BigDecimal("2");
        private BigDecimal minBet = new BigDecimal("2");
        private BigDecimal maxBet = new BigDecimal("500");
        private List<BigDecimal> betSizes = List.of(
                new BigDecimal("10"), new BigDecimal("20"), new BigDecimal("50"), new BigDecimal("100"));
        private BigDecimal minChipsToPlay = new BigDecimal("10");

        private Builder() {
        }

        public Builder decks(int decks) {
            this.decks = decks;
            return this;
        }

        public Builder blackjackValue(int blackjackValue) {
            this.blackjackValue = blackjackValue;
            return this;
        }

        public Builder dealerStandValue(int dealerStandValue) {
            this.dealerStandValue = dealerStandValue;
            return this;
        }

        public Builder blackjackPayoutRatio(BigDecimal ratio) {
            this.blackjackPayoutRatio = ratio;
            return this;
        }

        public Builder splitBlackjackPayoutRatio(BigDecimal ratio) {
            this.splitBlackjackPayoutRatio = ratio;
            return this;
        }

        public Builder insurancePayoutRatio(BigDecimal ratio) {
            this.insurancePayoutRatio = ratio;
            return this;
        }

        public Builder minBet(BigDecimal minBet) {
            this.minBet = minBet;
            return this;
        }

        public Builder maxBet(BigDecimal maxBet) {
            this.maxBet = maxBet;
            return this;
        }

        public Builder betSizes(List<BigDecimal> betSizes) {
            this.betSizes = List.copyOf(betSizes);
            return this;
        }

        public Builder minChipsToPlay(BigDecimal minChipsToPlay) {
            this.minChipsToPlay = minChipsToPlay;
            return this;
        }

        /**
         * Validates the rules and freezes them.
         *
         * @return the immutable configuration
         * @throws IllegalArgumentException if any rule is out of range
         */
        public TableConfig build() {
            if (decks <= 0) {
                throw new IllegalArgumentException("decks must be positive, got " + decks);
            }
            // an Ace must still be able to count 11 in a two-card hand
            if (blackjackValue < 12) {
                throw new IllegalArgumentException("blackjackValue must be at least 12, got " + blackjackValue);
            }
            if (dealerStandValue < 2 || dealerStandValue > blackjackValue) {
                throw new IllegalArgumentException("dealerStandValue must be within 2.." + blackjackValue
                        + ", got " + dealerStandValue);
            }
            requirePositive(blackjackPayoutRatio, "blackjackPayoutRatio");
            requirePositive(splitBlackjackPayoutRatio, "splitBlackjackPayoutRatio");
            requirePositive(insurancePayoutRatio, "insurancePayoutRatio");
            requirePositive(minBet, "minBet");
            requirePositive(maxBet, "maxBet");
            if (minBet.compareTo(maxBet) > 0) {
                throw new IllegalArgumentException("minBet " + minBet + " exceeds maxBet " + maxBet);
            }
            if (betSizes == null || betSizes.isEmpty()) {
                throw new IllegalArgumentException("at least one bet size must be offered");
            }
            for (BigDecimal size : betSizes) {
                requirePositive(size, "bet size");
            }
            Objects.requireNonNull(minChipsToPlay, "minChipsToPlay");
            if (minChipsToPlay.signum() < 0) {
                throw new IllegalArgumentException("minChipsToPlay must not be negative, got " + minChipsToPlay);
            }
            return new TableConfig(this);
        }

        private static void requirePositive(BigDecimal value, String name) {
            if (value == null || value.signum() <= 0) {
                throw new IllegalArgumentException(name + " must be positive, got " + value);
            }
        }
    }
}
