package ai.blackjack.config;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the table: house rules, bet limits and the seats.
 *
 * Example:
 * <pre>
 * table.decks=2
 * table.bet-sizes=10,20,50,100
 * table.seats[0].name=Alice
 * table.seats[0].type=basic
 * table.seats[0].chips=1000
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "table")
public class TableProperties {
  private static final TableConfig DEFAULTS = TableConfig.defaults();

  private int decks = DEFAULTS.getDecks();
  private int blackjackValue = DEFAULTS.getBlackjackValue();
  private int dealerStandValue = DEFAULTS.getDealerStandValue();
  private BigDecimal blackjackPayoutRatio = DEFAULTS.getBlackjackPayoutRatio();
  private BigDecimal splitBlackjackPayoutRatio = DEFAULTS.getSplitBlackjackPayoutRatio();
  private BigDecimal insurancePayoutRatio = DEFAULTS.getInsurancePayoutRatio();
  private BigDecimal minBet = DEFAULTS.getMinBet();
  private BigDecimal maxBet = DEFAULTS.getMaxBet();
  private List<BigDecimal> betSizes = new ArrayList<>(DEFAULTS.getBetSizes());
  private BigDecimal minChipsToPlay = DEFAULTS.getMinChipsToPlay();
  private List<SeatProperties> seats = new ArrayList<>();

  public int getDecks() {
    return decks;
  }

  public void setDecks(int decks) {
    this.decks = decks;
  }

  public int getBlackjackValue() {
    return blackjackValue;
  }

  public void setBlackjackValue(int blackjackValue) {
    this.blackjackValue = blackjackValue;
  }

  public int getDealerStandValue() {
    return dealerStandValue;
  }

  public void setDealerStandValue(int dealerStandValue) {
    this.dealerStandValue = dealerStandValue;
  }

  public BigDecimal getBlackjackPayoutRatio() {
    return blackjackPayoutRatio;
  }

  public void setBlackjackPayoutRatio(BigDecimal blackjackPayoutRatio) {
    this.blackjackPayoutRatio = blackjackPayoutRatio;
  }

  public BigDecimal getSplitBlackjackPayoutRatio() {
    return splitBlackjackPayoutRatio;
  }

  public void setSplitBlackjackPayoutRatio(BigDecimal splitBlackjackPayoutRatio) {
    this.splitBlackjackPayoutRatio = splitBlackjackPayoutRatio;
  }

  public BigDecimal getInsurancePayoutRatio() {
    return insurancePayoutRatio;
  }

  public void setInsurancePayoutRatio(BigDecimal insurancePayoutRatio) {
    this.insurancePayoutRatio = insurancePayoutRatio;
  }

  public BigDecimal getMinBet() {
    return minBet;
  }

  public void setMinBet(BigDecimal minBet) {
    this.minBet = minBet;
  }

  public BigDecimal getMaxBet() {
    return maxBet;
  }

  public void setMaxBet(BigDecimal maxBet) {
    this.maxBet = maxBet;
  }

  public List<BigDecimal> getBetSizes() {
    return betSizes;
  }

  public void setBetSizes(List<BigDecimal> betSizes) {
    this.betSizes = betSizes;
  }

  public BigDecimal getMinChipsToPlay() {
    return minChipsToPlay;
  }

  public void setMinChipsToPlay(BigDecimal minChipsToPlay) {
    this.minChipsToPlay = minChipsToPlay;
  }

  public List<SeatProperties> getSeats() {
    return seats;
  }

  public void setSeats(List<SeatProperties> seats) {
    this.seats = seats;
  }

  /**
   * Builds the immutable rule set handed to the round engine.
   *
   * @throws IllegalArgumentException if any value is out of range
   */
  public TableConfig toConfig() {
    return TableConfig.builder()
        .decks(decks)
        .blackjackValue(blackjackValue)
        .dealerStandValue(dealerStandValue)
        .blackjackPayoutRatio(blackjackPayoutRatio)
        .splitBlackjackPayoutRatio(splitBlackjackPayoutRatio)
        .insurancePayoutRatio(insurancePayoutRatio)
        .minBet(minBet)
        .maxBet(maxBet)
        .betSizes(betSizes)
        .minChipsToPlay(minChipsToPlay)
        .build();
  }

  /**
   * One configured seat: display name, player type and starting chips.
   */
  public static class SeatProperties {
    private String name;
    private String type = "basic";
    private BigDecimal chips = BigDecimal.valueOf(1000);

    public SeatProperties() {
    }

    public SeatProperties(String name, String type, BigDecimal chips) {
      this.name = name;
      this.type = type;
      this.chips = chips;
    }

    public String getName() {
      return name;
    }

    public void setName(String name) {
      this.name = name;
    }

    public String getType() {
      return type;
    }

    public void setType(String type) {
      this.type = type;
    }

    public BigDecimal getChips() {
      return chips;
    }

    public void setChips(BigDecimal chips) {
      this.chips = chips;
    }
  }
}
