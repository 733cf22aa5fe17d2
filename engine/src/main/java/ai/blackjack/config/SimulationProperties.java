package ai.blackjack.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for a simulation run.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--simulation.rounds=1000 --simulation.seed=42"}
 *
 * A round count of zero or less plays interactively, asking after each round whether to continue.
 */
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {
  private int rounds = 100;
  private Long seed;
  private String historyFile = "game_history.json";

  public int getRounds() {
    return rounds;
  }

  public void setRounds(int rounds) {
    this.rounds = rounds;
  }

  /**
   * @return seed for shuffling and random players, or {@code null} for a fresh seed per run
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  public String getHistoryFile() {
    return historyFile;
  }

  public void setHistoryFile(String historyFile) {
    this.historyFile = historyFile;
  }

  public boolean isInteractive() {
    return rounds <= 0;
  }
}
