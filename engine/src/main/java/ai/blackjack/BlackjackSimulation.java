package ai.blackjack;

import ai.blackjack.analysis.ResultsAnalyzer;
import ai.blackjack.analysis.RoundHistoryWriter;
import ai.blackjack.config.SimulationProperties;
import ai.blackjack.config.TableConfig;
import ai.blackjack.config.TableProperties;
import ai.blackjack.game.Seat;
import ai.blackjack.game.Table;
import ai.blackjack.game.record.RoundRecord;
import ai.blackjack.player.PlayerFactory;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Scanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BlackjackSimulation implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(BlackjackSimulation.class);

    private final Table table;
    private final SimulationProperties simulation;
    private final RoundHistoryWriter historyWriter;
    private final Scanner console;
    private final PrintStream out;

    @Autowired
    public BlackjackSimulation(TableProperties tableProperties, SimulationProperties simulation,
            PlayerFactory playerFactory) {
        this(buildTable(tableProperties, simulation, playerFactory), simulation, new RoundHistoryWriter(),
                playerFactory.getConsole(), System.out);
    }

    public BlackjackSimulation(Table table, SimulationProperties simulation, RoundHistoryWriter historyWriter,
            Scanner console, PrintStream out) {
        this.table = table;
        this.simulation = simulation;
        this.historyWriter = historyWriter;
        this.console = console;
        this.out = out;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(BlackjackSimulation.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    /**
     * Builds the table from the configured seats. One seeded {@link Random} drives both
     * the shuffles and any random players, so a fixed seed replays the same run.
     */
    static Table buildTable(TableProperties tableProperties, SimulationProperties simulation,
            PlayerFactory playerFactory) {
        TableConfig config = tableProperties.toConfig();
        Random random = simulation.getSeed() == null ? new Random() : new Random(simulation.getSeed());
        List<Seat> seats = new ArrayList<>();
        int seatNumber = 1;
        for (TableProperties.SeatProperties seat : tableProperties.getSeats()) {
            String name = seat.getName() == null || seat.getName().isBlank() ? "Player " + seatNumber : seat.getName();
            seats.add(new Seat(seatNumber, name, seat.getChips(), playerFactory.create(seat.getType(), random)));
            seatNumber++;
        }
        return new Table(config, seats, random);
    }

    @Override
    public void run(String... args) {
        // CLI entrypoint ignores the result; tests call play() directly.
        play();
    }

    /**
     * Plays rounds until the configured count is reached, the interactive user declines
     * another round, or no seat can afford to continue. Then logs the report and writes
     * the history file.
     *
     * @return the round history and how long the run took
     */
    public SimulationResult play() {
        long startNanos = System.nanoTime();
        List<RoundRecord> history = new ArrayList<>();
        boolean interactive = simulation.isInteractive();
        while (interactive || history.size() < simulation.getRounds()) {
            if (!table.canPlayRound()) {
                log.info("Every seat is below the minimum chips; stopping after {} rounds", history.size());
                break;
            }
            RoundRecord record = table.playRound();
            history.add(record);
            if (log.isDebugEnabled()) {
                log.debug("Round {} finished", record.getRoundNumber());
            }
            if (interactive && !askToContinue()) {
                break;
            }
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);

        if (log.isInfoEnabled()) {
            log.info("\n{}", new ResultsAnalyzer(history).formatReport(duration));
        }
        String historyFile = simulation.getHistoryFile();
        if (historyFile != null && !historyFile.isBlank()) {
            historyWriter.write(history, Path.of(historyFile));
        }
        return new SimulationResult(history, duration);
    }

    private boolean askToContinue() {
        while (true) {
            out.print("Play another round? (y/n): ");
            if (!console.hasNextLine()) {
                return false;
            }
            String answer = console.nextLine().trim();
            if (answer.equalsIgnoreCase("y") || answer.equalsIgnoreCase("yes")) {
                return true;
            }
            if (answer.equalsIgnoreCase("n") || answer.equalsIgnoreCase("no")) {
                return false;
            }
        }
    }

    public Table getTable() {
        return table;
    }

    /**
     * Summary of a simulation run.
     */
    public static final class SimulationResult {
        private final List<RoundRecord> history;
        private final Duration duration;

        public SimulationResult(List<RoundRecord> history, Duration duration) {
            this.history = Collections.unmodifiableList(new ArrayList<>(history));
            this.duration = duration;
        }

        public List<RoundRecord> getHistory() {
            return history;
        }

        public Duration getDuration() {
            return duration;
        }
    }
}
