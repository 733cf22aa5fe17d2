package ai.blackjack.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Binding-free checks of the Spring property holders.
 */
class TablePropertiesTest {

    @Test
    void defaultsProduceTheDefaultConfig() {
        TableConfig config = new TableProperties().toConfig();
        assertEquals(TableConfig.defaults().toString(), config.toString());
    }

    @Test
    void overridesReachTheConfig() {
        TableProperties properties = new TableProperties();
        properties.setDecks(6);
        properties.setBlackjackValue(23);
        properties.setDealerStandValue(18);
        properties.setBetSizes(List.of(new BigDecimal("5"), new BigDecimal("25")));

        TableConfig config = properties.toConfig();

        assertEquals(6, config.getDecks());
        assertEquals(23, config.getBlackjackValue());
        assertEquals(18, config.getDealerStandValue());
        assertEquals(2, config.getBetSizes().size());
    }

    @Test
    void invalidPropertiesFailFast() {
        TableProperties properties = new TableProperties();
        properties.setMaxBet(new BigDecimal("1"));
        assertThrows(IllegalArgumentException.class, properties::toConfig);
    }

    @Test
    void seatDefaults() {
        TableProperties.SeatProperties seat = new TableProperties.SeatProperties();
        assertEquals("basic", seat.getType());
        assertEquals(0, new BigDecimal("1000").compareTo(seat.getChips()));
        assertTrue(new TableProperties().getSeats().isEmpty());
    }

    @Test
    void nonPositiveRoundsMeansInteractive() {
        SimulationProperties simulation = new SimulationProperties();
        assertFalse(simulation.isInteractive());
        simulation.setRounds(0);
        assertTrue(simulation.isInteractive());
        assertEquals("game_history.json", simulation.getHistoryFile());
    }
}
