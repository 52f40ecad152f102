package games.nertz.unit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import games.nertz.NertzSimulation;
import games.nertz.config.NertzProperties;
import games.nertz.engine.GameResult;
import java.util.List;
import org.junit.jupiter.api.Test;

class NertzSimulationTest {

    @Test
    void seededBatchIsReproducible() {
        NertzProperties properties = new NertzProperties();
        properties.setPlayers(3);
        properties.setGames(3);
        properties.setSeed(500L);
        properties.setMaxTurns(2000);

        List<GameResult> first = new NertzSimulation(properties).simulate();
        List<GameResult> second = new NertzSimulation(properties).simulate();

        assertEquals(3, first.size());
        for (int i = 0; i < first.size(); i++) {
            assertEquals(first.get(i).getFinalScores(), second.get(i).getFinalScores(), "game " + i);
            assertEquals(first.get(i).getTurnsPlayed(), second.get(i).getTurnsPlayed(), "game " + i);
            assertEquals(first.get(i).getWinner(), second.get(i).getWinner(), "game " + i);
        }
    }

    @Test
    void defaultsMatchDocumentedValues() {
        NertzProperties properties = new NertzProperties();
        assertEquals(4, properties.getPlayers());
        assertEquals(5000, properties.getMaxTurns());
        assertEquals(1, properties.getGames());
        assertNull(properties.getSeed());
    }
}
