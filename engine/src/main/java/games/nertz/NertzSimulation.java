package games.nertz;

import games.nertz.config.NertzProperties;
import games.nertz.engine.GameResult;
import games.nertz.engine.NertzEngine;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NertzSimulation implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(NertzSimulation.class);

    private final NertzProperties properties;

    public NertzSimulation(NertzProperties properties) {
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(NertzSimulation.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        simulate();
    }

    /**
     * Plays the configured number of games, each on a freshly dealt table.
     * <p>
     * With a configured seed, game {@code i} is seeded with {@code seed + i} so a batch is
     * reproducible game by game.
     *
     * @return one result per game, in play order
     */
    public List<GameResult> simulate() {
        List<GameResult> results = new ArrayList<>(properties.getGames());
        for (int i = 0; i < properties.getGames(); i++) {
            Long seed = properties.getSeed() == null ? null : properties.getSeed() + i;
            NertzEngine engine = NertzEngine.create(
                    properties.getPlayers(), seed, properties.isVerbose(), properties.isParallelGeneration());
            GameResult result = engine.playGame(properties.getMaxTurns());
            log.info("Game {} of {}: {}", i + 1, properties.getGames(), result);
            results.add(result);
        }
        if (results.size() > 1) {
            logSummary(results);
        }
        return results;
    }

    private void logSummary(List<GameResult> results) {
        int[] wins = new int[properties.getPlayers()];
        int completed = 0;
        long turns = 0;
        for (GameResult result : results) {
            wins[result.getWinner()]++;
            turns += result.getTurnsPlayed();
            if (result.isCompleted()) {
                completed++;
            }
        }
        log.info("Played {} games ({} completed), average {} turns.",
                results.size(), completed, String.format("%.1f", (double) turns / results.size()));
        for (int p = 0; p < wins.length; p++) {
            log.info("Player {} won {} game(s).", p, wins[p]);
        }
    }
}
