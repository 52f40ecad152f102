package games.nertz.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the simulator.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--nertz.players=3 --nertz.seed=42"}
 */
@Component
@ConfigurationProperties(prefix = "nertz")
public class NertzProperties {
  private int players = 4;
  private Long seed;
  private int maxTurns = 5000;
  private int games = 1;
  private boolean verbose = false;
  private boolean parallelGeneration = false;

  /**
   * Number of players seated at the table.
   */
  public int getPlayers() {
    return players;
  }

  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Seed for shuffles and foundation jitter, or null for a fresh random seed per game.
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Turn cap for a single game.
   */
  public int getMaxTurns() {
    return maxTurns;
  }

  public void setMaxTurns(int maxTurns) {
    this.maxTurns = maxTurns;
  }

  public int getGames() {
    return games;
  }

  public void setGames(int games) {
    this.games = games;
  }

  /**
   * Whether DEBUG engine events are emitted.
   */
  public boolean isVerbose() {
    return verbose;
  }

  public void setVerbose(boolean verbose) {
    this.verbose = verbose;
  }

  public boolean isParallelGeneration() {
    return parallelGeneration;
  }

  public void setParallelGeneration(boolean parallelGeneration) {
    this.parallelGeneration = parallelGeneration;
  }
}
