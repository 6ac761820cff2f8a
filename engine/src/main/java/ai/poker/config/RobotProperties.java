package ai.poker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the demo runner.
 *
 * Controls how many games the runner deals, how many swap rounds follow the initial fill
 * in each game, and an optional deck seed so a run can be replayed exactly.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.arguments="--robot.rounds=3 --robot.seed=42"}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "robot")
public class RobotProperties {
  private int games = 1;
  private int rounds = 2;
  private Long seed;

  /**
   * Returns the number of games the runner deals.
   * @return games per run (at least 0)
   */
  public int getGames() {
    return games;
  }

  /**
   * Sets the number of games the runner deals.
   * @param games games per run
   */
  public void setGames(int games) {
    this.games = games;
  }

  /**
   * Returns the maximum number of swap rounds after the fill round.
   * @return swap rounds per game
   */
  public int getRounds() {
    return rounds;
  }

  /**
   * Sets the maximum number of swap rounds after the fill round.
   * @param rounds swap rounds per game
   */
  public void setRounds(int rounds) {
    this.rounds = rounds;
  }

  /**
   * Returns the deck seed, or null for an unseeded deck.
   * @return the seed or null
   */
  public Long getSeed() {
    return seed;
  }

  /**
   * Sets the deck seed; game n of a run uses {@code seed + n}.
   * @param seed the seed, or null for an unseeded deck
   */
  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
