package ai.poker;

import ai.poker.config.RobotProperties;
import ai.poker.evaluator.HandEvaluation;
import ai.poker.game.Deck;
import ai.poker.game.Hand;
import ai.poker.robot.ActionSequences;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PokerRobot implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(PokerRobot.class);

    private final PokerDecisionService decisionService;
    private final RobotProperties properties;

    public PokerRobot(PokerDecisionService decisionService, RobotProperties properties) {
        this.decisionService = Objects.requireNonNull(decisionService, "decisionService");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(PokerRobot.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        for (int game = 0; game < properties.getGames(); game++) {
            Deck deck = properties.getSeed() != null ? new Deck(properties.getSeed() + game) : new Deck();
            GameResult result = play(deck);
            log.info("Game {}/{} finished: [{}] {} after {} swap round(s), {} card(s) swapped",
                    game + 1,
                    properties.getGames(),
                    result.finalHand(),
                    result.finalEvaluation().rank().getDisplayName(),
                    result.swapRounds(),
                    result.cardsSwapped());
        }
    }

    /**
     * Plays one game on {@code deck}: a fill round on an empty table followed by up to
     * {@link RobotProperties#getRounds()} swap rounds, stopping early when the hand stands pat.
     *
     * @return final hand, its evaluation and how much swapping it took
     */
    public GameResult play(Deck deck) {
        deck.reset();
        TableSimulator table = new TableSimulator(decisionService, deck);

        TableSimulator.Round fill = table.playRound(Hand.empty());
        Hand hand = fill.hand();
        log.info("Dealt [{}] with {} actions", hand, fill.decision().actions().size());

        int swapRounds = 0;
        int cardsSwapped = 0;
        for (int round = 1; round <= properties.getRounds(); round++) {
            TableSimulator.Round swap = table.playRound(hand);
            Decision decision = swap.decision();
            HandEvaluation evaluation = decision.evaluation().orElseThrow();
            if (decision.isStandPat()) {
                log.info("Round {}: {} - standing pat", round, evaluation.rank().getDisplayName());
                break;
            }
            log.info("Round {}: {} keeping {}, swapping {}",
                    round,
                    evaluation.rank().getDisplayName(),
                    evaluation.keepers(),
                    ActionSequences.swapPositions(decision.actions()));
            if (log.isDebugEnabled()) {
                for (int i = 0; i < decision.actions().size(); i++) {
                    log.debug("  {}. {}", i + 1, decision.actions().get(i));
                }
            }
            hand = swap.hand();
            swapRounds++;
            cardsSwapped += ActionSequences.countSwaps(decision.actions());
            log.info("Round {}: now [{}]", round, hand);
        }
        HandEvaluation finalEvaluation = decisionService.analyse(hand).evaluation().orElseThrow();
        return new GameResult(hand, finalEvaluation, swapRounds, cardsSwapped);
    }

    /**
     * Summary of one game.
     *
     * @param finalHand       the hand when the game stopped
     * @param finalEvaluation its classification
     * @param swapRounds      swap rounds actually executed
     * @param cardsSwapped    cards replaced across all swap rounds
     */
    public record GameResult(Hand finalHand, HandEvaluation finalEvaluation, int swapRounds, int cardsSwapped) {
    }
}
