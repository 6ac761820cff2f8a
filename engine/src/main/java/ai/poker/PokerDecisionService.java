package ai.poker;

import ai.poker.evaluator.HandEvaluation;
import ai.poker.evaluator.HandEvaluator;
import ai.poker.game.Hand;
import ai.poker.robot.Action;
import ai.poker.robot.ActionCompiler;
import ai.poker.strategy.DiscardStrategy;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Entry point for the hand controller: given what is in the five holders, returns
 * what the arm should do next.
 * <p>
 * The decision is dispatched on the shape of the hand first:
 * <ol>
 *     <li>Any holder empty: fill the empty holders from the deck. Nothing is evaluated.</li>
 *     <li>All holders filled: evaluate, pick discards, and compile the swap sequence,
 *         which is empty when the hand stands pat.</li>
 * </ol>
 * The service keeps no state between calls. The controller executes the commands,
 * reads the new cards and calls again for the next round.
 */
@Component
public class PokerDecisionService {
    private static final Logger log = LoggerFactory.getLogger(PokerDecisionService.class);

    private final HandEvaluator evaluator;
    private final DiscardStrategy strategy;
    private final ActionCompiler compiler;

    public PokerDecisionService(HandEvaluator evaluator, DiscardStrategy strategy, ActionCompiler compiler) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.compiler = Objects.requireNonNull(compiler, "compiler");
    }

    /**
     * Service wired with the default evaluator, strategy and compiler.
     */
    public static PokerDecisionService withDefaults() {
        return new PokerDecisionService(new HandEvaluator(), new DiscardStrategy(), new ActionCompiler());
    }

    /**
     * Works out the next move for {@code hand}.
     *
     * @throws ai.poker.game.InvalidHandException if the hand holds a duplicate card
     */
    public Decision analyse(Hand hand) {
        Objects.requireNonNull(hand, "hand");
        Decision decision;
        if (!hand.isComplete()) {
            decision = new Decision(hand, Decision.Mode.FILL, Optional.empty(), hand.emptySlots(), compiler.fill(hand));
        } else {
            HandEvaluation evaluation = evaluator.evaluate(hand);
            SortedSet<Integer> discards = strategy.discardPositions(evaluation);
            List<Action> actions = compiler.swap(hand, discards);
            Decision.Mode mode = discards.isEmpty() ? Decision.Mode.STAND : Decision.Mode.SWAP;
            decision = new Decision(hand, mode, Optional.of(evaluation), discards, actions);
        }
        if (log.isDebugEnabled()) {
            log.debug("Hand [{}] -> {} {} ({} actions){}",
                    hand,
                    decision.mode(),
                    decision.positions(),
                    decision.actions().size(),
                    decision.evaluation().map(e -> " " + e.rank().getDisplayName() + " keeping " + e.keepers()).orElse(""));
        }
        DecisionLogger.logDecision(decision);
        return decision;
    }

    /**
     * Returns the commands for the next move; empty when the hand stands pat.
     */
    public List<Action> decide(Hand hand) {
        return analyse(hand).actions();
    }

    /**
     * Returns the next move as controller command strings.
     */
    public List<String> commands(Hand hand) {
        return analyse(hand).commands();
    }
}
