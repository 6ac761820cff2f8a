package ai.poker;

import ai.poker.game.Card;
import ai.poker.game.Deck;
import ai.poker.game.Hand;
import ai.poker.game.SlotContent;
import ai.poker.robot.Action;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays the controller's part against a {@link Deck}: executes command sequences on a hand
 * the way the arm would and reports the cards that end up in the holders.
 * <p>
 * The arm holds at most one card. Executing a command the arm cannot perform
 * (taking while already holding, placing on an occupied holder, dropping or placing
 * with an empty gripper, drawing from an exhausted deck) raises {@link IllegalStateException}
 * and leaves the simulator as it was after the last successful command.
 * <p>
 * One simulator per game; not thread-safe.
 */
public class TableSimulator {
    private static final Logger log = LoggerFactory.getLogger(TableSimulator.class);

    private final PokerDecisionService decisionService;
    private final Deck deck;

    /** Card currently in the gripper, or null. */
    private Card holding;
    /** Cards dropped into the discard tray this game, in order. */
    private final List<Card> discardTray = new ArrayList<>();

    public TableSimulator(PokerDecisionService decisionService, Deck deck) {
        this.decisionService = Objects.requireNonNull(decisionService, "decisionService");
        this.deck = Objects.requireNonNull(deck, "deck");
    }

    /**
     * Outcome of one decide-and-execute round.
     *
     * @param decision what the service decided for the hand before the round
     * @param hand     the hand after executing the decision's commands
     */
    public record Round(Decision decision, Hand hand) {
    }

    /**
     * Asks the decision service what to do with {@code hand}, executes it and returns the result.
     */
    public Round playRound(Hand hand) {
        Decision decision = decisionService.analyse(hand);
        Hand after = execute(hand, decision.actions());
        return new Round(decision, after);
    }

    /**
     * Executes {@code actions} starting from {@code hand}.
     * <p>
     * Cards already in the hand are marked as used in the deck so they cannot be drawn again.
     *
     * @return the hand after the last command
     * @throws IllegalStateException if a command cannot be performed
     */
    public Hand execute(Hand hand, List<Action> actions) {
        Objects.requireNonNull(hand, "hand");
        Objects.requireNonNull(actions, "actions");
        for (SlotContent slot : hand.slots()) {
            slot.card().ifPresent(deck::markUsed);
        }
        Hand current = hand;
        for (Action action : actions) {
            current = apply(current, action);
        }
        return current;
    }

    private Hand apply(Hand hand, Action action) {
        switch (action.type()) {
            case TAKE_CARD_AT -> {
                requireEmptyGripper(action);
                Card card = hand.get(action.slot()).card().orElseThrow(
                        () -> new IllegalStateException("Cannot '" + action + "': holder " + action.slot() + " is empty"));
                holding = card;
                return hand.withEmpty(action.slot());
            }
            case DROP_HOLDING -> {
                Card card = requireHolding(action);
                discardTray.add(card);
                holding = null;
                if (log.isDebugEnabled()) {
                    log.debug("Discarded {}", card);
                }
                return hand;
            }
            case TAKE_DECK -> {
                requireEmptyGripper(action);
                Card card = deck.draw();
                if (card == null) {
                    throw new IllegalStateException("Cannot '" + action + "': deck is exhausted");
                }
                holding = card;
                return hand;
            }
            case PLACE_AT -> {
                Card card = requireHolding(action);
                if (hand.get(action.slot()).isFilled()) {
                    throw new IllegalStateException("Cannot '" + action + "': holder " + action.slot() + " is occupied");
                }
                holding = null;
                return hand.withCard(action.slot(), card);
            }
            case DEFAULT_POSITION -> {
                return hand;
            }
            default -> throw new IllegalStateException("Unhandled action: " + action);
        }
    }

    private void requireEmptyGripper(Action action) {
        if (holding != null) {
            throw new IllegalStateException("Cannot '" + action + "' while holding " + holding);
        }
    }

    private Card requireHolding(Action action) {
        if (holding == null) {
            throw new IllegalStateException("Cannot '" + action + "': gripper is empty");
        }
        return holding;
    }

    /**
     * Card currently in the gripper, or null.
     */
    public Card getHolding() {
        return holding;
    }

    /**
     * Cards discarded so far, oldest first.
     */
    public List<Card> getDiscardTray() {
        return Collections.unmodifiableList(discardTray);
    }

    public Deck getDeck() {
        return deck;
    }
}
