package ai.poker.robot;

import ai.poker.game.Hand;
import ai.poker.game.InvalidHandException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Turns a fill or swap decision into the literal command sequence for the arm.
 * <p>
 * <b>Fill</b>, for a hand with empty holders: for each empty slot in ascending order
 * {@code take deck, place at n}; then one {@code default position}.
 * <p>
 * <b>Swap</b>, for a complete hand: for each discarded slot in ascending order
 * {@code take card n, drop holding, default position, take deck, place at n};
 * then one {@code default position}. No discards means no commands at all.
 * <p>
 * The two modes are never mixed. Asking for the mode that does not match the hand's
 * shape is rejected with {@link InvalidHandException.Reason#AMBIGUOUS_HAND_STATE}.
 */
@Component
public class ActionCompiler {

    /**
     * Compiles the fill sequence for every empty holder of {@code hand}.
     *
     * @throws InvalidHandException with reason {@code AMBIGUOUS_HAND_STATE} if the hand has no empty holder
     */
    public List<Action> fill(Hand hand) {
        Objects.requireNonNull(hand, "hand");
        SortedSet<Integer> empty = hand.emptySlots();
        if (empty.isEmpty()) {
            throw InvalidHandException.ambiguousHandState(
                    "Fill requested for a complete hand; evaluate and swap instead: " + hand);
        }
        List<Action> actions = new ArrayList<>(empty.size() * 2 + 1);
        for (int slot : empty) {
            actions.add(Action.takeDeck());
            actions.add(Action.placeAt(slot));
        }
        actions.add(Action.defaultPosition());
        return Collections.unmodifiableList(actions);
    }

    /**
     * Compiles the swap sequence replacing {@code discards} in a complete hand.
     *
     * @param hand     the complete hand the discards refer to
     * @param discards 1-based slots to replace; empty to stand pat
     * @return the commands, or an empty list when nothing is discarded
     * @throws InvalidHandException     with reason {@code AMBIGUOUS_HAND_STATE} if the hand has an empty holder
     * @throws IllegalArgumentException if a discard slot is outside [1, 5]
     */
    public List<Action> swap(Hand hand, SortedSet<Integer> discards) {
        Objects.requireNonNull(hand, "hand");
        Objects.requireNonNull(discards, "discards");
        if (!hand.isComplete()) {
            throw InvalidHandException.ambiguousHandState(
                    "Swap requested for a hand with empty slots " + hand.emptySlots() + ": " + hand);
        }
        if (discards.isEmpty()) {
            return Collections.emptyList();
        }
        // Ascending order regardless of the comparator the caller's set was built with.
        SortedSet<Integer> ordered = new TreeSet<>(discards);
        List<Action> actions = new ArrayList<>(ordered.size() * 5 + 1);
        for (int slot : ordered) {
            actions.add(Action.takeCardAt(slot));
            actions.add(Action.dropHolding());
            actions.add(Action.defaultPosition());
            actions.add(Action.takeDeck());
            actions.add(Action.placeAt(slot));
        }
        actions.add(Action.defaultPosition());
        return Collections.unmodifiableList(actions);
    }
}
