package ai.poker;

import ai.poker.evaluator.HandEvaluation;
import ai.poker.game.Hand;
import ai.poker.robot.Action;
import ai.poker.robot.ActionSequences;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Everything the decision service worked out for one hand.
 *
 * @param hand       the hand that was decided on
 * @param mode       fill, swap or stand pat
 * @param evaluation the classification; absent in fill mode because an incomplete hand has no rank
 * @param positions  holders to fill (fill mode) or to replace (swap mode); empty when standing pat
 * @param actions    the commands for the arm; empty when standing pat
 */
public record Decision(Hand hand, Mode mode, Optional<HandEvaluation> evaluation,
        SortedSet<Integer> positions, List<Action> actions) {

    public enum Mode {
        /** Empty holders are filled from the deck. */
        FILL,
        /** Selected cards are discarded and redrawn. */
        SWAP,
        /** The hand is kept as it is. */
        STAND
    }

    public Decision {
        Objects.requireNonNull(hand, "hand");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(evaluation, "evaluation");
        positions = Collections.unmodifiableSortedSet(new TreeSet<>(positions));
        actions = List.copyOf(actions);
    }

    /**
     * The actions rendered as controller command strings.
     */
    public List<String> commands() {
        return ActionSequences.toCommands(actions);
    }

    /**
     * Returns true if the arm has nothing to do.
     */
    public boolean isStandPat() {
        return mode == Mode.STAND;
    }
}
