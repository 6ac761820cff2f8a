package ai.poker.strategy;

import ai.poker.evaluator.HandEvaluation;
import ai.poker.evaluator.HandRank;
import ai.poker.game.Hand;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Decides which slots to throw away and redraw, given the category of a complete hand.
 * <p>
 * Policy:
 * <ul>
 *   <li>Straight or better (straight, flush, full house, four of a kind, straight flush,
 *       royal flush): stand pat, nothing is discarded.</li>
 *   <li>Three of a kind, two pair, pair: keep the matched cards and redraw the rest.</li>
 *   <li>High card: keep the single highest card and redraw the other four.</li>
 * </ul>
 * The table is a switch over every {@link HandRank}; a new category does not compile
 * until it is given a row here.
 */
@Component
public class DiscardStrategy {

    /**
     * Returns the slots to discard for an evaluated hand.
     */
    public SortedSet<Integer> discardPositions(HandEvaluation evaluation) {
        Objects.requireNonNull(evaluation, "evaluation");
        return discardPositions(evaluation.rank(), evaluation.keepers());
    }

    /**
     * Returns the slots to discard for a hand category and its keeper slots.
     *
     * @param rank    the hand category
     * @param keepers the 1-based slots that make up the category
     * @return the 1-based slots to discard, ascending; empty to stand pat
     * @throws IllegalArgumentException if a keeper slot is outside [1, 5], or a high card
     *                                  hand does not have exactly one keeper
     */
    public SortedSet<Integer> discardPositions(HandRank rank, SortedSet<Integer> keepers) {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(keepers, "keepers");
        for (int slot : keepers) {
            Hand.checkSlot(slot);
        }
        return switch (rank) {
            case ROYAL_FLUSH, STRAIGHT_FLUSH, FOUR_OF_A_KIND, FULL_HOUSE -> standPat();
            case FLUSH, STRAIGHT -> standPat();
            case THREE_OF_A_KIND, TWO_PAIR, PAIR -> allExcept(keepers);
            case HIGH_CARD -> {
                if (keepers.size() != 1) {
                    throw new IllegalArgumentException("High card keeps exactly one slot but got " + keepers);
                }
                yield allExcept(keepers);
            }
        };
    }

    private static SortedSet<Integer> standPat() {
        return Collections.emptySortedSet();
    }

    private static SortedSet<Integer> allExcept(SortedSet<Integer> keepers) {
        SortedSet<Integer> discards = new TreeSet<>();
        for (int slot = 1; slot <= Hand.SIZE; slot++) {
            if (!keepers.contains(slot)) {
                discards.add(slot);
            }
        }
        return Collections.unmodifiableSortedSet(discards);
    }
}
