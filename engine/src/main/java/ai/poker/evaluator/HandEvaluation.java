package ai.poker.evaluator;

import ai.poker.game.Hand;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Result of classifying a complete hand.
 *
 * @param rank        the hand category
 * @param keepers     1-based slots of the cards that make up the category, ascending
 * @param tiebreakers rank values (2–14, the wheel counted as 5-high) that order hands of the same
 *                    category, most significant first
 */
public record HandEvaluation(HandRank rank, SortedSet<Integer> keepers, List<Integer> tiebreakers)
        implements Comparable<HandEvaluation> {

    public HandEvaluation {
        Objects.requireNonNull(rank, "rank");
        Objects.requireNonNull(keepers, "keepers");
        Objects.requireNonNull(tiebreakers, "tiebreakers");
        if (keepers.isEmpty()) {
            throw new IllegalArgumentException("A hand always keeps at least one card");
        }
        for (int slot : keepers) {
            Hand.checkSlot(slot);
        }
        keepers = Collections.unmodifiableSortedSet(new TreeSet<>(keepers));
        tiebreakers = List.copyOf(tiebreakers);
    }

    /**
     * Orders evaluations by category strength, then by tiebreakers.
     */
    @Override
    public int compareTo(HandEvaluation other) {
        int byRank = rank.compareTo(other.rank);
        if (byRank != 0) {
            return byRank;
        }
        int n = Math.min(tiebreakers.size(), other.tiebreakers.size());
        for (int i = 0; i < n; i++) {
            int diff = Integer.compare(tiebreakers.get(i), other.tiebreakers.get(i));
            if (diff != 0) {
                return diff;
            }
        }
        return Integer.compare(tiebreakers.size(), other.tiebreakers.size());
    }
}
