package ai.poker.evaluator;

import ai.poker.game.Card;
import ai.poker.game.Hand;
import ai.poker.game.InvalidHandException;
import ai.poker.game.Rank;
import ai.poker.game.Suit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Classifies a complete five-card hand into a {@link HandRank} and finds the slots that
 * make up that category.
 * <p>
 * Categories are tested strongest first and the first match wins:
 * royal flush, straight flush, four of a kind, full house, flush, straight,
 * three of a kind, two pair, pair, high card.
 * <p>
 * Keepers per category:
 * <ul>
 *   <li>four of a kind, three of a kind, two pair, pair: the slots holding the matched ranks</li>
 *   <li>royal flush, straight flush, full house, flush, straight: all five slots</li>
 *   <li>high card: the single slot with the highest rank (lowest slot on a tie)</li>
 * </ul>
 * <p>
 * The evaluator holds no state and may be shared freely.
 */
@Component
public class HandEvaluator {

    /** Ace counted low, only used when scoring the A-2-3-4-5 straight. */
    private static final int WHEEL_HIGH = 5;

    private static final Set<Integer> ROYAL_RANKS = Set.of(10, 11, 12, 13, 14);

    /**
     * Evaluates a complete hand.
     *
     * @param hand the hand to classify (must not be null)
     * @return the category, keeper slots and tiebreakers
     * @throws InvalidHandException with reason {@code INCOMPLETE_HAND} if a slot is empty,
     *                              or {@code DUPLICATE_CARD} if a card appears twice
     */
    public HandEvaluation evaluate(Hand hand) {
        Objects.requireNonNull(hand, "hand");
        if (!hand.isComplete()) {
            throw InvalidHandException.incompleteHand(hand);
        }
        List<Card> cards = hand.cards();
        Set<Card> seen = new HashSet<>();
        for (Card card : cards) {
            if (!seen.add(card)) {
                throw InvalidHandException.duplicateCard(card);
            }
        }

        // rank value -> slots holding that rank, highest rank first
        Map<Integer, SortedSet<Integer>> slotsByRank = new TreeMap<>(Comparator.reverseOrder());
        Set<Suit> suits = EnumSet.noneOf(Suit.class);
        for (int slot = 1; slot <= Hand.SIZE; slot++) {
            Card card = cards.get(slot - 1);
            slotsByRank.computeIfAbsent(card.getRank().getValue(), r -> new TreeSet<>()).add(slot);
            suits.add(card.getSuit());
        }

        boolean flush = suits.size() == 1;
        int straightHigh = straightHigh(slotsByRank.keySet());
        boolean straight = straightHigh > 0;
        List<Integer> ranksDescending = ranksDescending(cards);

        if (flush && straight) {
            if (slotsByRank.keySet().equals(ROYAL_RANKS)) {
                return new HandEvaluation(HandRank.ROYAL_FLUSH, allSlots(), List.of(Rank.ACE.getValue()));
            }
            return new HandEvaluation(HandRank.STRAIGHT_FLUSH, allSlots(), List.of(straightHigh));
        }

        List<Integer> quads = ranksWithCount(slotsByRank, 4);
        List<Integer> trips = ranksWithCount(slotsByRank, 3);
        List<Integer> pairs = ranksWithCount(slotsByRank, 2);
        List<Integer> singles = ranksWithCount(slotsByRank, 1);

        if (!quads.isEmpty()) {
            int quad = quads.get(0);
            return new HandEvaluation(HandRank.FOUR_OF_A_KIND, slotsByRank.get(quad), List.of(quad, singles.get(0)));
        }
        if (!trips.isEmpty() && !pairs.isEmpty()) {
            return new HandEvaluation(HandRank.FULL_HOUSE, allSlots(), List.of(trips.get(0), pairs.get(0)));
        }
        if (flush) {
            return new HandEvaluation(HandRank.FLUSH, allSlots(), ranksDescending);
        }
        if (straight) {
            return new HandEvaluation(HandRank.STRAIGHT, allSlots(), List.of(straightHigh));
        }
        if (!trips.isEmpty()) {
            int trip = trips.get(0);
            return new HandEvaluation(HandRank.THREE_OF_A_KIND, slotsByRank.get(trip), prepend(trip, singles));
        }
        if (pairs.size() == 2) {
            SortedSet<Integer> keepers = new TreeSet<>(slotsByRank.get(pairs.get(0)));
            keepers.addAll(slotsByRank.get(pairs.get(1)));
            return new HandEvaluation(HandRank.TWO_PAIR, keepers, List.of(pairs.get(0), pairs.get(1), singles.get(0)));
        }
        if (pairs.size() == 1) {
            int pair = pairs.get(0);
            return new HandEvaluation(HandRank.PAIR, slotsByRank.get(pair), prepend(pair, singles));
        }
        return new HandEvaluation(HandRank.HIGH_CARD, highestCardSlot(cards), ranksDescending);
    }

    /**
     * Compares two complete hands.
     *
     * @return a positive number if {@code first} wins, a negative number if {@code second} wins, 0 on a tie
     * @throws InvalidHandException if either hand cannot be evaluated
     */
    public int compare(Hand first, Hand second) {
        return Integer.signum(evaluate(first).compareTo(evaluate(second)));
    }

    /**
     * Returns the display name of the hand's category (e.g., "Full House").
     */
    public String handName(Hand hand) {
        return evaluate(hand).rank().getDisplayName();
    }

    /**
     * Returns the high card of a straight, 5 for the wheel, or 0 if the ranks are not a straight.
     *
     * @param distinctRanks the distinct rank values of the hand, highest first
     */
    static int straightHigh(Set<Integer> distinctRanks) {
        if (distinctRanks.size() != Hand.SIZE) {
            return 0;
        }
        List<Integer> ranks = new ArrayList<>(distinctRanks);
        ranks.sort(Comparator.reverseOrder());
        int high = ranks.get(0);
        if (high - ranks.get(Hand.SIZE - 1) == Hand.SIZE - 1) {
            return high;
        }
        if (ranks.equals(List.of(14, 5, 4, 3, 2))) {
            return WHEEL_HIGH;
        }
        return 0;
    }

    private static List<Integer> ranksWithCount(Map<Integer, SortedSet<Integer>> slotsByRank, int count) {
        List<Integer> ranks = new ArrayList<>();
        for (Map.Entry<Integer, SortedSet<Integer>> entry : slotsByRank.entrySet()) {
            if (entry.getValue().size() == count) {
                ranks.add(entry.getKey());
            }
        }
        return ranks;
    }

    private static List<Integer> ranksDescending(List<Card> cards) {
        List<Integer> ranks = new ArrayList<>(cards.size());
        for (Card card : cards) {
            ranks.add(card.getRank().getValue());
        }
        ranks.sort(Comparator.reverseOrder());
        return ranks;
    }

    private static List<Integer> prepend(int first, List<Integer> rest) {
        List<Integer> list = new ArrayList<>(rest.size() + 1);
        list.add(first);
        list.addAll(rest);
        return list;
    }

    private static SortedSet<Integer> highestCardSlot(List<Card> cards) {
        int best = 1;
        for (int slot = 2; slot <= cards.size(); slot++) {
            if (cards.get(slot - 1).getRank().getValue() > cards.get(best - 1).getRank().getValue()) {
                best = slot;
            }
        }
        SortedSet<Integer> keepers = new TreeSet<>();
        keepers.add(best);
        return keepers;
    }

    private static SortedSet<Integer> allSlots() {
        SortedSet<Integer> slots = new TreeSet<>();
        for (int slot = 1; slot <= Hand.SIZE; slot++) {
            slots.add(slot);
        }
        return slots;
    }
}
