package ai.poker.unit.strategy;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.poker.evaluator.HandEvaluation;
import ai.poker.evaluator.HandEvaluator;
import ai.poker.evaluator.HandRank;
import ai.poker.game.Hand;
import ai.poker.strategy.DiscardStrategy;
import ai.poker.unit.helpers.HandFactory;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.junit.jupiter.api.Test;

/**
 * Discard policy per category.
 *
 * <p><b>Tests and their intentions:</b>
 * <ul>
 *   <li><b>madeHandsStandPat</b> - straight or better never discards</li>
 *   <li><b>matchedCategoriesRedrawTheUnmatched</b> - trips, two pair and pair keep only the matched cards</li>
 *   <li><b>highCardRedrawsFour</b> - only the highest card survives</li>
 *   <li><b>keepersAndDiscardsPartitionTheHand</b> - disjoint, and together they cover every slot unless standing pat</li>
 *   <li><b>invalidKeepersAreRejected</b> - slot 0 and 6 are not holders</li>
 * </ul>
 */
class DiscardStrategyTest {

    private final HandEvaluator evaluator = new HandEvaluator();
    private final DiscardStrategy strategy = new DiscardStrategy();

    private SortedSet<Integer> discards(Hand hand) {
        return strategy.discardPositions(evaluator.evaluate(hand));
    }

    @Test
    void madeHandsStandPat() {
        for (Hand hand : List.of(HandFactory.royalFlush(), HandFactory.straightFlush(), HandFactory.fourOfAKind(),
                HandFactory.fullHouse(), HandFactory.flush(), HandFactory.straight(), HandFactory.wheelStraight())) {
            assertTrue(discards(hand).isEmpty(), "expected to stand pat on " + hand);
        }
    }

    @Test
    void matchedCategoriesRedrawTheUnmatched() {
        assertEquals(Set.of(4, 5), discards(HandFactory.threeOfAKind()));
        assertEquals(Set.of(5), discards(HandFactory.twoPair()));
        assertEquals(Set.of(3, 4, 5), discards(HandFactory.pair()));
    }

    @Test
    void highCardRedrawsFour() {
        assertEquals(Set.of(2, 3, 4, 5), discards(HandFactory.highCard()));
        assertEquals(Set.of(1, 2, 4, 5), discards(Hand.parse("2H 10D AC 5S 8H")));
    }

    @Test
    void keepersAndDiscardsPartitionTheHand() {
        for (Hand hand : List.of(HandFactory.royalFlush(), HandFactory.straightFlush(), HandFactory.fourOfAKind(),
                HandFactory.fullHouse(), HandFactory.flush(), HandFactory.straight(), HandFactory.threeOfAKind(),
                HandFactory.twoPair(), HandFactory.pair(), HandFactory.highCard())) {
            HandEvaluation evaluation = evaluator.evaluate(hand);
            SortedSet<Integer> discards = strategy.discardPositions(evaluation);

            SortedSet<Integer> overlap = new TreeSet<>(evaluation.keepers());
            overlap.retainAll(discards);
            assertTrue(overlap.isEmpty(), hand + " discards a keeper: " + overlap);

            if (!discards.isEmpty()) {
                SortedSet<Integer> union = new TreeSet<>(evaluation.keepers());
                union.addAll(discards);
                assertEquals(Set.of(1, 2, 3, 4, 5), union, "union for " + hand);
            }
        }
    }

    @Test
    void fourOfAKindKeepsItsKickerByStandingPat() {
        HandEvaluation evaluation = evaluator.evaluate(HandFactory.fourOfAKind());
        assertEquals(Set.of(1, 2, 3, 4), evaluation.keepers());
        assertTrue(strategy.discardPositions(evaluation).isEmpty());
    }

    @Test
    void invalidKeepersAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> strategy.discardPositions(HandRank.PAIR, new TreeSet<>(List.of(0, 1))));
        assertThrows(IllegalArgumentException.class,
                () -> strategy.discardPositions(HandRank.PAIR, new TreeSet<>(List.of(5, 6))));
        assertThrows(IllegalArgumentException.class,
                () -> strategy.discardPositions(HandRank.HIGH_CARD, new TreeSet<>(List.of(1, 2))));
    }
}
