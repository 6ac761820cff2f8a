package ai.poker.unit.evaluator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.poker.evaluator.HandEvaluation;
import ai.poker.evaluator.HandEvaluator;
import ai.poker.evaluator.HandRank;
import ai.poker.game.Hand;
import ai.poker.game.InvalidHandException;
import ai.poker.unit.helpers.HandFactory;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("HandEvaluator")
class HandEvaluatorTest {

    private final HandEvaluator evaluator = new HandEvaluator();

    private static void assertEvaluation(HandEvaluation evaluation, HandRank rank, Set<Integer> keepers,
            List<Integer> tiebreakers) {
        assertEquals(rank, evaluation.rank());
        assertEquals(keepers, evaluation.keepers());
        assertEquals(tiebreakers, evaluation.tiebreakers());
    }

    @Nested
    @DisplayName("Categories")
    class CategoryTests {

        @Test
        void royalFlushKeepsEverything() {
            assertEvaluation(evaluator.evaluate(HandFactory.royalFlush()),
                    HandRank.ROYAL_FLUSH, Set.of(1, 2, 3, 4, 5), List.of(14));
        }

        @Test
        void straightFlush() {
            assertEvaluation(evaluator.evaluate(HandFactory.straightFlush()),
                    HandRank.STRAIGHT_FLUSH, Set.of(1, 2, 3, 4, 5), List.of(9));
        }

        @Test
        void wheelStraightFlushIsFiveHigh() {
            assertEvaluation(evaluator.evaluate(HandFactory.wheelStraightFlush()),
                    HandRank.STRAIGHT_FLUSH, Set.of(1, 2, 3, 4, 5), List.of(5));
        }

        @Test
        void fourOfAKindKeepsTheQuads() {
            assertEvaluation(evaluator.evaluate(HandFactory.fourOfAKind()),
                    HandRank.FOUR_OF_A_KIND, Set.of(1, 2, 3, 4), List.of(7, 2));
        }

        @Test
        void fullHouse() {
            assertEvaluation(evaluator.evaluate(HandFactory.fullHouse()),
                    HandRank.FULL_HOUSE, Set.of(1, 2, 3, 4, 5), List.of(10, 5));
        }

        @Test
        void flush() {
            assertEvaluation(evaluator.evaluate(HandFactory.flush()),
                    HandRank.FLUSH, Set.of(1, 2, 3, 4, 5), List.of(14, 10, 8, 5, 2));
        }

        @Test
        void straight() {
            assertEvaluation(evaluator.evaluate(HandFactory.straight()),
                    HandRank.STRAIGHT, Set.of(1, 2, 3, 4, 5), List.of(9));
        }

        @Test
        void wheelStraightIsFiveHigh() {
            assertEvaluation(evaluator.evaluate(HandFactory.wheelStraight()),
                    HandRank.STRAIGHT, Set.of(1, 2, 3, 4, 5), List.of(5));
        }

        @Test
        void threeOfAKindKeepsTheTrips() {
            assertEvaluation(evaluator.evaluate(HandFactory.threeOfAKind()),
                    HandRank.THREE_OF_A_KIND, Set.of(1, 2, 3), List.of(7, 9, 2));
        }

        @Test
        void twoPairKeepsBothPairs() {
            assertEvaluation(evaluator.evaluate(HandFactory.twoPair()),
                    HandRank.TWO_PAIR, Set.of(1, 2, 3, 4), List.of(10, 5, 7));
        }

        @Test
        void pairKeepsThePair() {
            assertEvaluation(evaluator.evaluate(HandFactory.pair()),
                    HandRank.PAIR, Set.of(1, 2), List.of(10, 7, 5, 3));
        }

        @Test
        void highCardKeepsOnlyTheHighestCard() {
            assertEvaluation(evaluator.evaluate(HandFactory.highCard()),
                    HandRank.HIGH_CARD, Set.of(1), List.of(14, 10, 8, 5, 2));
        }
    }

    @Nested
    @DisplayName("Edge cases")
    class EdgeCaseTests {

        @Test
        void keepersFollowTheCardsNotTheSlotOrder() {
            HandEvaluation evaluation = evaluator.evaluate(Hand.parse("3S 10H 7H 10D 5C"));
            assertEquals(HandRank.PAIR, evaluation.rank());
            assertEquals(Set.of(2, 4), evaluation.keepers());
        }

        @Test
        void highCardInTheMiddleSlot() {
            HandEvaluation evaluation = evaluator.evaluate(Hand.parse("2H 10D AC 5S 8H"));
            assertEquals(HandRank.HIGH_CARD, evaluation.rank());
            assertEquals(Set.of(3), evaluation.keepers());
        }

        @Test
        void gapOfOneIsNotAStraight() {
            assertEquals(HandRank.HIGH_CARD, evaluator.evaluate(Hand.parse("AH KD QC JS 9H")).rank());
        }

        @Test
        void straightsDoNotWrapAroundTheAce() {
            assertEquals(HandRank.HIGH_CARD, evaluator.evaluate(Hand.parse("QH KD AC 2S 3H")).rank());
        }

        @Test
        void aceHighStraightOfMixedSuitsIsNotRoyal() {
            HandEvaluation evaluation = evaluator.evaluate(Hand.parse("AH KD QC JS 10H"));
            assertEquals(HandRank.STRAIGHT, evaluation.rank());
            assertEquals(List.of(14), evaluation.tiebreakers());
        }

        @Test
        void fullHouseBeatsThreeOfAKindCheck() {
            assertEquals(HandRank.FULL_HOUSE, evaluator.evaluate(Hand.parse("5S 10H 5H 10D 10C")).rank());
        }

        @Test
        void everyKeeperIsAValidSlot() {
            for (Hand hand : List.of(HandFactory.royalFlush(), HandFactory.fourOfAKind(), HandFactory.threeOfAKind(),
                    HandFactory.twoPair(), HandFactory.pair(), HandFactory.highCard())) {
                for (int slot : evaluator.evaluate(hand).keepers()) {
                    assertTrue(slot >= 1 && slot <= Hand.SIZE, hand + " kept slot " + slot);
                }
            }
        }
    }

    @Nested
    @DisplayName("Invalid hands")
    class InvalidHandTests {

        @Test
        void duplicateCardIsRejected() {
            InvalidHandException e = assertThrows(InvalidHandException.class,
                    () -> evaluator.evaluate(Hand.parse("AH AH QH JH 10H")));
            assertEquals(InvalidHandException.Reason.DUPLICATE_CARD, e.getReason());
        }

        @Test
        void incompleteHandCannotBeEvaluated() {
            InvalidHandException e = assertThrows(InvalidHandException.class,
                    () -> evaluator.evaluate(Hand.parse("AH -- QH JH 10H")));
            assertEquals(InvalidHandException.Reason.INCOMPLETE_HAND, e.getReason());
        }
    }

    @Nested
    @DisplayName("Comparison")
    class ComparisonTests {

        @Test
        void strongerCategoryWins() {
            assertEquals(1, evaluator.compare(HandFactory.royalFlush(), HandFactory.straightFlush()));
            assertEquals(1, evaluator.compare(HandFactory.fullHouse(), HandFactory.flush()));
            assertEquals(-1, evaluator.compare(HandFactory.highCard(), HandFactory.pair()));
        }

        @Test
        void wheelIsTheLowestStraight() {
            assertEquals(-1, evaluator.compare(HandFactory.wheelStraight(), HandFactory.straight()));
            assertEquals(-1, evaluator.compare(HandFactory.wheelStraightFlush(), HandFactory.straightFlush()));
        }

        @Test
        void kickersBreakTies() {
            assertEquals(1, evaluator.compare(Hand.parse("10H 10D 9C 3S 2H"), Hand.parse("10S 10C 8C 3D 2D")));
            assertEquals(0, evaluator.compare(Hand.parse("10H 10D 9C 3S 2H"), Hand.parse("10S 10C 9D 3D 2D")));
        }

        @Test
        void handNameUsesTheDisplayName() {
            assertEquals("Full House", evaluator.handName(HandFactory.fullHouse()));
            assertEquals("One Pair", evaluator.handName(HandFactory.pair()));
        }
    }
}
