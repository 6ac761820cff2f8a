package ai.poker.game;

/**
 * Thrown when a hand, or a card inside it, cannot be accepted.
 * <p>
 * Every failure is fatal for the call that detected it: no partial action
 * sequence is produced. The {@link Reason} tells a caller which of its inputs
 * was wrong.
 */
public class InvalidHandException extends IllegalArgumentException {

    /**
     * Classification of the failure.
     */
    public enum Reason {
        /** The hand does not have exactly five positions. */
        INVALID_HAND_LENGTH,
        /** A rank is outside [2, 14] or a suit is not one of the four suits. */
        INVALID_CARD,
        /** The same card appears twice in one hand. */
        DUPLICATE_CARD,
        /** An empty slot was found where a complete hand is required. */
        INCOMPLETE_HAND,
        /** The hand shape does not match the requested fill/swap mode. */
        AMBIGUOUS_HAND_STATE
    }

    private final Reason reason;

    public InvalidHandException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public static InvalidHandException invalidHandLength(int length) {
        return new InvalidHandException(Reason.INVALID_HAND_LENGTH,
                "Hand must contain exactly " + Hand.SIZE + " positions but had " + length);
    }

    public static InvalidHandException invalidCard(String message) {
        return new InvalidHandException(Reason.INVALID_CARD, message);
    }

    public static InvalidHandException duplicateCard(Card card) {
        return new InvalidHandException(Reason.DUPLICATE_CARD, "Duplicate card in hand: " + card);
    }

    public static InvalidHandException incompleteHand(Hand hand) {
        return new InvalidHandException(Reason.INCOMPLETE_HAND,
                "Hand has empty slots " + hand.emptySlots() + " and cannot be evaluated: " + hand);
    }

    public static InvalidHandException ambiguousHandState(String message) {
        return new InvalidHandException(Reason.AMBIGUOUS_HAND_STATE, message);
    }

    public Reason getReason() {
        return reason;
    }
}
