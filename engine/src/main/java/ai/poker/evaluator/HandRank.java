package ai.poker.evaluator;

/**
 * The ten poker hand categories, declared weakest first so that {@link #ordinal()}
 * and {@link #getStrength()} both order hands by strength.
 * <p>
 * {@link #ROYAL_FLUSH} is the ace-high {@link #STRAIGHT_FLUSH}; it is reported as its
 * own category but is treated like any other straight flush when deciding discards.
 */
public enum HandRank {
    HIGH_CARD("High Card"),
    PAIR("One Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three of a Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four of a Kind"),
    STRAIGHT_FLUSH("Straight Flush"),
    ROYAL_FLUSH("Royal Flush");

    private final String displayName;

    HandRank(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Human-readable name, e.g. "Three of a Kind".
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Numeric strength from 0 (high card) to 9 (royal flush).
     */
    public int getStrength() {
        return ordinal();
    }

    /**
     * Returns true if this category is at least as strong as {@code other}.
     */
    public boolean isAtLeast(HandRank other) {
        return compareTo(other) >= 0;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
