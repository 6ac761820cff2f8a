package ai.poker.game;

/**
 * Enumeration representing the 13 ranks of a standard playing card deck.
 * <p>
 * Each rank is assigned a numeric value (2–14) for ordering and comparison,
 * and a short label for string representation (e.g., "A", "K", "10").
 * In draw poker the Ace is the highest rank (14); the only place it plays low
 * is the A-2-3-4-5 straight, which the evaluator handles separately.
 */
public enum Rank {
    /** Two – the lowest rank (value 2). */
    TWO(2, "2"),
    /** Three – rank value 3. */
    THREE(3, "3"),
    /** Four – rank value 4. */
    FOUR(4, "4"),
    /** Five – rank value 5. */
    FIVE(5, "5"),
    /** Six – rank value 6. */
    SIX(6, "6"),
    /** Seven – rank value 7. */
    SEVEN(7, "7"),
    /** Eight – rank value 8. */
    EIGHT(8, "8"),
    /** Nine – rank value 9. */
    NINE(9, "9"),
    /** Ten – rank value 10. */
    TEN(10, "10"),
    /** Jack – rank value 11. */
    JACK(11, "J"),
    /** Queen – rank value 12. */
    QUEEN(12, "Q"),
    /** King – rank value 13. */
    KING(13, "K"),
    /** Ace – the highest rank (value 14). */
    ACE(14, "A");

    /** Lowest valid rank value. */
    public static final int MIN_VALUE = 2;
    /** Highest valid rank value. */
    public static final int MAX_VALUE = 14;

    /** Numeric value of the rank, used for ordering and comparisons (2–14). */
    private final int value;
    /** Short string label for display (e.g., "A", "K", "10"). */
    private final String label;

    /**
     * Constructs a Rank with a numeric value and display label.
     *
     * @param value the numeric rank value (2–14)
     * @param label the short string representation of the rank
     */
    Rank(int value, String label) {
        this.value = value;
        this.label = label;
    }

    /**
     * Returns the numeric value of this rank.
     *
     * @return the numeric rank value (2 for Two, 14 for Ace)
     */
    public int getValue() {
        return value;
    }

    /**
     * Returns the short string label of this rank.
     *
     * @return the label (e.g., "A", "K", "10")
     */
    public String getLabel() {
        return label;
    }

    /**
     * Returns the rank for a numeric value.
     *
     * @param value the numeric rank value (2–14)
     * @return the matching rank
     * @throws InvalidHandException with reason {@code INVALID_CARD} if the value is outside [2, 14]
     */
    public static Rank fromValue(int value) {
        if (value < MIN_VALUE || value > MAX_VALUE) {
            throw InvalidHandException.invalidCard("Rank must be between " + MIN_VALUE + " and "
                    + MAX_VALUE + " but was " + value);
        }
        return values()[value - MIN_VALUE];
    }

    /**
     * Returns the rank for a label such as "10", "J" or "a" (case-insensitive).
     * <p>
     * "T" is accepted as an alias for Ten, as it commonly appears in two-character card codes.
     *
     * @param label the rank label
     * @return the matching rank
     * @throws InvalidHandException with reason {@code INVALID_CARD} if no rank matches
     */
    public static Rank fromLabel(String label) {
        if (label != null) {
            String l = label.trim();
            if (l.equalsIgnoreCase("T")) {
                return TEN;
            }
            for (Rank rank : values()) {
                if (rank.label.equalsIgnoreCase(l)) {
                    return rank;
                }
            }
        }
        throw InvalidHandException.invalidCard("Unknown rank: " + label);
    }

    /**
     * Returns the string representation of this rank.
     * <p>
     * Equivalent to {@link #getLabel()}.
     *
     * @return the rank label
     */
    @Override
    public String toString() {
        return label;
    }
}
