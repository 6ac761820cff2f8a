package ai.poker.game;

/**
 * Enumeration representing the four suits of a standard playing card deck.
 * <p>
 * Each suit has a single-letter code used in card tokens (e.g., "10H", "AS"),
 * a Unicode symbol for display and a full name. Suits carry no ordering in poker;
 * only equality matters (all five equal makes a flush).
 */
public enum Suit {
    /** Hearts – code {@code H}, symbol ♥. */
    HEARTS('H', "♥", "Hearts"),
    /** Diamonds – code {@code D}, symbol ♦. */
    DIAMONDS('D', "♦", "Diamonds"),
    /** Clubs – code {@code C}, symbol ♣. */
    CLUBS('C', "♣", "Clubs"),
    /** Spades – code {@code S}, symbol ♠. */
    SPADES('S', "♠", "Spades");

    /** Single-letter code of the suit. */
    private final char code;
    /** The Unicode symbol representing this suit (e.g., "♣", "♦"). */
    private final String symbol;
    /** Full display name (e.g., "Hearts"). */
    private final String displayName;

    Suit(char code, String symbol, String displayName) {
        this.code = code;
        this.symbol = symbol;
        this.displayName = displayName;
    }

    /**
     * Returns the single-letter code of this suit.
     *
     * @return the code ({@code H}, {@code D}, {@code C} or {@code S})
     */
    public char getCode() {
        return code;
    }

    /**
     * Returns the Unicode symbol of this suit.
     *
     * @return the suit symbol (e.g., "♣", "♦", "♥", "♠")
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Returns the full name of this suit.
     *
     * @return the display name (e.g., "Spades")
     */
    public String getDisplayName() {
        return displayName;
    }

    /**
     * Returns the suit for a letter code or a Unicode symbol (case-insensitive).
     *
     * @param c the code ({@code H}, {@code d}, ...) or symbol ({@code ♠}, ...)
     * @return the matching suit
     * @throws InvalidHandException with reason {@code INVALID_CARD} if no suit matches
     */
    public static Suit fromCode(char c) {
        char upper = Character.toUpperCase(c);
        for (Suit suit : values()) {
            if (suit.code == upper || suit.symbol.charAt(0) == c) {
                return suit;
            }
        }
        throw InvalidHandException.invalidCard("Unknown suit: " + c);
    }

    /**
     * Returns the single-letter code as a string.
     *
     * @return the suit code
     */
    @Override
    public String toString() {
        return String.valueOf(code);
    }
}
