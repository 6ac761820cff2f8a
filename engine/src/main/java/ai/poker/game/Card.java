package ai.poker.game;

import java.util.Objects;

/**
 * Represents a single playing card with a {@link Rank} and a {@link Suit}.
 * <p>
 * Each card is immutable and uniquely identified by its rank and suit combination.
 * Cards can be built from typed values, from the numeric form used by the hand
 * controller ({@code (14, 'H')}) or parsed from short tokens such as "10H", "AS" or "Q♠".
 */
public final class Card {
    /** The rank (Two through Ace) of this card. */
    private final Rank rank;
    /** The suit (Hearts, Diamonds, Clubs, Spades) of this card. */
    private final Suit suit;

    /**
     * Constructs a Card with the given rank and suit.
     *
     * @param rank the rank of the card (must not be null)
     * @param suit the suit of the card (must not be null)
     * @throws NullPointerException if rank or suit is null
     */
    public Card(Rank rank, Suit suit) {
        this.rank = Objects.requireNonNull(rank, "rank");
        this.suit = Objects.requireNonNull(suit, "suit");
    }

    /**
     * Builds a card from a numeric rank (2–14) and a suit code.
     *
     * @param rank the numeric rank, 11=Jack, 12=Queen, 13=King, 14=Ace
     * @param suit the suit code ({@code H}, {@code D}, {@code C}, {@code S})
     * @return the card
     * @throws InvalidHandException with reason {@code INVALID_CARD} if either part is out of range
     */
    public static Card of(int rank, char suit) {
        return new Card(Rank.fromValue(rank), Suit.fromCode(suit));
    }

    /**
     * Parses a short card token such as {@code AH}, {@code 10d}, {@code TD} or {@code Q♠}.
     * <p>
     * The last character is the suit; everything before it is the rank label.
     *
     * @param token the token to parse
     * @return the card
     * @throws InvalidHandException with reason {@code INVALID_CARD} if the token is malformed
     */
    public static Card parse(String token) {
        if (token == null || token.trim().length() < 2) {
            throw InvalidHandException.invalidCard("Unrecognised card: " + token);
        }
        String t = token.trim();
        Suit suit = Suit.fromCode(t.charAt(t.length() - 1));
        Rank rank = Rank.fromLabel(t.substring(0, t.length() - 1));
        return new Card(rank, suit);
    }

    /**
     * Returns the rank of this card.
     *
     * @return the rank (e.g., {@code Rank.ACE}, {@code Rank.KING})
     */
    public Rank getRank() {
        return rank;
    }

    /**
     * Returns the suit of this card.
     *
     * @return the suit (e.g., {@code Suit.SPADES}, {@code Suit.HEARTS})
     */
    public Suit getSuit() {
        return suit;
    }

    /**
     * Returns the short name of this card: rank label followed by suit code
     * (e.g., "QS", "10D", "AH").
     *
     * @return the short name of the card
     */
    public String shortName() {
        return rank.getLabel() + suit.getCode();
    }

    /**
     * Returns the readable name of this card (e.g., "A of Hearts", "10 of Clubs").
     *
     * @return the full name of the card
     */
    public String fullName() {
        return rank.getLabel() + " of " + suit.getDisplayName();
    }

    /**
     * Returns the short name of this card.
     *
     * @return the card string (e.g., "QS" or "10D")
     */
    @Override
    public String toString() {
        return shortName();
    }

    /**
     * Two cards are equal if and only if they have the same rank and suit.
     *
     * @param o the object to compare with
     * @return {@code true} if both cards have identical rank and suit; {@code false} otherwise
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Card)) {
            return false;
        }
        Card card = (Card) o;
        return rank == card.rank && suit == card.suit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rank, suit);
    }
}
