package ai.poker.game;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;

/**
 * Represents a standard 52-card deck used to deal the robot's hand.
 * <p>
 * A {@code Deck} keeps every card it has handed out (or been told about through
 * {@link #markUsed(Card)}) until {@link #reset()}, so a game never sees the same card twice.
 * Draws are random among the remaining cards; pass a seed or a {@link Random} to make a
 * game reproducible.
 * <p>
 * Instances are not thread-safe. Each game owns its own deck.
 */
public class Deck {
    /** Number of cards in a full deck. */
    public static final int FULL_SIZE = 52;

    /** All 52 cards in a fixed order (suit by suit, Two to Ace). */
    private final List<Card> allCards;
    /** Cards drawn or marked used since the last reset. */
    private final Set<Card> usedCards = new HashSet<>();
    /** Source of randomness for draws. */
    private final Random random;

    /**
     * Constructs a deck that draws with a fresh, unseeded random source.
     */
    public Deck() {
        this(new Random());
    }

    /**
     * Constructs a deck whose draws are reproducible for a given seed.
     *
     * @param seed the random seed
     */
    public Deck(long seed) {
        this(new Random(seed));
    }

    /**
     * Constructs a deck that draws using the given random source.
     *
     * @param random the random source (must not be null)
     */
    public Deck(Random random) {
        this.random = Objects.requireNonNull(random, "random");
        List<Card> cards = new ArrayList<>(FULL_SIZE);
        for (Suit suit : Suit.values()) {
            for (Rank rank : Rank.values()) {
                cards.add(new Card(rank, suit));
            }
        }
        this.allCards = Collections.unmodifiableList(cards);
    }

    /**
     * Makes all 52 cards available again.
     */
    public void reset() {
        usedCards.clear();
    }

    /**
     * Draws a random card that has not been drawn or marked used since the last reset.
     *
     * @return the drawn card, or {@code null} if the deck is exhausted
     */
    public Card draw() {
        List<Card> available = new ArrayList<>(remainingCount());
        for (Card card : allCards) {
            if (!usedCards.contains(card)) {
                available.add(card);
            }
        }
        if (available.isEmpty()) {
            return null;
        }
        Card card = available.get(random.nextInt(available.size()));
        usedCards.add(card);
        return card;
    }

    /**
     * Draws up to {@code count} cards.
     *
     * @param count the number of cards wanted
     * @return the drawn cards; fewer than {@code count} if the deck runs out
     */
    public List<Card> draw(int count) {
        List<Card> cards = new ArrayList<>(Math.max(count, 0));
        for (int i = 0; i < count; i++) {
            Card card = draw();
            if (card == null) {
                break;
            }
            cards.add(card);
        }
        return cards;
    }

    /**
     * Deals a complete starting hand of five distinct cards.
     *
     * @return the dealt hand
     * @throws IllegalStateException if fewer than five cards remain
     */
    public Hand generateInitialHand() {
        List<Card> cards = draw(Hand.SIZE);
        if (cards.size() != Hand.SIZE) {
            throw new IllegalStateException("Only " + cards.size() + " cards left; cannot deal a hand");
        }
        return Hand.of(cards.toArray(new Card[0]));
    }

    /**
     * Marks a card as no longer available (e.g., it went to the discard tray).
     */
    public void markUsed(Card card) {
        usedCards.add(Objects.requireNonNull(card, "card"));
    }

    /**
     * Marks several cards as no longer available.
     */
    public void markUsed(Collection<Card> cards) {
        for (Card card : cards) {
            markUsed(card);
        }
    }

    /**
     * Checks whether a card can still be drawn.
     */
    public boolean isAvailable(Card card) {
        return !usedCards.contains(card);
    }

    /**
     * Returns the number of cards that can still be drawn.
     */
    public int remainingCount() {
        return FULL_SIZE - usedCards.size();
    }

    /**
     * Returns a copy of the cards drawn or marked used since the last reset.
     */
    public Set<Card> usedCards() {
        return new HashSet<>(usedCards);
    }

    /**
     * Returns a string representation of the deck.
     *
     * @return a string showing the remaining count (e.g., "Deck(remaining=47)")
     */
    @Override
    public String toString() {
        return "Deck(remaining=" + remainingCount() + ")";
    }
}
