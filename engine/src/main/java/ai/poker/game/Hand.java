package ai.poker.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The five card holders in front of the robot.
 * <p>
 * A {@code Hand} always has exactly {@link #SIZE} slots, numbered 1 to 5 to match the
 * physical holders. Each slot holds a {@link SlotContent}: a card or nothing. Hands are
 * immutable; {@link #withCard(int, Card)} and {@link #withEmpty(int)} return modified copies.
 * <p>
 * The constructor only checks the shape of the hand. Duplicate cards are allowed here
 * because the robot can observe them; they are rejected when the hand is evaluated.
 */
public final class Hand {
    /** Number of card holders. */
    public static final int SIZE = 5;

    /** Slot contents, index 0 holding slot 1. */
    private final List<SlotContent> slots;

    /**
     * Constructs a hand from exactly five slot contents.
     *
     * @param slots the holder contents in slot order (must not be null or contain null)
     * @throws InvalidHandException with reason {@code INVALID_HAND_LENGTH} if there are not five slots
     */
    public Hand(List<SlotContent> slots) {
        Objects.requireNonNull(slots, "slots");
        if (slots.size() != SIZE) {
            throw InvalidHandException.invalidHandLength(slots.size());
        }
        List<SlotContent> copy = new ArrayList<>(SIZE);
        for (SlotContent slot : slots) {
            copy.add(Objects.requireNonNull(slot, "slot"));
        }
        this.slots = Collections.unmodifiableList(copy);
    }

    /**
     * Builds a complete hand from five cards.
     *
     * @throws InvalidHandException with reason {@code INVALID_HAND_LENGTH} if not given five cards
     */
    public static Hand of(Card... cards) {
        Objects.requireNonNull(cards, "cards");
        List<SlotContent> slots = new ArrayList<>(cards.length);
        for (Card card : cards) {
            slots.add(SlotContent.filled(card));
        }
        return new Hand(slots);
    }

    /**
     * Builds a hand with all five holders empty.
     */
    public static Hand empty() {
        return new Hand(Collections.nCopies(SIZE, SlotContent.empty()));
    }

    /**
     * Parses a hand from whitespace or comma separated tokens, e.g. {@code "AH -- 10D 3S _"}.
     * <p>
     * {@code --}, {@code _} and {@code empty} (any case) mark an empty holder;
     * anything else is parsed with {@link Card#parse(String)}.
     *
     * @throws InvalidHandException if a token is not a card or there are not five tokens
     */
    public static Hand parse(String text) {
        Objects.requireNonNull(text, "text");
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw InvalidHandException.invalidHandLength(0);
        }
        String[] tokens = trimmed.split("[\\s,]+");
        List<SlotContent> slots = new ArrayList<>(tokens.length);
        for (String token : tokens) {
            if (token.equals("--") || token.equals("_") || token.equalsIgnoreCase("empty")) {
                slots.add(SlotContent.empty());
            } else {
                slots.add(SlotContent.filled(Card.parse(token)));
            }
        }
        return new Hand(slots);
    }

    /**
     * Returns the content of a slot.
     *
     * @param slot the 1-based slot number
     * @throws IllegalArgumentException if slot is outside [1, 5]
     */
    public SlotContent get(int slot) {
        return slots.get(checkSlot(slot) - 1);
    }

    /**
     * Returns the card in a slot.
     *
     * @param slot the 1-based slot number
     * @throws InvalidHandException with reason {@code INCOMPLETE_HAND} if the slot is empty
     */
    public Card cardAt(int slot) {
        return get(slot).card().orElseThrow(() -> InvalidHandException.incompleteHand(this));
    }

    /**
     * Returns all slot contents in slot order.
     */
    public List<SlotContent> slots() {
        return slots;
    }

    /**
     * Returns the cards of a complete hand in slot order.
     *
     * @throws InvalidHandException with reason {@code INCOMPLETE_HAND} if any slot is empty
     */
    public List<Card> cards() {
        List<Card> cards = new ArrayList<>(SIZE);
        for (int slot = 1; slot <= SIZE; slot++) {
            cards.add(cardAt(slot));
        }
        return cards;
    }

    /**
     * Returns the 1-based numbers of the empty slots, ascending.
     */
    public SortedSet<Integer> emptySlots() {
        SortedSet<Integer> empty = new TreeSet<>();
        for (int i = 0; i < SIZE; i++) {
            if (!slots.get(i).isFilled()) {
                empty.add(i + 1);
            }
        }
        return Collections.unmodifiableSortedSet(empty);
    }

    /**
     * Returns true if every slot holds a card.
     */
    public boolean isComplete() {
        return slots.stream().allMatch(SlotContent::isFilled);
    }

    /**
     * Returns true if no slot holds a card.
     */
    public boolean isEmpty() {
        return slots.stream().noneMatch(SlotContent::isFilled);
    }

    /**
     * Returns a copy of this hand with the given card in a slot.
     */
    public Hand withCard(int slot, Card card) {
        return with(slot, SlotContent.filled(card));
    }

    /**
     * Returns a copy of this hand with a slot emptied.
     */
    public Hand withEmpty(int slot) {
        return with(slot, SlotContent.empty());
    }

    private Hand with(int slot, SlotContent content) {
        List<SlotContent> copy = new ArrayList<>(slots);
        copy.set(checkSlot(slot) - 1, content);
        return new Hand(copy);
    }

    /**
     * Validates a 1-based slot number.
     *
     * @return the slot number unchanged
     * @throws IllegalArgumentException if slot is outside [1, 5]
     */
    public static int checkSlot(int slot) {
        if (slot < 1 || slot > SIZE) {
            throw new IllegalArgumentException("Slot must be between 1 and " + SIZE + " but was " + slot);
        }
        return slot;
    }

    /**
     * Returns the slot contents separated by spaces, e.g. "AH -- 10D 3S 7C".
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (SlotContent slot : slots) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(slot);
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Hand other)) {
            return false;
        }
        return slots.equals(other.slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }
}
