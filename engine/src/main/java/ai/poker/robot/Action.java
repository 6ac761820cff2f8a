package ai.poker.robot;

import ai.poker.game.Hand;
import java.util.Locale;
import java.util.Objects;

/**
 * Structured representation of one manipulator command.
 *
 * <p><b>Supported command shapes:</b>
 * <ul>
 *   <li>{@code take card <n>}: pick up the card in holder n</li>
 *   <li>{@code default position}: return the arm to its rest position</li>
 *   <li>{@code drop holding}: drop the held card into the discard tray</li>
 *   <li>{@code take deck}: pick up the top card of the deck</li>
 *   <li>{@code place at <n>}: put the held card into holder n</li>
 * </ul>
 *
 * <p>Holder numbers are 1-based (1..5). Only {@link Type#TAKE_CARD_AT} and {@link Type#PLACE_AT}
 * carry a slot; for the other types {@link #slot()} is 0.
 */
public final class Action {

    /**
     * The command type.
     */
    public enum Type {
        TAKE_CARD_AT("take card", true),
        DEFAULT_POSITION("default position", false),
        DROP_HOLDING("drop holding", false),
        TAKE_DECK("take deck", false),
        PLACE_AT("place at", true);

        private final String verb;
        private final boolean hasSlot;

        Type(String verb, boolean hasSlot) {
            this.verb = verb;
            this.hasSlot = hasSlot;
        }

        /**
         * The command text without the slot number.
         */
        public String verb() {
            return verb;
        }

        /**
         * Returns true if commands of this type name a holder.
         */
        public boolean hasSlot() {
            return hasSlot;
        }
    }

    private static final Action DEFAULT_POSITION = new Action(Type.DEFAULT_POSITION, 0);
    private static final Action DROP_HOLDING = new Action(Type.DROP_HOLDING, 0);
    private static final Action TAKE_DECK = new Action(Type.TAKE_DECK, 0);

    private final Type type;

    /**
     * 1-based holder for slot commands; 0 otherwise.
     */
    private final int slot;

    private Action(Type type, int slot) {
        this.type = Objects.requireNonNull(type, "type");
        this.slot = slot;
    }

    public static Action takeCardAt(int slot) {
        return new Action(Type.TAKE_CARD_AT, Hand.checkSlot(slot));
    }

    public static Action defaultPosition() {
        return DEFAULT_POSITION;
    }

    public static Action dropHolding() {
        return DROP_HOLDING;
    }

    public static Action takeDeck() {
        return TAKE_DECK;
    }

    public static Action placeAt(int slot) {
        return new Action(Type.PLACE_AT, Hand.checkSlot(slot));
    }

    public Type type() {
        return type;
    }

    public int slot() {
        return slot;
    }

    /**
     * Returns the command string sent to the controller, e.g. {@code take card 3}.
     */
    public String toCommandString() {
        return switch (type) {
            case TAKE_CARD_AT, PLACE_AT -> type.verb() + " " + slot;
            case DEFAULT_POSITION, DROP_HOLDING, TAKE_DECK -> type.verb();
        };
    }

    /**
     * Parses a command string into an {@link Action}.
     * <p>
     * Matching ignores case and surrounding whitespace; words may be separated by any run
     * of whitespace.
     *
     * @throws IllegalArgumentException if the command is null, blank or not recognised,
     *                                  or names a holder outside 1..5
     */
    public static Action parse(String command) {
        if (command == null) {
            throw new IllegalArgumentException("Command cannot be null");
        }
        String normalised = command.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        if (normalised.isEmpty()) {
            throw new IllegalArgumentException("Command cannot be blank");
        }
        for (Action plain : new Action[] {DEFAULT_POSITION, DROP_HOLDING, TAKE_DECK}) {
            if (normalised.equals(plain.type.verb())) {
                return plain;
            }
        }
        for (Type type : new Type[] {Type.TAKE_CARD_AT, Type.PLACE_AT}) {
            String prefix = type.verb() + " ";
            if (normalised.startsWith(prefix)) {
                int slot;
                try {
                    slot = Integer.parseInt(normalised.substring(prefix.length()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Unrecognised command: " + command, e);
                }
                return type == Type.TAKE_CARD_AT ? takeCardAt(slot) : placeAt(slot);
            }
        }
        throw new IllegalArgumentException("Unrecognised command: " + command);
    }

    @Override
    public String toString() {
        return toCommandString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action other)) {
            return false;
        }
        return type == other.type && slot == other.slot;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, slot);
    }
}
