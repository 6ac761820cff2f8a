package ai.poker.game;

import java.util.Objects;
import java.util.Optional;

/**
 * What a single card holder contains: either a {@link Filled} card or {@link Empty}.
 * <p>
 * Empty holders are modelled explicitly instead of with {@code null}, so every
 * consumer has to decide what to do with both shapes.
 */
public sealed interface SlotContent permits SlotContent.Filled, SlotContent.Empty {

    /**
     * Returns the empty holder value.
     */
    static SlotContent empty() {
        return Empty.INSTANCE;
    }

    /**
     * Returns a holder containing the given card.
     */
    static SlotContent filled(Card card) {
        return new Filled(card);
    }

    /**
     * Returns true if the holder contains a card.
     */
    boolean isFilled();

    /**
     * Returns the card in the holder, if any.
     */
    Optional<Card> card();

    /**
     * A holder with a card in it.
     */
    record Filled(Card value) implements SlotContent {
        public Filled {
            Objects.requireNonNull(value, "card");
        }

        @Override
        public boolean isFilled() {
            return true;
        }

        @Override
        public Optional<Card> card() {
            return Optional.of(value);
        }

        @Override
        public String toString() {
            return value.shortName();
        }
    }

    /**
     * A holder with nothing in it.
     */
    record Empty() implements SlotContent {
        private static final Empty INSTANCE = new Empty();

        @Override
        public boolean isFilled() {
            return false;
        }

        @Override
        public Optional<Card> card() {
            return Optional.empty();
        }

        @Override
        public String toString() {
            return "--";
        }
    }
}
