package ai.poker.robot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-side helpers for command sequences: counting swaps and recovering which holders
 * a sequence touches. Used for logging and by callers that only see command strings.
 */
public final class ActionSequences {
    private ActionSequences() {
    }

    /**
     * Number of cards a sequence takes out of holders.
     */
    public static int countSwaps(List<Action> actions) {
        int swaps = 0;
        for (Action action : actions) {
            if (action.type() == Action.Type.TAKE_CARD_AT) {
                swaps++;
            }
        }
        return swaps;
    }

    /**
     * Distinct holders taken from, in order of first appearance.
     */
    public static List<Integer> swapPositions(List<Action> actions) {
        Set<Integer> positions = new LinkedHashSet<>();
        for (Action action : actions) {
            if (action.type() == Action.Type.TAKE_CARD_AT) {
                positions.add(action.slot());
            }
        }
        return List.copyOf(positions);
    }

    /**
     * Holders that receive a card without having one taken from them first, in order.
     */
    public static List<Integer> fillPositions(List<Action> actions) {
        Set<Integer> taken = new LinkedHashSet<>();
        List<Integer> filled = new ArrayList<>();
        for (Action action : actions) {
            if (action.type() == Action.Type.TAKE_CARD_AT) {
                taken.add(action.slot());
            } else if (action.type() == Action.Type.PLACE_AT && !taken.contains(action.slot())) {
                filled.add(action.slot());
            }
        }
        return Collections.unmodifiableList(filled);
    }

    /**
     * Serialises a sequence to controller command strings.
     */
    public static List<String> toCommands(List<Action> actions) {
        List<String> commands = new ArrayList<>(actions.size());
        for (Action action : actions) {
            commands.add(action.toCommandString());
        }
        return Collections.unmodifiableList(commands);
    }

    /**
     * Parses controller command strings.
     *
     * @throws IllegalArgumentException if any command is not recognised
     */
    public static List<Action> parseCommands(List<String> commands) {
        List<Action> actions = new ArrayList<>(commands.size());
        for (String command : commands) {
            actions.add(Action.parse(command));
        }
        return Collections.unmodifiableList(actions);
    }
}
