package ai.poker.unit.robot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.poker.robot.Action;
import ai.poker.robot.ActionSequences;
import java.util.List;
import org.junit.jupiter.api.Test;

class ActionSequencesTest {

    private static final List<String> SWAP_TWO = List.of(
            "take card 2", "drop holding", "default position", "take deck", "place at 2",
            "take card 4", "drop holding", "default position", "take deck", "place at 4",
            "default position");

    @Test
    void parseCommandsReadsAControllerTranscript() {
        List<Action> actions = ActionSequences.parseCommands(SWAP_TWO);
        assertEquals(11, actions.size());
        assertEquals(2, ActionSequences.countSwaps(actions));
        assertEquals(List.of(2, 4), ActionSequences.swapPositions(actions));
        assertTrue(ActionSequences.fillPositions(actions).isEmpty());
        assertEquals(SWAP_TWO, ActionSequences.toCommands(actions));
    }

    @Test
    void fillPositionsIgnoresReplacedHolders() {
        List<Action> actions = ActionSequences.parseCommands(List.of(
                "take deck", "place at 1",
                "take card 3", "drop holding", "default position", "take deck", "place at 3",
                "default position"));
        assertEquals(List.of(1), ActionSequences.fillPositions(actions));
        assertEquals(List.of(3), ActionSequences.swapPositions(actions));
    }

    @Test
    void emptySequence() {
        assertEquals(0, ActionSequences.countSwaps(List.of()));
        assertTrue(ActionSequences.swapPositions(List.of()).isEmpty());
        assertTrue(ActionSequences.toCommands(List.of()).isEmpty());
    }

    @Test
    void oneBadCommandRejectsTheTranscript() {
        assertThrows(IllegalArgumentException.class,
                () -> ActionSequences.parseCommands(List.of("take deck", "place at 0")));
    }
}
