package ai.poker;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.poker.unit.helpers.HandFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class DecisionLoggerTest {

    private final PokerDecisionService service = PokerDecisionService.withDefaults();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void swapDecisionCarriesRankAndKeepers() throws Exception {
        JsonNode json = mapper.readTree(DecisionLogger.toJson(service.analyse(HandFactory.pair())));

        assertEquals("10H", json.get("hand").get(0).asText());
        assertEquals("SWAP", json.get("mode").asText());
        assertEquals("One Pair", json.get("rank").asText());
        assertEquals("[1,2]", json.get("keepers").toString());
        assertEquals("[3,4,5]", json.get("positions").toString());
        assertEquals(16, json.get("commands").size());
        assertEquals("take card 3", json.get("commands").get(0).asText());
    }

    @Test
    void fillDecisionHasNoRank() throws Exception {
        JsonNode json = mapper.readTree(DecisionLogger.toJson(service.analyse(HandFactory.allEmpty())));

        assertEquals("--", json.get("hand").get(4).asText());
        assertEquals("FILL", json.get("mode").asText());
        assertFalse(json.has("rank"));
        assertFalse(json.has("keepers"));
        assertEquals(11, json.get("commands").size());
    }

    @Test
    void standPatHasNoCommands() throws Exception {
        JsonNode json = mapper.readTree(DecisionLogger.toJson(service.analyse(HandFactory.royalFlush())));

        assertEquals("STAND", json.get("mode").asText());
        assertTrue(json.get("commands").isEmpty());
        assertTrue(json.get("positions").isEmpty());
    }
}
