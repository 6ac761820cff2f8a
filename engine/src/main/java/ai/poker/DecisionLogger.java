package ai.poker;

import ai.poker.evaluator.HandEvaluation;
import ai.poker.game.SlotContent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits one structured JSON line per decision for offline analysis of the robot's play.
 *
 * <p>Lines are prefixed with "DECISION " and written through this class's own logger,
 * which logback routes to decisions.log. Disabled unless the JVM is started with
 * {@code -Dlog.decisions=true}.</p>
 */
public final class DecisionLogger {
    private static final Logger log = LoggerFactory.getLogger(DecisionLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.decisions");
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private DecisionLogger() {
    }

    /**
     * Return true if decision logging is enabled via -Dlog.decisions=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Log a decision if decision logging is enabled.
     */
    public static void logDecision(Decision decision) {
        if (!ENABLED || !log.isInfoEnabled()) {
            return;
        }
        try {
            log.info("DECISION {}", toJson(decision));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialise decision for hand [{}]: {}", decision.hand(), e.getMessage());
        }
    }

    /**
     * Render a decision as a single JSON object.
     *
     * <p>Format: {@code {"hand":["AH","--",...],"mode":"SWAP","rank":"One Pair","keepers":[1,2],
     * "positions":[3,4,5],"commands":["take card 3",...]}}. {@code rank} and {@code keepers}
     * are omitted in fill mode.
     */
    static String toJson(Decision decision) throws JsonProcessingException {
        List<String> hand = new ArrayList<>();
        for (SlotContent slot : decision.hand().slots()) {
            hand.add(slot.toString());
        }
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("hand", hand);
        line.put("mode", decision.mode().name());
        if (decision.evaluation().isPresent()) {
            HandEvaluation evaluation = decision.evaluation().get();
            line.put("rank", evaluation.rank().getDisplayName());
            line.put("keepers", evaluation.keepers());
        }
        line.put("positions", decision.positions());
        line.put("commands", decision.commands());
        return OBJECT_MAPPER.writeValueAsString(line);
    }
}
