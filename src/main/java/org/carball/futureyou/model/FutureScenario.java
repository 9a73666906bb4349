package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One simulated branch of a decision at a given timeline.
 * The id is assigned by the simulator as {@code <timeline>_<index>}, never by the model.
 */
@Builder
public record FutureScenario(
        @JsonProperty("scenario_id") String scenarioId,
        @JsonProperty("timeline") String timeline,
        @JsonProperty("decision_path") String decisionPath,
        @JsonProperty("outcomes") Map<String, Object> outcomes,
        @JsonProperty("probability") double probability,
        @JsonProperty("key_events") List<String> keyEvents,
        @JsonProperty("risks") List<String> risks,
        @JsonProperty("opportunities") List<String> opportunities
) {

    public FutureScenario {
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        keyEvents = copyOf(keyEvents);
        risks = copyOf(risks);
        opportunities = copyOf(opportunities);
    }

    public static String scenarioId(String timeline, int index) {
        return timeline + "_" + index;
    }

    private static List<String> copyOf(List<String> values) {
        return values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
