package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured summary of how a user tends to decide. Produced once per session by the Profiler.
 */
@Builder(toBuilder = true)
public record DecisionDNA(
        @JsonProperty("risk_tolerance") double riskTolerance,
        @JsonProperty("time_horizon_preference") String timeHorizonPreference,
        @JsonProperty("value_priorities") List<String> valuePriorities,
        @JsonProperty("decision_patterns") Map<String, Object> decisionPatterns,
        @JsonProperty("emotional_drivers") List<String> emotionalDrivers
) {

    public DecisionDNA {
        valuePriorities = valuePriorities == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(valuePriorities));
        decisionPatterns = decisionPatterns == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(decisionPatterns));
        emotionalDrivers = emotionalDrivers == null ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(emotionalDrivers));
    }

    @JsonIgnore
    public String getRiskLabel() {
        if (riskTolerance < 0.3) {
            return "Low";
        }
        return riskTolerance < 0.7 ? "Medium" : "High";
    }

    @JsonIgnore
    public List<String> getTopValues(int limit) {
        return valuePriorities.subList(0, Math.min(limit, valuePriorities.size()));
    }
}
