package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Everything one pipeline run produced. Report writers only read it.
 */
public record SimulationResult(
        @JsonProperty("decision_dna") DecisionDNA decisionDna,
        @JsonProperty("scenarios") List<FutureScenario> scenarios,
        @JsonProperty("analysis") AnalysisResult analysis,
        @JsonProperty("advice") String advice,
        @JsonProperty("session_id") String sessionId
) {

    public SimulationResult {
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    }
}
