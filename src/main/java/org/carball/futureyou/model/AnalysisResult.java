package org.carball.futureyou.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Comparative analysis of every scenario produced in one run.
 */
@Builder
public record AnalysisResult(
        @JsonProperty("best_scenario") String bestScenario,
        @JsonProperty("risk_analysis") String riskAnalysis,
        @JsonProperty("opportunity_analysis") String opportunityAnalysis,
        @JsonProperty("alignment_score") Map<String, Double> alignmentScore,
        @JsonProperty("trade_offs") String tradeOffs
) {

    public AnalysisResult {
        alignmentScore = alignmentScore == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(alignmentScore));
    }
}
