package org.carball.futureyou.ai;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.model.AnalysisResult;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.validation.ValidationException;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compares every scenario of a run against the user's Decision DNA.
 */
@Slf4j
public class AnalyzerAgent extends StructuredAgent<AnalyzerAgent.Request, AnalysisResult> {

    public static final ResponseSchema ANALYSIS_SCHEMA = ResponseSchema.object("analysis")
            .text("best_scenario")
            .text("risk_analysis")
            .text("opportunity_analysis")
            .object("alignment_score")
            .text("trade_offs")
            .build();

    private static final String EXAMPLE = """
        {
          "best_scenario": "1yr_0",
          "risk_analysis": "Main risks include...",
          "opportunity_analysis": "Key opportunities are...",
          "alignment_score": {"1yr_0": 0.8, "1yr_1": 0.6, "1yr_2": 0.3},
          "trade_offs": "Higher risk vs higher reward..."
        }""";

    public record Request(List<FutureScenario> scenarios, DecisionDNA dna) {}

    public AnalyzerAgent(ModelClient modelClient, ModelSettings settings) {
        super("AnalyzerAgent", modelClient, settings);
    }

    public AnalysisResult analyzeScenarios(List<FutureScenario> scenarios, DecisionDNA dna) {
        AnalysisResult analysis = execute(new Request(scenarios, dna));
        log.info("Scenario analysis completed, best scenario: {}", analysis.bestScenario());
        return analysis;
    }

    @Override
    protected Request validateInput(Request request) {
        if (request.scenarios() == null || request.scenarios().isEmpty()) {
            throw new ValidationException("No scenarios provided for analysis");
        }
        if (request.dna() == null) {
            throw new ValidationException("Decision DNA is required for analysis");
        }
        log.info("Analyzing {} scenarios", request.scenarios().size());
        return request;
    }

    @Override
    protected String buildPrompt(Request request) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Analyze these future scenarios based on the user's Decision DNA.\n\n");
        prompt.append("## Scenarios:\n").append(toPromptJson(request.scenarios())).append("\n\n");
        prompt.append("## Decision DNA:\n").append(toPromptJson(request.dna())).append("\n\n");

        prompt.append("## Provide:\n");
        prompt.append("1. best_scenario: the scenario_id that aligns best with the user's values (string)\n");
        prompt.append("2. risk_analysis: comprehensive risk assessment (string)\n");
        prompt.append("3. opportunity_analysis: key opportunities across scenarios (string)\n");
        prompt.append("4. alignment_score: how well each scenario matches the user's DNA 0-1 ")
                .append("(object with scenario_id as keys)\n");
        prompt.append("5. trade_offs: what the user gains vs loses in each path (string)\n\n");

        prompt.append("## Response Requirements:\n");
        prompt.append("Return ONLY valid JSON with these exact keys. Valid scenario ids: ")
                .append(request.scenarios().stream().map(FutureScenario::scenarioId).collect(Collectors.joining(", ")))
                .append("\n\n");
        prompt.append("Example format:\n");
        prompt.append(EXAMPLE);

        return prompt.toString();
    }

    @Override
    protected AnalysisResult parseResponse(Request request, String rawText) {
        JsonNode node = readJson(rawText, ANALYSIS_SCHEMA);

        Set<String> scenarioIds = request.scenarios().stream()
                .map(FutureScenario::scenarioId)
                .collect(Collectors.toSet());

        String bestScenario = node.get("best_scenario").asText();
        if (!scenarioIds.contains(bestScenario)) {
            throw new SchemaViolationException("best_scenario",
                    "best_scenario '" + bestScenario + "' does not reference a simulated scenario " + scenarioIds);
        }

        return AnalysisResult.builder()
                .bestScenario(bestScenario)
                .riskAnalysis(node.get("risk_analysis").asText())
                .opportunityAnalysis(node.get("opportunity_analysis").asText())
                .alignmentScore(readAlignmentScores(node.get("alignment_score")))
                .tradeOffs(node.get("trade_offs").asText())
                .build();
    }

    private Map<String, Double> readAlignmentScores(JsonNode scores) {
        Map<String, Double> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = scores.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (!value.isNumber() || value.asDouble() < 0.0 || value.asDouble() > 1.0) {
                throw new SchemaViolationException("alignment_score",
                        "Invalid alignment_score for " + entry.getKey() + ": " + value);
            }
            result.put(entry.getKey(), value.asDouble());
        }
        return result;
    }
}
