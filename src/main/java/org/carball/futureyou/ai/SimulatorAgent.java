package org.carball.futureyou.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.model.FutureScenario;
import org.carball.futureyou.validation.InputValidator;
import org.carball.futureyou.validation.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Simulates three futures (optimistic, realistic, pessimistic) of a decision at one timeline.
 */
@Slf4j
public class SimulatorAgent extends StructuredAgent<SimulatorAgent.Request, List<FutureScenario>> {

    public static final int SCENARIOS_PER_TIMELINE = 3;

    public static final ResponseSchema SCENARIO_SCHEMA = ResponseSchema.object("scenario")
            .text("decision_path")
            .object("outcomes")
            .number("probability", 0.0, 1.0)
            .array("key_events")
            .array("risks")
            .array("opportunities")
            .build();

    public static final ResponseSchema SCENARIOS_SCHEMA =
            ResponseSchema.arrayOf("scenarios", SCENARIOS_PER_TIMELINE, SCENARIO_SCHEMA);

    private static final String EXAMPLE = """
        [
          {
            "decision_path": "Take the startup role",
            "outcomes": {"career": "Senior role", "finance": "Equity growth"},
            "probability": 0.7,
            "key_events": ["Join startup", "Product launch"],
            "risks": ["Startup failure"],
            "opportunities": ["Equity upside"]
          }
        ]""";

    public record Request(String decision, DecisionDNA dna, String timeline) {}

    public SimulatorAgent(ModelClient modelClient, ModelSettings settings) {
        super("SimulatorAgent", modelClient, settings);
    }

    /**
     * @return exactly three scenarios with ids {@code <timeline>_0..2} in the model's array order
     */
    public List<FutureScenario> simulateFutures(String decision, DecisionDNA dna, String timeline) {
        List<FutureScenario> scenarios = execute(new Request(decision, dna, timeline));
        log.info("Successfully generated {} scenarios for {}", scenarios.size(), timeline);
        return scenarios;
    }

    @Override
    protected Request validateInput(Request request) {
        String decision = InputValidator.validateDecision(request.decision());
        InputValidator.validateTimeline(request.timeline());
        if (request.dna() == null) {
            throw new ValidationException("Decision DNA is required for simulation");
        }
        log.info("Simulating futures for timeline: {}", request.timeline());
        return new Request(decision, request.dna(), request.timeline());
    }

    @Override
    protected String buildPrompt(Request request) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Simulate ").append(SCENARIOS_PER_TIMELINE)
                .append(" different future scenarios for this decision.\n\n");
        prompt.append("## Decision:\n").append(request.decision()).append("\n\n");
        prompt.append("## Timeline:\n").append(request.timeline()).append("\n\n");
        prompt.append("## Decision DNA:\n").append(toPromptJson(request.dna())).append("\n\n");

        prompt.append("## For each scenario (optimistic, realistic, pessimistic), provide:\n");
        prompt.append("- decision_path: specific actions taken (string)\n");
        prompt.append("- outcomes: concrete results in career, finance, relationships, health, happiness (object)\n");
        prompt.append("- probability: likelihood 0-1 (float)\n");
        prompt.append("- key_events: major milestones (array of strings)\n");
        prompt.append("- risks: potential problems (array of strings)\n");
        prompt.append("- opportunities: potential gains (array of strings)\n\n");

        prompt.append("## Response Requirements:\n");
        prompt.append("Return ONLY a valid JSON array with exactly ").append(SCENARIOS_PER_TIMELINE)
                .append(" scenarios.\n\n");
        prompt.append("Example format:\n");
        prompt.append(EXAMPLE);

        return prompt.toString();
    }

    @Override
    protected List<FutureScenario> parseResponse(Request request, String rawText) {
        JsonNode array = readJson(rawText, SCENARIOS_SCHEMA);

        List<FutureScenario> scenarios = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            JsonNode node = array.get(i);
            scenarios.add(FutureScenario.builder()
                    .scenarioId(FutureScenario.scenarioId(request.timeline(), i))
                    .timeline(request.timeline())
                    .decisionPath(node.get("decision_path").asText())
                    .outcomes(convertField(node, "outcomes", new TypeReference<Map<String, Object>>() {}))
                    .probability(node.get("probability").asDouble())
                    .keyEvents(convertField(node, "key_events", new TypeReference<List<String>>() {}))
                    .risks(convertField(node, "risks", new TypeReference<List<String>>() {}))
                    .opportunities(convertField(node, "opportunities", new TypeReference<List<String>>() {}))
                    .build());
        }
        return scenarios;
    }
}
