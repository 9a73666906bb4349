package org.carball.futureyou.ai;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.model.UserProfile;
import org.carball.futureyou.validation.InputValidator;

import java.util.List;
import java.util.Map;

/**
 * Extracts a user's Decision DNA from their profile.
 */
@Slf4j
public class ProfilerAgent extends StructuredAgent<UserProfile, DecisionDNA> {

    public static final ResponseSchema DNA_SCHEMA = ResponseSchema.object("decision DNA")
            .number("risk_tolerance", 0.0, 1.0)
            .text("time_horizon_preference")
            .array("value_priorities")
            .object("decision_patterns")
            .array("emotional_drivers")
            .build();

    private static final String EXAMPLE = """
        {
          "risk_tolerance": 0.7,
          "time_horizon_preference": "medium",
          "value_priorities": ["career", "wealth", "freedom"],
          "decision_patterns": {"style": "analytical", "speed": "deliberate"},
          "emotional_drivers": ["achievement", "security"]
        }""";

    public ProfilerAgent(ModelClient modelClient, ModelSettings settings) {
        super("ProfilerAgent", modelClient, settings);
    }

    public DecisionDNA analyzeProfile(UserProfile profile) {
        DecisionDNA dna = execute(profile);
        log.info("Decision DNA extracted for user {}: risk={}, values={}",
                profile.getUserId(), dna.riskTolerance(), dna.valuePriorities());
        return dna;
    }

    @Override
    protected UserProfile validateInput(UserProfile profile) {
        UserProfile validated = InputValidator.validateProfile(profile);
        log.info("Analyzing profile for user: {}", validated.getUserId());
        return validated;
    }

    @Override
    protected String buildPrompt(UserProfile profile) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Analyze this user profile and extract their Decision DNA.\n\n");
        prompt.append("## User Data:\n");
        prompt.append(toPromptJson(profile)).append("\n\n");

        prompt.append("## Extract:\n");
        prompt.append("1. Risk tolerance (0-1 scale, float)\n");
        prompt.append("2. Time horizon preference (short/medium/long)\n");
        prompt.append("3. Top 3 value priorities from: career, family, health, wealth, freedom, creativity, impact\n");
        prompt.append("4. Decision patterns (how they typically decide)\n");
        prompt.append("5. Emotional drivers (what motivates them)\n\n");

        prompt.append("## Response Requirements:\n");
        prompt.append("Return ONLY valid JSON with keys: ")
                .append(String.join(", ", DNA_SCHEMA.getFieldNames())).append("\n\n");
        prompt.append("Example format:\n");
        prompt.append(EXAMPLE);

        return prompt.toString();
    }

    @Override
    protected DecisionDNA parseResponse(UserProfile profile, String rawText) {
        JsonNode node = readJson(rawText, DNA_SCHEMA);

        return DecisionDNA.builder()
                .riskTolerance(node.get("risk_tolerance").asDouble())
                .timeHorizonPreference(node.get("time_horizon_preference").asText())
                .valuePriorities(convertField(node, "value_priorities", new TypeReference<List<String>>() {}))
                .decisionPatterns(convertField(node, "decision_patterns", new TypeReference<Map<String, Object>>() {}))
                .emotionalDrivers(convertField(node, "emotional_drivers", new TypeReference<List<String>>() {}))
                .build();
    }
}
