package org.carball.futureyou.input;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.model.SimulationRequest;
import org.carball.futureyou.model.UserProfile;
import org.carball.futureyou.validation.InputValidator;
import org.carball.futureyou.validation.ValidationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads a simulation request from a snake_case JSON input file and validates it.
 */
@Slf4j
public class InputFileLoader {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public SimulationRequest load(Path inputFile) throws IOException {
        if (!Files.exists(inputFile)) {
            throw new IOException("Input file not found: " + inputFile);
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(Files.readString(inputFile));
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid JSON in " + inputFile + ": " + e.getOriginalMessage(), e);
        }
        if (data == null || !data.isObject()) {
            throw new IOException("Input file " + inputFile + " must contain a JSON object");
        }

        SimulationRequest request = fromJson(data);
        log.info("Loaded simulation request for user {} from {}",
                request.getUserProfile().get("user_id"), inputFile);
        return request;
    }

    SimulationRequest fromJson(JsonNode data) {
        JsonNode profileNode = data.get("user_profile");
        if (profileNode == null || profileNode.isNull()) {
            throw new ValidationException("Missing required key: user_profile");
        }
        if (!profileNode.isObject()) {
            throw new ValidationException("user_profile must be an object");
        }
        JsonNode decisionNode = data.get("decision");
        if (decisionNode == null || !decisionNode.isTextual()) {
            throw new ValidationException("Decision must be a non-empty string");
        }

        Map<String, Object> profile = InputValidator.validateProfile(
                objectMapper.convertValue(profileNode, new TypeReference<Map<String, Object>>() {}));
        String decision = InputValidator.validateDecision(decisionNode.asText());

        List<String> timelines = new ArrayList<>(SimulationRequest.DEFAULT_TIMELINES);
        JsonNode timelinesNode = data.get("timelines");
        if (timelinesNode != null) {
            if (!timelinesNode.isArray()) {
                throw new ValidationException("Timelines must be a non-empty list");
            }
            timelines.clear();
            timelinesNode.forEach(node -> timelines.add(node.asText()));
        }
        InputValidator.validateTimelines(timelines);

        boolean generateVisuals = false;
        JsonNode visualsNode = data.get("generate_visuals");
        if (visualsNode != null) {
            if (visualsNode.isBoolean()) {
                generateVisuals = visualsNode.asBoolean();
            } else {
                log.warn("generate_visuals should be a boolean, got {}; treating as false", visualsNode);
            }
        }

        return SimulationRequest.builder()
                .userProfile(profile)
                .decision(decision)
                .timelines(timelines)
                .generateVisuals(generateVisuals)
                .build();
    }

    /**
     * Converts validated raw profile data into a {@link UserProfile}; unknown keys land in its attributes.
     */
    public UserProfile toUserProfile(Map<String, Object> profile) {
        try {
            return objectMapper.convertValue(profile, UserProfile.class);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid user profile: " + e.getMessage());
        }
    }
}
