package org.carball.futureyou.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.validation.InputValidator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Pre-flight checks run by {@code --check} and before every simulation. Unlike
 * {@link InputValidator}, every problem is collected instead of stopping at the first.
 */
@Slf4j
public class EnvironmentValidator {

    public static final String PLACEHOLDER_API_KEY = "your_gemini_api_key_here";
    static final int MIN_API_KEY_LENGTH = 20;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ValidationReport validateEnvironment(ModelSettings settings, Path outputDirectory) {
        ValidationReport report = new ValidationReport();

        String apiKey = settings.getApiKey();
        if (!settings.hasApiKey()) {
            report.error("API key not found. Use --api-key or set FUTUREYOU_API_KEY / GEMINI_API_KEY");
        } else if (PLACEHOLDER_API_KEY.equals(apiKey)) {
            report.error("API key appears to be the default placeholder. Please set your actual API key.");
        } else if (apiKey.length() < MIN_API_KEY_LENGTH) {
            report.warning("API key seems unusually short. Please verify it's correct.");
        } else {
            report.info("API key found and appears valid");
        }
        report.info("Model: " + settings.getModelName() + " at " + settings.getBaseUrl());

        if (Files.isDirectory(outputDirectory)) {
            report.info("Directory exists: " + outputDirectory);
        } else {
            try {
                Files.createDirectories(outputDirectory);
                report.info("Created directory: " + outputDirectory);
            } catch (IOException e) {
                report.error("Cannot create directory " + outputDirectory + ": " + e.getMessage());
            }
        }

        log.debug("Environment validation: {} errors, {} warnings",
                report.getErrors().size(), report.getWarnings().size());
        return report;
    }

    public ValidationReport validateInputFile(Path inputFile) {
        ValidationReport report = new ValidationReport();

        if (!Files.exists(inputFile)) {
            return report.error("Input file " + inputFile + " not found");
        }

        JsonNode data;
        try {
            data = objectMapper.readTree(inputFile.toFile());
        } catch (JsonProcessingException e) {
            return report.error("Invalid JSON in " + inputFile + ": " + e.getOriginalMessage());
        } catch (IOException e) {
            return report.error("Error reading " + inputFile + ": " + e.getMessage());
        }
        if (data == null || !data.isObject()) {
            return report.error("Input file " + inputFile + " must contain a JSON object");
        }
        report.info(inputFile + " loaded successfully");

        for (String key : List.of("user_profile", "decision")) {
            if (!data.has(key)) {
                report.error("Missing required key: " + key);
            }
        }

        if (data.has("user_profile")) {
            validateProfile(data.get("user_profile"), report);
        }

        if (data.has("decision")) {
            JsonNode decision = data.get("decision");
            if (!decision.isTextual() || decision.asText().trim().length() < InputValidator.MIN_DECISION_LENGTH) {
                report.error("Decision must be a string with at least "
                        + InputValidator.MIN_DECISION_LENGTH + " characters");
            }
        }

        if (data.has("timelines")) {
            JsonNode timelines = data.get("timelines");
            if (!timelines.isArray()) {
                report.error("Timelines must be a list");
            } else if (timelines.isEmpty()) {
                report.error("Timelines must be a non-empty list");
            } else {
                for (JsonNode timeline : timelines) {
                    if (!InputValidator.VALID_TIMELINES.contains(timeline.asText())) {
                        report.error("Invalid timeline: " + timeline.asText());
                    }
                }
            }
        } else {
            report.info("Using default timelines: " + InputValidator.VALID_TIMELINES);
        }

        if (data.has("generate_visuals") && !data.get("generate_visuals").isBoolean()) {
            report.warning("generate_visuals should be a boolean");
        }

        return report;
    }

    private void validateProfile(JsonNode profile, ValidationReport report) {
        if (!profile.isObject()) {
            report.error("user_profile must be an object");
            return;
        }

        for (String key : InputValidator.REQUIRED_PROFILE_FIELDS) {
            if (!profile.hasNonNull(key)) {
                report.error("Missing required profile key: " + key);
            }
        }

        if (profile.has("age")) {
            JsonNode age = profile.get("age");
            if (!age.canConvertToInt() || !age.isIntegralNumber()
                    || age.asInt() < InputValidator.MIN_AGE || age.asInt() > InputValidator.MAX_AGE) {
                report.error("Age must be an integer between " + InputValidator.MIN_AGE
                        + " and " + InputValidator.MAX_AGE);
            }
        }

        for (String field : InputValidator.LIST_PROFILE_FIELDS) {
            if (!profile.has(field)) {
                report.warning("Optional field missing: " + field);
            } else if (!profile.get(field).isArray()) {
                report.error(field + " must be a list");
            }
        }
    }
}
