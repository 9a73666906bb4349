package org.carball.futureyou.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    static final List<String> API_KEY_VARIABLES = List.of("FUTUREYOU_API_KEY", "GEMINI_API_KEY", "OPENAI_API_KEY");

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads model settings using the hierarchy: CLI args > env vars > defaults
     */
    public ModelSettings loadConfiguration(String[] args) {
        return loadConfiguration(null, args);
    }

    /**
     * Loads model settings using the hierarchy: CLI args > env vars > YAML file > defaults
     */
    public ModelSettings loadConfiguration(Path configFile, String[] args) {
        log.debug("Loading configuration");

        // Start with defaults
        ModelSettings.ModelSettingsBuilder builder = ModelSettings.defaults().toBuilder();

        // 1. Apply YAML file
        if (configFile != null) {
            applyConfigFile(builder, configFile);
        }

        // 2. Apply environment variables
        applyEnvironmentVariables(builder);

        // 3. Apply CLI arguments (highest priority)
        applyCLIArguments(builder, args);

        ModelSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    private void applyConfigFile(ModelSettings.ModelSettingsBuilder builder, Path configFile) {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Config file not found: " + configFile);
        }

        JsonNode root;
        try {
            root = new ObjectMapper(new YAMLFactory()).readTree(configFile.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read config file " + configFile + ": " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            log.warn("Config file {} is empty or not a mapping, ignoring it", configFile);
            return;
        }

        if (root.hasNonNull("api_key")) {
            builder.apiKey(root.get("api_key").asText());
        }
        if (root.hasNonNull("base_url")) {
            builder.baseUrl(root.get("base_url").asText());
        }
        if (root.hasNonNull("model")) {
            builder.modelName(root.get("model").asText());
        }
        if (root.hasNonNull("temperature")) {
            applyNumber("temperature", root.get("temperature").asText(),
                    value -> builder.temperature(Double.parseDouble(value)));
        }
        if (root.hasNonNull("max_tokens")) {
            applyNumber("max_tokens", root.get("max_tokens").asText(),
                    value -> builder.maxTokens(Long.parseLong(value)));
        }
        if (root.hasNonNull("request_timeout_seconds")) {
            applyNumber("request_timeout_seconds", root.get("request_timeout_seconds").asText(),
                    value -> builder.requestTimeout(Duration.ofSeconds(Long.parseLong(value))));
        }

        JsonNode retry = root.path("retry");
        if (retry.hasNonNull("max_attempts")) {
            applyNumber("retry.max_attempts", retry.get("max_attempts").asText(),
                    value -> builder.maxAttempts(Integer.parseInt(value)));
        }
        if (retry.hasNonNull("initial_backoff_ms")) {
            applyNumber("retry.initial_backoff_ms", retry.get("initial_backoff_ms").asText(),
                    value -> builder.initialBackoff(Duration.ofMillis(Long.parseLong(value))));
        }
        if (retry.hasNonNull("multiplier")) {
            applyNumber("retry.multiplier", retry.get("multiplier").asText(),
                    value -> builder.backoffMultiplier(Double.parseDouble(value)));
        }
        if (retry.hasNonNull("max_backoff_ms")) {
            applyNumber("retry.max_backoff_ms", retry.get("max_backoff_ms").asText(),
                    value -> builder.maxBackoff(Duration.ofMillis(Long.parseLong(value))));
        }

        log.info("Loaded model configuration from: {}", configFile);
    }

    private void applyEnvironmentVariables(ModelSettings.ModelSettingsBuilder builder) {
        for (String variable : API_KEY_VARIABLES) {
            String value = environment.get(variable);
            if (value != null && !value.isBlank()) {
                builder.apiKey(value);
                log.debug("Using API key from {}", variable);
                break;
            }
        }

        if (environment.containsKey("FUTUREYOU_BASE_URL")) {
            builder.baseUrl(environment.get("FUTUREYOU_BASE_URL"));
        }
        if (environment.containsKey("FUTUREYOU_MODEL")) {
            builder.modelName(environment.get("FUTUREYOU_MODEL"));
        }
        if (environment.containsKey("FUTUREYOU_TEMPERATURE")) {
            applyNumber("FUTUREYOU_TEMPERATURE", environment.get("FUTUREYOU_TEMPERATURE"),
                    value -> builder.temperature(Double.parseDouble(value)));
        }
        if (environment.containsKey("FUTUREYOU_MAX_ATTEMPTS")) {
            applyNumber("FUTUREYOU_MAX_ATTEMPTS", environment.get("FUTUREYOU_MAX_ATTEMPTS"),
                    value -> builder.maxAttempts(Integer.parseInt(value)));
        }
    }

    private void applyCLIArguments(ModelSettings.ModelSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            switch (arg) {
                case "--api-key":
                    builder.apiKey(value);
                    break;
                case "--base-url":
                    builder.baseUrl(value);
                    break;
                case "--model":
                    builder.modelName(value);
                    break;
                case "--temperature":
                    applyNumber(arg, value, v -> builder.temperature(Double.parseDouble(v)));
                    break;
                case "--max-attempts":
                    applyNumber(arg, value, v -> builder.maxAttempts(Integer.parseInt(v)));
                    break;
                default:
                    break;
            }
        }
    }

    private static void applyNumber(String source, String value, Consumer<String> setter) {
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        }
    }

    /**
     * Returns help text for model configuration options.
     */
    public static String getConfigurationHelp() {
        return """
            Model Configuration Options:

            CLI Arguments:
              --api-key <key>          API key for the model endpoint
              --base-url <url>         OpenAI-compatible endpoint (default: Gemini)
              --model <name>           Model name (default: gemini-3-pro-preview)
              --temperature <num>      Sampling temperature 0-2 (default: 0.7)
              --max-attempts <num>     Attempts per model call (default: 3)
              --config <file>          YAML file with model and retry settings

            Environment Variables:
              FUTUREYOU_API_KEY        Same as --api-key (GEMINI_API_KEY, OPENAI_API_KEY also accepted)
              FUTUREYOU_BASE_URL       Same as --base-url
              FUTUREYOU_MODEL          Same as --model
              FUTUREYOU_TEMPERATURE    Same as --temperature
              FUTUREYOU_MAX_ATTEMPTS   Same as --max-attempts

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. YAML config file
              4. Built-in defaults
            """;
    }
}
