package org.carball.futureyou.config;

import lombok.Builder;
import lombok.Data;
import lombok.ToString;

import java.time.Duration;

/**
 * Connection, generation and retry settings handed to every agent at construction time.
 */
@Data
@Builder(toBuilder = true)
public class ModelSettings {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta/openai/";
    public static final String DEFAULT_MODEL = "gemini-3-pro-preview";

    @ToString.Exclude
    private String apiKey;

    @Builder.Default
    private String baseUrl = DEFAULT_BASE_URL;

    @Builder.Default
    private String modelName = DEFAULT_MODEL;

    @Builder.Default
    private double temperature = 0.7;

    @Builder.Default
    private long maxTokens = 4096;

    @Builder.Default
    private Duration requestTimeout = Duration.ofSeconds(60);

    // Retry envelope around each model call
    @Builder.Default
    private int maxAttempts = 3;

    @Builder.Default
    private Duration initialBackoff = Duration.ofSeconds(1);

    @Builder.Default
    private double backoffMultiplier = 2.0;

    @Builder.Default
    private Duration maxBackoff = Duration.ofSeconds(10);

    public static ModelSettings defaults() {
        return ModelSettings.builder().build();
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Rejects settings the retry envelope or the client cannot work with.
     */
    public void validate() {
        if (modelName == null || modelName.isBlank()) {
            throw new IllegalArgumentException("Model name must not be empty");
        }
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1, got " + maxAttempts);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be at least 1.0, got " + backoffMultiplier);
        }
        if (initialBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("Initial backoff must be at least 1 ms");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("Max backoff (" + maxBackoff + ") is shorter than initial backoff ("
                    + initialBackoff + ")");
        }
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("Temperature must be between 0 and 2, got " + temperature);
        }
    }

    public String getConfigurationSummary() {
        return String.format("model=%s, baseUrl=%s, temperature=%.2f, maxTokens=%d, attempts=%d, backoff=%dms..%dms",
                modelName, baseUrl, temperature, maxTokens, maxAttempts,
                initialBackoff.toMillis(), maxBackoff.toMillis());
    }
}
