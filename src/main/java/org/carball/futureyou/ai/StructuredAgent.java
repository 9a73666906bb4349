package org.carball.futureyou.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;

import java.util.Objects;

/**
 * One request/response cycle against the model, shared by all agents.
 *
 * <p>{@link #execute(Object)} validates the input and renders the prompt once, then runs
 * call, fence stripping, JSON parsing, schema validation and conversion inside the retry
 * envelope. The last failure propagates unchanged; there is no degraded result.</p>
 *
 * @param <I> typed input of the agent
 * @param <O> typed result of the agent
 */
@Slf4j
public abstract class StructuredAgent<I, O> {

    protected final ModelClient modelClient;
    protected final String modelName;
    protected final ObjectMapper objectMapper;
    private final String agentName;
    private final Retry retry;

    protected StructuredAgent(String agentName, ModelClient modelClient, ModelSettings settings) {
        this.agentName = agentName;
        this.modelClient = Objects.requireNonNull(modelClient, "modelClient");
        this.modelName = Objects.requireNonNull(settings.getModelName(), "modelName");
        this.retry = AgentRetryPolicy.create(agentName, settings);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        log.info("{} initialized with model: {}", agentName, modelName);
    }

    /**
     * Checks the typed input. Throws {@link org.carball.futureyou.validation.ValidationException}
     * before any model call is made; may return a normalized copy.
     */
    protected abstract I validateInput(I input);

    protected abstract String buildPrompt(I input);

    /**
     * Turns the raw model text into the typed result, or throws an {@link AgentException}.
     */
    protected abstract O parseResponse(I input, String rawText);

    protected final O execute(I input) {
        I validated = validateInput(input);
        String prompt = buildPrompt(validated);
        return retry.executeSupplier(() -> attempt(validated, prompt));
    }

    private O attempt(I input, String prompt) {
        log.debug("{} sending prompt of {} characters", agentName, prompt.length());
        log.trace("Full prompt:\n{}", prompt);

        String rawText;
        try {
            rawText = modelClient.generate(prompt, modelName);
        } catch (AgentException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelInvocationException(agentName + ": model call failed: " + e.getMessage(), e);
        }

        if (rawText == null || rawText.isBlank()) {
            throw new EmptyResponseException(agentName + ": empty response from model " + modelName);
        }
        log.trace("{} raw response:\n{}", agentName, rawText);

        return parseResponse(input, rawText);
    }

    /**
     * Strips code fences, parses JSON and validates it against {@code schema}.
     */
    protected JsonNode readJson(String rawText, ResponseSchema schema) {
        String cleaned = stripCodeFences(rawText);
        JsonNode node;
        try {
            node = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("{} could not parse response as JSON. Raw response: {}", agentName, rawText);
            throw new MalformedResponseException(
                    agentName + ": invalid JSON response from model: " + e.getOriginalMessage(), rawText, e);
        }
        if (node == null || node.isMissingNode()) {
            throw new MalformedResponseException(agentName + ": response contained no JSON value", rawText, null);
        }
        schema.validate(node);
        return node;
    }

    /**
     * Converts a validated field, reporting element-level type mismatches as schema violations.
     */
    protected <T> T convertField(JsonNode node, String field, TypeReference<T> type) {
        try {
            return objectMapper.convertValue(node.get(field), type);
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException(field, agentName + ": key " + field + " has unexpected content: "
                    + e.getMessage());
        }
    }

    /**
     * Pretty-printed JSON of a prompt input. Property order is fixed, so prompts are deterministic.
     */
    protected String toPromptJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize prompt input for " + agentName, e);
        }
    }

    public String getAgentName() {
        return agentName;
    }

    public String getModelName() {
        return modelName;
    }

    /**
     * Removes Markdown code-fence decoration. Text without fences comes back trimmed.
     */
    public static String stripCodeFences(String text) {
        String cleaned = text.trim();
        if (!cleaned.startsWith("```")) {
            int fenceStart = cleaned.indexOf("```");
            int fenceEnd = fenceStart < 0 ? -1 : cleaned.indexOf("```", fenceStart + 3);
            if (fenceEnd < 0) {
                return cleaned;
            }
            cleaned = cleaned.substring(fenceStart, fenceEnd + 3);
        }

        if (cleaned.regionMatches(true, 0, "```json", 0, 7)) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
