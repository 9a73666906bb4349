package org.carball.futureyou.ai;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.errors.OpenAIException;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;

/**
 * {@link ModelClient} backed by the OpenAI chat completions API. Any OpenAI-compatible endpoint
 * works through {@link ModelSettings#getBaseUrl()}; the default points at Gemini.
 */
@Slf4j
public class OpenAiModelClient implements ModelClient {

    private static final String SYSTEM_PROMPT = """
        You are one stage of a personal future simulator that helps people think through
        life decisions. Follow the output format requested in each prompt exactly.
        When JSON is requested, respond with the JSON value only, without commentary.
        """;

    private final OpenAIClient openAiClient;
    private final ModelSettings settings;

    public OpenAiModelClient(ModelSettings settings) {
        if (!settings.hasApiKey()) {
            throw new IllegalStateException(
                    "API key required. Use --api-key or set FUTUREYOU_API_KEY / GEMINI_API_KEY / OPENAI_API_KEY");
        }
        this.settings = settings;
        // retries are owned by the agents' retry envelope
        this.openAiClient = OpenAIOkHttpClient.builder()
                .apiKey(settings.getApiKey())
                .baseUrl(settings.getBaseUrl())
                .timeout(settings.getRequestTimeout())
                .maxRetries(0)
                .build();
        log.info("Model client configured: {}", settings.getConfigurationSummary());
    }

    @Override
    public String generate(String prompt, String modelName) {
        ChatCompletionCreateParams params = ChatCompletionCreateParams.builder()
                .model(modelName)
                .addSystemMessage(SYSTEM_PROMPT)
                .addUserMessage(prompt)
                .temperature(settings.getTemperature())
                .maxCompletionTokens(settings.getMaxTokens())
                .build();

        log.debug("Request model: {}", modelName);
        log.debug("User prompt length: {} characters", prompt.length());

        ChatCompletion completion;
        try {
            completion = openAiClient.chat().completions().create(params);
        } catch (OpenAIException e) {
            throw new ModelInvocationException("Model request to " + modelName + " failed: " + e.getMessage(), e);
        }

        String response = completion.choices().stream()
                .findFirst()
                .flatMap(choice -> choice.message().content())
                .orElse(null);

        log.trace("Received response: {} characters", response == null ? 0 : response.length());
        return response;
    }
}
