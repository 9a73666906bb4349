package org.carball.futureyou.ai;

import lombok.extern.slf4j.Slf4j;
import org.carball.futureyou.config.ModelSettings;
import org.carball.futureyou.model.AnalysisResult;
import org.carball.futureyou.model.DecisionDNA;
import org.carball.futureyou.validation.ValidationException;

/**
 * Turns the analysis into direct, personalized advice. The only agent whose response is plain text.
 */
@Slf4j
public class AdvisorAgent extends StructuredAgent<AdvisorAgent.Request, String> {

    public static final int MIN_ADVICE_LENGTH = 50;

    public record Request(AnalysisResult analysis, DecisionDNA dna) {}

    public AdvisorAgent(ModelClient modelClient, ModelSettings settings) {
        super("AdvisorAgent", modelClient, settings);
    }

    public String generateAdvice(AnalysisResult analysis, DecisionDNA dna) {
        String advice = execute(new Request(analysis, dna));
        log.info("Personalized advice generated ({} characters)", advice.length());
        return advice;
    }

    @Override
    protected Request validateInput(Request request) {
        if (request.analysis() == null) {
            throw new ValidationException("No analysis provided for advice generation");
        }
        if (request.dna() == null) {
            throw new ValidationException("Decision DNA is required for advice generation");
        }
        log.info("Generating personalized advice");
        return request;
    }

    @Override
    protected String buildPrompt(Request request) {
        StringBuilder prompt = new StringBuilder();

        prompt.append("Based on this analysis and Decision DNA, provide personalized advice.\n\n");
        prompt.append("## Analysis:\n").append(toPromptJson(request.analysis())).append("\n\n");
        prompt.append("## Decision DNA:\n").append(toPromptJson(request.dna())).append("\n\n");

        prompt.append("## Provide:\n");
        prompt.append("1. Clear recommendation with reasoning\n");
        prompt.append("2. Action steps for next 30/60/90 days\n");
        prompt.append("3. Warning signs to watch for\n");
        prompt.append("4. Success indicators\n");
        prompt.append("5. Contingency plans\n\n");

        prompt.append("Be direct, actionable, and personalized to their DNA. Format as clear, readable text.");

        return prompt.toString();
    }

    @Override
    protected String parseResponse(Request request, String rawText) {
        String advice = rawText.trim();
        if (advice.length() < MIN_ADVICE_LENGTH) {
            throw new IncompleteResponseException(
                    "AdvisorAgent: advice response too short (" + advice.length() + " characters), likely incomplete");
        }
        return advice;
    }
}
