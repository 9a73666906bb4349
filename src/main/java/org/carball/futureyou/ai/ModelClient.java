package org.carball.futureyou.ai;

/**
 * The one capability the pipeline needs from a generative model: text in, text out.
 * Implementations report transport and service failures as {@link ModelInvocationException}.
 */
public interface ModelClient {

    /**
     * @return the generated text, or {@code null}/blank when the service produced none
     */
    String generate(String prompt, String modelName);
}
