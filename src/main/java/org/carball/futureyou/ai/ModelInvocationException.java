package org.carball.futureyou.ai;

/**
 * The model service could not be reached or answered with an error.
 */
public class ModelInvocationException extends AgentException {

    public ModelInvocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
