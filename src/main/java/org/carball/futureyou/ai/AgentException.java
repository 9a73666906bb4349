package org.carball.futureyou.ai;

/**
 * Fault at the external model boundary. Only this family is retried by {@link AgentRetryPolicy}.
 */
public class AgentException extends RuntimeException {

    public AgentException(String message) {
        super(message);
    }

    public AgentException(String message, Throwable cause) {
        super(message, cause);
    }
}
