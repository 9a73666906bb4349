package org.carball.futureyou.ai;

/**
 * Free-text answer too short to be a complete generation.
 */
public class IncompleteResponseException extends AgentException {

    public IncompleteResponseException(String message) {
        super(message);
    }
}
