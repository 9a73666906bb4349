package org.carball.futureyou.ai;

import lombok.Getter;

/**
 * The model answered, but the cleaned text is not JSON. Keeps the raw text for diagnostics.
 */
@Getter
public class MalformedResponseException extends AgentException {

    private final String rawText;

    public MalformedResponseException(String message, String rawText, Throwable cause) {
        super(message, cause);
        this.rawText = rawText;
    }
}
