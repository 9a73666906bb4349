package org.carball.futureyou.ai;

import lombok.Getter;

/**
 * Parsed JSON is missing a required key, or a key has the wrong type or range.
 */
@Getter
public class SchemaViolationException extends AgentException {

    private final String field;

    public SchemaViolationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
