package org.carball.futureyou.validation;

/**
 * Caller input was rejected before any model call was made. Never retried.
 */
public class ValidationException extends IllegalArgumentException {

    public ValidationException(String message) {
        super(message);
    }
}
