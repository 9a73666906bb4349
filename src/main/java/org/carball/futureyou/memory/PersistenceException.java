package org.carball.futureyou.memory;

/**
 * A session snapshot could not be taken or restored.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
