package com.herzen.practice.error;

/**
 * Malformed session config or an empty candidate pool.
 */
public class SessionValidationException extends PracticeEngineException {

    public SessionValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
