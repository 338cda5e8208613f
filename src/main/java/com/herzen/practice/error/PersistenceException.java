package com.herzen.practice.error;

/**
 * Durable read or write failed. Callers log it and keep the in-memory state.
 */
public class PersistenceException extends PracticeEngineException {

    public PersistenceException(String message) {
        super("PERSISTENCE_ERROR", message);
    }

    public PersistenceException(String message, Throwable cause) {
        super("PERSISTENCE_ERROR", message, cause);
    }
}
