package com.herzen.practice.error;

/**
 * An operation was invoked outside the session state it is valid in.
 */
public class SessionStateException extends PracticeEngineException {

    public SessionStateException(String message) {
        super("STATE_ERROR", message);
    }
}
