package com.herzen.practice.error;

/**
 * Base type for every failure the engine reports to its callers.
 */
public class PracticeEngineException extends RuntimeException {

    private final String errorCode;

    public PracticeEngineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PracticeEngineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
