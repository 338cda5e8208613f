package com.herzen.practice.error;

/**
 * The evaluation capability failed or timed out for a single answer.
 */
public class EvaluationException extends PracticeEngineException {

    public EvaluationException(String message) {
        super("EVALUATION_ERROR", message);
    }

    public EvaluationException(String message, Throwable cause) {
        super("EVALUATION_ERROR", message, cause);
    }
}
