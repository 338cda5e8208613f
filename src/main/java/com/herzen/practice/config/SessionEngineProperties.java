package com.herzen.practice.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Engine settings bound from {@code session.*}.
 */
@ConfigurationProperties(prefix = "session")
public class SessionEngineProperties {

    private Evaluation evaluation = new Evaluation();

    /** Wait for in-flight evaluations before computing final performance on end. */
    private boolean awaitPendingEvaluations = false;

    /** Upper bound for that wait. */
    private long evaluationAwaitTimeoutMs = 5000;

    /** Sessions per day used for goals until the user sets one. */
    private int defaultDailyGoal = 1;

    public Evaluation getEvaluation() {
        return evaluation;
    }

    public void setEvaluation(Evaluation evaluation) {
        this.evaluation = evaluation;
    }

    public boolean isAwaitPendingEvaluations() {
        return awaitPendingEvaluations;
    }

    public void setAwaitPendingEvaluations(boolean awaitPendingEvaluations) {
        this.awaitPendingEvaluations = awaitPendingEvaluations;
    }

    public long getEvaluationAwaitTimeoutMs() {
        return evaluationAwaitTimeoutMs;
    }

    public void setEvaluationAwaitTimeoutMs(long evaluationAwaitTimeoutMs) {
        this.evaluationAwaitTimeoutMs = evaluationAwaitTimeoutMs;
    }

    public int getDefaultDailyGoal() {
        return defaultDailyGoal;
    }

    public void setDefaultDailyGoal(int defaultDailyGoal) {
        this.defaultDailyGoal = defaultDailyGoal;
    }

    public static class Evaluation {
        private long timeoutMs = 15000;
        private int poolSize = 4;
        /** Score given to non-blank answers when AI evaluation is disabled. */
        private double neutralScore = 0.5;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public double getNeutralScore() {
            return neutralScore;
        }

        public void setNeutralScore(double neutralScore) {
            this.neutralScore = neutralScore;
        }
    }
}
