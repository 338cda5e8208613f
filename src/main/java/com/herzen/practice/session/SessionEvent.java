package com.herzen.practice.session;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.EvaluationStatus;
import com.herzen.practice.domain.DomainModels.SessionStatus;

import java.time.Instant;

public record SessionEvent(Type type,
                           String sessionId,
                           ContentType contentType,
                           SessionStatus status,
                           String questionId,
                           EvaluationStatus evaluationStatus,
                           int currentIndex,
                           int totalQuestions,
                           Instant at) {

    public enum Type {
        SESSION_STARTED,
        SESSION_FAILED,
        SESSION_PAUSED,
        SESSION_RESUMED,
        SESSION_COMPLETED,
        SESSION_RESET,
        SESSION_RESTORED,
        NAVIGATED,
        ANSWER_UPDATED,
        FLAGS_CHANGED
    }
}
