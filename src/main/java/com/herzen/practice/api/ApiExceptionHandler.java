package com.herzen.practice.api;

import com.herzen.practice.error.EvaluationException;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.error.PracticeEngineException;
import com.herzen.practice.error.SessionStateException;
import com.herzen.practice.error.SessionValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(SessionValidationException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(SessionValidationException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, ex.getMessage(), "VALIDATION_ERROR");
    }

    @ExceptionHandler(SessionStateException.class)
    public ResponseEntity<Map<String, Object>> handleState(SessionStateException ex) {
        return body(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(EvaluationException.class)
    public ResponseEntity<Map<String, Object>> handleEvaluation(EvaluationException ex) {
        log.warn("Evaluation error surfaced to client: {}", ex.getMessage());
        return body(HttpStatus.BAD_GATEWAY, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<Map<String, Object>> handlePersistence(PersistenceException ex) {
        log.error("Persistence error", ex);
        return body(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(PracticeEngineException.class)
    public ResponseEntity<Map<String, Object>> handleEngine(PracticeEngineException ex) {
        log.error("Unclassified engine error", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.getErrorCode());
    }

    private ResponseEntity<Map<String, Object>> body(HttpStatus status, String message, String errorCode) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("errorCode", errorCode);
        error.put("status", status.value());
        error.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(error);
    }
}
