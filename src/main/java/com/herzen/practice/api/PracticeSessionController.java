package com.herzen.practice.api;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.manager.SessionCoordinator;
import com.herzen.practice.session.SessionModels.Answer;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.Progress;
import com.herzen.practice.session.SessionModels.SessionStats;
import com.herzen.practice.session.SessionModels.SessionView;
import com.herzen.practice.session.SessionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/sessions/{type}")
public class PracticeSessionController {
    private final SessionCoordinator coordinator;

    public PracticeSessionController(SessionCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/start")
    public ResponseEntity<SessionView> start(@PathVariable String type, @RequestBody SessionConfig config) {
        return ResponseEntity.ok(coordinator.startSession(ContentType.fromLabel(type), config));
    }

    @GetMapping
    public ResponseEntity<SessionView> view(@PathVariable String type) {
        return ResponseEntity.ok(store(type).snapshot());
    }

    @PostMapping("/pause")
    public ResponseEntity<SessionView> pause(@PathVariable String type) {
        return ResponseEntity.ok(store(type).pauseSession());
    }

    @PostMapping("/resume")
    public ResponseEntity<SessionView> resume(@PathVariable String type) {
        return ResponseEntity.ok(store(type).resumeSession());
    }

    @PostMapping("/end")
    public ResponseEntity<Performance> end(@PathVariable String type) {
        return ResponseEntity.ok(store(type).endSession());
    }

    @PostMapping("/reset")
    public ResponseEntity<SessionView> reset(@PathVariable String type) {
        return ResponseEntity.ok(store(type).resetSession());
    }

    @PostMapping("/restore/{sessionId}")
    public ResponseEntity<SessionView> restore(@PathVariable String type, @PathVariable String sessionId) {
        return ResponseEntity.of(coordinator.restore(ContentType.fromLabel(type), sessionId));
    }

    @GetMapping("/current")
    public ResponseEntity<Item> current(@PathVariable String type) {
        return ResponseEntity.of(store(type).getCurrentQuestion());
    }

    @PostMapping("/next")
    public ResponseEntity<SessionView> next(@PathVariable String type) {
        return ResponseEntity.ok(store(type).moveToNextQuestion());
    }

    @PostMapping("/previous")
    public ResponseEntity<SessionView> previous(@PathVariable String type) {
        return ResponseEntity.ok(store(type).moveToPreviousQuestion());
    }

    @PostMapping("/jump/{index}")
    public ResponseEntity<SessionView> jump(@PathVariable String type, @PathVariable int index) {
        return ResponseEntity.ok(store(type).jumpToQuestion(index));
    }

    @PostMapping("/flags/{questionId}")
    public ResponseEntity<Set<String>> flag(@PathVariable String type, @PathVariable String questionId) {
        return ResponseEntity.ok(store(type).flagQuestion(questionId));
    }

    @DeleteMapping("/flags/{questionId}")
    public ResponseEntity<Set<String>> unflag(@PathVariable String type, @PathVariable String questionId) {
        return ResponseEntity.ok(store(type).unflagQuestion(questionId));
    }

    @PutMapping("/draft")
    public ResponseEntity<Void> draft(@PathVariable String type, @RequestBody DraftRequest request) {
        store(type).updateCurrentAnswer(request.text());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/answers")
    public CompletableFuture<Answer> submit(@PathVariable String type, @RequestBody SubmitAnswerRequest request) {
        return store(type).submitAnswer(request.questionId(), request.text(), request.timeSpent() == null ? 0L : request.timeSpent());
    }

    @PutMapping("/answers/{questionId}")
    public CompletableFuture<Answer> edit(@PathVariable String type, @PathVariable String questionId, @RequestBody DraftRequest request) {
        return store(type).editAnswer(questionId, request.text());
    }

    @GetMapping("/answers/{questionId}")
    public ResponseEntity<Answer> feedback(@PathVariable String type, @PathVariable String questionId) {
        return ResponseEntity.of(store(type).getEvaluationFeedback(questionId));
    }

    @PostMapping("/skip")
    public ResponseEntity<SessionView> skip(@PathVariable String type) {
        return ResponseEntity.ok(store(type).skipQuestion());
    }

    @GetMapping("/progress")
    public ResponseEntity<Progress> progress(@PathVariable String type) {
        return ResponseEntity.ok(store(type).calculateProgress());
    }

    @GetMapping("/performance")
    public ResponseEntity<Performance> performance(@PathVariable String type) {
        return ResponseEntity.ok(store(type).calculatePerformance());
    }

    @GetMapping("/stats")
    public ResponseEntity<SessionStats> stats(@PathVariable String type) {
        return ResponseEntity.ok(store(type).getSessionStats());
    }

    @GetMapping("/answered")
    public ResponseEntity<List<Answer>> answered(@PathVariable String type) {
        return ResponseEntity.ok(store(type).getAnsweredQuestions());
    }

    @GetMapping("/unanswered")
    public ResponseEntity<List<Item>> unanswered(@PathVariable String type) {
        return ResponseEntity.ok(store(type).getUnansweredQuestions());
    }

    @GetMapping("/flagged")
    public ResponseEntity<List<Item>> flagged(@PathVariable String type) {
        return ResponseEntity.ok(store(type).getFlaggedQuestions());
    }

    @GetMapping("/low-scoring")
    public ResponseEntity<List<Answer>> lowScoring(@PathVariable String type,
                                                   @RequestParam(required = false, defaultValue = "0.5") double threshold) {
        return ResponseEntity.ok(store(type).getLowScoringAnswers(threshold));
    }

    private SessionStore store(String type) {
        return coordinator.store(ContentType.fromLabel(type));
    }

    public record SubmitAnswerRequest(String questionId, String text, Long timeSpent) {}

    public record DraftRequest(String text) {}
}
