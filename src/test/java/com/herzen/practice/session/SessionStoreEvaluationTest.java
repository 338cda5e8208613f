package com.herzen.practice.session;

import com.herzen.practice.config.SessionEngineProperties;
import com.herzen.practice.domain.DomainModels.Difficulty;
import com.herzen.practice.domain.DomainModels.DifficultyFilter;
import com.herzen.practice.domain.DomainModels.EvaluationStatus;
import com.herzen.practice.domain.DomainModels.FocusStrategy;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.PracticeMode;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.error.SessionStateException;
import com.herzen.practice.evaluation.EvaluationCapability;
import com.herzen.practice.evaluation.KeywordHeuristicEvaluator;
import com.herzen.practice.session.SessionModels.Answer;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.SessionView;
import com.herzen.practice.session.StoreFixtures.FailingEvaluator;
import com.herzen.practice.session.StoreFixtures.FixedEvaluator;
import com.herzen.practice.session.StoreFixtures.InMemoryDurableStore;
import com.herzen.practice.session.StoreFixtures.InMemoryPool;
import com.herzen.practice.session.StoreFixtures.ManualExecutor;
import com.herzen.practice.snapshot.SessionSnapshot;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.herzen.practice.session.StoreFixtures.item;
import static org.junit.jupiter.api.Assertions.*;

class SessionStoreEvaluationTest {

    private static final SessionConfig CONFIG = new SessionConfig("course-1", List.of(), 3, DifficultyFilter.MIXED,
            FocusStrategy.WEAK_AREAS, PracticeMode.PRACTICE, null, null, true);

    private static InMemoryPool pool() {
        return new InMemoryPool(List.of(
                item("q1", Difficulty.EASY, 0.1),
                item("q2", Difficulty.MEDIUM, 0.2),
                item("q3", Difficulty.HARD, 0.3)));
    }

    @Test
    void answerMovesThroughPendingEvaluatingCompleted() {
        ManualExecutor executor = new ManualExecutor();
        SessionStore store = StoreFixtures.store(pool(), new KeywordHeuristicEvaluator(), new InMemoryDurableStore(),
                executor, StoreFixtures.properties());
        List<EvaluationStatus> observed = new ArrayList<>();
        store.addListener(e -> {
            if (e.type() == SessionEvent.Type.ANSWER_UPDATED) observed.add(e.evaluationStatus());
        });
        store.startSession(CONFIG);

        CompletableFuture<Answer> future = store.submitAnswer("q1", "latency " + StoreFixtures.words(59), 30_000);
        assertEquals(EvaluationStatus.PENDING, store.getEvaluationFeedback("q1").orElseThrow().evaluationStatus());
        assertTrue(store.isEvaluating());
        assertEquals(SessionStatus.ACTIVE, store.getStatus());

        executor.runAll();

        Answer settled = future.join();
        assertEquals(List.of(EvaluationStatus.PENDING, EvaluationStatus.EVALUATING, EvaluationStatus.COMPLETED), observed);
        assertEquals(EvaluationStatus.COMPLETED, settled.evaluationStatus());
        assertEquals(60, settled.wordCount());
        assertTrue(settled.score() >= 0 && settled.score() <= 1);
        assertEquals(List.of("latency"), settled.keywordMatches());
        assertFalse(store.isEvaluating());
    }

    @Test
    void navigationContinuesWhileEvaluationIsInFlight() {
        ManualExecutor executor = new ManualExecutor();
        SessionStore store = StoreFixtures.store(pool(), new FixedEvaluator(0.8), new InMemoryDurableStore(),
                executor, StoreFixtures.properties());
        store.startSession(CONFIG);

        store.submitAnswer("q1", "first", 1000);
        SessionView moved = store.moveToNextQuestion();
        store.submitAnswer("q2", "second", 1000);

        assertEquals("q2", moved.currentItem().id());
        assertTrue(moved.evaluating());
        executor.runAll();
        assertEquals(2, store.getAnsweredQuestions().size());
        assertTrue(store.getAnsweredQuestions().stream().allMatch(a -> a.score() == 0.8));
    }

    @Test
    void evaluatorFailureDegradesOnlyThatAnswer() {
        SessionStore store = StoreFixtures.store(pool(), new FailingEvaluator());
        store.startSession(CONFIG);

        Answer answer = store.submitAnswer("q1", "some answer text", 1000).join();

        assertEquals(EvaluationStatus.FAILED, answer.evaluationStatus());
        assertEquals(SessionModels.EVALUATION_FAILED_FEEDBACK, answer.feedback());
        assertNull(answer.score());
        assertEquals(SessionStatus.ACTIVE, store.getStatus());
        assertEquals(1, store.calculateProgress().answeredCount());
    }

    @Test
    void saturatedEvaluationQueueFailsTheAnswerInsteadOfThrowing() {
        InMemoryPool pool = pool();
        InMemoryDurableStore durable = new InMemoryDurableStore();
        Executor saturated = command -> {
            throw new RejectedExecutionException("evaluation queue full");
        };
        SessionStore store = StoreFixtures.store(pool, new FixedEvaluator(0.9), durable, saturated, StoreFixtures.properties());
        SessionView view = store.startSession(CONFIG);

        CompletableFuture<Answer> future = assertDoesNotThrow(() -> store.submitAnswer("q1", "latency answer", 1000));

        assertTrue(future.isDone());
        Answer answer = future.join();
        assertEquals(EvaluationStatus.FAILED, answer.evaluationStatus());
        assertEquals(SessionModels.EVALUATION_FAILED_FEEDBACK, answer.feedback());
        assertEquals(EvaluationStatus.FAILED, store.getEvaluationFeedback("q1").orElseThrow().evaluationStatus());
        assertFalse(store.isEvaluating());
        assertEquals(SessionStatus.ACTIVE, store.getStatus());
        assertEquals(1, pool.recorded.get("q1").timesSeen());

        SessionSnapshot saved = durable.snapshots.get(view.id());
        assertEquals(EvaluationStatus.FAILED, saved.progress().answers().get(0).evaluationStatus());
    }

    @Test
    void slowEvaluationTimesOut() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            SessionEngineProperties properties = StoreFixtures.properties();
            properties.getEvaluation().setTimeoutMs(50);
            EvaluationCapability slow = new FixedEvaluator(text -> {
                sleep(1_000);
                return 1.0;
            });
            SessionStore store = StoreFixtures.store(pool(), slow, new InMemoryDurableStore(), executor, properties);
            store.startSession(CONFIG);

            Answer answer = store.submitAnswer("q1", "slow answer", 1000).get(5, TimeUnit.SECONDS);

            assertEquals(EvaluationStatus.FAILED, answer.evaluationStatus());
            assertEquals(SessionModels.EVALUATION_FAILED_FEEDBACK, answer.feedback());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void lastSubmittedTextWinsOverAnEarlierEvaluation() {
        ManualExecutor executor = new ManualExecutor();
        InMemoryPool pool = pool();
        FixedEvaluator evaluator = new FixedEvaluator(text -> text.startsWith("first") ? 0.1 : 0.9);
        SessionStore store = StoreFixtures.store(pool, evaluator, new InMemoryDurableStore(), executor, StoreFixtures.properties());
        store.startSession(CONFIG);

        CompletableFuture<Answer> firstFuture = store.submitAnswer("q1", "first draft", 1000);
        CompletableFuture<Answer> editFuture = store.editAnswer("q1", "revised answer");
        executor.runAll();

        assertEquals(2, evaluator.calls);
        assertEquals(0.1, firstFuture.join().score());
        Answer stored = store.getEvaluationFeedback("q1").orElseThrow();
        assertEquals("revised answer", stored.userAnswer());
        assertEquals(0.9, stored.score());
        assertEquals(editFuture.join(), stored);
        assertEquals(1, store.calculateProgress().answers().size());
        assertFalse(store.isEvaluating());

        Item recorded = pool.recorded.get("q1");
        assertEquals(1, recorded.timesSeen());
        assertEquals(0.9, recorded.averageScore(), 1e-9);
    }

    @Test
    void endingDoesNotWaitForEvaluationsByDefault() {
        ManualExecutor executor = new ManualExecutor();
        SessionStore store = StoreFixtures.store(pool(), new FixedEvaluator(0.9), new InMemoryDurableStore(),
                executor, StoreFixtures.properties());
        store.startSession(CONFIG);
        store.submitAnswer("q1", "pending answer", 1000);

        Performance performance = store.endSession();

        assertEquals(0.0, performance.overallScore());
        assertEquals(SessionStatus.COMPLETED, store.getStatus());
        executor.runAll();
        assertEquals(EvaluationStatus.COMPLETED, store.getEvaluationFeedback("q1").orElseThrow().evaluationStatus());
        assertEquals(0.0, store.snapshot().performance().overallScore());
    }

    @Test
    void endingWaitsForEvaluationsWhenConfigured() {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            SessionEngineProperties properties = StoreFixtures.properties();
            properties.setAwaitPendingEvaluations(true);
            properties.setEvaluationAwaitTimeoutMs(5_000);
            EvaluationCapability slow = new FixedEvaluator(text -> {
                sleep(100);
                return 0.9;
            });
            SessionStore store = StoreFixtures.store(pool(), slow, new InMemoryDurableStore(), executor, properties);
            store.startSession(CONFIG);
            store.submitAnswer("q1", "awaited answer", 1000);

            Performance performance = store.endSession();

            assertEquals(0.9, performance.overallScore(), 1e-9);
            assertEquals(SessionStatus.COMPLETED, store.getStatus());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void restoreMarksInterruptedEvaluationsFailed() {
        ManualExecutor executor = new ManualExecutor();
        InMemoryDurableStore durable = new InMemoryDurableStore();
        SessionStore crashed = StoreFixtures.store(pool(), new FixedEvaluator(0.9), durable, executor, StoreFixtures.properties());
        String sessionId = crashed.startSession(CONFIG).id();
        crashed.submitAnswer("q1", "interrupted answer", 1000);
        crashed.flagQuestion("q2");

        SessionStore recovered = StoreFixtures.store(pool(), new FixedEvaluator(0.9), durable, Runnable::run, StoreFixtures.properties());
        SessionView view = recovered.restore(sessionId).orElseThrow();

        assertEquals(SessionStatus.ACTIVE, view.status());
        assertEquals(3, view.questions().size());
        assertEquals(List.of("q2"), List.copyOf(view.progress().flaggedQuestions()));
        Answer answer = recovered.getEvaluationFeedback("q1").orElseThrow();
        assertEquals(EvaluationStatus.FAILED, answer.evaluationStatus());
        assertEquals(SessionModels.EVALUATION_INTERRUPTED_FEEDBACK, answer.feedback());

        Answer resubmitted = recovered.editAnswer("q1", "interrupted answer again").join();
        assertEquals(0.9, resubmitted.score());
        assertEquals(1, recovered.calculateProgress().answers().size());
        assertThrows(SessionStateException.class, () -> recovered.restore(sessionId));
    }

    @Test
    void restoreOfUnknownSessionIsEmpty() {
        SessionStore store = StoreFixtures.store(pool(), new FixedEvaluator(0.9));

        assertTrue(store.restore("missing").isEmpty());
        assertEquals(SessionStatus.IDLE, store.getStatus());
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
