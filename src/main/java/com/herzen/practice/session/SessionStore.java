package com.herzen.practice.session;

import com.herzen.practice.config.SessionEngineProperties;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.EvaluationStatus;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.ItemFilter;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.domain.IdGenerator;
import com.herzen.practice.domain.TextMetrics;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.error.SessionStateException;
import com.herzen.practice.error.SessionValidationException;
import com.herzen.practice.evaluation.EvaluationCapability;
import com.herzen.practice.evaluation.EvaluationModels.EvaluationResult;
import com.herzen.practice.pool.QuestionPoolProvider;
import com.herzen.practice.session.SessionModels.Answer;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.Progress;
import com.herzen.practice.session.SessionModels.SessionStats;
import com.herzen.practice.session.SessionModels.SessionView;
import com.herzen.practice.snapshot.DurableSessionStore;
import com.herzen.practice.snapshot.SessionSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Owns one practice session of a single content type: item selection, answers, evaluation and
 * per-session performance.
 * <p>
 * Every mutation happens under the instance lock. Evaluations run on the evaluation executor and
 * re-enter the lock only to apply their result; a result is applied only when the answer still
 * carries the revision the evaluation was started for, so the last submission for a question wins.
 */
@Slf4j
public class SessionStore {
    static final String NO_ITEMS_MESSAGE = "No questions found matching the specified criteria";

    private final ContentType contentType;
    private final QuestionPoolProvider pool;
    private final EvaluationCapability evaluator;
    private final DurableSessionStore durableStore;
    private final Executor evaluationExecutor;
    private final SessionEngineProperties properties;
    private final Clock clock;
    private final Random random;

    private final Object lock = new Object();
    private final List<SessionEventListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, PendingEvaluation> inFlight = new HashMap<>();

    private String id = "";
    private SessionStatus status = SessionStatus.IDLE;
    private SessionConfig config;
    private List<Item> questions = List.of();
    private Progress progress;
    private Performance performance = Performance.empty();
    private String currentDraftAnswer = "";
    private Instant startedAt;
    private String error;
    private long revisionCounter;

    public SessionStore(ContentType contentType,
                        QuestionPoolProvider pool,
                        EvaluationCapability evaluator,
                        DurableSessionStore durableStore,
                        Executor evaluationExecutor,
                        SessionEngineProperties properties,
                        Clock clock,
                        Random random) {
        this.contentType = contentType;
        this.pool = pool;
        this.evaluator = evaluator;
        this.durableStore = durableStore;
        this.evaluationExecutor = evaluationExecutor;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
        this.progress = Progress.initial(0, clock.instant(), null);
    }

    public void addListener(SessionEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionEventListener listener) {
        listeners.remove(listener);
    }

    // ==================== lifecycle ====================

    public SessionView startSession(SessionConfig newConfig) {
        return startSession(null, newConfig);
    }

    /**
     * Selects the session's items and activates it. An invalid config or an empty candidate pool
     * leaves the store in {@code failed} with the reason in {@link SessionView#error()}.
     */
    public SessionView startSession(String sessionId, SessionConfig newConfig) {
        synchronized (lock) {
            requireStatus("start a session", SessionStatus.IDLE, SessionStatus.COMPLETED, SessionStatus.FAILED);
            String newId = sessionId == null || sessionId.isBlank() ? IdGenerator.withPrefix(contentType.label()) : sessionId;

            List<Item> selected;
            try {
                validate(newConfig);
                ItemFilter filter = ItemFilter.of(contentType, newConfig);
                selected = ItemSelector.select(pool.fetchItems(filter), filter, newConfig, random);
                if (selected.isEmpty()) {
                    throw new SessionValidationException(NO_ITEMS_MESSAGE);
                }
            } catch (SessionValidationException e) {
                return fail(newId, newConfig, e.getMessage());
            } catch (RuntimeException e) {
                log.error("Question pool lookup failed for session {}", newId, e);
                return fail(newId, newConfig, "Failed to load questions: " + e.getMessage());
            }

            Instant now = clock.instant();
            Long remainingTime = newConfig.timeLimit() == null ? null : newConfig.timeLimit() * 60_000L;
            id = newId;
            config = newConfig;
            questions = selected;
            progress = Progress.initial(selected.size(), now, remainingTime);
            performance = Performance.empty();
            currentDraftAnswer = "";
            startedAt = now;
            error = null;
            revisionCounter = 0;
            inFlight.clear();
            status = SessionStatus.ACTIVE;

            log.info("Started {} session {} with {} items (focus={}, difficulty={})",
                    contentType.label(), id, selected.size(), newConfig.focus().label(), newConfig.difficulty().label());
            persist();
            publish(SessionEvent.Type.SESSION_STARTED, null, null);
            return view();
        }
    }

    public SessionView pauseSession() {
        synchronized (lock) {
            requireStatus("pause the session", SessionStatus.ACTIVE);
            status = SessionStatus.PAUSED;
            progress = progress.touched(clock.instant());
            persist();
            publish(SessionEvent.Type.SESSION_PAUSED, null, null);
            return view();
        }
    }

    public SessionView resumeSession() {
        synchronized (lock) {
            requireStatus("resume the session", SessionStatus.PAUSED);
            status = SessionStatus.ACTIVE;
            progress = progress.touched(clock.instant());
            persist();
            publish(SessionEvent.Type.SESSION_RESUMED, null, null);
            return view();
        }
    }

    /**
     * Computes final performance from the answers recorded so far and completes the session.
     * In-flight evaluations are awaited only when {@code session.await-pending-evaluations} is set.
     */
    public Performance endSession() {
        List<CompletableFuture<Answer>> pending;
        synchronized (lock) {
            requireStatus("end the session", SessionStatus.ACTIVE, SessionStatus.PAUSED);
            pending = inFlight.values().stream().map(PendingEvaluation::future).toList();
        }
        if (properties.isAwaitPendingEvaluations() && !pending.isEmpty()) {
            awaitEvaluations(pending);
        }
        synchronized (lock) {
            if (status != SessionStatus.ACTIVE && status != SessionStatus.PAUSED) {
                return performance;
            }
            performance = computePerformance();
            progress = progress.touched(clock.instant());
            status = SessionStatus.COMPLETED;
            log.info("Completed {} session {}: {} answered, {} skipped, overall score {}",
                    contentType.label(), id, progress.answeredCount(), progress.skippedCount(),
                    String.format("%.2f", performance.overallScore()));
            persist();
            publish(SessionEvent.Type.SESSION_COMPLETED, null, null);
            return performance;
        }
    }

    public SessionView resetSession() {
        synchronized (lock) {
            String previousId = id;
            boolean unfinished = status == SessionStatus.ACTIVE || status == SessionStatus.PAUSED;
            if (unfinished && !previousId.isBlank()) {
                try {
                    durableStore.delete(previousId);
                } catch (PersistenceException e) {
                    log.warn("Could not drop snapshot of reset session {}: {}", previousId, e.getMessage());
                }
            }
            id = "";
            status = SessionStatus.IDLE;
            config = null;
            questions = List.of();
            progress = Progress.initial(0, clock.instant(), null);
            performance = Performance.empty();
            currentDraftAnswer = "";
            startedAt = null;
            error = null;
            inFlight.clear();
            publish(new SessionEvent(SessionEvent.Type.SESSION_RESET, previousId, contentType, status,
                    null, null, 0, 0, clock.instant()));
            return view();
        }
    }

    /**
     * Reloads a session from its durable snapshot. Answers that were still being evaluated when the
     * snapshot was taken are marked failed, since their evaluation cannot be resumed.
     */
    public Optional<SessionView> restore(String sessionId) {
        Optional<SessionSnapshot> loaded;
        try {
            loaded = durableStore.load(sessionId);
        } catch (PersistenceException e) {
            log.warn("Could not load snapshot {}: {}", sessionId, e.getMessage());
            return Optional.empty();
        }
        if (loaded.isEmpty()) {
            return Optional.empty();
        }
        SessionSnapshot snapshot = loaded.get();
        synchronized (lock) {
            requireStatus("restore a session", SessionStatus.IDLE, SessionStatus.COMPLETED, SessionStatus.FAILED);
            if (snapshot.contentType() != contentType) {
                throw new SessionValidationException("Snapshot " + sessionId + " belongs to " + snapshot.contentType().label());
            }
            Instant now = clock.instant();
            List<Answer> answers = snapshot.progress().answers().stream()
                    .map(a -> a.evaluationStatus() == EvaluationStatus.PENDING || a.evaluationStatus() == EvaluationStatus.EVALUATING
                            ? a.failed(SessionModels.EVALUATION_INTERRUPTED_FEEDBACK)
                            : a)
                    .toList();
            id = snapshot.id();
            status = snapshot.status();
            config = snapshot.config();
            questions = snapshot.questions();
            progress = PerformanceCalculator.withAnswers(snapshot.progress(), answers, 0L, now);
            performance = snapshot.performance() == null ? Performance.empty() : snapshot.performance();
            currentDraftAnswer = snapshot.currentDraftAnswer() == null ? "" : snapshot.currentDraftAnswer();
            startedAt = snapshot.progress().startedAt();
            error = null;
            inFlight.clear();
            revisionCounter = answers.stream().mapToLong(Answer::revision).max().orElse(0L);

            log.info("Restored {} session {} in status {}", contentType.label(), id, status.label());
            persist();
            publish(SessionEvent.Type.SESSION_RESTORED, null, null);
            return Optional.of(view());
        }
    }

    // ==================== navigation ====================

    public Optional<Item> getCurrentQuestion() {
        synchronized (lock) {
            return Optional.ofNullable(currentItem());
        }
    }

    /**
     * Advances to the next item; advancing past the last one ends the session.
     */
    public SessionView moveToNextQuestion() {
        boolean finished;
        synchronized (lock) {
            requireStatus("move to the next question", SessionStatus.ACTIVE);
            int next = progress.currentIndex() + 1;
            finished = next >= questions.size();
            if (!finished) {
                goTo(next);
            }
        }
        if (finished) {
            endSession();
        }
        return snapshot();
    }

    public SessionView moveToPreviousQuestion() {
        synchronized (lock) {
            requireStatus("move to the previous question", SessionStatus.ACTIVE);
            goTo(Math.max(0, progress.currentIndex() - 1));
            return view();
        }
    }

    public SessionView jumpToQuestion(int index) {
        synchronized (lock) {
            requireStatus("jump to a question", SessionStatus.ACTIVE);
            goTo(Math.max(0, Math.min(index, questions.size() - 1)));
            return view();
        }
    }

    public Set<String> flagQuestion(String questionId) {
        synchronized (lock) {
            requireStatus("flag a question", SessionStatus.ACTIVE, SessionStatus.PAUSED);
            findItem(questionId);
            Set<String> flags = new LinkedHashSet<>(progress.flaggedQuestions());
            if (flags.add(questionId)) {
                progress = progress.withFlags(flags, clock.instant());
                persist();
                publish(SessionEvent.Type.FLAGS_CHANGED, questionId, null);
            }
            return progress.flaggedQuestions();
        }
    }

    public Set<String> unflagQuestion(String questionId) {
        synchronized (lock) {
            requireStatus("unflag a question", SessionStatus.ACTIVE, SessionStatus.PAUSED);
            Set<String> flags = new LinkedHashSet<>(progress.flaggedQuestions());
            if (flags.remove(questionId)) {
                progress = progress.withFlags(flags, clock.instant());
                persist();
                publish(SessionEvent.Type.FLAGS_CHANGED, questionId, null);
            }
            return progress.flaggedQuestions();
        }
    }

    // ==================== answers ====================

    public void updateCurrentAnswer(String draft) {
        synchronized (lock) {
            requireStatus("update the draft answer", SessionStatus.ACTIVE);
            currentDraftAnswer = draft == null ? "" : draft;
        }
    }

    /**
     * Records an answer, replacing any earlier answer to the same item. The returned future settles
     * once the answer is scored; it never completes exceptionally for evaluation failures.
     *
     * @param timeSpent milliseconds spent on the item
     */
    public CompletableFuture<Answer> submitAnswer(String questionId, String text, long timeSpent) {
        synchronized (lock) {
            requireStatus("submit an answer", SessionStatus.ACTIVE);
            if (timeSpent < 0) {
                throw new SessionValidationException("timeSpent must not be negative");
            }
            Item item = findItem(questionId);
            Answer answer = newAnswer(questionId, text == null ? "" : text, timeSpent);
            return record(item, answer, timeSpent, true);
        }
    }

    /**
     * Replaces the text of an existing answer and scores it again. Item statistics are not counted again,
     * unless the edit supersedes a submission whose evaluation has not settled yet.
     */
    public CompletableFuture<Answer> editAnswer(String questionId, String newText) {
        synchronized (lock) {
            requireStatus("edit an answer", SessionStatus.ACTIVE);
            Item item = findItem(questionId);
            Answer existing = findAnswer(questionId)
                    .orElseThrow(() -> new SessionValidationException("No answer to edit for question " + questionId));
            PendingEvaluation superseded = inFlight.get(questionId);
            Answer edited = newAnswer(questionId, newText == null ? "" : newText, existing.timeSpent());
            return record(item, edited, 0L, superseded != null && superseded.countsStats());
        }
    }

    public SessionView skipQuestion() {
        synchronized (lock) {
            requireStatus("skip a question", SessionStatus.ACTIVE);
            Item current = currentItem();
            if (current == null) {
                throw new SessionStateException("There is no current question to skip");
            }
            submitAnswer(current.id(), "", 0L);
        }
        return moveToNextQuestion();
    }

    public Optional<Answer> getEvaluationFeedback(String questionId) {
        synchronized (lock) {
            return findAnswer(questionId);
        }
    }

    public boolean isEvaluating() {
        synchronized (lock) {
            return !inFlight.isEmpty();
        }
    }

    // ==================== progress and performance ====================

    public Progress calculateProgress() {
        synchronized (lock) {
            return progress;
        }
    }

    public Performance calculatePerformance() {
        synchronized (lock) {
            performance = computePerformance();
            return performance;
        }
    }

    public SessionStats getSessionStats() {
        synchronized (lock) {
            return new SessionStats(progress.timeSpent(), progress.answeredCount(), progress.averageScore(),
                    progress.totalQuestions() - progress.answeredCount(), progress.averageWordCount());
        }
    }

    public List<Answer> getAnsweredQuestions() {
        synchronized (lock) {
            return progress.answers().stream().filter(a -> !a.isBlank()).toList();
        }
    }

    public List<Item> getUnansweredQuestions() {
        synchronized (lock) {
            Set<String> answered = progress.answers().stream().map(Answer::questionId).collect(Collectors.toSet());
            return questions.stream().filter(q -> !answered.contains(q.id())).toList();
        }
    }

    public List<Item> getFlaggedQuestions() {
        synchronized (lock) {
            return questions.stream().filter(q -> progress.flaggedQuestions().contains(q.id())).toList();
        }
    }

    public List<Answer> getLowScoringAnswers() {
        return getLowScoringAnswers(0.5);
    }

    public List<Answer> getLowScoringAnswers(double threshold) {
        synchronized (lock) {
            return progress.answers().stream().filter(a -> a.scoreOrZero() < threshold).toList();
        }
    }

    public ContentType getContentType() {
        return contentType;
    }

    public SessionStatus getStatus() {
        synchronized (lock) {
            return status;
        }
    }

    public String getSessionId() {
        synchronized (lock) {
            return id;
        }
    }

    public SessionView snapshot() {
        synchronized (lock) {
            return view();
        }
    }

    // ==================== internals ====================

    private void validate(SessionConfig candidate) {
        if (candidate == null) {
            throw new SessionValidationException("Session config is required");
        }
        if (candidate.courseId() == null || candidate.courseId().isBlank()) {
            throw new SessionValidationException("courseId is required");
        }
        if (candidate.numQuestions() <= 0) {
            throw new SessionValidationException("numQuestions must be positive, got " + candidate.numQuestions());
        }
        if (candidate.timeLimit() != null && candidate.timeLimit() <= 0) {
            throw new SessionValidationException("timeLimit must be positive when set");
        }
    }

    private SessionView fail(String failedId, SessionConfig failedConfig, String message) {
        id = failedId;
        config = failedConfig;
        questions = List.of();
        currentDraftAnswer = "";
        error = message;
        inFlight.clear();
        status = SessionStatus.FAILED;
        log.warn("Could not start {} session {}: {}", contentType.label(), failedId, message);
        publish(SessionEvent.Type.SESSION_FAILED, null, null);
        return view();
    }

    private void requireStatus(String operation, SessionStatus... allowed) {
        if (Arrays.stream(allowed).noneMatch(s -> s == status)) {
            throw new SessionStateException("Cannot " + operation + " while the session is " + status.label());
        }
    }

    private Item currentItem() {
        int index = progress.currentIndex();
        return index < questions.size() ? questions.get(index) : null;
    }

    private Item findItem(String questionId) {
        return questions.stream()
                .filter(q -> q.id().equals(questionId))
                .findFirst()
                .orElseThrow(() -> new SessionValidationException("Question " + questionId + " is not part of session " + id));
    }

    private Optional<Answer> findAnswer(String questionId) {
        return progress.answers().stream().filter(a -> a.questionId().equals(questionId)).findFirst();
    }

    private void goTo(int index) {
        progress = progress.atIndex(index, clock.instant());
        Item item = currentItem();
        currentDraftAnswer = item == null ? "" : findAnswer(item.id()).map(Answer::userAnswer).orElse("");
        persist();
        publish(SessionEvent.Type.NAVIGATED, item == null ? null : item.id(), null);
    }

    private Answer newAnswer(String questionId, String text, long timeSpent) {
        long revision = ++revisionCounter;
        Instant now = clock.instant();
        int words = TextMetrics.wordCount(text);
        if (config.enableAiEvaluation() && !TextMetrics.isBlank(text)) {
            return new Answer(questionId, text, words, timeSpent, now, EvaluationStatus.PENDING,
                    null, List.of(), null, List.of(), revision);
        }
        double score = TextMetrics.isBlank(text) ? 0.0 : properties.getEvaluation().getNeutralScore();
        return withLengthHint(new Answer(questionId, text, words, timeSpent, now, EvaluationStatus.COMPLETED,
                score, List.of(), null, List.of(), revision));
    }

    private CompletableFuture<Answer> record(Item item, Answer answer, long addedTime, boolean countStats) {
        upsert(answer, addedTime);
        if (answer.evaluationStatus() == EvaluationStatus.COMPLETED) {
            if (countStats) {
                recordItemStats(item.id(), answer);
            }
            persist();
            publish(SessionEvent.Type.ANSWER_UPDATED, answer.questionId(), answer.evaluationStatus());
            return CompletableFuture.completedFuture(answer);
        }
        persist();
        publish(SessionEvent.Type.ANSWER_UPDATED, answer.questionId(), answer.evaluationStatus());
        return startEvaluation(item, answer, countStats);
    }

    private CompletableFuture<Answer> startEvaluation(Item item, Answer answer, boolean countStats) {
        String sessionId = id;
        CompletableFuture<Answer> future;
        try {
            future = CompletableFuture
                    .supplyAsync(() -> {
                        markEvaluating(sessionId, answer);
                        return evaluator.evaluate(item, answer.userAnswer());
                    }, evaluationExecutor)
                    .orTimeout(properties.getEvaluation().getTimeoutMs(), TimeUnit.MILLISECONDS)
                    .handle((result, failure) -> settleEvaluation(sessionId, item, answer, result, failure, countStats));
        } catch (RejectedExecutionException e) {
            // queue saturated, settle as failed rather than leave it pending
            return CompletableFuture.completedFuture(settleEvaluation(sessionId, item, answer, null, e, countStats));
        }
        if (!future.isDone()) {
            inFlight.put(answer.questionId(), new PendingEvaluation(answer.revision(), future, countStats));
        }
        return future;
    }

    private void markEvaluating(String sessionId, Answer submitted) {
        synchronized (lock) {
            Answer current = liveAnswer(sessionId, submitted);
            if (current == null || current.evaluationStatus() != EvaluationStatus.PENDING) {
                return;
            }
            replace(current.evaluating());
            publish(SessionEvent.Type.ANSWER_UPDATED, current.questionId(), EvaluationStatus.EVALUATING);
        }
    }

    private Answer settleEvaluation(String sessionId, Item item, Answer submitted, EvaluationResult result,
                                    Throwable failure, boolean countStats) {
        synchronized (lock) {
            PendingEvaluation pending = inFlight.get(submitted.questionId());
            if (sessionId.equals(id) && pending != null && pending.revision() == submitted.revision()) {
                inFlight.remove(submitted.questionId());
            }

            Answer current = liveAnswer(sessionId, submitted);
            if (current == null) {
                log.debug("Discarding evaluation of {} revision {}: superseded", submitted.questionId(), submitted.revision());
                return failure == null ? submitted.evaluated(result) : submitted.failed(SessionModels.EVALUATION_FAILED_FEEDBACK);
            }

            Answer settled;
            if (failure != null) {
                Throwable cause = failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
                log.warn("Evaluation of {} in session {} failed ({}): {}", submitted.questionId(), sessionId,
                        evaluator.getName(), cause.toString());
                settled = current.failed(SessionModels.EVALUATION_FAILED_FEEDBACK);
            } else {
                settled = withLengthHint(current.evaluated(result));
            }
            replace(settled);
            if (countStats) {
                recordItemStats(item.id(), settled);
            }
            persist();
            publish(SessionEvent.Type.ANSWER_UPDATED, settled.questionId(), settled.evaluationStatus());
            return settled;
        }
    }

    private Answer liveAnswer(String sessionId, Answer submitted) {
        if (!sessionId.equals(id)) {
            return null;
        }
        return findAnswer(submitted.questionId())
                .filter(a -> a.revision() == submitted.revision())
                .orElse(null);
    }

    private Answer withLengthHint(Answer answer) {
        Integer minWords = config.requireMinWords();
        if (minWords == null || answer.isBlank() || answer.wordCount() >= minWords) {
            return answer;
        }
        List<String> suggestions = new ArrayList<>(answer.suggestions());
        suggestions.add("Expand your answer to at least " + minWords + " words.");
        return new Answer(answer.questionId(), answer.userAnswer(), answer.wordCount(), answer.timeSpent(), answer.timestamp(),
                answer.evaluationStatus(), answer.score(), answer.keywordMatches(), answer.feedback(), suggestions, answer.revision());
    }

    private void upsert(Answer answer, long addedTime) {
        List<Answer> answers = new ArrayList<>(progress.answers());
        int existing = indexOfAnswer(answers, answer.questionId());
        if (existing >= 0) {
            answers.set(existing, answer);
        } else {
            answers.add(answer);
        }
        progress = PerformanceCalculator.withAnswers(progress, answers, addedTime, clock.instant());
    }

    private void replace(Answer answer) {
        upsert(answer, 0L);
    }

    private int indexOfAnswer(List<Answer> answers, String questionId) {
        for (int i = 0; i < answers.size(); i++) {
            if (answers.get(i).questionId().equals(questionId)) return i;
        }
        return -1;
    }

    private void recordItemStats(String questionId, Answer answer) {
        List<Item> updated = new ArrayList<>(questions);
        for (int i = 0; i < updated.size(); i++) {
            Item item = updated.get(i);
            if (item.id().equals(questionId)) {
                Item withStats = item.withRecordedAttempt(!answer.isBlank(), answer.scoreOrZero(), answer.wordCount(), answer.timeSpent());
                updated.set(i, withStats);
                questions = List.copyOf(updated);
                try {
                    pool.recordItemStats(config.courseId(), withStats);
                } catch (RuntimeException e) {
                    log.warn("Could not write back stats for item {}: {}", questionId, e.getMessage());
                }
                return;
            }
        }
    }

    private Performance computePerformance() {
        return PerformanceCalculator.calculate(progress.answers(), questions, progress.timeSpent(), performance);
    }

    private void awaitEvaluations(List<CompletableFuture<Answer>> pending) {
        try {
            CompletableFuture.allOf(pending.toArray(new CompletableFuture[0]))
                    .get(properties.getEvaluationAwaitTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Ending session {} with {} evaluations still running", id, pending.stream().filter(f -> !f.isDone()).count());
        } catch (ExecutionException e) {
            log.warn("Pending evaluation failed while ending session {}: {}", id, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for evaluations of session {}", id);
        }
    }

    private void persist() {
        if (id.isBlank() || config == null) {
            return;
        }
        SessionSnapshot snapshot = new SessionSnapshot(SessionSnapshot.CURRENT_VERSION, id, contentType, status, config,
                questions, progress, performance, currentDraftAnswer, clock.instant());
        try {
            durableStore.save(id, snapshot);
        } catch (PersistenceException e) {
            log.warn("Snapshot write for session {} failed, continuing in memory: {}", id, e.getMessage());
        }
    }

    private void publish(SessionEvent.Type type, String questionId, EvaluationStatus evaluationStatus) {
        publish(new SessionEvent(type, id, contentType, status, questionId, evaluationStatus,
                progress.currentIndex(), progress.totalQuestions(), clock.instant()));
    }

    private void publish(SessionEvent event) {
        for (SessionEventListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Session listener failed on {}: {}", event.type(), e.getMessage());
            }
        }
    }

    private SessionView view() {
        return new SessionView(id, contentType, status, config, questions, progress, performance, currentItem(),
                currentDraftAnswer, startedAt, error, !inFlight.isEmpty());
    }

    private record PendingEvaluation(long revision, CompletableFuture<Answer> future, boolean countsStats) {}
}
