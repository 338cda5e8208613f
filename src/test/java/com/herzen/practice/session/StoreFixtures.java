package com.herzen.practice.session;

import com.herzen.practice.config.SessionEngineProperties;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Difficulty;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.ItemFilter;
import com.herzen.practice.error.EvaluationException;
import com.herzen.practice.evaluation.EvaluationCapability;
import com.herzen.practice.evaluation.EvaluationModels.EvaluationResult;
import com.herzen.practice.pool.QuestionPoolProvider;
import com.herzen.practice.snapshot.DurableSessionStore;
import com.herzen.practice.snapshot.SessionSnapshot;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.function.ToDoubleFunction;

/**
 * In-memory collaborators for store tests.
 */
final class StoreFixtures {
    static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-10T10:00:00Z"), ZoneOffset.UTC);

    private StoreFixtures() {}

    static Item item(String id, Difficulty difficulty, double averageScore) {
        return new Item(id, "Explain " + id, difficulty, "topic-" + id, "week-1", List.of("latency", "throughput"),
                List.of(), null, 0, 0, averageScore, 0, 0);
    }

    static Item item(String id, String topic, String week, List<String> keywords) {
        return new Item(id, "Explain " + id, Difficulty.MEDIUM, topic, week, keywords, List.of(), null, 0, 0, 0, 0, 0);
    }

    static String words(int n) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < n; i++) {
            sb.append(i == 0 ? "" : " ").append("word").append(i);
        }
        return sb.toString();
    }

    static SessionEngineProperties properties() {
        return new SessionEngineProperties();
    }

    static SessionStore store(InMemoryPool pool, EvaluationCapability evaluator, DurableSessionStore durable,
                              Executor executor, SessionEngineProperties properties) {
        return new SessionStore(ContentType.OPEN_QUESTIONS, pool, evaluator, durable, executor, properties, CLOCK, new Random(7));
    }

    static SessionStore store(InMemoryPool pool, EvaluationCapability evaluator) {
        return store(pool, evaluator, new InMemoryDurableStore(), Runnable::run, properties());
    }

    static class InMemoryPool implements QuestionPoolProvider {
        final List<Item> items;
        final Map<String, Item> recorded = new HashMap<>();

        InMemoryPool(List<Item> items) {
            this.items = items;
        }

        @Override
        public List<Item> fetchItems(ItemFilter filter) {
            return items.stream().filter(i -> ItemSelector.matches(filter, i)).toList();
        }

        @Override
        public void recordItemStats(String courseId, Item item) {
            recorded.put(item.id(), item);
        }
    }

    static class FixedEvaluator implements EvaluationCapability {
        private final ToDoubleFunction<String> scorer;
        int calls;

        FixedEvaluator(ToDoubleFunction<String> scorer) {
            this.scorer = scorer;
        }

        FixedEvaluator(double score) {
            this(text -> score);
        }

        @Override
        public EvaluationResult evaluate(Item item, String answerText) {
            calls++;
            return new EvaluationResult(scorer.applyAsDouble(answerText), List.of("latency"), "scored", List.of());
        }

        @Override
        public String getName() {
            return "fixed";
        }
    }

    static class FailingEvaluator implements EvaluationCapability {
        @Override
        public EvaluationResult evaluate(Item item, String answerText) {
            throw new EvaluationException("scoring backend unavailable");
        }

        @Override
        public String getName() {
            return "failing";
        }
    }

    /** Holds submitted tasks until the test runs them. */
    static class ManualExecutor implements Executor {
        final Deque<Runnable> tasks = new ArrayDeque<>();

        @Override
        public void execute(Runnable command) {
            tasks.add(command);
        }

        void runNext() {
            tasks.removeFirst().run();
        }

        void runAll() {
            while (!tasks.isEmpty()) {
                runNext();
            }
        }
    }

    static class InMemoryDurableStore implements DurableSessionStore {
        final Map<String, SessionSnapshot> snapshots = new HashMap<>();
        final List<String> writes = new ArrayList<>();

        @Override
        public void save(String sessionId, SessionSnapshot snapshot) {
            snapshots.put(sessionId, snapshot);
            writes.add(sessionId);
        }

        @Override
        public Optional<SessionSnapshot> load(String sessionId) {
            return Optional.ofNullable(snapshots.get(sessionId));
        }

        @Override
        public void delete(String sessionId) {
            snapshots.remove(sessionId);
        }
    }
}
