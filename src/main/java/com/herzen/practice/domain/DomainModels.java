package com.herzen.practice.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

public class DomainModels {

    public interface Labeled {
        String label();
    }

    static <E extends Enum<E> & Labeled> E parse(E[] values, String raw, E fallback) {
        if (raw == null || raw.isBlank()) return fallback;
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return Arrays.stream(values)
                .filter(v -> v.label().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown value: " + raw));
    }

    public enum ContentType implements Labeled {
        CUECARDS("cuecards"),
        MULTIPLE_CHOICE("multiple-choice"),
        OPEN_QUESTIONS("open-questions");

        private final String label;

        ContentType(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static ContentType fromLabel(String raw) {
            return parse(values(), raw, null);
        }
    }

    public enum Difficulty implements Labeled {
        EASY("easy", 1), MEDIUM("medium", 2), HARD("hard", 3);

        private final String label;
        private final int weight;

        Difficulty(String label, int weight) {
            this.label = label;
            this.weight = weight;
        }

        @JsonValue
        public String label() {
            return label;
        }

        public int weight() {
            return weight;
        }

        @JsonCreator
        public static Difficulty fromLabel(String raw) {
            return parse(values(), raw, MEDIUM);
        }
    }

    public enum DifficultyFilter implements Labeled {
        EASY("easy"), MEDIUM("medium"), HARD("hard"), MIXED("mixed");

        private final String label;

        DifficultyFilter(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        public boolean accepts(Difficulty difficulty) {
            return this == MIXED || label.equals(difficulty.label());
        }

        @JsonCreator
        public static DifficultyFilter fromLabel(String raw) {
            return parse(values(), raw, MIXED);
        }
    }

    public enum FocusStrategy implements Labeled {
        TAILORED_FOR_ME("tailored-for-me"),
        WEAK_AREAS("weak-areas"),
        RECENT_CONTENT("recent-content"),
        COMPREHENSIVE("comprehensive");

        private final String label;

        FocusStrategy(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static FocusStrategy fromLabel(String raw) {
            return parse(values(), raw, COMPREHENSIVE);
        }
    }

    public enum PracticeMode implements Labeled {
        PRACTICE("practice"), EXAM("exam");

        private final String label;

        PracticeMode(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static PracticeMode fromLabel(String raw) {
            return parse(values(), raw, PRACTICE);
        }
    }

    public enum SessionStatus implements Labeled {
        IDLE("idle"), ACTIVE("active"), PAUSED("paused"), COMPLETED("completed"), FAILED("failed");

        private final String label;

        SessionStatus(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static SessionStatus fromLabel(String raw) {
            return parse(values(), raw, IDLE);
        }
    }

    public enum EvaluationStatus implements Labeled {
        PENDING("pending"), EVALUATING("evaluating"), COMPLETED("completed"), FAILED("failed");

        private final String label;

        EvaluationStatus(String label) {
            this.label = label;
        }

        @JsonValue
        public String label() {
            return label;
        }

        @JsonCreator
        public static EvaluationStatus fromLabel(String raw) {
            return parse(values(), raw, PENDING);
        }
    }

    public record SessionConfig(String courseId,
                                List<String> weeks,
                                int numQuestions,
                                DifficultyFilter difficulty,
                                FocusStrategy focus,
                                PracticeMode practiceMode,
                                Integer timeLimit,
                                Integer requireMinWords,
                                boolean enableAiEvaluation) {
        public SessionConfig {
            weeks = weeks == null ? List.of() : List.copyOf(weeks);
            difficulty = difficulty == null ? DifficultyFilter.MIXED : difficulty;
            focus = focus == null ? FocusStrategy.COMPREHENSIVE : focus;
            practiceMode = practiceMode == null ? PracticeMode.PRACTICE : practiceMode;
        }

        public static SessionConfig defaults(String courseId) {
            return new SessionConfig(courseId, List.of(), 5, DifficultyFilter.MIXED, FocusStrategy.COMPREHENSIVE,
                    PracticeMode.PRACTICE, null, 50, true);
        }

        public static SessionConfig preset(String courseId, DifficultyFilter difficulty, FocusStrategy focus, PracticeMode mode) {
            return new SessionConfig(courseId, List.of(), 5, difficulty, focus, mode, null, 50, true);
        }

        public SessionConfig withFocus(FocusStrategy newFocus) {
            return new SessionConfig(courseId, weeks, numQuestions, difficulty, newFocus, practiceMode,
                    timeLimit, requireMinWords, enableAiEvaluation);
        }
    }

    public record ItemFilter(String courseId, ContentType contentType, List<String> weeks, DifficultyFilter difficulty) {
        public ItemFilter {
            weeks = weeks == null ? List.of() : List.copyOf(weeks);
            difficulty = difficulty == null ? DifficultyFilter.MIXED : difficulty;
        }

        public static ItemFilter of(ContentType type, SessionConfig config) {
            return new ItemFilter(config.courseId(), type, config.weeks(), config.difficulty());
        }

        public boolean allWeeks() {
            return weeks.isEmpty() || weeks.contains("all-weeks");
        }
    }

    public record Item(String id,
                       String content,
                       Difficulty difficulty,
                       String topic,
                       String week,
                       List<String> keywords,
                       List<String> options,
                       String correctAnswer,
                       int timesSeen,
                       int timesAnswered,
                       double averageScore,
                       double averageWordCount,
                       double averageResponseTime) {
        public Item {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            options = options == null ? List.of() : List.copyOf(options);
            week = week == null ? "" : week;
            difficulty = difficulty == null ? Difficulty.MEDIUM : difficulty;
        }

        @JsonIgnore
        public boolean isChoice() {
            return correctAnswer != null && !options.isEmpty();
        }

        /**
         * Applies one submission to the running statistics. Skipped submissions only count as seen.
         */
        public Item withRecordedAttempt(boolean answered, double score, int wordCount, long timeSpent) {
            if (!answered) {
                return new Item(id, content, difficulty, topic, week, keywords, options, correctAnswer,
                        timesSeen + 1, timesAnswered, averageScore, averageWordCount, averageResponseTime);
            }
            int n = timesAnswered;
            return new Item(id, content, difficulty, topic, week, keywords, options, correctAnswer,
                    timesSeen + 1, n + 1,
                    runningMean(averageScore, n, score),
                    runningMean(averageWordCount, n, wordCount),
                    runningMean(averageResponseTime, n, timeSpent));
        }

        static double runningMean(double oldAverage, int n, double value) {
            return (oldAverage * n + value) / (n + 1);
        }
    }
}
