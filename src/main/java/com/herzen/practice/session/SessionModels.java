package com.herzen.practice.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Difficulty;
import com.herzen.practice.domain.DomainModels.EvaluationStatus;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.evaluation.EvaluationModels.EvaluationResult;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class SessionModels {

    public static final String EVALUATION_FAILED_FEEDBACK = "Evaluation failed - please try again";
    public static final String EVALUATION_INTERRUPTED_FEEDBACK = "Evaluation was interrupted - please resubmit";

    public record Answer(String questionId,
                         String userAnswer,
                         int wordCount,
                         long timeSpent,
                         Instant timestamp,
                         EvaluationStatus evaluationStatus,
                         Double score,
                         List<String> keywordMatches,
                         String feedback,
                         List<String> suggestions,
                         long revision) {
        public Answer {
            userAnswer = userAnswer == null ? "" : userAnswer;
            keywordMatches = keywordMatches == null ? List.of() : List.copyOf(keywordMatches);
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }

        @JsonIgnore
        public boolean isBlank() {
            return userAnswer.isBlank();
        }

        public double scoreOrZero() {
            return score == null ? 0.0 : score;
        }

        public Answer evaluating() {
            return withStatus(EvaluationStatus.EVALUATING, score, keywordMatches, feedback, suggestions);
        }

        public Answer evaluated(EvaluationResult result) {
            return withStatus(EvaluationStatus.COMPLETED, result.score(), result.keywordMatches(), result.feedback(), result.suggestions());
        }

        public Answer failed(String fallbackFeedback) {
            return withStatus(EvaluationStatus.FAILED, null, List.of(), fallbackFeedback, List.of());
        }

        private Answer withStatus(EvaluationStatus status, Double newScore, List<String> matches, String newFeedback, List<String> newSuggestions) {
            return new Answer(questionId, userAnswer, wordCount, timeSpent, timestamp, status, newScore, matches, newFeedback, newSuggestions, revision);
        }
    }

    public record Progress(int currentIndex,
                           int totalQuestions,
                           int answeredCount,
                           int skippedCount,
                           long timeSpent,
                           Instant startedAt,
                           Instant lastUpdated,
                           double averageTimePerQuestion,
                           double averageWordCount,
                           double averageScore,
                           List<Answer> answers,
                           Set<String> flaggedQuestions,
                           Long remainingTime) {
        public Progress {
            answers = answers == null ? List.of() : List.copyOf(answers);
            flaggedQuestions = flaggedQuestions == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(flaggedQuestions));
        }

        public static Progress initial(int totalQuestions, Instant now, Long remainingTime) {
            return new Progress(0, totalQuestions, 0, 0, 0L, now, now, 0.0, 0.0, 0.0, List.of(), Set.of(), remainingTime);
        }

        public Progress atIndex(int index, Instant now) {
            return new Progress(index, totalQuestions, answeredCount, skippedCount, timeSpent, startedAt, now,
                    averageTimePerQuestion, averageWordCount, averageScore, answers, flaggedQuestions, remainingTime);
        }

        public Progress withFlags(Set<String> flags, Instant now) {
            return new Progress(currentIndex, totalQuestions, answeredCount, skippedCount, timeSpent, startedAt, now,
                    averageTimePerQuestion, averageWordCount, averageScore, answers, flags, remainingTime);
        }

        public Progress touched(Instant now) {
            return atIndex(currentIndex, now);
        }
    }

    public record DifficultyStats(int attempted, double averageScore, double averageWordCount) {}

    public record TopicStats(int attempted, double averageScore, List<String> keyStrengths, List<String> improvementAreas) {}

    public record WritingMetrics(double vocabularyDiversity, double averageSentenceLength, double keywordUsage, double clarity) {
        public static WritingMetrics empty() {
            return new WritingMetrics(0, 0, 0, 0);
        }
    }

    public record Performance(double overallScore,
                              double averageResponseTime,
                              double averageWordCount,
                              double wordCountTrend,
                              double scoreTrend,
                              Map<String, DifficultyStats> difficultyBreakdown,
                              Map<String, TopicStats> topicBreakdown,
                              WritingMetrics writingMetrics,
                              double timeEfficiency,
                              double consistencyScore) {

        public static Performance empty() {
            Map<String, DifficultyStats> byDifficulty = new LinkedHashMap<>();
            Arrays.stream(Difficulty.values()).forEach(d -> byDifficulty.put(d.label(), new DifficultyStats(0, 0, 0)));
            return new Performance(0, 0, 0, 0, 0, byDifficulty, Map.of(), WritingMetrics.empty(), 0, 0);
        }
    }

    public record SessionStats(long totalTime,
                               int questionsAnswered,
                               double averageScore,
                               int questionsRemaining,
                               double averageWordCount) {}

    public record SessionView(String id,
                              ContentType contentType,
                              SessionStatus status,
                              SessionConfig config,
                              List<Item> questions,
                              Progress progress,
                              Performance performance,
                              Item currentItem,
                              String currentDraftAnswer,
                              Instant startedAt,
                              String error,
                              boolean evaluating) {}
}
