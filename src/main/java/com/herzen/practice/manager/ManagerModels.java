package com.herzen.practice.manager;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class ManagerModels {

    public record SessionProgressInfo(int currentIndex, int totalItems, int completionPercentage) {
        public static SessionProgressInfo of(int currentIndex, int totalItems) {
            int percentage = totalItems > 0 ? (int) Math.round(currentIndex * 100.0 / totalItems) : 0;
            return new SessionProgressInfo(currentIndex, totalItems, percentage);
        }
    }

    public record ActiveSessionInfo(String id,
                                    ContentType type,
                                    Instant startedAt,
                                    Instant lastActivityAt,
                                    SessionStatus status,
                                    SessionConfig config,
                                    SessionProgressInfo progress) {
        public ActiveSessionInfo withStatus(SessionStatus newStatus, Instant now) {
            return new ActiveSessionInfo(id, type, startedAt, now, newStatus, config, progress);
        }

        public ActiveSessionInfo withProgress(SessionProgressInfo newProgress, Instant now) {
            return new ActiveSessionInfo(id, type, startedAt, now, status, config, newProgress);
        }
    }

    /**
     * Outcome of a finished session.
     *
     * @param totalTime   milliseconds
     * @param accuracy    0-100
     * @param score       0-1 when the session produced scored answers
     * @param topicScores mean score per topic, may be empty
     */
    public record FinalStats(long totalTime,
                             int itemsCompleted,
                             double accuracy,
                             Double score,
                             Map<String, Double> topicScores) {
        public FinalStats {
            topicScores = topicScores == null ? Map.of() : Map.copyOf(topicScores);
        }

        public static FinalStats partial(long totalTime, int itemsCompleted) {
            return new FinalStats(totalTime, itemsCompleted, 0, null, Map.of());
        }
    }

    public record HistoryPerformance(List<String> strengths, List<String> weaknesses, List<String> recommendations) {
        public HistoryPerformance {
            strengths = strengths == null ? List.of() : List.copyOf(strengths);
            weaknesses = weaknesses == null ? List.of() : List.copyOf(weaknesses);
            recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        }
    }

    public record SessionHistoryEntry(String id,
                                      ContentType type,
                                      String courseId,
                                      Instant startedAt,
                                      Instant completedAt,
                                      SessionStatus status,
                                      SessionConfig config,
                                      FinalStats finalStats,
                                      HistoryPerformance performance) {}

    /** Both ends of the date range are inclusive; any null part matches everything. */
    public record HistoryFilter(ContentType type, Instant start, Instant end) {
        public boolean matches(SessionHistoryEntry entry) {
            if (type != null && entry.type() != type) return false;
            if (start != null && entry.startedAt().isBefore(start)) return false;
            return end == null || !entry.startedAt().isAfter(end);
        }
    }

    public record TypeBreakdown(int count, double averageAccuracy, double averageScore, long totalTime, String preferredDifficulty) {
        public static TypeBreakdown empty() {
            return new TypeBreakdown(0, 0, 0, 0, "mixed");
        }
    }

    public record LearningPatterns(int mostProductiveTimeOfDay,
                                   int preferredSessionLength,
                                   List<String> strongestTopics,
                                   List<String> weakestTopics,
                                   double improvementTrend) {}

    public record Goals(int dailySessionTarget, int currentStreak, int longestStreak, double weeklyProgress) {}

    public record CrossSessionAnalytics(int totalSessions,
                                        long totalTimeSpent,
                                        double averageSessionLength,
                                        Map<String, TypeBreakdown> sessionTypeBreakdown,
                                        LearningPatterns learningPatterns,
                                        Goals goals) {
        public static CrossSessionAnalytics initial(int dailyGoal) {
            Map<String, TypeBreakdown> byType = new LinkedHashMap<>();
            Arrays.stream(ContentType.values()).forEach(t -> byType.put(t.label(), TypeBreakdown.empty()));
            return new CrossSessionAnalytics(0, 0, 0, byType,
                    new LearningPatterns(14, 20, List.of(), List.of(), 0),
                    new Goals(dailyGoal, 0, 0, 0));
        }
    }

    public enum Priority {
        LOW, MEDIUM, HIGH;

        @JsonValue
        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Priority fromLabel(String raw) {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        }
    }

    public record Recommendation(ContentType type,
                                 String reason,
                                 SessionConfig config,
                                 int estimatedDuration,
                                 Priority priority,
                                 List<String> benefits) {}

    public record ReminderSettings(Boolean enabled, Integer dailyGoal, List<String> reminderTimes) {
        ReminderSettings mergedWith(ReminderSettings patch) {
            if (patch == null) return this;
            return new ReminderSettings(
                    patch.enabled() != null ? patch.enabled() : enabled,
                    patch.dailyGoal() != null ? patch.dailyGoal() : dailyGoal,
                    patch.reminderTimes() != null ? List.copyOf(patch.reminderTimes()) : reminderTimes);
        }
    }

    /**
     * User preferences. When used as an update, null fields keep their current value.
     */
    public record Preferences(Integer defaultSessionLength,
                              List<ContentType> preferredSessionTypes,
                              Integer autoSaveInterval,
                              ReminderSettings reminderSettings) {
        public static Preferences defaults(int dailyGoal) {
            return new Preferences(20, List.of(ContentType.values()), 5,
                    new ReminderSettings(false, dailyGoal, List.of("09:00", "18:00")));
        }

        public Preferences mergedWith(Preferences patch) {
            if (patch == null) return this;
            return new Preferences(
                    patch.defaultSessionLength() != null ? patch.defaultSessionLength() : defaultSessionLength,
                    patch.preferredSessionTypes() != null ? List.copyOf(patch.preferredSessionTypes()) : preferredSessionTypes,
                    patch.autoSaveInterval() != null ? patch.autoSaveInterval() : autoSaveInterval,
                    reminderSettings.mergedWith(patch.reminderSettings()));
        }

        public int dailyGoal() {
            return reminderSettings.dailyGoal() == null ? 1 : reminderSettings.dailyGoal();
        }
    }

    public record GoalProgress(int completed, int target, double percentage) {}
}
