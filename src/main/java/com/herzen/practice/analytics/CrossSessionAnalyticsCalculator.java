package com.herzen.practice.analytics;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.domain.Statistics;
import com.herzen.practice.manager.ManagerModels.CrossSessionAnalytics;
import com.herzen.practice.manager.ManagerModels.GoalProgress;
import com.herzen.practice.manager.ManagerModels.Goals;
import com.herzen.practice.manager.ManagerModels.LearningPatterns;
import com.herzen.practice.manager.ManagerModels.SessionHistoryEntry;
import com.herzen.practice.manager.ManagerModels.TypeBreakdown;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.DoublePredicate;
import java.util.stream.Collectors;

/**
 * Cross-session analytics, always rebuilt from the full history. History is expected most recent first.
 */
public final class CrossSessionAnalyticsCalculator {
    static final double STRONG_TOPIC = 0.8;
    static final double WEAK_TOPIC = 0.6;
    private static final int MAX_TOPICS = 3;

    private CrossSessionAnalyticsCalculator() {}

    public static CrossSessionAnalytics calculate(List<SessionHistoryEntry> history, int dailyGoal, ZonedDateTime now) {
        if (history.isEmpty()) {
            return CrossSessionAnalytics.initial(dailyGoal);
        }
        ZoneId zone = now.getZone();
        LocalDate today = now.toLocalDate();

        int totalSessions = history.size();
        long totalTimeSpent = history.stream().mapToLong(e -> e.finalStats().totalTime()).sum();
        double averageSessionLength = totalTimeSpent / (double) totalSessions / 60_000.0;

        Map<String, Double> topicMeans = topicMeans(history);
        LearningPatterns patterns = new LearningPatterns(
                mostProductiveHour(history, zone),
                preferredSessionLength(history),
                rankTopics(topicMeans, t -> t >= STRONG_TOPIC, Comparator.reverseOrder()),
                rankTopics(topicMeans, t -> t < WEAK_TOPIC, Comparator.naturalOrder()),
                improvementTrend(history));

        Set<LocalDate> days = completedDays(history, zone);
        Goals goals = new Goals(dailyGoal, currentStreak(days, today), longestStreak(days),
                weeklyProgress(history, dailyGoal, today, zone));

        return new CrossSessionAnalytics(totalSessions, totalTimeSpent, averageSessionLength,
                typeBreakdown(history), patterns, goals);
    }

    static Map<String, TypeBreakdown> typeBreakdown(List<SessionHistoryEntry> history) {
        Map<String, TypeBreakdown> byType = new LinkedHashMap<>();
        for (ContentType type : ContentType.values()) {
            List<SessionHistoryEntry> ofType = history.stream().filter(e -> e.type() == type).toList();
            if (ofType.isEmpty()) {
                byType.put(type.label(), TypeBreakdown.empty());
                continue;
            }
            String preferredDifficulty = ofType.stream()
                    .collect(Collectors.groupingBy(e -> e.config().difficulty().label(), TreeMap::new, Collectors.counting()))
                    .entrySet().stream()
                    .max(Map.Entry.comparingByValue())
                    .map(Map.Entry::getKey)
                    .orElse("mixed");
            byType.put(type.label(), new TypeBreakdown(
                    ofType.size(),
                    ofType.stream().mapToDouble(e -> e.finalStats().accuracy()).average().orElse(0),
                    ofType.stream().mapToDouble(e -> e.finalStats().score() == null ? 0 : e.finalStats().score()).average().orElse(0),
                    ofType.stream().mapToLong(e -> e.finalStats().totalTime()).sum(),
                    preferredDifficulty));
        }
        return byType;
    }

    /** Mode of the start hour; ties go to the earliest hour. */
    static int mostProductiveHour(List<SessionHistoryEntry> history, ZoneId zone) {
        int[] counts = new int[24];
        history.forEach(e -> counts[e.startedAt().atZone(zone).getHour()]++);
        int best = 14;
        int bestCount = 0;
        for (int hour = 0; hour < 24; hour++) {
            if (counts[hour] > bestCount) {
                best = hour;
                bestCount = counts[hour];
            }
        }
        return best;
    }

    static int preferredSessionLength(List<SessionHistoryEntry> history) {
        List<Long> minutes = history.stream()
                .filter(e -> e.completedAt() != null)
                .map(e -> Duration.between(e.startedAt(), e.completedAt()).toMinutes())
                .toList();
        return minutes.isEmpty() ? 20 : (int) Math.round(Statistics.mean(minutes));
    }

    static double improvementTrend(List<SessionHistoryEntry> history) {
        List<Double> chronological = new ArrayList<>();
        for (int i = history.size() - 1; i >= 0; i--) {
            chronological.add(history.get(i).finalStats().accuracy());
        }
        return Statistics.slopeByIndex(chronological);
    }

    static Map<String, Double> topicMeans(List<SessionHistoryEntry> history) {
        return history.stream()
                .flatMap(e -> e.finalStats().topicScores().entrySet().stream())
                .collect(Collectors.groupingBy(Map.Entry::getKey, TreeMap::new,
                        Collectors.averagingDouble(Map.Entry::getValue)));
    }

    private static List<String> rankTopics(Map<String, Double> means,
                                           DoublePredicate keep,
                                           Comparator<Double> order) {
        return means.entrySet().stream()
                .filter(e -> keep.test(e.getValue()))
                .sorted(Map.Entry.<String, Double>comparingByValue(order))
                .limit(MAX_TOPICS)
                .map(Map.Entry::getKey)
                .toList();
    }

    /**
     * The content type whose sessions scored lowest on {@code topic}.
     */
    public static Optional<ContentType> weakestTypeFor(List<SessionHistoryEntry> history, String topic) {
        return history.stream()
                .filter(e -> e.finalStats().topicScores().containsKey(topic))
                .min(Comparator.comparingDouble(e -> e.finalStats().topicScores().get(topic)))
                .map(SessionHistoryEntry::type);
    }

    static Set<LocalDate> completedDays(List<SessionHistoryEntry> history, ZoneId zone) {
        return history.stream()
                .filter(e -> e.status() == SessionStatus.COMPLETED)
                .map(e -> e.startedAt().atZone(zone).toLocalDate())
                .collect(Collectors.toCollection(TreeSet::new));
    }

    /**
     * Consecutive days with a completed session, ending today. A day without sessions only breaks the
     * streak after today, so a streak that ended yesterday still counts.
     */
    static int currentStreak(Set<LocalDate> days, LocalDate today) {
        LocalDate day = days.contains(today) ? today : today.minusDays(1);
        int streak = 0;
        while (days.contains(day)) {
            streak++;
            day = day.minusDays(1);
        }
        return streak;
    }

    /** Runs over distinct calendar days; a second session on the same day neither extends nor breaks a run. */
    static int longestStreak(Set<LocalDate> days) {
        int longest = 0;
        int run = 0;
        LocalDate previous = null;
        for (LocalDate day : new TreeSet<>(days)) {
            run = previous != null && previous.plusDays(1).equals(day) ? run + 1 : 1;
            longest = Math.max(longest, run);
            previous = day;
        }
        return longest;
    }

    /** Completed sessions in the Sunday-to-Saturday week of {@code today} as a percentage of the weekly target, capped at 100. */
    static double weeklyProgress(List<SessionHistoryEntry> history, int dailyGoal, LocalDate today, ZoneId zone) {
        int target = dailyGoal * 7;
        if (target <= 0) return 0;
        LocalDate weekStart = today.minusDays(today.getDayOfWeek().getValue() % 7);
        LocalDate weekEnd = weekStart.plusDays(6);
        long completed = history.stream()
                .filter(e -> e.status() == SessionStatus.COMPLETED)
                .map(e -> e.startedAt().atZone(zone).toLocalDate())
                .filter(d -> !d.isBefore(weekStart) && !d.isAfter(weekEnd))
                .count();
        return Math.min(100.0, completed * 100.0 / target);
    }

    public static GoalProgress goalProgress(List<SessionHistoryEntry> history, int dailyGoal, ZonedDateTime now) {
        LocalDate today = now.toLocalDate();
        int completed = (int) history.stream()
                .filter(e -> e.status() == SessionStatus.COMPLETED)
                .filter(e -> e.startedAt().atZone(now.getZone()).toLocalDate().equals(today))
                .count();
        double percentage = dailyGoal > 0 ? Math.min(100.0, completed * 100.0 / dailyGoal) : 0;
        return new GoalProgress(completed, dailyGoal, percentage);
    }
}
