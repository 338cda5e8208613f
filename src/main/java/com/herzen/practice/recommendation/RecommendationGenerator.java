package com.herzen.practice.recommendation;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.DifficultyFilter;
import com.herzen.practice.domain.DomainModels.FocusStrategy;
import com.herzen.practice.domain.DomainModels.PracticeMode;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.manager.ManagerModels.CrossSessionAnalytics;
import com.herzen.practice.manager.ManagerModels.Priority;
import com.herzen.practice.manager.ManagerModels.Recommendation;
import com.herzen.practice.manager.ManagerModels.TypeBreakdown;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Rule-based next-session suggestions. Rules fire in a fixed order and only the first three results are kept.
 */
public final class RecommendationGenerator {
    static final int MAX_RECOMMENDATIONS = 3;
    static final int PRODUCTIVE_WINDOW_HOURS = 2;

    private RecommendationGenerator() {}

    /**
     * @param courseId        course the suggested configs target
     * @param weakestTopicType content type in which the weakest topic scored lowest, or null
     * @param currentHour     local hour of day, 0-23
     */
    public static List<Recommendation> generate(CrossSessionAnalytics analytics,
                                                String courseId,
                                                ContentType weakestTopicType,
                                                int currentHour) {
        List<Recommendation> out = new ArrayList<>();

        List<String> weakest = analytics.learningPatterns().weakestTopics();
        if (!weakest.isEmpty()) {
            String topic = weakest.get(0);
            out.add(new Recommendation(
                    weakestTopicType == null ? ContentType.MULTIPLE_CHOICE : weakestTopicType,
                    "Focus on " + topic + " where you need improvement",
                    SessionConfig.preset(courseId, DifficultyFilter.MEDIUM, FocusStrategy.WEAK_AREAS, PracticeMode.PRACTICE),
                    15, Priority.HIGH,
                    List.of("Improve understanding", "Build confidence", "Fill knowledge gaps")));
        }

        Map<String, TypeBreakdown> breakdown = analytics.sessionTypeBreakdown();
        int total = breakdown.values().stream().mapToInt(TypeBreakdown::count).sum();
        if (total > 0) {
            if (share(breakdown, ContentType.CUECARDS, total) < 0.3) {
                out.add(new Recommendation(ContentType.CUECARDS,
                        "Practice vocabulary and key concepts with cue cards",
                        SessionConfig.preset(courseId, DifficultyFilter.MIXED, FocusStrategy.TAILORED_FOR_ME, PracticeMode.PRACTICE),
                        10, Priority.MEDIUM,
                        List.of("Improve memory retention", "Quick review", "Strengthen fundamentals")));
            }
            if (share(breakdown, ContentType.MULTIPLE_CHOICE, total) < 0.3) {
                out.add(new Recommendation(ContentType.MULTIPLE_CHOICE,
                        "Test your knowledge with multiple choice questions",
                        SessionConfig.preset(courseId, DifficultyFilter.MEDIUM, FocusStrategy.COMPREHENSIVE, PracticeMode.EXAM),
                        15, Priority.MEDIUM,
                        List.of("Identify knowledge gaps", "Practice for exams", "Quick feedback")));
            }
            if (share(breakdown, ContentType.OPEN_QUESTIONS, total) < 0.2) {
                out.add(new Recommendation(ContentType.OPEN_QUESTIONS,
                        "Develop deeper understanding through written explanations",
                        SessionConfig.preset(courseId, DifficultyFilter.MEDIUM, FocusStrategy.COMPREHENSIVE, PracticeMode.PRACTICE),
                        25, Priority.MEDIUM,
                        List.of("Improve critical thinking", "Practice explanation skills", "Deepen understanding")));
            }
        }

        if (hourDistance(currentHour, analytics.learningPatterns().mostProductiveTimeOfDay()) <= PRODUCTIVE_WINDOW_HOURS) {
            out.add(new Recommendation(ContentType.MULTIPLE_CHOICE,
                    "This is your most productive time - tackle challenging questions",
                    SessionConfig.preset(courseId, DifficultyFilter.HARD, FocusStrategy.COMPREHENSIVE, PracticeMode.PRACTICE),
                    20, Priority.HIGH,
                    List.of("Maximize learning efficiency", "Challenge yourself", "Build expertise")));
        }

        return out.size() > MAX_RECOMMENDATIONS ? List.copyOf(out.subList(0, MAX_RECOMMENDATIONS)) : List.copyOf(out);
    }

    private static double share(Map<String, TypeBreakdown> breakdown, ContentType type, int total) {
        TypeBreakdown row = breakdown.get(type.label());
        return row == null ? 0 : row.count() / (double) total;
    }

    /** Distance on the 24-hour clock, so 23 and 1 are two hours apart. */
    static int hourDistance(int a, int b) {
        int d = Math.abs(a - b) % 24;
        return Math.min(d, 24 - d);
    }
}
