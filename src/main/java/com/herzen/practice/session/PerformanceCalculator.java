package com.herzen.practice.session;

import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.Statistics;
import com.herzen.practice.domain.TextMetrics;
import com.herzen.practice.session.SessionModels.Answer;
import com.herzen.practice.session.SessionModels.DifficultyStats;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.Progress;
import com.herzen.practice.session.SessionModels.TopicStats;
import com.herzen.practice.session.SessionModels.WritingMetrics;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Pure aggregation over a session's answers. Nothing here touches session state.
 */
public final class PerformanceCalculator {

    private PerformanceCalculator() {}

    /**
     * Recomputes answered/skipped counts and averages from the full answer list.
     */
    public static Progress withAnswers(Progress progress, List<Answer> answers, long addedTime, Instant now) {
        int answered = (int) answers.stream().filter(a -> !a.isBlank()).count();
        int skipped = answers.size() - answered;
        long timeSpent = progress.timeSpent() + addedTime;
        double totalWords = answers.stream().mapToDouble(Answer::wordCount).sum();
        double totalScore = answers.stream().mapToDouble(Answer::scoreOrZero).sum();

        return new Progress(progress.currentIndex(), progress.totalQuestions(), answered, skipped, timeSpent,
                progress.startedAt(), now,
                answered > 0 ? (double) timeSpent / answered : 0.0,
                answered > 0 ? totalWords / answered : 0.0,
                answered > 0 ? totalScore / answered : 0.0,
                answers, progress.flaggedQuestions(), progress.remainingTime());
    }

    /**
     * Final or interim performance. Only answers with text count; with none, {@code prior} is returned as is.
     */
    public static Performance calculate(List<Answer> allAnswers, List<Item> questions, long totalTimeSpent, Performance prior) {
        List<Answer> answers = allAnswers.stream().filter(a -> !a.isBlank()).toList();
        if (answers.isEmpty()) {
            return prior;
        }
        Map<String, Item> byId = questions.stream().collect(Collectors.toMap(Item::id, Function.identity(), (a, b) -> a));

        List<Double> scores = answers.stream().map(Answer::scoreOrZero).toList();
        List<Integer> wordCounts = answers.stream().map(Answer::wordCount).toList();
        double overallScore = Statistics.mean(scores);
        double averageResponseTime = Statistics.mean(answers.stream().map(Answer::timeSpent).toList());
        double averageWordCount = Statistics.mean(wordCounts);

        double totalMinutes = totalTimeSpent / 60_000.0;
        double timeEfficiency = totalMinutes > 0 ? answers.size() / totalMinutes : 0.0;
        double consistency = Math.max(0.0, Math.min(1.0, 1 - Math.sqrt(Statistics.variance(scores))));

        return new Performance(overallScore, averageResponseTime, averageWordCount,
                Statistics.slopeByIndex(wordCounts), Statistics.slopeByIndex(scores),
                difficultyBreakdown(answers, byId), topicBreakdown(answers, byId),
                writingMetrics(answers, questions, overallScore), timeEfficiency, consistency);
    }

    private static Map<String, DifficultyStats> difficultyBreakdown(List<Answer> answers, Map<String, Item> byId) {
        Map<String, DifficultyStats> result = new LinkedHashMap<>(Performance.empty().difficultyBreakdown());
        answers.stream()
                .filter(a -> byId.containsKey(a.questionId()))
                .collect(Collectors.groupingBy(a -> byId.get(a.questionId()).difficulty().label()))
                .forEach((difficulty, group) -> result.put(difficulty, new DifficultyStats(
                        group.size(),
                        group.stream().mapToDouble(Answer::scoreOrZero).average().orElse(0.0),
                        group.stream().mapToDouble(Answer::wordCount).average().orElse(0.0))));
        return result;
    }

    private static Map<String, TopicStats> topicBreakdown(List<Answer> answers, Map<String, Item> byId) {
        Map<String, List<Answer>> byTopic = answers.stream()
                .filter(a -> Optional.ofNullable(byId.get(a.questionId())).map(Item::topic).isPresent())
                .collect(Collectors.groupingBy(a -> byId.get(a.questionId()).topic(), LinkedHashMap::new, Collectors.toList()));

        Map<String, TopicStats> result = new LinkedHashMap<>();
        byTopic.forEach((topic, group) -> {
            Set<String> strengths = new LinkedHashSet<>();
            group.forEach(a -> strengths.addAll(a.keywordMatches()));

            Set<String> missed = new LinkedHashSet<>();
            group.forEach(a -> byId.get(a.questionId()).keywords().stream()
                    .filter(k -> !strengths.contains(k))
                    .forEach(missed::add));

            result.put(topic, new TopicStats(group.size(),
                    group.stream().mapToDouble(Answer::scoreOrZero).average().orElse(0.0),
                    new ArrayList<>(strengths), new ArrayList<>(missed)));
        });
        return result;
    }

    private static WritingMetrics writingMetrics(List<Answer> answers, List<Item> questions, double overallScore) {
        String allText = answers.stream().map(Answer::userAnswer).collect(Collectors.joining(" "));
        List<String> words = TextMetrics.tokens(allText);
        double vocabularyDiversity = words.isEmpty() ? 0.0 : new HashSet<>(words).size() / (double) words.size();

        long sentences = TextMetrics.sentenceCount(allText);
        double averageSentenceLength = sentences > 0 ? words.size() / (double) sentences : 0.0;

        List<String> allKeywords = questions.stream()
                .flatMap(q -> q.keywords().stream())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        Set<String> keywordSet = new HashSet<>(allKeywords);
        long usedKeywords = words.stream().filter(keywordSet::contains).count();
        double keywordUsage = allKeywords.isEmpty() ? 0.0 : usedKeywords / (double) allKeywords.size();

        return new WritingMetrics(vocabularyDiversity, averageSentenceLength, keywordUsage, overallScore);
    }
}
