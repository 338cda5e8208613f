package com.herzen.practice.evaluation;

import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.TextMetrics;
import com.herzen.practice.evaluation.EvaluationModels.EvaluationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Keyword and length heuristic for free-form answers, exact match for choice items.
 */
@Component
public class KeywordHeuristicEvaluator implements EvaluationCapability {
    private static final int GOOD_LENGTH_WORDS = 50;

    @Override
    public EvaluationResult evaluate(Item item, String answerText) {
        if (item.isChoice()) {
            return evaluateChoice(item, answerText);
        }

        List<String> answerTokens = TextMetrics.tokens(answerText);
        List<String> matches = item.keywords().stream()
                .filter(k -> answerTokens.stream().anyMatch(w -> w.contains(k.toLowerCase(Locale.ROOT))))
                .toList();

        double keywordScore = matches.size() / (double) Math.max(1, item.keywords().size());
        double lengthScore = Math.min(TextMetrics.wordCount(answerText) / (double) GOOD_LENGTH_WORDS, 1.0);
        double score = Math.min(keywordScore * 0.7 + lengthScore * 0.3, 1.0);

        List<String> suggestions = new ArrayList<>();
        if (keywordScore < 0.5 && !item.keywords().isEmpty()) {
            suggestions.add("Consider discussing: " + String.join(", ", item.keywords().stream().limit(3).toList()));
        }
        if (lengthScore < 0.5) {
            suggestions.add("Provide a more detailed explanation with examples.");
        }
        return new EvaluationResult(score, matches, feedbackFor(score), suggestions);
    }

    @Override
    public String getName() {
        return "keyword-heuristic";
    }

    private EvaluationResult evaluateChoice(Item item, String answerText) {
        boolean correct = item.correctAnswer().trim().equalsIgnoreCase(answerText.trim());
        if (correct) {
            return new EvaluationResult(1.0, List.of(), "Correct.", List.of());
        }
        return new EvaluationResult(0.0, List.of(), "Incorrect. The correct answer is: " + item.correctAnswer(),
                List.of("Review the material on " + (item.topic() == null ? "this topic" : item.topic()) + "."));
    }

    private String feedbackFor(double score) {
        if (score > 0.8) return "Excellent answer! You covered the key concepts well.";
        if (score > 0.6) return "Good answer, but could be more comprehensive.";
        if (score > 0.4) return "Your answer addresses some points but misses key concepts.";
        return "This answer needs significant improvement to address the question properly.";
    }
}
