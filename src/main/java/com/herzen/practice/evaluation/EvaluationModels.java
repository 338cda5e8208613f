package com.herzen.practice.evaluation;

import java.util.List;

public class EvaluationModels {
    public record EvaluationResult(double score,
                                   List<String> keywordMatches,
                                   String feedback,
                                   List<String> suggestions) {
        public EvaluationResult {
            score = Math.max(0.0, Math.min(1.0, score));
            keywordMatches = keywordMatches == null ? List.of() : List.copyOf(keywordMatches);
            suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        }
    }
}
