package com.herzen.practice.evaluation;

import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.evaluation.EvaluationModels.EvaluationResult;

/**
 * Scores a submitted answer. Implementations may block for seconds and may throw; the session
 * store runs them off the caller's thread and downgrades failures to the single answer.
 */
public interface EvaluationCapability {

    /**
     * @param item       the item being answered, with its keywords and, for choice items, the correct option
     * @param answerText the learner's answer, never blank
     * @return score in [0, 1] with qualitative feedback
     */
    EvaluationResult evaluate(Item item, String answerText);

    String getName();
}
