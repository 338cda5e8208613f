package com.herzen.practice.pool;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Difficulty;
import com.herzen.practice.domain.DomainModels.Item;

import java.util.List;

public class PoolModels {
    public record ItemDraft(String id,
                            String content,
                            String sampleAnswer,
                            Difficulty difficulty,
                            String source,
                            String week,
                            String topic,
                            List<String> keywords,
                            List<String> options,
                            String correctAnswer) {}

    public record StoredItem(String courseId,
                             ContentType contentType,
                             String sampleAnswer,
                             String source,
                             Item item) {}

    public record RegistrationResult(String courseId, ContentType contentType, int registered, List<String> rejected) {}
}
