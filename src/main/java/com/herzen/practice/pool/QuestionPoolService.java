package com.herzen.practice.pool;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.ItemFilter;
import com.herzen.practice.domain.TextMetrics;
import com.herzen.practice.error.SessionValidationException;
import com.herzen.practice.pool.PoolModels.ItemDraft;
import com.herzen.practice.pool.PoolModels.RegistrationResult;
import com.herzen.practice.pool.PoolModels.StoredItem;
import com.herzen.practice.repository.QuestionPoolJdbcRepository;
import com.herzen.practice.session.ItemSelector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Slf4j
@Service
public class QuestionPoolService implements QuestionPoolProvider {
    private static final int MAX_KEYWORDS = 10;
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "be", "been", "have", "has", "had", "do", "does", "did",
            "will", "would", "could", "should", "may", "might", "can", "that", "this", "these",
            "those", "they", "them", "their", "it", "its", "there", "which", "where", "about");

    private final QuestionPoolJdbcRepository repository;

    public QuestionPoolService(QuestionPoolJdbcRepository repository) {
        this.repository = repository;
    }

    public RegistrationResult registerItems(String courseId, ContentType contentType, List<ItemDraft> drafts) {
        if (courseId == null || courseId.isBlank()) {
            throw new SessionValidationException("courseId is required to register items");
        }
        if (contentType == null) {
            throw new SessionValidationException("contentType is required to register items");
        }
        List<String> rejected = new ArrayList<>();
        int registered = 0;
        for (ItemDraft draft : drafts == null ? List.<ItemDraft>of() : drafts) {
            if (draft == null || draft.id() == null || draft.id().isBlank() || TextMetrics.isBlank(draft.content())) {
                rejected.add(draft == null || draft.id() == null ? "<missing id>" : draft.id());
                continue;
            }
            Item item = new Item(draft.id(), draft.content(), draft.difficulty(),
                    draft.topic() == null || draft.topic().isBlank() ? topicFromSource(draft.source()) : draft.topic(),
                    draft.week(),
                    draft.keywords() == null || draft.keywords().isEmpty() ? extractKeywords(draft.sampleAnswer()) : draft.keywords(),
                    draft.options(), draft.correctAnswer(),
                    0, 0, 0.0, 0.0, 0.0);
            repository.upsertItem(new StoredItem(courseId, contentType, draft.sampleAnswer(), draft.source(), item));
            registered++;
        }
        log.info("Registered {} {} items for course {} ({} rejected)", registered, contentType.label(), courseId, rejected.size());
        return new RegistrationResult(courseId, contentType, registered, rejected);
    }

    @Override
    public List<Item> fetchItems(ItemFilter filter) {
        return repository.loadItems(filter.courseId(), filter.contentType()).stream()
                .filter(item -> ItemSelector.matches(filter, item))
                .toList();
    }

    @Override
    public void recordItemStats(String courseId, Item item) {
        repository.updateStats(courseId, item);
    }

    public void removeCourse(String courseId) {
        repository.deleteCourse(courseId);
        log.info("Removed question pool of course {}", courseId);
    }

    static String topicFromSource(String source) {
        if (source == null || source.isBlank()) return null;
        String fileName = source.substring(source.lastIndexOf('/') + 1);
        return fileName.replace(".pdf", "").replaceAll("[-_]", " ");
    }

    static List<String> extractKeywords(String sampleAnswer) {
        return TextMetrics.tokens(sampleAnswer).stream()
                .filter(w -> w.length() > 4 && !STOP_WORDS.contains(w))
                .limit(MAX_KEYWORDS)
                .toList();
    }
}
