package com.herzen.practice.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Difficulty;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.pool.PoolModels.StoredItem;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class QuestionPoolJdbcRepository {
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public QuestionPoolJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void upsertItem(StoredItem stored) {
        Item i = stored.item();
        jdbcTemplate.update(
                "MERGE INTO question_items(course_id, item_id, content_type, content, sample_answer, difficulty, topic, week, source, keywords, options, correct_answer, times_seen, times_answered, average_score, average_word_count, average_response_time) KEY(course_id, item_id) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)",
                stored.courseId(), i.id(), stored.contentType().name(), i.content(), stored.sampleAnswer(),
                i.difficulty().name(), i.topic(), i.week(), stored.source(),
                toJson(i.keywords()), toJson(i.options()), i.correctAnswer(),
                i.timesSeen(), i.timesAnswered(), i.averageScore(), i.averageWordCount(), i.averageResponseTime());
    }

    public List<Item> loadItems(String courseId, ContentType contentType) {
        return jdbcTemplate.query(
                "SELECT item_id, content, difficulty, topic, week, keywords, options, correct_answer, times_seen, times_answered, average_score, average_word_count, average_response_time FROM question_items " +
                        "WHERE course_id = ? AND content_type = ? ORDER BY item_id",
                (rs, n) -> new Item(
                        rs.getString(1), rs.getString(2), Difficulty.valueOf(rs.getString(3)), rs.getString(4), rs.getString(5),
                        fromJson(rs.getString(6)), fromJson(rs.getString(7)), rs.getString(8),
                        rs.getInt(9), rs.getInt(10), rs.getDouble(11), rs.getDouble(12), rs.getDouble(13)),
                courseId, contentType.name());
    }

    public void updateStats(String courseId, Item item) {
        jdbcTemplate.update(
                "UPDATE question_items SET times_seen = ?, times_answered = ?, average_score = ?, average_word_count = ?, average_response_time = ? WHERE course_id = ? AND item_id = ?",
                item.timesSeen(), item.timesAnswered(), item.averageScore(), item.averageWordCount(), item.averageResponseTime(),
                courseId, item.id());
    }

    public void deleteCourse(String courseId) {
        jdbcTemplate.update("DELETE FROM question_items WHERE course_id = ?", courseId);
    }

    private String toJson(List<String> values) {
        try {
            return objectMapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize item list column", e);
        }
    }

    private List<String> fromJson(String value) {
        if (value == null || value.isBlank()) return List.of();
        try {
            return objectMapper.readValue(value, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt item list column: " + value, e);
        }
    }
}
