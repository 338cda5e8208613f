package com.herzen.practice.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.manager.ManagerModels.FinalStats;
import com.herzen.practice.manager.ManagerModels.HistoryPerformance;
import com.herzen.practice.manager.ManagerModels.SessionHistoryEntry;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

@Repository
public class SessionHistoryJdbcRepository {
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public SessionHistoryJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void save(SessionHistoryEntry entry) {
        try {
            jdbcTemplate.update(
                    "MERGE INTO session_history(session_id, content_type, course_id, started_at, completed_at, status, config, final_stats, performance) KEY(session_id) VALUES (?,?,?,?,?,?,?,?,?)",
                    entry.id(), entry.type().name(), entry.courseId(), entry.startedAt().toString(),
                    entry.completedAt() == null ? null : entry.completedAt().toString(), entry.status().name(),
                    toJson(entry.config()), toJson(entry.finalStats()), toJson(entry.performance()));
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot archive session " + entry.id(), e);
        }
    }

    /** Most recent first. */
    public List<SessionHistoryEntry> loadAll() {
        try {
            return jdbcTemplate.query(
                    "SELECT session_id, content_type, course_id, started_at, completed_at, status, config, final_stats, performance FROM session_history",
                    (rs, n) -> new SessionHistoryEntry(
                            rs.getString(1),
                            ContentType.valueOf(rs.getString(2)),
                            rs.getString(3),
                            Instant.parse(rs.getString(4)),
                            rs.getString(5) == null ? null : Instant.parse(rs.getString(5)),
                            SessionStatus.valueOf(rs.getString(6)),
                            fromJson(rs.getString(7), SessionConfig.class),
                            fromJson(rs.getString(8), FinalStats.class),
                            fromJson(rs.getString(9), HistoryPerformance.class)))
                    .stream()
                    .sorted(Comparator.comparing(SessionHistoryEntry::startedAt).reversed())
                    .toList();
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot load session history", e);
        }
    }

    public void delete(String sessionId) {
        try {
            jdbcTemplate.update("DELETE FROM session_history WHERE session_id = ?", sessionId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot delete history entry " + sessionId, e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt " + type.getSimpleName() + " column", e);
        }
    }
}
