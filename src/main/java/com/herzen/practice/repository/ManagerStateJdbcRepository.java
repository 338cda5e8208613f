package com.herzen.practice.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.manager.ManagerModels.ActiveSessionInfo;
import com.herzen.practice.manager.ManagerModels.Preferences;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Single-row records of the session manager: the active-session pointer and user preferences.
 */
@Repository
public class ManagerStateJdbcRepository {
    static final String ACTIVE_SESSION = "active_session";
    static final String PREFERENCES = "preferences";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public ManagerStateJdbcRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void saveActiveSession(ActiveSessionInfo active) {
        if (active == null) {
            delete(ACTIVE_SESSION);
        } else {
            write(ACTIVE_SESSION, active);
        }
    }

    public Optional<ActiveSessionInfo> loadActiveSession() {
        return read(ACTIVE_SESSION, ActiveSessionInfo.class);
    }

    public void savePreferences(Preferences preferences) {
        write(PREFERENCES, preferences);
    }

    public Optional<Preferences> loadPreferences() {
        return read(PREFERENCES, Preferences.class);
    }

    private void write(String key, Object value) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize " + key, e);
        }
        try {
            jdbcTemplate.update("MERGE INTO manager_state(state_key, payload, updated_at) KEY(state_key) VALUES (?,?,?)",
                    key, payload, Instant.now().toString());
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot write " + key, e);
        }
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        List<String> rows;
        try {
            rows = jdbcTemplate.query("SELECT payload FROM manager_state WHERE state_key = ?", (rs, n) -> rs.getString(1), key);
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot read " + key, e);
        }
        if (rows.isEmpty() || rows.get(0) == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(rows.get(0), type));
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt " + key + " record", e);
        }
    }

    private void delete(String key) {
        try {
            jdbcTemplate.update("DELETE FROM manager_state WHERE state_key = ?", key);
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot clear " + key, e);
        }
    }
}
