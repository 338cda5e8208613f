package com.herzen.practice.repository;

import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.snapshot.DurableSessionStore;
import com.herzen.practice.snapshot.SessionSnapshot;
import com.herzen.practice.snapshot.SessionSnapshotCodec;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class SessionSnapshotJdbcRepository implements DurableSessionStore {
    private final JdbcTemplate jdbcTemplate;
    private final SessionSnapshotCodec codec;

    public SessionSnapshotJdbcRepository(JdbcTemplate jdbcTemplate, SessionSnapshotCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
    }

    @Override
    public void save(String sessionId, SessionSnapshot snapshot) {
        String payload = codec.encode(snapshot);
        try {
            jdbcTemplate.update(
                    "MERGE INTO session_snapshots(session_id, content_type, status, schema_version, payload, saved_at) KEY(session_id) VALUES (?,?,?,?,?,?)",
                    sessionId, snapshot.contentType().name(), snapshot.status().name(), snapshot.schemaVersion(),
                    payload, snapshot.savedAt().toString());
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot save snapshot " + sessionId, e);
        }
    }

    @Override
    public Optional<SessionSnapshot> load(String sessionId) {
        List<String> payloads;
        try {
            payloads = jdbcTemplate.query("SELECT payload FROM session_snapshots WHERE session_id = ?",
                    (rs, n) -> rs.getString(1), sessionId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot load snapshot " + sessionId, e);
        }
        return payloads.stream().findFirst().map(codec::decode);
    }

    @Override
    public void delete(String sessionId) {
        try {
            jdbcTemplate.update("DELETE FROM session_snapshots WHERE session_id = ?", sessionId);
        } catch (DataAccessException e) {
            throw new PersistenceException("Cannot delete snapshot " + sessionId, e);
        }
    }
}
