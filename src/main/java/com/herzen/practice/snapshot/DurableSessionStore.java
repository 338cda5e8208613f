package com.herzen.practice.snapshot;

import java.util.Optional;

/**
 * Best-effort snapshot storage used for crash recovery. Failures surface as
 * {@link com.herzen.practice.error.PersistenceException}.
 */
public interface DurableSessionStore {

    void save(String sessionId, SessionSnapshot snapshot);

    Optional<SessionSnapshot> load(String sessionId);

    void delete(String sessionId);
}
