package com.herzen.practice.snapshot;

import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.Progress;

import java.time.Instant;
import java.util.List;

/**
 * Persisted form of one session. Bump {@link #CURRENT_VERSION} and add a step to
 * {@link SessionSnapshotCodec} whenever a field changes meaning.
 */
public record SessionSnapshot(int schemaVersion,
                              String id,
                              ContentType contentType,
                              SessionStatus status,
                              SessionConfig config,
                              List<Item> questions,
                              Progress progress,
                              Performance performance,
                              String currentDraftAnswer,
                              Instant savedAt) {
    public static final int CURRENT_VERSION = 2;

    public SessionSnapshot {
        questions = questions == null ? List.of() : List.copyOf(questions);
    }
}
