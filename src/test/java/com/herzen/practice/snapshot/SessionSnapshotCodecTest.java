package com.herzen.practice.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.herzen.practice.domain.DomainModels.ContentType;
import com.herzen.practice.domain.DomainModels.Difficulty;
import com.herzen.practice.domain.DomainModels.EvaluationStatus;
import com.herzen.practice.domain.DomainModels.Item;
import com.herzen.practice.domain.DomainModels.SessionConfig;
import com.herzen.practice.domain.DomainModels.SessionStatus;
import com.herzen.practice.error.PersistenceException;
import com.herzen.practice.session.SessionModels.Answer;
import com.herzen.practice.session.SessionModels.Performance;
import com.herzen.practice.session.SessionModels.Progress;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionSnapshotCodecTest {
    private static final Instant NOW = Instant.parse("2026-03-10T10:00:00Z");

    private final ObjectMapper mapper = JsonMapper.builder().findAndAddModules().build();
    private final SessionSnapshotCodec codec = new SessionSnapshotCodec(mapper);

    private static SessionSnapshot snapshot() {
        Item item = new Item("q1", "Explain caching", Difficulty.HARD, "caching", "week-1",
                List.of("cache", "ttl"), List.of(), null, 2, 1, 0.4, 30, 1000);
        Answer answer = new Answer("q1", "cache with ttl", 3, 4000, NOW, EvaluationStatus.COMPLETED, 0.75,
                List.of("cache", "ttl"), "Good", List.of(), 1);
        Progress progress = new Progress(0, 1, 1, 0, 4000, NOW, NOW, 4000, 3, 0.75,
                List.of(answer), Set.of("q1"), null);
        return new SessionSnapshot(SessionSnapshot.CURRENT_VERSION, "s-1", ContentType.OPEN_QUESTIONS, SessionStatus.ACTIVE,
                SessionConfig.defaults("course-1"), List.of(item), progress, Performance.empty(), "draft", NOW);
    }

    @Test
    void decodesWhatItEncodes() {
        SessionSnapshot original = snapshot();

        SessionSnapshot decoded = codec.decode(codec.encode(original));

        assertEquals(original, decoded);
    }

    @Test
    void upgradesUnversionedPayloadWithLegacyScoreField() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(codec.encode(snapshot()));
        root.remove("schemaVersion");
        ObjectNode answer = (ObjectNode) root.path("progress").path("answers").get(0);
        answer.set("aiScore", answer.get("score"));
        answer.remove("score");

        SessionSnapshot decoded = codec.decode(mapper.writeValueAsString(root));

        assertEquals(SessionSnapshot.CURRENT_VERSION, decoded.schemaVersion());
        assertEquals(0.75, decoded.progress().answers().get(0).score());
    }

    @Test
    void rejectsNewerSchemaVersion() throws Exception {
        ObjectNode root = (ObjectNode) mapper.readTree(codec.encode(snapshot()));
        root.put("schemaVersion", SessionSnapshot.CURRENT_VERSION + 1);
        String payload = mapper.writeValueAsString(root);

        PersistenceException ex = assertThrows(PersistenceException.class, () -> codec.decode(payload));
        assertTrue(ex.getMessage().contains("newer"));
    }

    @Test
    void corruptPayloadIsAPersistenceError() {
        assertThrows(PersistenceException.class, () -> codec.decode("{not json"));
        assertThrows(PersistenceException.class, () -> codec.decode("[1, 2]"));
    }
}
