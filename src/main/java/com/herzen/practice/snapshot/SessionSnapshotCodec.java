package com.herzen.practice.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.herzen.practice.error.PersistenceException;
import org.springframework.stereotype.Component;

/**
 * JSON boundary for {@link SessionSnapshot}, upgrading older payloads on read.
 */
@Component
public class SessionSnapshotCodec {
    private final ObjectMapper objectMapper;

    public SessionSnapshotCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String encode(SessionSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Cannot serialize snapshot " + snapshot.id(), e);
        }
    }

    public SessionSnapshot decode(String payload) {
        try {
            JsonNode root = objectMapper.readTree(payload);
            if (!(root instanceof ObjectNode node)) {
                throw new PersistenceException("Snapshot payload is not a JSON object");
            }
            int version = node.path("schemaVersion").asInt(1);
            if (version > SessionSnapshot.CURRENT_VERSION) {
                throw new PersistenceException("Snapshot schema version " + version + " is newer than supported "
                        + SessionSnapshot.CURRENT_VERSION);
            }
            if (version < 2) {
                migrateV1ToV2(node);
            }
            return objectMapper.treeToValue(node, SessionSnapshot.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupt snapshot payload", e);
        }
    }

    /**
     * v1 stored the answer score as {@code aiScore} and carried no version stamp.
     */
    private void migrateV1ToV2(ObjectNode node) {
        JsonNode answers = node.path("progress").path("answers");
        if (answers.isArray()) {
            answers.forEach(answer -> {
                if (answer instanceof ObjectNode a && a.has("aiScore")) {
                    a.set("score", a.get("aiScore"));
                    a.remove("aiScore");
                }
            });
        }
        node.put("schemaVersion", 2);
    }
}
