package com.memclaw.memory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memclaw.memory.Importance;

import java.time.Instant;

/**
 * Snapshot of what the graph indexer needs, captured when the memory is written so
 * indexing never has to read the memory row back.
 */
public record SyncPayload(long memoryId, String content, String category,
                          Importance importance, Instant createdAt) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public String toJson() {
        var node = MAPPER.createObjectNode()
                .put("id", memoryId)
                .put("content", content)
                .put("category", category)
                .put("importance", importance.wireName())
                .put("created_at", createdAt.toEpochMilli());
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize sync payload for memory " + memoryId, e);
        }
    }

    public static SyncPayload fromJson(String json) {
        try {
            var node = MAPPER.readTree(json);
            return new SyncPayload(
                    node.path("id").asLong(),
                    node.path("content").asText(""),
                    node.path("category").asText("general"),
                    Importance.parse(node.path("importance").asText(null)),
                    Instant.ofEpochMilli(node.path("created_at").asLong()));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed sync payload: " + json, e);
        }
    }
}
