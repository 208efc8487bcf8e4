package com.memclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryStore;

import java.util.Map;

public class MemoryStoreTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final MemoryStore memoryStore;

    public MemoryStoreTool(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Override public String name() { return "memory_store"; }

    @Override public String description() {
        return "Store important information to long-term memory for future recall.";
    }

    @Override public JsonNode inputSchema() {
        var importance = MAPPER.createObjectNode().put("type", "string");
        importance.putArray("enum").add("low").add("medium").add("high");
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", MAPPER.createObjectNode()
                        .<ObjectNode>set("content", MAPPER.createObjectNode()
                                .put("type", "string")
                                .put("description", "the knowledge to remember"))
                        .<ObjectNode>set("category", MAPPER.createObjectNode()
                                .put("type", "string")
                                .put("description", "e.g. decision, preference, fact (default general)"))
                        .set("importance", importance))
                .set("required", MAPPER.createArrayNode().add("content"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var content = input.path("content").asText("");
        if (content.isBlank()) return new ToolResult("content is required", true);
        Importance importance;
        try {
            importance = Importance.parse(input.path("importance").asText(null));
        } catch (IllegalArgumentException e) {
            return new ToolResult(e.getMessage(), true);
        }
        var category = input.path("category").asText("general");
        long id = memoryStore.store(content, category, importance, Map.of("sessionId", ctx.sessionId()));
        return new ToolResult("Stored to memory (#" + id + ").", false);
    }
}
