package com.memclaw.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memclaw.memory.MemoryStore;

public class MemoryStatsTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private final MemoryStore memoryStore;

    public MemoryStatsTool(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Override public String name() { return "memory_stats"; }

    @Override public String description() {
        return "Report how many memories are stored, per category, and whether graph and semantic search are available.";
    }

    @Override public JsonNode inputSchema() {
        return MAPPER.createObjectNode()
                .put("type", "object")
                .set("properties", MAPPER.createObjectNode());
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var stats = memoryStore.getStats();
        try {
            return new ToolResult(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(stats), false);
        } catch (JsonProcessingException e) {
            return new ToolResult("Failed to render stats: " + e.getMessage(), true);
        }
    }
}
