package com.memclaw.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memclaw.memory.MemoryQuery;
import com.memclaw.memory.MemoryStore;
import com.memclaw.memory.QueryType;

import java.util.Locale;

public class MemoryRecallTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_LIMIT = 20;
    private final MemoryStore memoryStore;

    public MemoryRecallTool(MemoryStore memoryStore) {
        this.memoryStore = memoryStore;
    }

    @Override public String name() { return "memory_recall"; }

    @Override public String description() {
        return "Search long-term memory. type: quick (keywords), semantic (meaning), "
                + "context (what happened around a memory), related (same entities).";
    }

    @Override public JsonNode inputSchema() {
        var type = MAPPER.createObjectNode().put("type", "string");
        type.putArray("enum").add("quick").add("semantic").add("context").add("related");
        return MAPPER.createObjectNode()
                .put("type", "object")
                .<ObjectNode>set("properties", MAPPER.createObjectNode()
                        .<ObjectNode>set("query", MAPPER.createObjectNode().put("type", "string").put("description", "search query"))
                        .<ObjectNode>set("type", type)
                        .set("limit", MAPPER.createObjectNode().put("type", "integer").put("description", "max results (default 5)")))
                .set("required", MAPPER.createArrayNode().add("query"));
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        var query = input.path("query").asText("");
        if (query.isBlank()) return new ToolResult("query is required", true);
        QueryType type;
        try {
            type = QueryType.parse(input.path("type").asText(null));
        } catch (IllegalArgumentException e) {
            return new ToolResult(e.getMessage(), true);
        }
        int limit = Math.max(1, Math.min(MAX_LIMIT, input.path("limit").asInt(MemoryQuery.DEFAULT_LIMIT)));

        var results = memoryStore.recall(MemoryQuery.of(type, query).withLimit(limit));
        if (results.isEmpty()) return new ToolResult("No memories found.", false);
        var sb = new StringBuilder();
        for (var r : results) {
            sb.append("- ");
            if (r.score() != null) sb.append("[").append(String.format(Locale.ROOT, "%.3f", r.score())).append("] ");
            sb.append("(").append(r.category()).append(") ").append(r.content()).append("\n");
        }
        return new ToolResult(sb.toString(), false);
    }
}
