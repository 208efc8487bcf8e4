package com.memclaw.tools;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryQuery;
import com.memclaw.memory.MemoryResult;
import com.memclaw.memory.MemoryStats;
import com.memclaw.memory.MemoryStore;
import com.memclaw.memory.QueryType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MemoryToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    private ToolContext ctx() {
        return new ToolContext("s1");
    }

    @Test
    void storeToolWritesToMemory() throws Exception {
        var stub = new StubStore(List.of());
        var tool = new MemoryStoreTool(stub);
        var input = MAPPER.readTree("{\"content\":\"remember this\",\"category\":\"fact\",\"importance\":\"high\"}");

        var result = tool.execute(ctx(), input);

        assertFalse(result.isError());
        assertTrue(result.output().contains("#1"));
        assertEquals(List.of("remember this"), stub.stored);
        assertEquals("fact", stub.lastCategory);
        assertEquals(Importance.HIGH, stub.lastImportance);
        assertEquals("s1", stub.lastMetadata.get("sessionId"));
    }

    @Test
    void storeToolRejectsBlankContent() throws Exception {
        var tool = new MemoryStoreTool(new StubStore(List.of()));
        var result = tool.execute(ctx(), MAPPER.readTree("{\"content\":\"\"}"));
        assertTrue(result.isError());
    }

    @Test
    void storeToolRejectsUnknownImportance() throws Exception {
        var tool = new MemoryStoreTool(new StubStore(List.of()));
        var result = tool.execute(ctx(), MAPPER.readTree("{\"content\":\"x\",\"importance\":\"urgent\"}"));
        assertTrue(result.isError());
        assertTrue(result.output().contains("urgent"));
    }

    @Test
    void recallToolPassesTypeAndLimit() throws Exception {
        var hit = new MemoryResult(3, "found it", "decision", Instant.EPOCH, 0.91);
        var stub = new StubStore(List.of(hit));
        var tool = new MemoryRecallTool(stub);

        var result = tool.execute(ctx(), MAPPER.readTree("{\"query\":\"find\",\"type\":\"context\",\"limit\":2}"));

        assertFalse(result.isError());
        assertTrue(result.output().contains("found it"));
        assertTrue(result.output().contains("0.910"));
        assertEquals(QueryType.CONTEXT, stub.lastQuery.type());
        assertEquals(2, stub.lastQuery.limit());
    }

    @Test
    void recallToolDefaultsToQuick() throws Exception {
        var stub = new StubStore(List.of(new MemoryResult(1, "no score", "general", Instant.EPOCH, null)));
        var result = new MemoryRecallTool(stub).execute(ctx(), MAPPER.readTree("{\"query\":\"x\"}"));

        assertEquals(QueryType.QUICK, stub.lastQuery.type());
        assertEquals(MemoryQuery.DEFAULT_LIMIT, stub.lastQuery.limit());
        assertTrue(result.output().contains("(general) no score"));
    }

    @Test
    void recallToolReturnsEmptyMessage() throws Exception {
        var tool = new MemoryRecallTool(new StubStore(List.of()));
        var result = tool.execute(ctx(), MAPPER.readTree("{\"query\":\"nothing\"}"));
        assertFalse(result.isError());
        assertTrue(result.output().contains("No memories"));
    }

    @Test
    void statsToolRendersJson() throws Exception {
        var result = new MemoryStatsTool(new StubStore(List.of())).execute(ctx(), MAPPER.createObjectNode());

        assertFalse(result.isError());
        var json = MAPPER.readTree(result.output());
        assertEquals(4, json.path("fastStore").path("total").asLong());
        assertEquals("toy", json.path("embeddingModelName").asText());
    }

    @Test
    void registryHoldsTheThreeMemoryTools() {
        var registry = ToolRegistry.forMemory(new StubStore(List.of()));

        assertEquals(3, registry.all().size());
        assertNotNull(registry.get("memory_store"));
        assertNotNull(registry.get("memory_recall"));
        assertNotNull(registry.get("memory_stats"));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new MemoryStatsTool(null)));
        assertEquals("object", registry.get("memory_recall").inputSchema().path("type").asText());
    }

    private static class StubStore implements MemoryStore {
        final List<String> stored = new ArrayList<>();
        final List<MemoryResult> results;
        String lastCategory;
        Importance lastImportance;
        Map<String, Object> lastMetadata;
        MemoryQuery lastQuery;

        StubStore(List<MemoryResult> results) {
            this.results = results;
        }

        @Override
        public long store(String content, String category, Importance importance, Map<String, Object> metadata) {
            stored.add(content);
            lastCategory = category;
            lastImportance = importance;
            lastMetadata = metadata;
            return stored.size();
        }

        @Override
        public List<MemoryResult> recall(MemoryQuery query) {
            lastQuery = query;
            return results;
        }

        @Override
        public MemoryStats getStats() {
            return new MemoryStats(new MemoryStats.FastStoreStats(4, Map.of("general", 4L)),
                    MemoryStats.GraphStoreStats.empty(), true, 0, "toy");
        }

        @Override
        public void clear() {
            stored.clear();
        }
    }
}
