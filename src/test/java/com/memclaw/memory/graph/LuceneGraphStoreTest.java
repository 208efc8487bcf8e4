package com.memclaw.memory.graph;

import com.memclaw.memory.Importance;
import com.memclaw.memory.extract.Entity;
import com.memclaw.memory.extract.EntityType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LuceneGraphStoreTest {

    @TempDir Path tempDir;
    private LuceneGraphStore graph;

    @BeforeEach
    void setUp() throws Exception {
        graph = new LuceneGraphStore(tempDir.resolve("graph"));
    }

    @AfterEach
    void tearDown() {
        graph.close();
    }

    private static MemoryNode node(long id, String content) {
        return new MemoryNode(id, content, "general", Importance.MEDIUM, Instant.ofEpochSecond(1_000 + id));
    }

    private static List<Long> ids(List<MemoryNode> nodes) {
        return nodes.stream().map(MemoryNode::id).toList();
    }

    @Test
    void upsertsDoNotDuplicate() {
        graph.upsertMemory(node(1, "first"));
        graph.upsertMemory(node(1, "first, edited"));
        graph.linkTopic(1, "Docker");
        graph.linkTopic(1, "Docker");
        graph.linkEntity(1, new Entity("Docker", EntityType.TECHNOLOGY));
        graph.linkEntity(1, new Entity("Docker", EntityType.TECHNOLOGY));

        var stats = graph.stats();
        assertEquals(3, stats.nodeCount());
        assertEquals(2, stats.edgeCount());
        assertEquals("first, edited", graph.findMemory(1).orElseThrow().content());
    }

    @Test
    void previousMemoryIdIsHighestLowerId() {
        graph.upsertMemory(node(1, "a"));
        graph.upsertMemory(node(3, "b"));
        graph.upsertMemory(node(5, "c"));

        assertEquals(OptionalLong.of(3), graph.previousMemoryId(5));
        assertEquals(OptionalLong.of(3), graph.previousMemoryId(4));
        assertTrue(graph.previousMemoryId(1).isEmpty());
    }

    @Test
    void latestMemoryContainingIgnoresCaseAndPrefersNewest() {
        graph.upsertMemory(node(1, "Docker container restarted"));
        graph.upsertMemory(node(2, "Another DOCKER note"));
        graph.upsertMemory(node(3, "weather"));

        assertEquals(2, graph.latestMemoryContaining("docker").orElseThrow().id());
        assertEquals(1, graph.latestMemoryContaining("container rest").orElseThrow().id());
        assertTrue(graph.latestMemoryContaining("kubernetes").isEmpty());
        assertTrue(graph.latestMemoryContaining("  ").isEmpty());
    }

    @Test
    void containsLookupOnlyCoversBoundedPrefixes() {
        var prefix = "deploy notes ".repeat(20);
        graph.upsertMemory(node(1, prefix + "unrelated tail"));
        graph.upsertMemory(node(2, "x".repeat(9_000) + " late marker"));

        assertTrue(graph.latestMemoryContaining(prefix + "different tail").isEmpty());
        assertTrue(graph.latestMemoryContaining("late marker").isEmpty());
    }

    @Test
    void wildcardCharactersInQueryAreLiteral() {
        graph.upsertMemory(node(1, "plain text"));
        graph.upsertMemory(node(2, "what? really*"));

        assertTrue(graph.latestMemoryContaining("p*t").isEmpty());
        assertEquals(2, graph.latestMemoryContaining("really*").orElseThrow().id());
    }

    @Test
    void traversalFollowsEdgesBothWaysWithinDepth() {
        for (long id = 1; id <= 4; id++) graph.upsertMemory(node(id, "m" + id));
        graph.linkMemories(Relation.FOLLOWS, 2, 1, 1.0);
        graph.linkMemories(Relation.FOLLOWS, 3, 2, 1.0);
        graph.linkMemories(Relation.FOLLOWS, 4, 3, 1.0);
        var both = Set.of(Relation.FOLLOWS, Relation.RELATED_TO);

        assertEquals(List.of(2L), ids(graph.traverse(1, both, 1)));
        assertEquals(List.of(3L, 2L), ids(graph.traverse(1, both, 2)));
        assertEquals(List.of(4L, 2L), ids(graph.traverse(3, both, 1)));
        assertTrue(graph.traverse(1, Set.of(Relation.RELATED_TO), 3).isEmpty());
    }

    @Test
    void selfLinksAreIgnored() {
        graph.upsertMemory(node(1, "alone"));
        graph.linkMemories(Relation.RELATED_TO, 1, 1, 0.8);

        assertEquals(0, graph.stats().edgeCount());
    }

    @Test
    void topicAndEntityLookups() {
        graph.upsertMemory(node(1, "docker one"));
        graph.upsertMemory(node(2, "docker two"));
        graph.upsertMemory(node(3, "python"));
        graph.linkTopic(1, "Docker");
        graph.linkTopic(2, "Docker");
        graph.linkTopic(3, "Python");
        graph.linkEntity(3, new Entity("Python", EntityType.TECHNOLOGY));

        assertEquals(List.of(2L, 1L), ids(graph.memoriesWithTopics(List.of("Docker"), 5)));
        assertEquals(List.of(2L), ids(graph.memoriesWithTopics(List.of("Docker"), 1)));
        assertEquals(List.of(2L), graph.memoriesSharingTopics(1, List.of("Docker"), 5));
        assertEquals(List.of(3L), ids(graph.memoriesMentioning(List.of("Python"), 5)));
        assertTrue(graph.memoriesWithTopics(List.of(), 5).isEmpty());
    }

    @Test
    void clearEmptiesTheGraph() {
        graph.upsertMemory(node(1, "x"));
        graph.linkTopic(1, "Docker");

        graph.clear();

        assertEquals(0, graph.stats().nodeCount());
        assertEquals(0, graph.stats().edgeCount());
        assertTrue(graph.memoryIds().isEmpty());
    }

    @Test
    void committedDataSurvivesReopen() throws Exception {
        graph.upsertMemory(node(7, "persisted"));
        graph.commit();
        graph.close();

        graph = new LuceneGraphStore(tempDir.resolve("graph"));

        assertTrue(graph.containsMemory(7));
        assertEquals(Set.of(7L), graph.memoryIds());
    }
}
