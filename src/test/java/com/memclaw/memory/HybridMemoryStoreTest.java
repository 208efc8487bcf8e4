package com.memclaw.memory;

import com.memclaw.memory.embedding.EmbeddingFunction;
import com.memclaw.memory.embedding.EmbeddingGate;
import com.memclaw.memory.extract.ExtractionEngine;
import com.memclaw.memory.graph.GraphStoreException;
import com.memclaw.memory.graph.LuceneGraphStore;
import com.memclaw.memory.store.JdbcFastStore;
import com.memclaw.memory.store.SqliteDataSources;
import com.memclaw.memory.store.SyncQueue;
import com.memclaw.observability.MemoryMetrics;
import com.memclaw.shared.config.MemoryConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class HybridMemoryStoreTest {

    private static final String DOCKER = "Docker container keeps restarting after the upgrade";
    private static final String WEATHER = "Sunny weather expected for the weekend hike";
    private static final String PYTHON = "Python script parses the CSV export nightly";

    @TempDir Path tempDir;
    private HybridMemoryStore store;

    @AfterEach
    void tearDown() {
        if (store != null) store.close();
    }

    private MemoryConfig config(boolean graphEnabled, boolean workerEnabled) {
        var storage = MemoryConfig.StorageConfig.under(tempDir);
        return new MemoryConfig(
                new MemoryConfig.StorageConfig(storage.dbPath(), storage.graphPath(), graphEnabled),
                MemoryConfig.EmbeddingConfig.disabled(),
                MemoryConfig.SyncConfig.defaults().withWorkerEnabled(workerEnabled),
                MemoryConfig.ExtractionConfig.defaults(),
                MemoryConfig.RecallConfig.defaults());
    }

    private HybridMemoryStore openIndexed() throws Exception {
        return HybridMemoryStore.open(config(true, false));
    }

    private static List<Long> ids(List<MemoryResult> results) {
        return results.stream().map(MemoryResult::id).toList();
    }

    @Test
    void decisionIsIndexedUnderTopicAndEntity() throws Exception {
        store = openIndexed();
        var id = store.store("We decided to use PostgreSQL for the project", "decision", Importance.HIGH, Map.of());

        store.syncPending();

        var stats = store.getStats();
        assertEquals(3, stats.graphStore().nodeCount());
        assertEquals(0, stats.pendingSyncCount());
        assertEquals(List.of(id), ids(store.recall(MemoryQuery.related("Tell me about PostgreSQL"))));
    }

    @Test
    void contextRecallFollowsOnlyTheTemporalNeighbour() throws Exception {
        store = openIndexed();
        var docker = store.store(DOCKER);
        var weather = store.store(WEATHER);
        var python = store.store(PYTHON);
        store.syncPending();

        var shallow = store.recall(MemoryQuery.context("Docker", 1));
        assertEquals(List.of(docker, weather), ids(shallow));

        var deep = store.recall(MemoryQuery.context("docker", 2));
        assertEquals(docker, deep.get(0).id());
        assertThat(ids(deep)).containsExactlyInAnyOrder(docker, weather, python);
    }

    @Test
    void contextRecallWithoutSeedFallsBackToKeywords() throws Exception {
        store = openIndexed();
        store.store(DOCKER);
        store.syncPending();

        var results = store.recall(MemoryQuery.context("kubernetes upgrade", 2));

        assertEquals(1, results.size());
        assertEquals(1.0, store.metrics().recallFallbacks().count());
    }

    @Test
    void semanticRecallUsesTopicsWhenEmbeddingsAreUnavailable() throws Exception {
        store = openIndexed();
        var tuning = store.store("Database index tuning cut query latency in half");
        store.store(WEATHER);
        store.syncPending();

        var results = store.recall(MemoryQuery.semantic("database performance"));

        assertEquals(List.of(tuning), ids(results));
        assertNull(store.getStats().embeddingModelName());
    }

    @Test
    void semanticRecallUsesVectorsAboveTheFloor() throws Exception {
        EmbeddingFunction fn = new EmbeddingFunction() {
            @Override public String modelName() { return "toy-embed"; }
            @Override public float[] embed(String text) {
                return text.toLowerCase().contains("cat") ? new float[]{1f, 0f} : new float[]{0f, 1f};
            }
        };
        var cfg = config(true, false);
        var ds = SqliteDataSources.open(cfg.storage().dbPath());
        var queue = new SyncQueue(ds);
        store = new HybridMemoryStore(ds, new JdbcFastStore(ds, queue), queue,
                new LuceneGraphStore(cfg.storage().graphPath()), new ExtractionEngine(),
                EmbeddingGate.of(fn), cfg, new MemoryMetrics());
        store.start();
        var cat = store.store("my cat sleeps all day");
        store.store("quarterly tax filing");
        store.syncPending();

        var results = store.recall(MemoryQuery.semantic("where is the cat"));

        assertEquals(List.of(cat), ids(results));
        assertEquals(1.0, results.get(0).score(), 1e-6);
        assertEquals("toy-embed", store.getStats().embeddingModelName());
    }

    @Test
    void unsyncedEntriesAreRecoveredOnReopen() throws Exception {
        store = openIndexed();
        store.store(DOCKER);
        store.store(WEATHER);
        store.store(PYTHON);
        assertEquals(3, store.getStats().pendingSyncCount());
        store.close();

        store = openIndexed();

        var stats = store.getStats();
        assertEquals(0, stats.pendingSyncCount());
        assertEquals(3, stats.fastStore().total());
        assertThat(stats.graphStore().nodeCount()).isGreaterThanOrEqualTo(3);
        assertEquals(2, store.recall(MemoryQuery.context("Docker", 1)).size());
    }

    @Test
    void memoriesWrittenWithoutGraphAreIndexedLater() throws Exception {
        store = HybridMemoryStore.open(config(false, false));
        store.store(DOCKER);
        assertFalse(store.getStats().graphAvailable());
        assertEquals(1, store.getStats().pendingSyncCount());
        store.close();

        store = openIndexed();

        assertEquals(0, store.getStats().pendingSyncCount());
        assertTrue(store.getStats().graphAvailable());
    }

    @Test
    void everyQueryTypeAnswersWithoutGraph() throws Exception {
        store = HybridMemoryStore.open(config(false, false));
        var docker = store.store(DOCKER);

        for (var type : QueryType.values()) {
            var results = store.recall(MemoryQuery.of(type, "docker"));
            assertEquals(List.of(docker), ids(results), type.name());
        }
        var stats = store.getStats();
        assertEquals(0, stats.graphStore().nodeCount());
        assertThrows(IllegalStateException.class, () -> store.backfill(false));
    }

    @Test
    void everyRecallTypeBumpsAccessCounters() throws Exception {
        store = openIndexed();
        var id = store.store("We decided to use PostgreSQL for the database");
        store.syncPending();

        long previous = 0;
        for (var type : EnumSet.allOf(QueryType.class)) {
            var text = type == QueryType.CONTEXT ? "postgresql" : "PostgreSQL database";
            var results = store.recall(MemoryQuery.of(type, text));
            assertEquals(List.of(id), ids(results), type.name());
            var record = store.get(id).orElseThrow();
            assertThat(record.accessCount()).as(type.name()).isGreaterThan(previous);
            assertNotNull(record.lastAccessedAt());
            previous = record.accessCount();
        }
    }

    @Test
    void backgroundWorkerDrainsTheQueue() throws Exception {
        store = HybridMemoryStore.open(config(true, true));
        store.store(DOCKER);
        store.store(PYTHON);

        long deadline = System.currentTimeMillis() + 10_000;
        while (store.getStats().pendingSyncCount() > 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }

        assertEquals(0, store.getStats().pendingSyncCount());
    }

    @Test
    void clearEmptiesBothStoresAndQueue() throws Exception {
        store = openIndexed();
        store.store(DOCKER);
        store.store(PYTHON);
        store.syncPending();
        store.store(WEATHER);

        store.clear();

        var stats = store.getStats();
        assertEquals(0, stats.fastStore().total());
        assertEquals(0, stats.graphStore().nodeCount());
        assertEquals(0, stats.graphStore().edgeCount());
        assertEquals(0, stats.pendingSyncCount());
        assertTrue(store.recall(MemoryQuery.quick("docker")).isEmpty());
    }

    @Test
    void failedGraphClearDeletesNothing() throws Exception {
        var cfg = config(true, false);
        var ds = SqliteDataSources.open(cfg.storage().dbPath());
        var queue = new SyncQueue(ds);
        var graph = spy(new LuceneGraphStore(cfg.storage().graphPath()));
        store = new HybridMemoryStore(ds, new JdbcFastStore(ds, queue), queue, graph, new ExtractionEngine(),
                EmbeddingGate.disabled(), cfg, new MemoryMetrics());
        store.start();
        var docker = store.store(DOCKER);
        store.syncPending();
        doThrow(new GraphStoreException("index locked", null)).when(graph).clear();

        assertThrows(MemoryStorageException.class, () -> store.clear());

        assertEquals(1, store.getStats().fastStore().total());
        assertEquals(List.of(docker), ids(store.recall(MemoryQuery.context("docker", 1))));

        doCallRealMethod().when(graph).clear();
        store.clear();
        assertEquals(0, store.getStats().fastStore().total());
        assertEquals(0, store.getStats().graphStore().nodeCount());
    }

    @Test
    void concurrentCallersGetDistinctIdsAndQueueEntries() throws Exception {
        store = openIndexed();
        int threads = 8;
        int perThread = 50;
        var pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        var returned = new AtomicLong();
        var futures = new ArrayList<Future<List<Long>>>();
        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(pool.submit(() -> {
                start.await();
                var mine = new ArrayList<Long>();
                for (int i = 0; i < perThread; i++) {
                    mine.add(store.store("concurrent note " + worker + "-" + i));
                    returned.addAndGet(store.recall(MemoryQuery.quick("concurrent")).size());
                }
                return mine;
            }));
        }
        start.countDown();

        var all = new HashSet<Long>();
        for (var future : futures) {
            var mine = future.get(60, TimeUnit.SECONDS);
            assertThat(mine).isSorted();
            all.addAll(mine);
        }
        pool.shutdown();

        assertEquals(threads * perThread, all.size());
        assertEquals(threads * perThread, store.getStats().pendingSyncCount());
        long accessed = store.list(threads * perThread, 0).stream().mapToLong(MemoryRecord::accessCount).sum();
        assertEquals(returned.get(), accessed);
        assertEquals(threads * perThread, store.syncPending().synced());
    }

    @Test
    void contextSeedIsFoundPastTheIndexedContentPrefix() throws Exception {
        store = openIndexed();
        var earlier = store.store(WEATHER);
        var longNote = store.store("x".repeat(9_000) + " finally the deployment checklist");
        store.syncPending();

        var results = store.recall(MemoryQuery.context("Deployment Checklist", 1));

        assertEquals(List.of(longNote, earlier), ids(results));
    }

    @Test
    void storeDefaultsAndValidation() throws Exception {
        store = openIndexed();
        var meta = new HashMap<String, Object>();
        meta.put("source", "test");
        meta.put("tags", List.of("a", "b"));

        var id = store.store("plain note", null, null, meta);

        var record = store.get(id).orElseThrow();
        assertEquals("general", record.category());
        assertEquals(Importance.MEDIUM, record.importance());
        assertEquals("b", record.metadata().path("tags").get(1).asText());
        assertThrows(IllegalArgumentException.class, () -> store.store("  "));
        assertEquals(1.0, store.metrics().memoriesStored().count());
    }

    @Test
    void statsGroupByCategory() throws Exception {
        store = openIndexed();
        store.store("first decision", "decision");
        store.store("second decision", "decision");
        store.store("a fact", "fact");

        var stats = store.getStats();

        assertEquals(3, stats.fastStore().total());
        assertEquals(Map.of("decision", 2L, "fact", 1L), stats.fastStore().byCategory());
        assertTrue(stats.graphAvailable());
    }

    @Test
    void closedStoreRejectsCalls() throws Exception {
        store = openIndexed();
        store.close();

        assertThrows(IllegalStateException.class, () -> store.store("late"));
    }
}
