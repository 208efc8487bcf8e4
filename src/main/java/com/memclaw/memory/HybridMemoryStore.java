package com.memclaw.memory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.memclaw.memory.embedding.EmbeddingGate;
import com.memclaw.memory.embedding.HttpEmbeddingFunction;
import com.memclaw.memory.extract.ExtractionEngine;
import com.memclaw.memory.extract.TopicTaxonomy;
import com.memclaw.memory.graph.BackfillReport;
import com.memclaw.memory.graph.DrainResult;
import com.memclaw.memory.graph.GraphIndexer;
import com.memclaw.memory.graph.GraphStore;
import com.memclaw.memory.graph.LuceneGraphStore;
import com.memclaw.memory.graph.SyncWorker;
import com.memclaw.memory.store.FastStore;
import com.memclaw.memory.store.JdbcFastStore;
import com.memclaw.memory.store.SqliteDataSources;
import com.memclaw.memory.store.SyncQueue;
import com.memclaw.observability.MemoryMetrics;
import com.memclaw.shared.config.MemoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The memory handle an application opens once and passes around. Writes land in the
 * Fast Store together with a sync-queue entry; the graph is built afterwards by the
 * indexer, so {@link #store} never waits on or fails because of the graph.
 */
public class HybridMemoryStore implements MemoryStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HybridMemoryStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final DataSource dataSource;
    private final FastStore fastStore;
    private final SyncQueue syncQueue;
    private final GraphStore graph;
    private final EmbeddingGate embeddings;
    private final MemoryConfig config;
    private final MemoryMetrics metrics;
    private final GraphIndexer indexer;
    private final RecallRouter router;
    private SyncWorker worker;
    private volatile boolean closed;

    /**
     * Wires the components without starting anything; {@link #start()} runs recovery
     * and launches the worker. {@code graph} may be null.
     */
    public HybridMemoryStore(DataSource dataSource, FastStore fastStore, SyncQueue syncQueue, GraphStore graph,
                             ExtractionEngine extraction, EmbeddingGate embeddings,
                             MemoryConfig config, MemoryMetrics metrics) {
        this.dataSource = dataSource;
        this.fastStore = fastStore;
        this.syncQueue = syncQueue;
        this.graph = graph;
        this.embeddings = embeddings;
        this.config = config;
        this.metrics = metrics;
        this.indexer = graph == null ? null
                : new GraphIndexer(fastStore, syncQueue, graph, extraction, embeddings, config.recall(), metrics);
        this.router = new RecallRouter(fastStore, graph, extraction, embeddings, config.recall(), metrics);
    }

    public static HybridMemoryStore open(MemoryConfig config) throws IOException {
        return open(config, new MemoryMetrics());
    }

    public static HybridMemoryStore open(MemoryConfig config, MemoryMetrics metrics) throws IOException {
        var storage = config.storage();
        var dataSource = SqliteDataSources.open(storage.dbPath());
        var syncQueue = new SyncQueue(dataSource);
        var fastStore = new JdbcFastStore(dataSource, syncQueue);

        GraphStore graph = null;
        if (storage.graphEnabled()) {
            try {
                graph = new LuceneGraphStore(storage.graphPath());
            } catch (IOException | RuntimeException e) {
                log.warn("Graph store unavailable at {}, continuing without it: {}",
                        storage.graphPath(), e.getMessage());
            }
        } else {
            log.info("Graph store disabled by configuration");
        }

        var extraction = new ExtractionEngine(TopicTaxonomy.defaults(),
                config.extraction().maxTopics(), config.extraction().maxEntities());
        var store = new HybridMemoryStore(dataSource, fastStore, syncQueue, graph, extraction,
                embeddingGate(config.embedding()), config, metrics);
        store.start();
        log.info("Memory store opened at {} (graph {})", storage.dbPath(), graph != null ? "on" : "off");
        return store;
    }

    static EmbeddingGate embeddingGate(MemoryConfig.EmbeddingConfig embedding) {
        if (!embedding.enabled()) return EmbeddingGate.disabled();
        return new EmbeddingGate(embedding.model(),
                () -> HttpEmbeddingFunction.connect(embedding.baseUrl(), embedding.apiKey(), embedding.model()));
    }

    /** Replays unsynced entries left by a previous process, then starts the background worker. */
    public void start() {
        if (indexer == null) {
            long pending = syncQueue.pendingCount();
            if (pending > 0) log.warn("{} memories wait for graph indexing, graph store is unavailable", pending);
            return;
        }
        indexer.recoverPending(config.sync().batchSize());
        if (config.sync().workerEnabled()) {
            worker = new SyncWorker(indexer, syncQueue, config.sync());
            worker.start();
        }
    }

    @Override
    public long store(String content, String category, Importance importance, Map<String, Object> metadata) {
        ensureOpen();
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("content must not be blank");
        }
        var cat = category == null || category.isBlank() ? "general" : category;
        var imp = importance == null ? Importance.MEDIUM : importance;
        ObjectNode meta = MAPPER.valueToTree(metadata == null ? Map.of() : metadata);
        var record = fastStore.store(content, cat, imp, meta);
        metrics.memoriesStored().increment();
        log.debug("Stored memory {} [{}]", record.id(), cat);
        return record.id();
    }

    @Override
    public List<MemoryResult> recall(MemoryQuery query) {
        ensureOpen();
        return router.recall(query);
    }

    @Override
    public MemoryStats getStats() {
        ensureOpen();
        var graphStats = MemoryStats.GraphStoreStats.empty();
        if (graph != null) {
            try {
                graphStats = graph.stats();
            } catch (RuntimeException e) {
                log.warn("Graph stats unavailable: {}", e.getMessage());
            }
        }
        return new MemoryStats(fastStore.stats(), graphStats, graph != null,
                syncQueue.pendingCount(), embeddings.modelName());
    }

    /**
     * Wipes the graph, then memories and the sync queue. Waits for an in-flight sync to
     * finish. A graph failure aborts before anything is deleted, so the call can be retried.
     *
     * @throws MemoryStorageException if either store cannot be cleared
     */
    @Override
    public void clear() {
        ensureOpen();
        if (indexer == null) {
            fastStore.clear();
            return;
        }
        indexer.runExclusive(() -> {
            try {
                graph.clear();
            } catch (RuntimeException e) {
                throw new MemoryStorageException("Failed to clear graph store, nothing was deleted", e);
            }
            fastStore.clear();
        });
        log.info("Memory store cleared");
    }

    /** Drains every pending sync entry on the calling thread. */
    public DrainResult syncPending() {
        ensureOpen();
        if (indexer == null) {
            log.warn("Graph store unavailable, {} entries stay pending", syncQueue.pendingCount());
            return DrainResult.EMPTY;
        }
        return indexer.drainAll(config.sync().batchSize());
    }

    public BackfillReport backfill(boolean dryRun) {
        ensureOpen();
        if (indexer == null) throw new IllegalStateException("Graph store is not available");
        return indexer.backfill(dryRun);
    }

    public List<MemoryRecord> list(int limit, int offset) {
        ensureOpen();
        return fastStore.list(limit, offset);
    }

    public Optional<MemoryRecord> get(long id) {
        ensureOpen();
        return fastStore.get(id);
    }

    public boolean graphAvailable() {
        return graph != null;
    }

    public EmbeddingGate embeddings() {
        return embeddings;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public MemoryMetrics metrics() {
        return metrics;
    }

    private void ensureOpen() {
        if (closed) throw new IllegalStateException("Memory store is closed");
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (worker != null) worker.close();
        if (graph != null) graph.close();
        log.info("Memory store closed");
    }
}
