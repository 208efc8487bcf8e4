package com.memclaw.memory.graph;

import com.memclaw.memory.MemoryRecord;
import com.memclaw.memory.embedding.EmbeddingGate;
import com.memclaw.memory.extract.ExtractionEngine;
import com.memclaw.memory.store.FastStore;
import com.memclaw.memory.store.SyncPayload;
import com.memclaw.memory.store.SyncQueue;
import com.memclaw.memory.store.SyncQueueEntry;
import com.memclaw.observability.MemoryMetrics;
import com.memclaw.shared.config.MemoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Turns sync-queue entries into graph structure. The only writer of the graph store:
 * every write path (worker, recovery, backfill, clear) goes through {@link #lock}.
 */
public class GraphIndexer {

    private static final Logger log = LoggerFactory.getLogger(GraphIndexer.class);
    private static final int LIST_PAGE = 500;

    private final FastStore fastStore;
    private final SyncQueue syncQueue;
    private final GraphStore graph;
    private final ExtractionEngine extraction;
    private final EmbeddingGate embeddings;
    private final MemoryConfig.RecallConfig recallConfig;
    private final MemoryMetrics metrics;
    private final ReentrantLock lock = new ReentrantLock();
    private long drainCursor;

    public GraphIndexer(FastStore fastStore, SyncQueue syncQueue, GraphStore graph,
                        ExtractionEngine extraction, EmbeddingGate embeddings,
                        MemoryConfig.RecallConfig recallConfig, MemoryMetrics metrics) {
        this.fastStore = fastStore;
        this.syncQueue = syncQueue;
        this.graph = graph;
        this.extraction = extraction;
        this.embeddings = embeddings;
        this.recallConfig = recallConfig;
        this.metrics = metrics;
    }

    /**
     * Indexes one memory. The memory node is written first and its failure aborts the
     * call; every later step is attempted even if an earlier one failed, and any failure
     * is reported at the end so the queue entry stays pending.
     */
    public void syncToGraph(SyncPayload payload) throws GraphSyncException {
        long id = payload.memoryId();
        try {
            graph.upsertMemory(new MemoryNode(id, payload.content(), payload.category(),
                    payload.importance(), payload.createdAt()));
        } catch (RuntimeException e) {
            throw new GraphSyncException("Failed to write memory node " + id, e);
        }

        var failures = new ArrayList<String>();
        var topics = extraction.extractTopics(payload.content());
        for (var topic : topics) {
            guarded(failures, "topic " + topic, () -> graph.linkTopic(id, topic));
        }
        for (var entity : extraction.extractEntities(payload.content())) {
            guarded(failures, "entity " + entity.name(), () -> graph.linkEntity(id, entity));
        }
        guarded(failures, "embedding", () -> embeddings.embed(payload.content())
                .ifPresent(vector -> fastStore.updateEmbedding(id, vector)));
        guarded(failures, "predecessor", () -> graph.previousMemoryId(id)
                .ifPresent(prev -> graph.linkMemories(Relation.FOLLOWS, id, prev, 1.0)));
        if (!topics.isEmpty()) {
            guarded(failures, "related memories", () -> {
                for (var other : graph.memoriesSharingTopics(id, topics, recallConfig.relatedFanOut())) {
                    graph.linkMemories(Relation.RELATED_TO, id, other, recallConfig.relatedStrength());
                }
            });
        }
        guarded(failures, "commit", graph::commit);

        if (!failures.isEmpty()) {
            throw new GraphSyncException("Memory " + id + " partially indexed, failed steps: " + failures);
        }
        log.debug("Indexed memory {} with topics {}", id, topics);
    }

    private static void guarded(List<String> failures, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            failures.add(step);
            log.warn("Graph step '{}' failed: {}", step, e.getMessage());
        }
    }

    /**
     * Syncs up to {@code batchSize} pending entries. Successive calls move through the
     * queue and wrap around to its head once they run past the end, so entries that keep
     * failing cannot starve the ones behind them.
     */
    public DrainResult drainOnce(int batchSize) {
        return exclusive(() -> {
            var batch = syncQueue.pendingAfter(drainCursor, batchSize);
            if (batch.isEmpty() && drainCursor > 0) {
                drainCursor = 0;
                batch = syncQueue.pending(batchSize);
            }
            if (batch.isEmpty()) return DrainResult.EMPTY;
            drainCursor = batch.get(batch.size() - 1).queueId();
            return drainBatch(batch);
        });
    }

    /**
     * Syncs every entry that is pending when the call starts. Entries that fail are
     * skipped over, so one bad entry cannot stall the rest.
     */
    public DrainResult drainAll(int batchSize) {
        return exclusive(() -> {
            var total = DrainResult.EMPTY;
            long cursor = 0;
            while (true) {
                var batch = syncQueue.pendingAfter(cursor, batchSize);
                if (batch.isEmpty()) return total;
                total = total.plus(drainBatch(batch));
                cursor = batch.get(batch.size() - 1).queueId();
            }
        });
    }

    /** Startup replay of everything a previous process left unsynced. */
    public DrainResult recoverPending(int batchSize) {
        long pending = syncQueue.pendingCount();
        if (pending == 0) return DrainResult.EMPTY;
        log.info("Recovering {} unsynced memories", pending);
        var result = drainAll(batchSize);
        log.info("Recovery finished: {} synced, {} still pending", result.synced(), result.failed());
        return result;
    }

    private DrainResult drainBatch(List<SyncQueueEntry> batch) {
        int synced = 0;
        int failed = 0;
        for (var entry : batch) {
            try {
                syncToGraph(entry.payload());
                syncQueue.markSynced(entry.queueId());
                metrics.syncCompleted().increment();
                synced++;
            } catch (GraphSyncException e) {
                metrics.syncFailed().increment();
                failed++;
                log.error("Sync of queue entry {} failed, will retry", entry.queueId(), e);
            }
        }
        return new DrainResult(batch.size(), synced, failed);
    }

    /**
     * Indexes every Fast Store memory that has no memory node yet, oldest first. Pending
     * queue entries of memories indexed here are marked synced.
     */
    public BackfillReport backfill(boolean dryRun) {
        return exclusive(() -> {
            var records = allRecordsOldestFirst();
            int processed = 0;
            int skipped = 0;
            int errors = 0;
            for (var record : records) {
                if (graph.containsMemory(record.id())) {
                    skipped++;
                    continue;
                }
                if (dryRun) {
                    log.info("Would index memory {}: topics={} entities={}", record.id(),
                            extraction.extractTopics(record.content()),
                            extraction.extractEntities(record.content()));
                    processed++;
                    continue;
                }
                try {
                    syncToGraph(new SyncPayload(record.id(), record.content(), record.category(),
                            record.importance(), record.createdAt()));
                    for (var entry : syncQueue.entriesFor(record.id())) {
                        if (!entry.synced()) syncQueue.markSynced(entry.queueId());
                    }
                    processed++;
                } catch (GraphSyncException e) {
                    errors++;
                    log.error("Backfill of memory {} failed", record.id(), e);
                }
            }
            var report = new BackfillReport(records.size(), processed, skipped, errors, dryRun);
            log.info(report.summary());
            return report;
        });
    }

    /** Runs {@code action} while holding the writer lock. */
    public void runExclusive(Runnable action) {
        exclusive(() -> {
            action.run();
            return null;
        });
    }

    private <T> T exclusive(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private List<MemoryRecord> allRecordsOldestFirst() {
        var all = new ArrayList<MemoryRecord>();
        for (int offset = 0; ; offset += LIST_PAGE) {
            var page = fastStore.list(LIST_PAGE, offset);
            all.addAll(page);
            if (page.size() < LIST_PAGE) break;
        }
        all.sort(Comparator.comparingLong(MemoryRecord::id));
        return all;
    }
}
