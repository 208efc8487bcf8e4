package com.memclaw.memory.graph;

import com.memclaw.memory.store.SyncQueue;
import com.memclaw.shared.config.MemoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background drain loop. Each pass reschedules itself: short delay while the queue has
 * work, longer when it is empty, longer still after an unexpected failure.
 */
public class SyncWorker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);
    private static final Duration COMPACT_INTERVAL = Duration.ofHours(1);

    private final GraphIndexer indexer;
    private final SyncQueue syncQueue;
    private final MemoryConfig.SyncConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "memory-sync");
        t.setDaemon(true);
        return t;
    });

    private volatile boolean running;
    private Instant lastCompaction = Instant.EPOCH;

    public SyncWorker(GraphIndexer indexer, SyncQueue syncQueue, MemoryConfig.SyncConfig config) {
        this(indexer, syncQueue, config, Clock.systemUTC());
    }

    SyncWorker(GraphIndexer indexer, SyncQueue syncQueue, MemoryConfig.SyncConfig config, Clock clock) {
        this.indexer = indexer;
        this.syncQueue = syncQueue;
        this.config = config;
        this.clock = clock;
    }

    public void start() {
        running = true;
        scheduler.schedule(this::pass, 0, TimeUnit.MILLISECONDS);
        log.info("Sync worker started (batch {}, poll {}/{} ms)",
                config.batchSize(), config.busyPollMs(), config.idlePollMs());
    }

    public boolean isRunning() {
        return running;
    }

    private void pass() {
        if (!running) return;
        long delay;
        try {
            var result = indexer.drainOnce(config.batchSize());
            if (result.failed() > 0) {
                delay = config.errorBackoffMs();
            } else {
                delay = result.idle() ? config.idlePollMs() : config.busyPollMs();
            }
            maybeCompact();
        } catch (RuntimeException e) {
            log.error("Sync pass failed", e);
            delay = config.errorBackoffMs();
        }
        if (running) {
            try {
                scheduler.schedule(this::pass, delay, TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                log.debug("Sync worker stopped while rescheduling");
            }
        }
    }

    private void maybeCompact() {
        if (config.compactAfterDays() <= 0) return;
        var now = clock.instant();
        if (Duration.between(lastCompaction, now).compareTo(COMPACT_INTERVAL) < 0) return;
        lastCompaction = now;
        int removed = syncQueue.compact(now.minus(Duration.ofDays(config.compactAfterDays())));
        if (removed > 0) log.info("Compacted {} synced queue entries", removed);
    }

    /** Stops scheduling and waits for an in-flight pass to finish. */
    @Override
    public void close() {
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Sync worker did not stop within 10s");
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
