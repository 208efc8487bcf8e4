package com.memclaw.shared.config;

import java.nio.file.Path;

public record MemoryConfig(
    StorageConfig storage,
    EmbeddingConfig embedding,
    SyncConfig sync,
    ExtractionConfig extraction,
    RecallConfig recall
) {
    public record StorageConfig(Path dbPath, Path graphPath, boolean graphEnabled) {
        public static StorageConfig defaults() {
            var home = Path.of(System.getProperty("user.home"), ".memclaw");
            return new StorageConfig(home.resolve("memory.db"), home.resolve("graph"), true);
        }

        public static StorageConfig under(Path dir) {
            return new StorageConfig(dir.resolve("memory.db"), dir.resolve("graph"), true);
        }
    }

    public record EmbeddingConfig(boolean enabled, String baseUrl, String apiKey, String model) {
        public static EmbeddingConfig defaults() {
            return new EmbeddingConfig(true, "http://localhost:11434/v1", "", "nomic-embed-text");
        }

        public static EmbeddingConfig disabled() {
            return new EmbeddingConfig(false, "", "", "");
        }
    }

    /**
     * Background indexing cadence. The worker polls every {@code busyPollMs} while the
     * queue has work and backs off to {@code idlePollMs} once it is empty.
     */
    public record SyncConfig(int batchSize, long busyPollMs, long idlePollMs,
                             long errorBackoffMs, boolean workerEnabled, int compactAfterDays) {
        public static SyncConfig defaults() {
            return new SyncConfig(10, 200, 1000, 2000, true, 0);
        }

        public SyncConfig withWorkerEnabled(boolean enabled) {
            return new SyncConfig(batchSize, busyPollMs, idlePollMs, errorBackoffMs, enabled, compactAfterDays);
        }
    }

    public record ExtractionConfig(int maxTopics, int maxEntities) {
        public static ExtractionConfig defaults() {
            return new ExtractionConfig(3, 3);
        }
    }

    public record RecallConfig(double similarityFloor, int maxContextDepth,
                               int relatedFanOut, double relatedStrength) {
        public static RecallConfig defaults() {
            return new RecallConfig(0.65, 5, 5, 0.8);
        }
    }

    public static MemoryConfig defaults() {
        return new MemoryConfig(
            StorageConfig.defaults(),
            EmbeddingConfig.defaults(),
            SyncConfig.defaults(),
            ExtractionConfig.defaults(),
            RecallConfig.defaults()
        );
    }

    public MemoryConfig withStorage(StorageConfig storage) {
        return new MemoryConfig(storage, embedding, sync, extraction, recall);
    }

    public MemoryConfig withEmbedding(EmbeddingConfig embedding) {
        return new MemoryConfig(storage, embedding, sync, extraction, recall);
    }

    public MemoryConfig withSync(SyncConfig sync) {
        return new MemoryConfig(storage, embedding, sync, extraction, recall);
    }
}
