package com.memclaw.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".memclaw", "config.yaml"
    );

    public static MemoryConfig load() {
        return load(DEFAULT_PATH);
    }

    public static MemoryConfig load(Path path) {
        return load(path, System.getenv());
    }

    @SuppressWarnings("unchecked")
    static MemoryConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var memory = (Map<String, Object>) raw.getOrDefault("memory", Map.of());
        var embedding = (Map<String, Object>) raw.getOrDefault("embedding", Map.of());
        var sync = (Map<String, Object>) raw.getOrDefault("sync", Map.of());
        var extraction = (Map<String, Object>) raw.getOrDefault("extraction", Map.of());
        var recall = (Map<String, Object>) raw.getOrDefault("recall", Map.of());

        return new MemoryConfig(
            parseStorage(memory, env),
            parseEmbedding(embedding, env),
            parseSync(sync),
            parseExtraction(extraction),
            parseRecall(recall)
        );
    }

    private static MemoryConfig.StorageConfig parseStorage(Map<String, Object> memory, Map<String, String> env) {
        var defaults = MemoryConfig.StorageConfig.defaults();
        return new MemoryConfig.StorageConfig(
            Path.of(envOrDefault(env, "MEMCLAW_DB_PATH",
                String.valueOf(memory.getOrDefault("db-path", defaults.dbPath())))),
            Path.of(envOrDefault(env, "MEMCLAW_GRAPH_PATH",
                String.valueOf(memory.getOrDefault("graph-path", defaults.graphPath())))),
            Boolean.parseBoolean(String.valueOf(memory.getOrDefault("graph-enabled", defaults.graphEnabled())))
        );
    }

    private static MemoryConfig.EmbeddingConfig parseEmbedding(Map<String, Object> embedding, Map<String, String> env) {
        var defaults = MemoryConfig.EmbeddingConfig.defaults();
        return new MemoryConfig.EmbeddingConfig(
            Boolean.parseBoolean(String.valueOf(embedding.getOrDefault("enabled", defaults.enabled()))),
            envOrDefault(env, "MEMCLAW_EMBEDDING_URL",
                String.valueOf(embedding.getOrDefault("base-url", defaults.baseUrl()))),
            envOrDefault(env, "MEMCLAW_EMBEDDING_KEY",
                String.valueOf(embedding.getOrDefault("api-key", defaults.apiKey()))),
            String.valueOf(embedding.getOrDefault("model", defaults.model()))
        );
    }

    private static MemoryConfig.SyncConfig parseSync(Map<String, Object> sync) {
        var defaults = MemoryConfig.SyncConfig.defaults();
        return new MemoryConfig.SyncConfig(
            Integer.parseInt(String.valueOf(sync.getOrDefault("batch-size", defaults.batchSize()))),
            Long.parseLong(String.valueOf(sync.getOrDefault("busy-poll-ms", defaults.busyPollMs()))),
            Long.parseLong(String.valueOf(sync.getOrDefault("idle-poll-ms", defaults.idlePollMs()))),
            Long.parseLong(String.valueOf(sync.getOrDefault("error-backoff-ms", defaults.errorBackoffMs()))),
            Boolean.parseBoolean(String.valueOf(sync.getOrDefault("worker-enabled", defaults.workerEnabled()))),
            Integer.parseInt(String.valueOf(sync.getOrDefault("compact-after-days", defaults.compactAfterDays())))
        );
    }

    private static MemoryConfig.ExtractionConfig parseExtraction(Map<String, Object> extraction) {
        var defaults = MemoryConfig.ExtractionConfig.defaults();
        return new MemoryConfig.ExtractionConfig(
            Integer.parseInt(String.valueOf(extraction.getOrDefault("max-topics", defaults.maxTopics()))),
            Integer.parseInt(String.valueOf(extraction.getOrDefault("max-entities", defaults.maxEntities())))
        );
    }

    private static MemoryConfig.RecallConfig parseRecall(Map<String, Object> recall) {
        var defaults = MemoryConfig.RecallConfig.defaults();
        return new MemoryConfig.RecallConfig(
            Double.parseDouble(String.valueOf(recall.getOrDefault("similarity-floor", defaults.similarityFloor()))),
            Integer.parseInt(String.valueOf(recall.getOrDefault("max-context-depth", defaults.maxContextDepth()))),
            Integer.parseInt(String.valueOf(recall.getOrDefault("related-fan-out", defaults.relatedFanOut()))),
            Double.parseDouble(String.valueOf(recall.getOrDefault("related-strength", defaults.relatedStrength())))
        );
    }

    private static String envOrDefault(Map<String, String> env, String key, String fallback) {
        var val = env.get(key);
        return val != null ? val : fallback;
    }
}
