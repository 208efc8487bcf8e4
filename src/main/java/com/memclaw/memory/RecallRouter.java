package com.memclaw.memory;

import com.memclaw.memory.embedding.EmbeddingGate;
import com.memclaw.memory.extract.Entity;
import com.memclaw.memory.extract.ExtractionEngine;
import com.memclaw.memory.graph.GraphStore;
import com.memclaw.memory.graph.MemoryNode;
import com.memclaw.memory.graph.Relation;
import com.memclaw.memory.store.FastStore;
import com.memclaw.observability.MemoryMetrics;
import com.memclaw.shared.config.MemoryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Dispatches a {@link MemoryQuery} to keyword, vector, graph or entity retrieval. Every
 * graph-backed path falls back to keyword search; only Fast Store errors propagate.
 */
public class RecallRouter {

    private static final Logger log = LoggerFactory.getLogger(RecallRouter.class);
    private static final Set<Relation> CONTEXT_RELATIONS = EnumSet.of(Relation.RELATED_TO, Relation.FOLLOWS);

    private final FastStore fastStore;
    private final GraphStore graph;
    private final ExtractionEngine extraction;
    private final EmbeddingGate embeddings;
    private final MemoryConfig.RecallConfig config;
    private final MemoryMetrics metrics;

    /** {@code graph} may be null when the graph store is disabled or failed to open. */
    public RecallRouter(FastStore fastStore, GraphStore graph, ExtractionEngine extraction,
                        EmbeddingGate embeddings, MemoryConfig.RecallConfig config, MemoryMetrics metrics) {
        this.fastStore = fastStore;
        this.graph = graph;
        this.extraction = extraction;
        this.embeddings = embeddings;
        this.config = config;
        this.metrics = metrics;
    }

    public List<MemoryResult> recall(MemoryQuery query) {
        Supplier<List<MemoryResult>> call = () -> dispatch(query);
        return metrics.recallLatency(query.type()).record(call);
    }

    private List<MemoryResult> dispatch(MemoryQuery query) {
        return switch (query.type()) {
            case QUICK -> fastStore.recall(query.text(), query.limit());
            case SEMANTIC -> semantic(query);
            case CONTEXT -> context(query);
            case RELATED -> related(query);
        };
    }

    private List<MemoryResult> semantic(MemoryQuery query) {
        var vector = embeddings.embed(query.text());
        if (vector.isPresent()) {
            var hits = vectorSearch(vector.get(), query.limit());
            if (!hits.isEmpty()) return touched(hits);
        }

        var topics = extraction.extractTopics(query.text());
        if (!topics.isEmpty()) {
            var nodes = fromGraph("topic match", () -> graph.memoriesWithTopics(topics, query.limit()));
            if (nodes.isPresent() && !nodes.get().isEmpty()) return touched(toResults(nodes.get()));
        }
        return fallback(query, "no vector or topic match");
    }

    private List<MemoryResult> vectorSearch(float[] queryVector, int limit) {
        var scored = new ArrayList<MemoryResult>();
        for (var stored : fastStore.vectors()) {
            double sim = EmbeddingGate.similarity(queryVector, stored.vector());
            if (sim >= config.similarityFloor()) scored.add(stored.toResult(sim));
        }
        scored.sort(Comparator.comparing(MemoryResult::score).reversed()
                .thenComparing(MemoryResult::createdAt, Comparator.reverseOrder()));
        return scored.size() > limit ? new ArrayList<>(scored.subList(0, limit)) : scored;
    }

    private List<MemoryResult> context(MemoryQuery query) {
        int depth = Math.max(1, Math.min(query.contextDepth(), config.maxContextDepth()));
        var seed = contextSeed(query.text());
        if (seed.isEmpty()) return fallback(query, "no context seed");
        var found = fromGraph("context traversal", () -> {
            var nodes = new ArrayList<MemoryNode>();
            nodes.add(seed.get());
            for (var node : graph.traverse(seed.get().id(), CONTEXT_RELATIONS, depth)) {
                if (nodes.size() >= query.limit()) break;
                nodes.add(node);
            }
            return nodes;
        });
        if (found.isEmpty()) return fallback(query, "context traversal failed");
        return touched(toResults(found.get()));
    }

    private Optional<MemoryNode> contextSeed(String text) {
        var fromIndex = fromGraph("context seed", () -> graph.latestMemoryContaining(text));
        if (fromIndex.isEmpty()) return Optional.empty();
        if (fromIndex.get().isPresent()) return fromIndex.get();
        // the graph only matches a content prefix, the Fast Store sees whole contents
        var id = fastStore.latestContaining(text);
        if (id.isEmpty()) return Optional.empty();
        return fromGraph("context seed", () -> graph.findMemory(id.getAsLong())).flatMap(node -> node);
    }

    private List<MemoryResult> related(MemoryQuery query) {
        var names = extraction.extractEntities(query.text()).stream().map(Entity::name).toList();
        if (!names.isEmpty()) {
            var nodes = fromGraph("entity match", () -> graph.memoriesMentioning(names, query.limit()));
            if (nodes.isPresent() && !nodes.get().isEmpty()) return touched(toResults(nodes.get()));
        }
        return semantic(query);
    }

    /** Runs a graph read; empty when there is no graph or the read failed. */
    private <T> Optional<T> fromGraph(String what, GraphRead<T> read) {
        if (graph == null) return Optional.empty();
        try {
            return Optional.of(read.run());
        } catch (RuntimeException e) {
            log.warn("Graph {} failed, falling back: {}", what, e.getMessage());
            return Optional.empty();
        }
    }

    private List<MemoryResult> fallback(MemoryQuery query, String reason) {
        metrics.recallFallbacks().increment();
        log.debug("{} recall falls back to keyword search: {}", query.type(), reason);
        return fastStore.recall(query.text(), query.limit());
    }

    private List<MemoryResult> touched(List<MemoryResult> results) {
        fastStore.recordAccess(results.stream().map(MemoryResult::id).toList());
        return results;
    }

    private static List<MemoryResult> toResults(List<MemoryNode> nodes) {
        return nodes.stream().map(MemoryNode::toResult).toList();
    }

    @FunctionalInterface
    private interface GraphRead<T> {
        T run();
    }
}
