package com.memclaw.observability;

import com.memclaw.memory.HybridMemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

public class DoctorCommand {

    private static final Logger log = LoggerFactory.getLogger(DoctorCommand.class);
    static final long BACKLOG_WARN_THRESHOLD = 100;

    private final HybridMemoryStore store;

    public DoctorCommand(HybridMemoryStore store) {
        this.store = store;
    }

    public String run() {
        var results = new ArrayList<String>();
        results.add(checkDatabase());
        results.add(checkGraph());
        results.add(checkEmbedding());
        results.add(checkBacklog());
        results.add(checkJavaVersion());
        return String.join("\n", results);
    }

    private String checkDatabase() {
        try (var conn = store.dataSource().getConnection();
             var ps = conn.prepareStatement("SELECT COUNT(*) FROM memories");
             var rs = ps.executeQuery()) {
            long count = rs.next() ? rs.getLong(1) : 0;
            return "[OK] Fast store reachable (" + count + " memories)";
        } catch (Exception e) {
            log.warn("Fast store check failed", e);
            return "[FAIL] Fast store: " + e.getMessage();
        }
    }

    private String checkGraph() {
        if (!store.graphAvailable()) {
            return "[WARN] Graph store unavailable (context and related recall fall back to keyword search)";
        }
        try {
            var stats = store.getStats().graphStore();
            return "[OK] Graph store (" + stats.nodeCount() + " nodes, " + stats.edgeCount() + " edges)";
        } catch (Exception e) {
            return "[FAIL] Graph store: " + e.getMessage();
        }
    }

    private String checkEmbedding() {
        var gate = store.embeddings();
        // forces the lazy load so the check reflects the real endpoint
        gate.embed("doctor");
        return gate.isAvailable()
                ? "[OK] Embedding model " + gate.modelName()
                : "[WARN] Embedding model unavailable (semantic recall uses topics)";
    }

    private String checkBacklog() {
        try {
            long pending = store.getStats().pendingSyncCount();
            return pending < BACKLOG_WARN_THRESHOLD
                    ? "[OK] Sync backlog: " + pending
                    : "[WARN] Sync backlog: " + pending + " entries waiting for the graph";
        } catch (Exception e) {
            return "[FAIL] Sync queue: " + e.getMessage();
        }
    }

    private String checkJavaVersion() {
        var ver = Runtime.version().feature();
        return ver >= 17
                ? "[OK] Java " + ver
                : "[WARN] Java " + ver + " (17+ required)";
    }
}
