package com.memclaw.gateway;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.memclaw.memory.HybridMemoryStore;
import com.memclaw.memory.Importance;
import com.memclaw.memory.MemoryQuery;
import com.memclaw.memory.QueryType;
import com.memclaw.observability.DoctorCommand;
import com.memclaw.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Map;

/** Admin entry point: {@code memclaw <stats|doctor|store|recall|backfill|sync> ...}. */
public class MemClawApp {

    private static final Logger log = LoggerFactory.getLogger(MemClawApp.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String USAGE = """
            usage: memclaw <command>
              stats                       counts per store, backlog, embedding model
              doctor                      health checks
              store <category> <text...>  store a memory
              recall <type> <text...>     quick | semantic | context | related
              backfill [--dry-run]        index memories missing from the graph
              sync                        drain the sync queue now""";

    private final HybridMemoryStore store;
    private final PrintStream out;

    public MemClawApp(HybridMemoryStore store, PrintStream out) {
        this.store = store;
        this.out = out;
    }

    public static void main(String[] args) throws Exception {
        var config = ConfigLoader.load();
        // one-shot commands drain explicitly, no background worker
        config = config.withSync(config.sync().withWorkerEnabled(false));
        int code;
        try (var store = HybridMemoryStore.open(config)) {
            code = new MemClawApp(store, System.out).run(args);
        }
        System.exit(code);
    }

    /** Runs one command and returns the process exit code. */
    public int run(String[] args) {
        if (args.length == 0) {
            out.println(USAGE);
            return 2;
        }
        try {
            return switch (args[0]) {
                case "stats" -> stats();
                case "doctor" -> doctor();
                case "store" -> store(args);
                case "recall" -> recall(args);
                case "backfill" -> backfill(args);
                case "sync" -> sync();
                default -> {
                    out.println("unknown command: " + args[0]);
                    out.println(USAGE);
                    yield 2;
                }
            };
        } catch (IllegalArgumentException | IllegalStateException e) {
            out.println("error: " + e.getMessage());
            return 1;
        }
    }

    private int stats() {
        try {
            out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(store.getStats()));
            return 0;
        } catch (JsonProcessingException e) {
            log.error("Failed to render stats", e);
            return 1;
        }
    }

    private int doctor() {
        var report = new DoctorCommand(store).run();
        out.println(report);
        return report.contains("[FAIL]") ? 1 : 0;
    }

    private int store(String[] args) {
        if (args.length < 3) throw new IllegalArgumentException("store needs a category and text");
        var text = String.join(" ", Arrays.copyOfRange(args, 2, args.length));
        long id = store.store(text, args[1], Importance.MEDIUM, Map.of("source", "cli"));
        out.println("stored #" + id);
        return 0;
    }

    private int recall(String[] args) {
        if (args.length < 3) throw new IllegalArgumentException("recall needs a type and text");
        var type = QueryType.parse(args[1]);
        var text = String.join(" ", Arrays.copyOfRange(args, 2, args.length));
        var results = store.recall(MemoryQuery.of(type, text));
        if (results.isEmpty()) {
            out.println("no memories found");
            return 0;
        }
        for (var r : results) {
            out.printf("#%d (%s) %s%n", r.id(), r.category(), r.content());
        }
        return 0;
    }

    private int backfill(String[] args) {
        boolean dryRun = args.length > 1 && "--dry-run".equals(args[1]);
        var report = store.backfill(dryRun);
        out.println(report.summary());
        return report.errors() > 0 ? 1 : 0;
    }

    private int sync() {
        var result = store.syncPending();
        out.printf("synced %d, failed %d%n", result.synced(), result.failed());
        return result.failed() > 0 ? 1 : 0;
    }
}
