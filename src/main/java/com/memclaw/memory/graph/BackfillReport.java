package com.memclaw.memory.graph;

/** Outcome of a graph backfill pass over the Fast Store. */
public record BackfillReport(int total, int processed, int skipped, int errors, boolean dryRun) {

    public String summary() {
        return String.format("%s: %d memories, %d indexed, %d already present, %d errors",
                dryRun ? "Backfill (dry run)" : "Backfill", total, processed, skipped, errors);
    }
}
