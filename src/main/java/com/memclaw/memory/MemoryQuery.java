package com.memclaw.memory;

public record MemoryQuery(QueryType type, String text, int limit, int contextDepth) {

    public static final int DEFAULT_LIMIT = 5;
    public static final int DEFAULT_CONTEXT_DEPTH = 2;

    public MemoryQuery {
        if (type == null) throw new IllegalArgumentException("query type is required");
        if (text == null) text = "";
        if (limit < 1) throw new IllegalArgumentException("limit must be positive: " + limit);
        if (contextDepth < 1) contextDepth = 1;
    }

    public static MemoryQuery of(QueryType type, String text) {
        return new MemoryQuery(type, text, DEFAULT_LIMIT, DEFAULT_CONTEXT_DEPTH);
    }

    public static MemoryQuery quick(String text) {
        return of(QueryType.QUICK, text);
    }

    public static MemoryQuery semantic(String text) {
        return of(QueryType.SEMANTIC, text);
    }

    public static MemoryQuery context(String text, int depth) {
        return new MemoryQuery(QueryType.CONTEXT, text, DEFAULT_LIMIT, depth);
    }

    public static MemoryQuery related(String text) {
        return of(QueryType.RELATED, text);
    }

    public MemoryQuery withLimit(int limit) {
        return new MemoryQuery(type, text, limit, contextDepth);
    }
}
