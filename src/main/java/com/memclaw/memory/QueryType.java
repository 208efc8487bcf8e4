package com.memclaw.memory;

import java.util.Locale;

public enum QueryType {
    /** Keyword scoring against the fast store. */
    QUICK,
    /** Embedding similarity, then shared topics, then keyword. */
    SEMANTIC,
    /** Graph walk over RELATED_TO / FOLLOWS edges from the newest matching memory. */
    CONTEXT,
    /** Memories mentioning the same entities as the query. */
    RELATED;

    public static QueryType parse(String value) {
        if (value == null || value.isBlank()) return QUICK;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown query type: " + value, e);
        }
    }
}
