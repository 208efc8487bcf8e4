package com.memclaw.memory.graph;

/** One or more steps of indexing a memory failed; the queue entry stays pending. */
public class GraphSyncException extends Exception {

    public GraphSyncException(String message) {
        super(message);
    }

    public GraphSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
