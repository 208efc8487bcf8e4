package com.memclaw.memory.graph;

public class GraphStoreException extends RuntimeException {

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
