package com.memclaw.memory;

/**
 * The fast store could not read or write: disk full, corrupted file, closed data source.
 * Not recoverable locally.
 */
public class MemoryStorageException extends RuntimeException {

    public MemoryStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
