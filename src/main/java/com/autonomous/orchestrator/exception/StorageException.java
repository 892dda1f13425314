package com.autonomous.orchestrator.exception;

/**
 * Transient failure of the object store. Callers retry with backoff.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
