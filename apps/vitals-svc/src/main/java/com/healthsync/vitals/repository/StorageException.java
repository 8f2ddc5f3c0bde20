package com.healthsync.vitals.repository;

/**
 * Raised for any durable-store I/O or transaction failure. Callers decide whether to retry.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
