package com.ingestmanager.ingestmanager.ingestion;

/**
 * Raised when the entity or history store cannot be reached during a run.
 */
public class StorageUnavailableException extends IllegalStateException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
