package com.ingestmanager.ingestmanager.source;

/**
 * Raised when a data source fails to produce the records of a run.
 */
public class FetchException extends RuntimeException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
