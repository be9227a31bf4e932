package com.ingestmanager.ingestmanager.scd2;

import java.time.Instant;

/**
 * Raised when an upsert is not strictly later than the current version of its key.
 */
public class PersistenceOrderingException extends IllegalStateException {

    public PersistenceOrderingException(String entityName, String businessKey, Instant at, Instant currentValidFrom) {
        super("Rejected out-of-order write for %s[%s]: %s is not after current version start %s"
                .formatted(entityName, businessKey, at, currentValidFrom));
    }
}
