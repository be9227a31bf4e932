package com.ingestmanager.ingestmanager.scd2;

import java.time.Instant;

/**
 * One stored version of an entity. {@code validTo} is null while the version is current.
 */
public record EntityVersion(
        long versionId,
        String entityName,
        String businessKey,
        String payload,
        Instant validFrom,
        Instant validTo,
        boolean current
) {
}
