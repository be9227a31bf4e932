package com.ingestmanager.ingestmanager.history;

import java.time.Duration;
import java.time.Instant;

/**
 * One execution attempt of a job. {@code historyId} is 0 until the record has been stored.
 */
public record IngestionHistoryRecord(
        long historyId,
        String jobName,
        Instant runStartedAt,
        Instant runFinishedAt,
        RunStatus status,
        int recordsProcessed,
        int versionsCreated,
        String errorDetail
) {

    public long durationMs() {
        return Duration.between(runStartedAt, runFinishedAt).toMillis();
    }
}
