package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.history.RunStatus;

import java.time.Instant;

/**
 * Outcome of one job execution. On failure {@code recordsProcessed} counts the records applied before the error.
 */
public record ExecutionResult(
        String jobName,
        RunStatus status,
        int recordsProcessed,
        int versionsCreated,
        String error,
        Instant startedAt,
        Instant finishedAt
) {

    public boolean succeeded() {
        return status == RunStatus.SUCCESS;
    }
}
