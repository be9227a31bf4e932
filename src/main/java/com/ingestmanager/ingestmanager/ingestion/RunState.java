package com.ingestmanager.ingestmanager.ingestion;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last run instant per job name. Written only after an execution result is known.
 */
public class RunState {

    private final Map<String, Instant> lastRuns = new ConcurrentHashMap<>();

    public Instant lastRunAt(String jobName) {
        return lastRuns.get(jobName);
    }

    public void markRun(String jobName, Instant runAt) {
        lastRuns.merge(jobName, runAt, (previous, next) -> next.isAfter(previous) ? next : previous);
    }

    public void restore(Map<String, Instant> persisted) {
        persisted.forEach(this::markRun);
    }
}
