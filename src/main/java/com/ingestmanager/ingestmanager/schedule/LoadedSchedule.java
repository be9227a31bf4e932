package com.ingestmanager.ingestmanager.schedule;

import java.util.List;

/**
 * Outcome of loading a schedule file: the accepted jobs in file order plus one message per rejected entry.
 */
public record LoadedSchedule(List<JobDefinition> jobs, List<String> rejected) {

    public LoadedSchedule {
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
        rejected = rejected == null ? List.of() : List.copyOf(rejected);
    }
}
