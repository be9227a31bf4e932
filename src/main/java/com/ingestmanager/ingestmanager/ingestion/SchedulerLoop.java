package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.schedule.JobDefinition;
import com.ingestmanager.ingestmanager.schedule.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives repeated evaluation of a fixed job list: a single forced pass, one polling iteration,
 * or polling on a task scheduler until cancelled. Due jobs run in list order, or all at once on the
 * task executor when concurrent dispatch is enabled.
 */
public class SchedulerLoop {

    private static final Logger log = LoggerFactory.getLogger(SchedulerLoop.class);

    private final List<JobDefinition> jobs;
    private final JobExecutor jobExecutor;
    private final TriggerEvaluator triggerEvaluator;
    private final RunState runState;
    private final Clock clock;
    private final AsyncTaskExecutor taskExecutor;
    private final boolean concurrent;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public SchedulerLoop(
            List<JobDefinition> jobs,
            JobExecutor jobExecutor,
            TriggerEvaluator triggerEvaluator,
            RunState runState,
            Clock clock,
            AsyncTaskExecutor taskExecutor,
            boolean concurrent) {
        if (concurrent && taskExecutor == null) {
            throw new IllegalArgumentException("Concurrent dispatch requires a task executor");
        }
        this.jobs = List.copyOf(jobs);
        this.jobExecutor = jobExecutor;
        this.triggerEvaluator = triggerEvaluator;
        this.runState = runState;
        this.clock = clock;
        this.taskExecutor = taskExecutor;
        this.concurrent = concurrent;
    }

    /**
     * Executes every job once regardless of its trigger.
     */
    public List<ExecutionResult> runOnce() {
        log.info("Running {} jobs once (concurrent={})", jobs.size(), concurrent);
        return dispatch(jobs);
    }

    /**
     * Executes the jobs that are due now.
     */
    public List<ExecutionResult> runIteration() {
        Instant now = clock.instant();
        List<JobDefinition> due = new ArrayList<>();
        for (JobDefinition job : jobs) {
            if (triggerEvaluator.isDue(job.trigger(), runState.lastRunAt(job.name()), now)) {
                due.add(job);
            }
        }
        if (due.isEmpty()) {
            log.debug("No jobs due at {}", now);
            return List.of();
        }
        return dispatch(due);
    }

    /**
     * Schedules {@link #runIteration()} on {@code taskScheduler} with a start-to-start period.
     * Cancel the returned future, or shut the scheduler down, to stop polling.
     */
    public ScheduledFuture<?> schedule(TaskScheduler taskScheduler, Duration period) {
        PollingTrigger trigger = new PollingTrigger(period);
        log.info("Polling {} jobs every {}s (concurrent={})", jobs.size(), period.toSeconds(), concurrent);
        return taskScheduler.schedule(this::pollIteration, trigger);
    }

    public List<JobDefinition> getJobs() {
        return jobs;
    }

    public RunState getRunState() {
        return runState;
    }

    public boolean isInFlight(String jobName) {
        return inFlight.contains(jobName);
    }

    private void pollIteration() {
        try {
            runIteration();
        } catch (RuntimeException ex) {
            log.error("Polling iteration failed", ex);
        }
    }

    private List<ExecutionResult> dispatch(List<JobDefinition> batch) {
        return concurrent ? dispatchConcurrently(batch) : dispatchSequentially(batch);
    }

    private List<ExecutionResult> dispatchSequentially(List<JobDefinition> batch) {
        List<ExecutionResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            try {
                executeGuarded(batch.get(i)).ifPresent(results::add);
            } catch (StorageUnavailableException ex) {
                log.error("{}; skipping {} remaining jobs until the next iteration",
                        ex.getMessage(), batch.size() - i - 1);
                break;
            }
        }
        return results;
    }

    /**
     * Submits the batch to the task executor and waits for every job. The first storage outage stops
     * jobs that have not started yet; jobs already running complete normally.
     */
    private List<ExecutionResult> dispatchConcurrently(List<JobDefinition> batch) {
        AtomicBoolean storageUnavailable = new AtomicBoolean();
        List<Future<Optional<ExecutionResult>>> futures = new ArrayList<>(batch.size());
        for (JobDefinition job : batch) {
            futures.add(taskExecutor.submit(() -> {
                if (storageUnavailable.get()) {
                    return Optional.<ExecutionResult>empty();
                }
                try {
                    return executeGuarded(job);
                } catch (StorageUnavailableException ex) {
                    storageUnavailable.set(true);
                    throw ex;
                }
            }));
        }

        List<ExecutionResult> results = new ArrayList<>(batch.size());
        for (int i = 0; i < futures.size(); i++) {
            try {
                futures.get(i).get().ifPresent(results::add);
            } catch (CancellationException ex) {
                log.debug("Job {} was cancelled before it started", batch.get(i).name());
            } catch (ExecutionException ex) {
                Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                if (cause instanceof StorageUnavailableException) {
                    log.error("{}; skipping jobs not yet started until the next iteration", cause.getMessage());
                    futures.subList(i + 1, futures.size()).forEach(future -> future.cancel(false));
                } else {
                    log.error("Job {} did not complete: {}", batch.get(i).name(), cause.getMessage());
                }
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                futures.forEach(future -> future.cancel(true));
                break;
            }
        }
        return results;
    }

    /**
     * Runs a job unless a previous execution of it is still outstanding, then records its run time.
     * A storage outage leaves the run time untouched so the job is retried on the next iteration.
     */
    private Optional<ExecutionResult> executeGuarded(JobDefinition job) {
        if (!inFlight.add(job.name())) {
            log.warn("Job {} is still running; skipping this iteration", job.name());
            return Optional.empty();
        }
        try {
            ExecutionResult result = jobExecutor.execute(job);
            runState.markRun(job.name(), result.startedAt());
            return Optional.of(result);
        } catch (StorageUnavailableException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            log.error("Job {} aborted unexpectedly", job.name(), ex);
            runState.markRun(job.name(), clock.instant());
            return Optional.empty();
        } finally {
            inFlight.remove(job.name());
        }
    }
}
