package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.history.IngestionHistoryStore;
import com.ingestmanager.ingestmanager.schedule.LoadedSchedule;
import com.ingestmanager.ingestmanager.schedule.ScheduleLoader;
import com.ingestmanager.ingestmanager.schedule.TriggerEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

/**
 * Process entry point: {@code --schedule=<file>} with {@code --once} or {@code --poll=<seconds>},
 * optionally {@code --async}. Without a run mode the application only serves the read API.
 */
@Component
public class IngestionRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

    private final ScheduleLoader scheduleLoader;
    private final JobExecutor jobExecutor;
    private final TriggerEvaluator triggerEvaluator;
    private final IngestionHistoryStore historyStore;
    private final IngestionProperties ingestionProperties;
    private final Clock clock;
    private final ThreadPoolTaskExecutor ingestionTaskExecutor;
    private final ThreadPoolTaskScheduler ingestionTaskScheduler;

    private volatile SchedulerLoop schedulerLoop;
    private volatile ScheduledFuture<?> polling;
    private volatile int exitCode;

    public IngestionRunner(
            ScheduleLoader scheduleLoader,
            JobExecutor jobExecutor,
            TriggerEvaluator triggerEvaluator,
            IngestionHistoryStore historyStore,
            IngestionProperties ingestionProperties,
            Clock clock,
            ThreadPoolTaskExecutor ingestionTaskExecutor,
            ThreadPoolTaskScheduler ingestionTaskScheduler) {
        this.scheduleLoader = scheduleLoader;
        this.jobExecutor = jobExecutor;
        this.triggerEvaluator = triggerEvaluator;
        this.historyStore = historyStore;
        this.ingestionProperties = ingestionProperties;
        this.clock = clock;
        this.ingestionTaskExecutor = ingestionTaskExecutor;
        this.ingestionTaskScheduler = ingestionTaskScheduler;
    }

    @Override
    public void run(ApplicationArguments args) {
        boolean once = args.containsOption(IngestionConstants.OPTION_ONCE);
        Duration pollPeriod = parsePollPeriod(args);
        if (once && pollPeriod != null) {
            throw new IllegalArgumentException(IngestionConstants.MSG_CONFLICTING_MODES);
        }
        boolean concurrent = args.containsOption(IngestionConstants.OPTION_ASYNC);
        Optional<Path> schedulePath = resolveSchedulePath(args);

        if (!once && pollPeriod == null) {
            schedulePath.ifPresent(path -> schedulerLoop = createLoop(scheduleLoader.load(path), concurrent));
            log.info("No run mode requested (--once or --poll=<seconds>); serving read API only");
            return;
        }

        Path path = schedulePath.orElseThrow(() -> new IllegalArgumentException(IngestionConstants.MSG_SCHEDULE_REQUIRED));
        LoadedSchedule schedule = scheduleLoader.load(path);
        schedulerLoop = createLoop(schedule, concurrent);

        if (once) {
            List<ExecutionResult> results = schedulerLoop.runOnce();
            long failed = results.stream().filter(result -> !result.succeeded()).count();
            boolean allRan = results.size() == schedule.jobs().size();
            exitCode = failed == 0 && allRan && schedule.rejected().isEmpty() ? 0 : 1;
            log.info("Single pass complete. jobs={}, failed={}, rejected={}",
                    results.size(), failed, schedule.rejected().size());
            return;
        }

        ScheduledFuture<?> previous = polling;
        if (previous != null) {
            previous.cancel(false);
        }
        polling = schedulerLoop.schedule(ingestionTaskScheduler, pollPeriod);
    }

    public Optional<SchedulerLoop> currentLoop() {
        return Optional.ofNullable(schedulerLoop);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private SchedulerLoop createLoop(LoadedSchedule schedule, boolean concurrent) {
        RunState runState = new RunState();
        if (ingestionProperties.isRestoreRunState()) {
            runState.restore(historyStore.findLastRunStartedAtByJob());
        }
        return new SchedulerLoop(
                schedule.jobs(), jobExecutor, triggerEvaluator, runState, clock, ingestionTaskExecutor, concurrent);
    }

    private Duration parsePollPeriod(ApplicationArguments args) {
        if (!args.containsOption(IngestionConstants.OPTION_POLL)) {
            return null;
        }
        List<String> values = args.getOptionValues(IngestionConstants.OPTION_POLL);
        String raw = values == null || values.isEmpty() ? "" : values.get(values.size() - 1);
        try {
            long seconds = Long.parseLong(raw.trim());
            if (seconds <= 0) {
                throw new IllegalArgumentException(IngestionConstants.MSG_INVALID_POLL.formatted(raw));
            }
            return Duration.ofSeconds(seconds);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(IngestionConstants.MSG_INVALID_POLL.formatted(raw), ex);
        }
    }

    private Optional<Path> resolveSchedulePath(ApplicationArguments args) {
        List<String> values = args.getOptionValues(IngestionConstants.OPTION_SCHEDULE);
        if (values != null && !values.isEmpty() && !values.get(values.size() - 1).isBlank()) {
            return Optional.of(Path.of(values.get(values.size() - 1).trim()));
        }
        String configured = ingestionProperties.getScheduleFile();
        return configured == null || configured.isBlank() ? Optional.empty() : Optional.of(Path.of(configured.trim()));
    }
}
