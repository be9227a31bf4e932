package com.ingestmanager.ingestmanager.ingestion;

import org.springframework.scheduling.Trigger;
import org.springframework.scheduling.TriggerContext;

import java.time.Duration;
import java.time.Instant;

/**
 * Start-to-start polling cadence. The first iteration runs immediately; an iteration that overruns
 * the period is followed at once by the next, and the boundaries it missed are not replayed.
 */
public class PollingTrigger implements Trigger {

    private final Duration period;

    public PollingTrigger(Duration period) {
        if (period == null || period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("Poll period must be positive, got: " + period);
        }
        this.period = period;
    }

    public Duration getPeriod() {
        return period;
    }

    @Override
    public Instant nextExecution(TriggerContext triggerContext) {
        Instant lastStart = triggerContext.lastActualExecution();
        if (lastStart == null) {
            return triggerContext.getClock().instant();
        }
        Instant nextBoundary = lastStart.plus(period);
        Instant lastCompletion = triggerContext.lastCompletion();
        if (lastCompletion != null && lastCompletion.isAfter(nextBoundary)) {
            return lastCompletion;
        }
        return nextBoundary;
    }
}
