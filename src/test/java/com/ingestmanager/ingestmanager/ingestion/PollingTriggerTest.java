package com.ingestmanager.ingestmanager.ingestion;

import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.SimpleTriggerContext;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PollingTriggerTest {

    private static final Instant NOW = Instant.parse("2025-03-03T08:00:00Z");

    private final PollingTrigger trigger = new PollingTrigger(Duration.ofSeconds(10));

    @Test
    void firstIterationRunsImmediately() {
        SimpleTriggerContext context = new SimpleTriggerContext(Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(NOW, trigger.nextExecution(context));
    }

    @Test
    void periodIsMeasuredStartToStart() {
        SimpleTriggerContext context = new SimpleTriggerContext(NOW, NOW, NOW.plusSeconds(3));

        assertEquals(NOW.plusSeconds(10), trigger.nextExecution(context));
    }

    @Test
    void overrunStartsNextIterationImmediatelyWithoutReplay() {
        Instant finished = NOW.plusSeconds(35);
        SimpleTriggerContext context = new SimpleTriggerContext(NOW, NOW, finished);

        assertEquals(finished, trigger.nextExecution(context));
    }

    @Test
    void rejectsNonPositivePeriod() {
        assertThrows(IllegalArgumentException.class, () -> new PollingTrigger(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new PollingTrigger(Duration.ofSeconds(-1)));
    }
}
