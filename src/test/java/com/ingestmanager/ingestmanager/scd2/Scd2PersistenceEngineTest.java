package com.ingestmanager.ingestmanager.scd2;

import com.ingestmanager.ingestmanager.TestIngestionConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@Import(TestIngestionConfig.class)
class Scd2PersistenceEngineTest {

    private static final String ENTITY = "accounts";
    private static final Instant T1 = Instant.parse("2025-03-03T08:00:00Z");
    private static final Instant T2 = Instant.parse("2025-03-03T09:00:00Z");
    private static final Instant T3 = Instant.parse("2025-03-03T10:00:00Z");

    @Autowired
    private Scd2PersistenceEngine persistenceEngine;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void resetTables() {
        TestIngestionConfig.clearTables(jdbcTemplate);
    }

    @Test
    void shouldInsertFirstVersionAsCurrent() {
        UpsertOutcome outcome = persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 100), T1);

        assertEquals(UpsertOutcome.INSERTED, outcome);
        EntityVersion current = persistenceEngine.findCurrentVersion(ENTITY, "A-1").orElseThrow();
        assertEquals(T1, current.validFrom());
        assertNull(current.validTo());
        assertTrue(current.current());
        assertEquals("{\"balance\":100}", current.payload());
    }

    @Test
    void shouldIgnoreIdenticalPayloadRegardlessOfKeyOrder() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("balance", 100);
        first.put("owner", "kim");
        Map<String, Object> reordered = new LinkedHashMap<>();
        reordered.put("owner", "kim");
        reordered.put("balance", 100);

        persistenceEngine.upsert(ENTITY, "A-1", first, T1);
        UpsertOutcome outcome = persistenceEngine.upsert(ENTITY, "A-1", reordered, T2);

        assertEquals(UpsertOutcome.UNCHANGED, outcome);
        assertEquals(1, persistenceEngine.countVersions(ENTITY, "A-1"));
        assertEquals(T1, persistenceEngine.findCurrentVersion(ENTITY, "A-1").orElseThrow().validFrom());
    }

    @Test
    void shouldCloseCurrentVersionWhenPayloadChanges() {
        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 100), T1);
        UpsertOutcome outcome = persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 250), T2);

        assertEquals(UpsertOutcome.VERSIONED, outcome);
        List<EntityVersion> history = persistenceEngine.findVersionHistory(ENTITY, "A-1");
        assertEquals(2, history.size());

        EntityVersion closed = history.get(0);
        assertFalse(closed.current());
        assertEquals(T1, closed.validFrom());
        assertEquals(T2, closed.validTo());

        EntityVersion open = history.get(1);
        assertTrue(open.current());
        assertEquals(T2, open.validFrom());
        assertNull(open.validTo());
    }

    @Test
    void shouldKeepVersionsContiguousAcrossSeveralChanges() {
        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 1), T1);
        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 2), T2);
        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 3), T3);

        List<EntityVersion> history = persistenceEngine.findVersionHistory(ENTITY, "A-1");
        assertEquals(3, history.size());
        for (int i = 0; i < history.size() - 1; i++) {
            assertEquals(history.get(i + 1).validFrom(), history.get(i).validTo());
            assertTrue(history.get(i).validFrom().isBefore(history.get(i).validTo()));
        }
        assertEquals(1, history.stream().filter(EntityVersion::current).count());
    }

    @Test
    void shouldRejectOutOfOrderWriteAndLeaveStateUnchanged() {
        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 100), T2);

        assertThrows(PersistenceOrderingException.class,
                () -> persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 999), T1));
        assertThrows(PersistenceOrderingException.class,
                () -> persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 999), T2));
        // identical payloads are subject to the same ordering check
        assertThrows(PersistenceOrderingException.class,
                () -> persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 100), T1));

        List<EntityVersion> history = persistenceEngine.findVersionHistory(ENTITY, "A-1");
        assertEquals(1, history.size());
        assertEquals("{\"balance\":100}", history.get(0).payload());
        assertTrue(history.get(0).current());
    }

    @Test
    void shouldKeepSubMillisecondOrderingAndPrecision() {
        Instant first = Instant.parse("2025-03-03T08:00:00.000100Z");
        Instant second = first.plusNanos(500_000);
        Instant third = second.plusNanos(1);

        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 1), first);
        assertEquals(UpsertOutcome.VERSIONED, persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 2), second));
        assertEquals(UpsertOutcome.VERSIONED, persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 3), third));
        assertThrows(PersistenceOrderingException.class,
                () -> persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 4), third));

        List<EntityVersion> history = persistenceEngine.findVersionHistory(ENTITY, "A-1");
        assertEquals(3, history.size());
        assertEquals(first, history.get(0).validFrom());
        assertEquals(second, history.get(0).validTo());
        assertEquals(second, history.get(1).validFrom());
        assertEquals(third, history.get(1).validTo());
        assertEquals(third, history.get(2).validFrom());
    }

    @Test
    void shouldKeepKeysAndEntitiesIndependent() {
        persistenceEngine.upsert(ENTITY, "A-1", Map.of("balance", 1), T1);
        persistenceEngine.upsert(ENTITY, "A-2", Map.of("balance", 1), T1);
        persistenceEngine.upsert("customers", "A-1", Map.of("name", "lee"), T1);
        persistenceEngine.upsert(ENTITY, "A-2", Map.of("balance", 2), T2);

        assertEquals(1, persistenceEngine.countVersions(ENTITY, "A-1"));
        assertEquals(2, persistenceEngine.countVersions(ENTITY, "A-2"));
        assertEquals(1, persistenceEngine.countVersions("customers", "A-1"));
        assertEquals(List.of("A-1", "A-2"),
                persistenceEngine.findCurrentVersions(ENTITY).stream().map(EntityVersion::businessKey).toList());
    }

    @Test
    void shouldRejectInvalidEntityNameAndBlankKey() {
        assertThrows(IllegalArgumentException.class,
                () -> persistenceEngine.upsert("accounts; DROP TABLE x", "A-1", Map.of(), T1));
        assertThrows(IllegalArgumentException.class,
                () -> persistenceEngine.upsert(ENTITY, " ", Map.of(), T1));
    }

    @Test
    void shouldKeepSingleCurrentVersionUnderConcurrentWriters() throws Exception {
        int writers = 8;
        ExecutorService pool = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<UpsertOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                int value = i;
                Instant at = T1.plusSeconds(i);
                Callable<UpsertOutcome> task = () -> {
                    start.await();
                    try {
                        return persistenceEngine.upsert(ENTITY, "HOT", Map.of("balance", value), at);
                    } catch (PersistenceOrderingException ex) {
                        return null;
                    }
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            for (Future<UpsertOutcome> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        List<EntityVersion> history = persistenceEngine.findVersionHistory(ENTITY, "HOT");
        assertEquals(1, history.stream().filter(EntityVersion::current).count());
        for (int i = 0; i < history.size() - 1; i++) {
            assertEquals(history.get(i + 1).validFrom(), history.get(i).validTo());
        }
    }
}
