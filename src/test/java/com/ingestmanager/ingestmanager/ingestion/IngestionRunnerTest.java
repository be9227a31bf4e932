package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.MutableClock;
import com.ingestmanager.ingestmanager.ScriptedDataFetcher;
import com.ingestmanager.ingestmanager.TestIngestionConfig;
import com.ingestmanager.ingestmanager.history.IngestionHistoryRecord;
import com.ingestmanager.ingestmanager.scd2.EntityVersion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@Import(TestIngestionConfig.class)
class IngestionRunnerTest {

    @Autowired
    private IngestionRunner ingestionRunner;

    @Autowired
    private IngestionController ingestionController;

    @Autowired
    private ScriptedDataFetcher scriptedDataFetcher;

    @Autowired
    private MutableClock clock;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @TempDir
    Path tempDir;

    @BeforeEach
    void reset() {
        TestIngestionConfig.clearTables(jdbcTemplate);
        scriptedDataFetcher.reset();
        clock.set(TestIngestionConfig.START);
    }

    @Test
    void shouldRunEveryJobOnceAndExposeResults() throws IOException {
        Path schedule = writeSchedule("""
                {"jobs": [
                  {"name": "mock-tx", "trigger": {"type": "interval", "seconds": 3600}, "args": {"source": "mock", "limit": 3}},
                  {"name": "nightly", "trigger": {"type": "daily", "time": "23:30"}, "args": {"source": "mock", "limit": 2, "entity": "nightly_tx"}}
                ]}
                """);

        ingestionRunner.run(new DefaultApplicationArguments("--once", "--schedule=" + schedule));

        assertEquals(0, ingestionRunner.getExitCode());
        List<IngestionHistoryRecord> history = ingestionController.getHistory(10).getBody();
        assertNotNull(history);
        assertEquals(2, history.size());
        assertEquals("nightly", history.get(0).jobName());

        List<EntityVersion> current = ingestionController.getCurrentVersions("transactions").getBody();
        assertNotNull(current);
        assertEquals(3, current.size());
        assertEquals(1, ingestionController.getVersionHistory("nightly_tx", "mock-1").getBody().size());

        List<IngestionModels.JobStatusResponse> jobs = ingestionController.getJobs().getBody();
        assertNotNull(jobs);
        assertEquals(List.of("mock-tx", "nightly"), jobs.stream().map(IngestionModels.JobStatusResponse::name).toList());
        assertEquals("INTERVAL", jobs.get(0).triggerType());
        assertEquals(TestIngestionConfig.START.plusSeconds(3600), jobs.get(0).nextEligibleAt());
        assertFalse(jobs.get(0).running());
    }

    @Test
    void shouldExitNonZeroWhenAJobFailsOrIsRejected() throws IOException {
        scriptedDataFetcher.enqueueFailure(new IllegalStateException("boom"));
        Path failing = writeSchedule("""
                [{"name": "broken", "trigger": {"type": "interval", "seconds": 60}, "args": {"source": "scripted"}}]
                """);
        ingestionRunner.run(new DefaultApplicationArguments("--once", "--schedule=" + failing));
        assertEquals(1, ingestionRunner.getExitCode());

        Path rejected = writeSchedule("""
                [{"name": "ok", "trigger": {"type": "interval", "seconds": 60}, "args": {"source": "mock"}},
                 {"name": "cron", "trigger": {"type": "cron"}, "args": {"source": "mock"}}]
                """);
        ingestionRunner.run(new DefaultApplicationArguments("--once", "--schedule=" + rejected));
        assertEquals(1, ingestionRunner.getExitCode());
    }

    @Test
    void shouldPollOnTheTaskScheduler() throws Exception {
        Path schedule = writeSchedule("""
                [{"name": "polled", "trigger": {"type": "interval", "seconds": 3600}, "args": {"source": "mock", "limit": 1, "entity": "polled_tx"}}]
                """);

        ingestionRunner.run(new DefaultApplicationArguments("--poll=60", "--schedule=" + schedule));

        long deadline = System.currentTimeMillis() + 5_000;
        while (ingestionController.getHistory(10).getBody().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        List<IngestionHistoryRecord> history = ingestionController.getHistory(10).getBody();
        assertEquals(1, history.size());
        assertEquals("polled", history.get(0).jobName());
        assertEquals(TestIngestionConfig.START,
                ingestionRunner.currentLoop().orElseThrow().getRunState().lastRunAt("polled"));
    }

    @Test
    void shouldRejectInvalidRunModes() throws IOException {
        Path schedule = writeSchedule("[]");

        assertThrows(IllegalArgumentException.class, () -> ingestionRunner.run(
                new DefaultApplicationArguments("--once", "--poll=5", "--schedule=" + schedule)));
        assertThrows(IllegalArgumentException.class, () -> ingestionRunner.run(
                new DefaultApplicationArguments("--poll=0", "--schedule=" + schedule)));
        assertThrows(IllegalArgumentException.class, () -> ingestionRunner.run(
                new DefaultApplicationArguments("--poll=soon", "--schedule=" + schedule)));
        assertThrows(IllegalArgumentException.class, () -> ingestionRunner.run(
                new DefaultApplicationArguments("--once")));
    }

    @Test
    void shouldRejectInvalidEntityNamesInReadApi() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> ingestionController.getCurrentVersions("bad-name"));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ingestionController.getHistory(0).getBody().isEmpty());
    }

    private Path writeSchedule(String json) throws IOException {
        Path file = Files.createTempFile(tempDir, "schedule", ".json");
        Files.writeString(file, json, StandardCharsets.UTF_8);
        return file;
    }
}
