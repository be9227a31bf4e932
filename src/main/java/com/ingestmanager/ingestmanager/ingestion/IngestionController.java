package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.history.IngestionHistoryRecord;
import com.ingestmanager.ingestmanager.history.IngestionHistoryStore;
import com.ingestmanager.ingestmanager.schedule.JobDefinition;
import com.ingestmanager.ingestmanager.schedule.TriggerEvaluator;
import com.ingestmanager.ingestmanager.scd2.EntityVersion;
import com.ingestmanager.ingestmanager.scd2.Scd2PersistenceEngine;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only view of the loaded schedule, the run history and the versioned entities.
 */
@RestController
@RequestMapping("/api/ingestion")
public class IngestionController {

    private final IngestionRunner ingestionRunner;
    private final TriggerEvaluator triggerEvaluator;
    private final IngestionHistoryStore historyStore;
    private final Scd2PersistenceEngine persistenceEngine;

    public IngestionController(
            IngestionRunner ingestionRunner,
            TriggerEvaluator triggerEvaluator,
            IngestionHistoryStore historyStore,
            Scd2PersistenceEngine persistenceEngine) {
        this.ingestionRunner = ingestionRunner;
        this.triggerEvaluator = triggerEvaluator;
        this.historyStore = historyStore;
        this.persistenceEngine = persistenceEngine;
    }

    /**
     * Returns the loaded jobs with their last run and next eligible time.
     */
    @GetMapping("/jobs")
    public ResponseEntity<List<IngestionModels.JobStatusResponse>> getJobs() {
        List<IngestionModels.JobStatusResponse> jobs = new ArrayList<>();
        ingestionRunner.currentLoop().ifPresent(loop -> {
            for (JobDefinition job : loop.getJobs()) {
                Instant lastRunAt = loop.getRunState().lastRunAt(job.name());
                jobs.add(new IngestionModels.JobStatusResponse(
                        job.name(),
                        job.trigger().kind().name(),
                        job.trigger().toString(),
                        lastRunAt,
                        triggerEvaluator.nextEligible(job.trigger(), lastRunAt),
                        loop.isInFlight(job.name())
                ));
            }
        });
        return ResponseEntity.ok(jobs);
    }

    @GetMapping("/history")
    public ResponseEntity<List<IngestionHistoryRecord>> getHistory(
            @RequestParam(defaultValue = "" + IngestionConstants.DEFAULT_HISTORY_LIMIT) int limit) {
        return ResponseEntity.ok(historyStore.findRecent(clampLimit(limit)));
    }

    @GetMapping("/history/{jobName}")
    public ResponseEntity<List<IngestionHistoryRecord>> getJobHistory(
            @PathVariable String jobName,
            @RequestParam(defaultValue = "" + IngestionConstants.DEFAULT_HISTORY_LIMIT) int limit) {
        return ResponseEntity.ok(historyStore.findByJob(jobName, clampLimit(limit)));
    }

    @GetMapping("/entities/{entity}/current")
    public ResponseEntity<List<EntityVersion>> getCurrentVersions(@PathVariable String entity) {
        requireValidEntity(entity);
        return ResponseEntity.ok(persistenceEngine.findCurrentVersions(entity));
    }

    /**
     * Returns the full version chain of one business key, oldest first.
     */
    @GetMapping("/entities/{entity}/versions")
    public ResponseEntity<List<EntityVersion>> getVersionHistory(@PathVariable String entity, @RequestParam String key) {
        requireValidEntity(entity);
        if (key.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "key is required");
        }
        return ResponseEntity.ok(persistenceEngine.findVersionHistory(entity, key));
    }

    private int clampLimit(int limit) {
        return Math.max(1, Math.min(limit, IngestionConstants.MAX_HISTORY_LIMIT));
    }

    private void requireValidEntity(String entity) {
        if (!entity.matches(IngestionConstants.VALID_ENTITY_NAME_REGEX)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, IngestionConstants.MSG_INVALID_ENTITY.formatted(entity));
        }
    }
}
