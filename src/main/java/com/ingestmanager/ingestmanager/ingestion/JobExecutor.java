package com.ingestmanager.ingestmanager.ingestion;

import com.ingestmanager.ingestmanager.history.IngestionHistoryRecord;
import com.ingestmanager.ingestmanager.history.IngestionHistoryStore;
import com.ingestmanager.ingestmanager.history.RunStatus;
import com.ingestmanager.ingestmanager.schedule.JobDefinition;
import com.ingestmanager.ingestmanager.scd2.Scd2PersistenceEngine;
import com.ingestmanager.ingestmanager.scd2.UpsertOutcome;
import com.ingestmanager.ingestmanager.source.DataFetcher;
import com.ingestmanager.ingestmanager.source.DataFetcherRegistry;
import com.ingestmanager.ingestmanager.source.FetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Runs one job: fetches its records, versions each into the SCD2 store, and appends exactly one
 * history row for the attempt. Record application is fail-fast; the first failing record ends the run.
 */
@Service
public class JobExecutor {

    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final DataFetcherRegistry dataFetcherRegistry;
    private final Scd2PersistenceEngine persistenceEngine;
    private final IngestionHistoryStore historyStore;
    private final Clock clock;

    public JobExecutor(
            DataFetcherRegistry dataFetcherRegistry,
            Scd2PersistenceEngine persistenceEngine,
            IngestionHistoryStore historyStore,
            Clock clock) {
        this.dataFetcherRegistry = dataFetcherRegistry;
        this.persistenceEngine = persistenceEngine;
        this.historyStore = historyStore;
        this.clock = clock;
    }

    /**
     * Executes a job and records the attempt. Per-job failures are reported in the result, never thrown.
     *
     * @throws StorageUnavailableException when the store cannot be reached
     */
    public ExecutionResult execute(JobDefinition job) {
        Instant startedAt = clock.instant();
        int processed = 0;
        int versionsCreated = 0;
        String error = null;
        StorageUnavailableException storageFailure = null;

        try {
            DataFetcher fetcher = dataFetcherRegistry.resolve(sourceOf(job));
            String entityName = entityOf(job, fetcher);
            List<String> keyFields = keyFieldsOf(job, fetcher);
            List<Map<String, Object>> records = fetch(fetcher, job);

            for (Map<String, Object> record : records) {
                if (Thread.currentThread().isInterrupted()) {
                    error = IngestionConstants.MSG_INTERRUPTED.formatted(processed);
                    break;
                }
                UpsertOutcome outcome = persistenceEngine.upsert(entityName, businessKey(record, keyFields), record, startedAt);
                processed++;
                if (outcome.createdVersion()) {
                    versionsCreated++;
                }
            }
        } catch (DataAccessResourceFailureException ex) {
            storageFailure = new StorageUnavailableException(IngestionConstants.MSG_STORAGE_UNAVAILABLE.formatted(job.name()), ex);
            error = describe(ex);
        } catch (RuntimeException ex) {
            error = describe(ex);
        }

        RunStatus status = error == null ? RunStatus.SUCCESS : RunStatus.FAILURE;
        Instant finishedAt = clock.instant();
        IngestionHistoryRecord historyRecord = new IngestionHistoryRecord(
                0L, job.name(), startedAt, finishedAt, status, processed, versionsCreated, error);
        try {
            historyStore.append(historyRecord);
        } catch (DataAccessResourceFailureException ex) {
            log.error("Unable to record history for job {}: {}", job.name(), ex.getMessage());
            throw new StorageUnavailableException(IngestionConstants.MSG_STORAGE_UNAVAILABLE.formatted(job.name()), ex);
        }
        if (storageFailure != null) {
            throw storageFailure;
        }

        if (status == RunStatus.SUCCESS) {
            log.info("Job {} succeeded. records={}, newVersions={}", job.name(), processed, versionsCreated);
        } else {
            log.warn("Job {} failed after {} records: {}", job.name(), processed, error);
        }
        return new ExecutionResult(job.name(), status, processed, versionsCreated, error, startedAt, finishedAt);
    }

    private List<Map<String, Object>> fetch(DataFetcher fetcher, JobDefinition job) {
        try {
            List<Map<String, Object>> records = fetcher.fetch(job.args());
            return records == null ? List.of() : records;
        } catch (FetchException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new FetchException("Data source '" + fetcher.sourceName() + "' failed: " + ex.getMessage(), ex);
        }
    }

    private String sourceOf(JobDefinition job) {
        Object source = job.arg(IngestionConstants.ARG_SOURCE);
        if (source == null || String.valueOf(source).isBlank()) {
            throw new FetchException(IngestionConstants.MSG_SOURCE_MISSING.formatted(job.name()));
        }
        return String.valueOf(source);
    }

    private String entityOf(JobDefinition job, DataFetcher fetcher) {
        Object entity = job.arg(IngestionConstants.ARG_ENTITY);
        return entity == null ? fetcher.defaultEntityName() : String.valueOf(entity).trim();
    }

    private List<String> keyFieldsOf(JobDefinition job, DataFetcher fetcher) {
        Object declared = job.arg(IngestionConstants.ARG_KEY_FIELDS);
        List<String> keyFields = new ArrayList<>();
        if (declared instanceof List<?> list) {
            list.forEach(field -> keyFields.add(String.valueOf(field).trim()));
        } else if (declared != null) {
            for (String field : String.valueOf(declared).split(",")) {
                keyFields.add(field.trim());
            }
        } else {
            keyFields.addAll(fetcher.defaultKeyFields());
        }
        keyFields.removeIf(String::isEmpty);
        if (keyFields.isEmpty()) {
            throw new IllegalArgumentException("Job '" + job.name() + "' declares no business key fields");
        }
        return keyFields;
    }

    private String businessKey(Map<String, Object> record, List<String> keyFields) {
        StringJoiner key = new StringJoiner(IngestionConstants.BUSINESS_KEY_SEPARATOR);
        for (String field : keyFields) {
            Object value = record.get(field);
            if (value == null) {
                throw new IllegalArgumentException(IngestionConstants.MSG_MISSING_KEY_FIELD.formatted(field));
            }
            key.add(String.valueOf(value));
        }
        return key.toString();
    }

    private String describe(Throwable ex) {
        return ex.getClass().getSimpleName() + ": " + ex.getMessage();
    }
}
