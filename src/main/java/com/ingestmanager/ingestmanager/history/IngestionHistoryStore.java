package com.ingestmanager.ingestmanager.history;

import com.ingestmanager.ingestmanager.ingestion.EpochNanos;
import com.ingestmanager.ingestmanager.ingestion.IngestionConstants;
import jakarta.annotation.PostConstruct;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only log of ingestion runs. Rows are never updated after insert; run instants are epoch nanoseconds.
 */
@Service
public class IngestionHistoryStore {

    private static final String TABLE = IngestionConstants.HISTORY_TABLE;
    private static final String SELECT_COLUMNS = "history_id, job_name, run_started_at, run_finished_at, "
            + "status, records_processed, versions_created, error_detail";

    private final JdbcTemplate jdbcTemplate;

    public IngestionHistoryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                + "history_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "job_name VARCHAR(256) NOT NULL, "
                + "run_started_at BIGINT NOT NULL, "
                + "run_finished_at BIGINT NOT NULL, "
                + "duration_ms BIGINT NOT NULL, "
                + "status VARCHAR(16) NOT NULL, "
                + "records_processed INT NOT NULL, "
                + "versions_created INT NOT NULL, "
                + "error_detail VARCHAR"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_ingestion_history_job_started ON "
                + TABLE + " (job_name, run_started_at)");
    }

    public void append(IngestionHistoryRecord record) {
        jdbcTemplate.update(
                "INSERT INTO " + TABLE + " (job_name, run_started_at, run_finished_at, duration_ms, status, "
                        + "records_processed, versions_created, error_detail) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                record.jobName(),
                EpochNanos.toNanos(record.runStartedAt()),
                EpochNanos.toNanos(record.runFinishedAt()),
                record.durationMs(),
                record.status().name(),
                record.recordsProcessed(),
                record.versionsCreated(),
                record.errorDetail()
        );
    }

    /**
     * Returns the most recent runs across all jobs, newest first.
     */
    public List<IngestionHistoryRecord> findRecent(int limit) {
        return jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM " + TABLE + " ORDER BY history_id DESC LIMIT ?",
                historyMapper(),
                limit
        );
    }

    public List<IngestionHistoryRecord> findByJob(String jobName, int limit) {
        return jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM " + TABLE
                        + " WHERE job_name = ? ORDER BY run_started_at DESC, history_id DESC LIMIT ?",
                historyMapper(),
                jobName,
                limit
        );
    }

    /**
     * Latest start time per job, used to restore run state after a restart.
     */
    public Map<String, Instant> findLastRunStartedAtByJob() {
        Map<String, Instant> lastRuns = new LinkedHashMap<>();
        jdbcTemplate.query(
                "SELECT job_name, MAX(run_started_at) AS last_started FROM " + TABLE + " GROUP BY job_name",
                (RowCallbackHandler) rs -> lastRuns.put(
                        rs.getString("job_name"), EpochNanos.fromNanos(rs.getLong("last_started")))
        );
        return lastRuns;
    }

    private RowMapper<IngestionHistoryRecord> historyMapper() {
        return (rs, rowNum) -> new IngestionHistoryRecord(
                rs.getLong("history_id"),
                rs.getString("job_name"),
                EpochNanos.fromNanos(rs.getLong("run_started_at")),
                EpochNanos.fromNanos(rs.getLong("run_finished_at")),
                RunStatus.valueOf(rs.getString("status")),
                rs.getInt("records_processed"),
                rs.getInt("versions_created"),
                rs.getString("error_detail")
        );
    }
}
