package com.ingestmanager.ingestmanager.ingestion;

/**
 * Shared constants for the ingestion runner.
 */
public final class IngestionConstants {

    private IngestionConstants() {
    }

    public static final String DEFAULT_ZONE_ID = "UTC";
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final int DEFAULT_SCD2_LOCK_STRIPES = 64;
    public static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 10;
    public static final int DEFAULT_HISTORY_LIMIT = 50;
    public static final int MAX_HISTORY_LIMIT = 500;

    public static final String HISTORY_TABLE = "ingestion_history";
    public static final String ENTITY_VERSION_TABLE = "scd2_entity_version";

    public static final String ARG_SOURCE = "source";
    public static final String ARG_ENTITY = "entity";
    public static final String ARG_KEY_FIELDS = "key_fields";
    public static final String BUSINESS_KEY_SEPARATOR = "|";

    public static final String VALID_ENTITY_NAME_REGEX = "[a-zA-Z_][a-zA-Z0-9_]*";

    public static final String OPTION_ONCE = "once";
    public static final String OPTION_POLL = "poll";
    public static final String OPTION_ASYNC = "async";
    public static final String OPTION_SCHEDULE = "schedule";

    public static final String SCHEDULER_THREAD_PREFIX = "ingestion-scheduler-";
    public static final String WORKER_THREAD_PREFIX = "ingestion-job-";

    public static final String MSG_SOURCE_MISSING = "Job '%s' does not declare a '" + ARG_SOURCE + "' argument";
    public static final String MSG_UNKNOWN_SOURCE = "Unknown data source '%s'. Available sources: %s";
    public static final String MSG_MISSING_KEY_FIELD = "Record is missing business key field '%s'";
    public static final String MSG_INVALID_ENTITY = "Invalid entity name: %s";
    public static final String MSG_INTERRUPTED = "Interrupted after %d records";
    public static final String MSG_STORAGE_UNAVAILABLE = "Storage unavailable while running job '%s'";
    public static final String MSG_CONFLICTING_MODES = "--once and --poll cannot be combined";
    public static final String MSG_INVALID_POLL = "--poll requires a positive number of seconds, got: %s";
    public static final String MSG_SCHEDULE_REQUIRED = "A schedule file is required (--schedule=<file>)";
}
