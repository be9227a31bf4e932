package com.ingestmanager.ingestmanager.scd2;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ingestmanager.ingestmanager.ingestion.EpochNanos;
import com.ingestmanager.ingestmanager.ingestion.IngestionConstants;
import com.ingestmanager.ingestmanager.ingestion.IngestionProperties;
import jakarta.annotation.PostConstruct;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Versions incoming entity records as a slowly changing dimension (type 2).
 * Each business key has at most one open version; a changed payload closes it and opens a new one
 * in a single transaction. Writes to one key are serialized through a striped lock, and the close
 * step is a compare-and-swap on {@code is_current} so a concurrent writer outside this process
 * cannot produce a second open version. Validity bounds are stored as epoch nanoseconds.
 */
@Service
public class Scd2PersistenceEngine {

    private static final String TABLE = IngestionConstants.ENTITY_VERSION_TABLE;
    private static final String SELECT_COLUMNS =
            "version_id, entity_name, business_key, payload, valid_from, valid_to, is_current";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper canonicalMapper;
    private final Clock clock;
    private final ReentrantLock[] keyLocks;

    public Scd2PersistenceEngine(
            JdbcTemplate jdbcTemplate,
            TransactionTemplate transactionTemplate,
            ObjectMapper objectMapper,
            Clock clock,
            IngestionProperties ingestionProperties) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.canonicalMapper = objectMapper.copy().configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
        this.clock = clock;
        this.keyLocks = new ReentrantLock[Math.max(1, ingestionProperties.getScd2LockStripes())];
        for (int i = 0; i < keyLocks.length; i++) {
            keyLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Creates the version table at startup so an unreachable store fails the process early.
     */
    @PostConstruct
    public void initializeSchema() {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS " + TABLE + " ("
                + "version_id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, "
                + "entity_name VARCHAR(128) NOT NULL, "
                + "business_key VARCHAR(1024) NOT NULL, "
                + "payload VARCHAR NOT NULL, "
                + "valid_from BIGINT NOT NULL, "
                + "valid_to BIGINT, "
                + "is_current BOOLEAN NOT NULL"
                + ")");
        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_scd2_entity_version_key ON "
                + TABLE + " (entity_name, business_key, is_current)");
    }

    public UpsertOutcome upsert(String entityName, String businessKey, Map<String, Object> payload) {
        return upsert(entityName, businessKey, payload, clock.instant());
    }

    /**
     * Applies one record to the history of {@code businessKey}.
     *
     * @throws PersistenceOrderingException when {@code at} is not after the current version's start;
     *                                      stored state is left unchanged
     */
    public UpsertOutcome upsert(String entityName, String businessKey, Map<String, Object> payload, Instant at) {
        validateEntityName(entityName);
        if (businessKey == null || businessKey.isBlank()) {
            throw new IllegalArgumentException("Business key is required");
        }
        String canonicalPayload = canonicalize(payload);
        long atNanos = EpochNanos.toNanos(at);

        ReentrantLock lock = lockFor(entityName, businessKey);
        lock.lock();
        try {
            return transactionTemplate.execute(status ->
                    applyUpsert(entityName, businessKey, canonicalPayload, atNanos));
        } finally {
            lock.unlock();
        }
    }

    public Optional<EntityVersion> findCurrentVersion(String entityName, String businessKey) {
        List<EntityVersion> current = jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM " + TABLE
                        + " WHERE entity_name = ? AND business_key = ? AND is_current = TRUE"
                        + " ORDER BY version_id DESC",
                versionMapper(),
                entityName,
                businessKey
        );
        return current.isEmpty() ? Optional.empty() : Optional.of(current.get(0));
    }

    /**
     * Returns every version of one key, oldest first.
     */
    public List<EntityVersion> findVersionHistory(String entityName, String businessKey) {
        return jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM " + TABLE
                        + " WHERE entity_name = ? AND business_key = ? ORDER BY valid_from, version_id",
                versionMapper(),
                entityName,
                businessKey
        );
    }

    public List<EntityVersion> findCurrentVersions(String entityName) {
        return jdbcTemplate.query(
                "SELECT " + SELECT_COLUMNS + " FROM " + TABLE
                        + " WHERE entity_name = ? AND is_current = TRUE ORDER BY business_key",
                versionMapper(),
                entityName
        );
    }

    public int countVersions(String entityName, String businessKey) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM " + TABLE + " WHERE entity_name = ? AND business_key = ?",
                Integer.class,
                entityName,
                businessKey
        );
        return count == null ? 0 : count;
    }

    private UpsertOutcome applyUpsert(String entityName, String businessKey, String payload, long atNanos) {
        Optional<EntityVersion> current = findCurrentVersion(entityName, businessKey);
        if (current.isEmpty()) {
            insertVersion(entityName, businessKey, payload, atNanos);
            return UpsertOutcome.INSERTED;
        }

        EntityVersion existing = current.get();
        if (atNanos <= EpochNanos.toNanos(existing.validFrom())) {
            throw new PersistenceOrderingException(entityName, businessKey, EpochNanos.fromNanos(atNanos), existing.validFrom());
        }
        if (samePayload(existing.payload(), payload)) {
            return UpsertOutcome.UNCHANGED;
        }

        int closed = jdbcTemplate.update(
                "UPDATE " + TABLE + " SET valid_to = ?, is_current = FALSE WHERE version_id = ? AND is_current = TRUE",
                atNanos,
                existing.versionId()
        );
        if (closed != 1) {
            throw new OptimisticLockingFailureException(
                    "Current version of %s[%s] was closed concurrently".formatted(entityName, businessKey));
        }
        insertVersion(entityName, businessKey, payload, atNanos);
        return UpsertOutcome.VERSIONED;
    }

    private void insertVersion(String entityName, String businessKey, String payload, long validFrom) {
        jdbcTemplate.update(
                "INSERT INTO " + TABLE + " (entity_name, business_key, payload, valid_from, valid_to, is_current)"
                        + " VALUES (?, ?, ?, ?, NULL, TRUE)",
                entityName,
                businessKey,
                payload,
                validFrom
        );
    }

    /**
     * Field-by-field comparison of two JSON documents, independent of key order.
     */
    private boolean samePayload(String storedPayload, String incomingPayload) {
        try {
            JsonNode stored = canonicalMapper.readTree(storedPayload);
            JsonNode incoming = canonicalMapper.readTree(incomingPayload);
            return stored.equals(incoming);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored payload is not valid JSON", ex);
        }
    }

    private String canonicalize(Map<String, Object> payload) {
        try {
            return canonicalMapper.writeValueAsString(payload == null ? Map.of() : payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Payload cannot be serialized to JSON", ex);
        }
    }

    private ReentrantLock lockFor(String entityName, String businessKey) {
        int hash = (entityName + '\u0000' + businessKey).hashCode();
        return keyLocks[Math.floorMod(hash, keyLocks.length)];
    }

    private void validateEntityName(String entityName) {
        if (entityName == null || !entityName.matches(IngestionConstants.VALID_ENTITY_NAME_REGEX)) {
            throw new IllegalArgumentException(IngestionConstants.MSG_INVALID_ENTITY.formatted(entityName));
        }
    }

    private RowMapper<EntityVersion> versionMapper() {
        return (rs, rowNum) -> {
            long validTo = rs.getLong("valid_to");
            boolean open = rs.wasNull();
            return new EntityVersion(
                    rs.getLong("version_id"),
                    rs.getString("entity_name"),
                    rs.getString("business_key"),
                    rs.getString("payload"),
                    EpochNanos.fromNanos(rs.getLong("valid_from")),
                    open ? null : EpochNanos.fromNanos(validTo),
                    rs.getBoolean("is_current")
            );
        };
    }
}
