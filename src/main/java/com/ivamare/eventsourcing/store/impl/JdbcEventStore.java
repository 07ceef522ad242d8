package com.ivamare.eventsourcing.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.eventsourcing.exception.ConcurrencyConflictException;
import com.ivamare.eventsourcing.exception.EventSerializationException;
import com.ivamare.eventsourcing.model.DomainEvent;
import com.ivamare.eventsourcing.model.EventMetadata;
import com.ivamare.eventsourcing.model.Snapshot;
import com.ivamare.eventsourcing.store.EventQuery;
import com.ivamare.eventsourcing.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * PostgreSQL event store backed by {@code eventsourcing.event} and {@code eventsourcing.snapshot}.
 *
 * <p>Appends run in one transaction. Version checks re-read the aggregate's highest
 * version per event; a concurrent writer that slips past the check is caught by the
 * unique {@code (aggregate_id, version)} constraint.
 *
 * <p>Appends also hold a transaction-scoped advisory lock so that global positions
 * become visible in the order they were assigned. Pollers reading by
 * {@code afterPosition} rely on this.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private static final String EVENT_COLUMNS = """
        global_position, event_id, aggregate_id, aggregate_type, event_type,
        version, occurred_at, payload, metadata
        """;

    static final long APPEND_LOCK_KEY = 7_310_575_183_227_167_028L;
    static final String APPEND_LOCK_SQL = "SELECT pg_advisory_xact_lock(" + APPEND_LOCK_KEY + ")";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final RowMapper<DomainEvent> eventMapper;
    private final RowMapper<Snapshot> snapshotMapper;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                          ObjectMapper objectMapper) {
        this(jdbcTemplate, transactionTemplate, objectMapper, Clock.systemUTC());
    }

    public JdbcEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                          ObjectMapper objectMapper, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.eventMapper = createEventMapper();
        this.snapshotMapper = createSnapshotMapper();
    }

    private RowMapper<DomainEvent> createEventMapper() {
        return (rs, rowNum) -> new DomainEvent(
            rs.getString("event_id"),
            rs.getString("aggregate_id"),
            rs.getString("aggregate_type"),
            rs.getString("event_type"),
            rs.getLong("version"),
            rs.getTimestamp("occurred_at").toInstant(),
            readMap(rs.getString("payload")),
            readMetadata(rs.getString("metadata")),
            rs.getLong("global_position")
        );
    }

    private RowMapper<Snapshot> createSnapshotMapper() {
        return (rs, rowNum) -> new Snapshot(
            rs.getString("aggregate_id"),
            rs.getString("aggregate_type"),
            rs.getLong("version"),
            readMap(rs.getString("state")),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    @Override
    public List<DomainEvent> append(List<DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        long start = System.currentTimeMillis();
        List<DomainEvent> stored = transactionTemplate.execute(status -> {
            jdbcTemplate.execute(APPEND_LOCK_SQL);
            Map<String, Long> versions = new HashMap<>();
            List<DomainEvent> result = new ArrayList<>(events.size());
            for (DomainEvent event : events) {
                Long current = versions.get(event.aggregateId());
                if (current == null) {
                    current = getLatestVersion(event.aggregateId());
                }
                if (event.version() != current + 1) {
                    throw new ConcurrencyConflictException(event.aggregateId(), current + 1, event.version());
                }
                result.add(insert(event));
                versions.put(event.aggregateId(), event.version());
            }
            return result;
        });
        log.debug("Appended {} events in {}ms", events.size(), System.currentTimeMillis() - start);
        return stored != null ? stored : List.of();
    }

    private DomainEvent insert(DomainEvent event) {
        String sql = """
            INSERT INTO eventsourcing.event (
                event_id, aggregate_id, aggregate_type, event_type,
                version, occurred_at, payload, metadata
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb)
            RETURNING global_position
            """;
        try {
            Long position = jdbcTemplate.queryForObject(sql, Long.class,
                event.eventId(),
                event.aggregateId(),
                event.aggregateType(),
                event.eventType(),
                event.version(),
                Timestamp.from(event.timestamp()),
                writeJson(event.payload()),
                writeJson(event.metadata())
            );
            return event.withPosition(position != null ? position : DomainEvent.UNASSIGNED);
        } catch (DuplicateKeyException e) {
            // Another transaction committed this version after our check
            throw new ConcurrencyConflictException(event.aggregateId(), event.version(), event.version(), e);
        }
    }

    @Override
    public List<DomainEvent> getEvents(String aggregateId, long fromVersion) {
        String sql = "SELECT " + EVENT_COLUMNS + """
            FROM eventsourcing.event
            WHERE aggregate_id = ? AND version > ?
            ORDER BY version ASC
            """;
        return jdbcTemplate.query(sql, eventMapper, aggregateId, fromVersion);
    }

    @Override
    public List<DomainEvent> getAllEvents(EventQuery query) {
        record Clause(String sql, List<Object> params) {}

        List<Clause> clauses = new ArrayList<>();
        if (query.from() != null) {
            clauses.add(new Clause("occurred_at >= ?", List.of(Timestamp.from(query.from()))));
        }
        if (query.to() != null) {
            clauses.add(new Clause("occurred_at <= ?", List.of(Timestamp.from(query.to()))));
        }
        if (!query.eventTypes().isEmpty()) {
            clauses.add(new Clause("event_type IN (" + placeholders(query.eventTypes().size()) + ")",
                List.copyOf(query.eventTypes())));
        }
        if (query.aggregateType() != null) {
            clauses.add(new Clause("aggregate_type = ?", List.of(query.aggregateType())));
        }
        if (!query.aggregateIds().isEmpty()) {
            clauses.add(new Clause("aggregate_id IN (" + placeholders(query.aggregateIds().size()) + ")",
                List.copyOf(query.aggregateIds())));
        }
        if (query.afterPosition() != null) {
            clauses.add(new Clause("global_position > ?", List.of(query.afterPosition())));
        }
        if (query.excludeArchived()) {
            clauses.add(new Clause("archived = FALSE", List.of()));
        }

        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS)
            .append("FROM eventsourcing.event WHERE 1=1");
        List<Object> params = new ArrayList<>();
        for (Clause clause : clauses) {
            sql.append(" AND ").append(clause.sql());
            params.addAll(clause.params());
        }

        sql.append(query.orderedByPosition()
            ? " ORDER BY global_position ASC"
            : " ORDER BY occurred_at ASC, global_position ASC");

        if (query.limit() != null && query.limit() > 0) {
            sql.append(" LIMIT ?");
            params.add(query.limit());
        }
        if (query.offset() != null && query.offset() > 0) {
            sql.append(" OFFSET ?");
            params.add(query.offset());
        }

        return jdbcTemplate.query(sql.toString(), eventMapper, params.toArray());
    }

    @Override
    public long getEventCount(String aggregateId) {
        Long count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM eventsourcing.event WHERE aggregate_id = ?",
            Long.class, aggregateId);
        return count != null ? count : 0;
    }

    @Override
    public long getLatestVersion(String aggregateId) {
        Long version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(version), 0) FROM eventsourcing.event WHERE aggregate_id = ?",
            Long.class, aggregateId);
        return version != null ? version : 0;
    }

    @Override
    public long getStreamPosition() {
        Long position = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(global_position), 0) FROM eventsourcing.event",
            Long.class);
        return position != null ? position : 0;
    }

    // --- Snapshots ---

    @Override
    public Snapshot createSnapshot(String aggregateId, String aggregateType, long version,
                                   Map<String, Object> state) {
        long latest = getLatestVersion(aggregateId);
        if (version > latest) {
            throw new IllegalArgumentException("Snapshot version " + version
                + " is ahead of latest event version " + latest + " for aggregate " + aggregateId);
        }
        Snapshot snapshot = new Snapshot(aggregateId, aggregateType, version, state, clock.instant());
        String sql = """
            INSERT INTO eventsourcing.snapshot (aggregate_id, aggregate_type, version, state, created_at)
            VALUES (?, ?, ?, ?::jsonb, ?)
            ON CONFLICT (aggregate_id) DO UPDATE SET
                aggregate_type = EXCLUDED.aggregate_type,
                version = EXCLUDED.version,
                state = EXCLUDED.state,
                created_at = EXCLUDED.created_at
            """;
        jdbcTemplate.update(sql,
            aggregateId,
            aggregateType,
            version,
            writeJson(snapshot.state()),
            Timestamp.from(snapshot.timestamp())
        );
        log.debug("Saved snapshot for {} at version {}", aggregateId, version);
        return snapshot;
    }

    @Override
    public Optional<Snapshot> getSnapshot(String aggregateId) {
        List<Snapshot> results = jdbcTemplate.query(
            "SELECT * FROM eventsourcing.snapshot WHERE aggregate_id = ?",
            snapshotMapper, aggregateId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Snapshot> listSnapshots() {
        return jdbcTemplate.query(
            "SELECT * FROM eventsourcing.snapshot ORDER BY created_at ASC",
            snapshotMapper);
    }

    @Override
    public List<Snapshot> findSnapshotsOlderThan(Instant threshold) {
        return jdbcTemplate.query(
            "SELECT * FROM eventsourcing.snapshot WHERE created_at < ? ORDER BY created_at ASC",
            snapshotMapper, Timestamp.from(threshold));
    }

    @Override
    public int deleteSnapshotsOlderThan(Instant threshold) {
        return jdbcTemplate.update(
            "DELETE FROM eventsourcing.snapshot WHERE created_at < ?",
            Timestamp.from(threshold));
    }

    // --- Maintenance ---

    @Override
    public int archiveEvents(Instant before) {
        int count = jdbcTemplate.update("""
            UPDATE eventsourcing.event
            SET archived = TRUE, archived_at = ?
            WHERE occurred_at < ? AND archived = FALSE
            """,
            Timestamp.from(clock.instant()), Timestamp.from(before));
        log.info("Archived {} events before {}", count, before);
        return count;
    }

    // --- JSON helpers ---

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private Map<String, Object> readMap(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize JSON object", e);
        }
    }

    private EventMetadata readMetadata(String json) {
        if (json == null || json.isBlank()) {
            return EventMetadata.empty();
        }
        try {
            return objectMapper.readValue(json, EventMetadata.class);
        } catch (JsonProcessingException e) {
            throw new EventSerializationException("Failed to deserialize event metadata", e);
        }
    }

    private static String placeholders(int count) {
        return String.join(",", Collections.nCopies(count, "?"));
    }
}
