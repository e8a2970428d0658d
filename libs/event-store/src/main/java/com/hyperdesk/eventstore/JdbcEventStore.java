package com.hyperdesk.eventstore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Relational event store backed by the {@code event_store_events} table.
 * <p>
 * Appends run in one transaction: the stream length is read, compared with the expected
 * version and the events are batch-inserted. Two writers that pass the length check
 * concurrently still collide on {@code UNIQUE (aggregate_id, stream_version)}; the loser's
 * {@link DuplicateKeyException} becomes a {@link ConcurrencyConflict}.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String INSERT_SQL = """
            INSERT INTO event_store_events (
                event_id, aggregate_id, aggregate_type, event_type, schema_version, stream_version,
                tenant_id, user_id, correlation_id, occurred_at, payload, stored_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final String SELECT_STREAM_SQL = """
            SELECT event_id, aggregate_id, aggregate_type, event_type, schema_version, stream_version,
                   tenant_id, user_id, correlation_id, occurred_at, payload, stored_at
            FROM event_store_events
            WHERE aggregate_id = ?
            ORDER BY stream_version
            """;

    private static final String COUNT_SQL =
            "SELECT COUNT(*) FROM event_store_events WHERE aggregate_id = ?";

    private static final RowMapper<StoredEvent> ROW_MAPPER = (rs, rowNum) -> new StoredEvent(
            rs.getObject("event_id", UUID.class),
            rs.getObject("aggregate_id", UUID.class),
            rs.getString("aggregate_type"),
            rs.getString("event_type"),
            rs.getInt("schema_version"),
            rs.getLong("stream_version"),
            new EventMetadata(
                    rs.getString("tenant_id"),
                    rs.getString("user_id"),
                    rs.getString("correlation_id"),
                    rs.getObject("occurred_at", OffsetDateTime.class).toInstant()),
            rs.getString("payload"),
            rs.getObject("stored_at", OffsetDateTime.class).toInstant());

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final EventSerializer serializer;
    private final Clock clock;

    public JdbcEventStore(DataSource dataSource, EventSerializer serializer) {
        this(new JdbcTemplate(dataSource),
                new TransactionTemplate(new DataSourceTransactionManager(dataSource)),
                serializer,
                Clock.systemUTC());
    }

    public JdbcEventStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                          EventSerializer serializer, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.serializer = serializer;
        this.clock = clock;
    }

    @Override
    public Result<Long, ConcurrencyConflict> append(UUID aggregateId, List<? extends DomainEvent> events,
                                                    long expectedVersion) {
        EventStreams.requireAppendable(aggregateId, events, expectedVersion);

        var rows = new ArrayList<StoredEvent>(events.size());
        long position = expectedVersion;
        for (DomainEvent event : events) {
            rows.add(EventStreams.toStoredEvent(serializer, aggregateId, event, position++, clock.instant()));
        }

        try {
            return transactionTemplate.execute(status -> {
                long actual = countEvents(aggregateId);
                if (actual != expectedVersion) {
                    return Result.<Long, ConcurrencyConflict>failure(
                            new ConcurrencyConflict(aggregateId, expectedVersion, actual));
                }
                jdbcTemplate.batchUpdate(INSERT_SQL, rows, rows.size(), (ps, row) -> {
                    ps.setObject(1, row.eventId());
                    ps.setObject(2, row.aggregateId());
                    ps.setString(3, row.aggregateType());
                    ps.setString(4, row.eventType());
                    ps.setInt(5, row.schemaVersion());
                    ps.setLong(6, row.version());
                    ps.setString(7, row.metadata().tenantId());
                    ps.setString(8, row.metadata().userId());
                    ps.setString(9, row.metadata().correlationId());
                    ps.setObject(10, OffsetDateTime.ofInstant(row.metadata().timestamp(), ZoneOffset.UTC));
                    ps.setString(11, row.payload());
                    ps.setObject(12, OffsetDateTime.ofInstant(row.storedAt(), ZoneOffset.UTC));
                });
                return Result.<Long, ConcurrencyConflict>success(expectedVersion + rows.size());
            });
        } catch (DuplicateKeyException e) {
            long actual = currentVersion(aggregateId);
            log.debug("Concurrent append lost the race on {}: expected version {}, actual {}",
                    aggregateId, expectedVersion, actual);
            return Result.failure(new ConcurrencyConflict(aggregateId, expectedVersion, actual));
        } catch (DataAccessException | TransactionException e) {
            throw new EventStoreException(aggregateId, "Failed to append " + rows.size() + " event(s)", e);
        }
    }

    @Override
    public List<StoredEvent> load(UUID aggregateId) {
        try {
            return jdbcTemplate.query(SELECT_STREAM_SQL, ROW_MAPPER, aggregateId);
        } catch (DataAccessException e) {
            throw new EventStoreException(aggregateId, "Failed to load event stream", e);
        }
    }

    @Override
    public long currentVersion(UUID aggregateId) {
        try {
            return countEvents(aggregateId);
        } catch (DataAccessException e) {
            throw new EventStoreException(aggregateId, "Failed to read stream version", e);
        }
    }

    private long countEvents(UUID aggregateId) {
        Long count = jdbcTemplate.queryForObject(COUNT_SQL, Long.class, aggregateId);
        return count == null ? 0L : count;
    }
}
