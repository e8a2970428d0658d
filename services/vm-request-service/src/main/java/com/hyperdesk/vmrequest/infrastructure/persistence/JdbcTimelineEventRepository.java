package com.hyperdesk.vmrequest.infrastructure.persistence;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.ProjectionError;
import com.hyperdesk.vmrequest.application.projection.TimelineEventProjectionUpdater;
import com.hyperdesk.vmrequest.application.projection.TimelineEventType;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.util.List;
import java.util.UUID;

/** {@code vm_request_timeline_events}; inserting an id that already exists is a success. */
public class JdbcTimelineEventRepository implements TimelineEventProjectionUpdater {

    private static final Logger log = LoggerFactory.getLogger(JdbcTimelineEventRepository.class);

    private static final String INSERT_SQL = """
            INSERT INTO vm_request_timeline_events (
                id, request_id, tenant_id, event_type, actor_id, actor_name, details, occurred_at)
            VALUES (:id, :requestId, :tenantId, :eventType, :actorId, :actorName, :details, :occurredAt)
            """;

    private static final String SELECT_SQL = """
            SELECT id, event_type, actor_id, actor_name, details, occurred_at
            FROM vm_request_timeline_events
            WHERE request_id = :requestId AND tenant_id = :tenantId
            ORDER BY occurred_at, id
            """;

    private static final RowMapper<TimelineEntry> ROW_MAPPER = (rs, rowNum) -> new TimelineEntry(
            rs.getObject("id", UUID.class),
            TimelineEventType.valueOf(rs.getString("event_type")),
            rs.getString("actor_id"),
            rs.getString("actor_name"),
            rs.getString("details"),
            SqlTimestamps.readInstant(rs, "occurred_at"));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcTimelineEventRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Result<Void, ProjectionError> addTimelineEvent(NewTimelineEvent event) {
        var params = new MapSqlParameterSource()
                .addValue("id", event.id())
                .addValue("requestId", event.requestId().value())
                .addValue("tenantId", event.tenantId())
                .addValue("eventType", event.eventType().name())
                .addValue("actorId", event.actorId(), Types.VARCHAR)
                .addValue("actorName", event.actorName(), Types.VARCHAR)
                .addValue("details", event.details(), Types.VARCHAR)
                .addValue("occurredAt", SqlTimestamps.toUtc(event.occurredAt()));
        try {
            jdbc.update(INSERT_SQL, params);
            return Result.success();
        } catch (DuplicateKeyException e) {
            log.debug("Timeline entry {} for VM request {} already recorded", event.id(), event.requestId());
            return Result.success();
        } catch (DataAccessException e) {
            log.error("Failed to record {} timeline entry for VM request {}", event.eventType(), event.requestId(), e);
            return Result.failure(new ProjectionError.DatabaseError(
                    "Timeline insert failed: " + e.getMostSpecificCause().getMessage()));
        }
    }

    public List<TimelineEntry> findByRequest(String tenantId, VmRequestId requestId) {
        var params = new MapSqlParameterSource()
                .addValue("requestId", requestId.value())
                .addValue("tenantId", tenantId);
        return jdbc.query(SELECT_SQL, params, ROW_MAPPER);
    }
}
