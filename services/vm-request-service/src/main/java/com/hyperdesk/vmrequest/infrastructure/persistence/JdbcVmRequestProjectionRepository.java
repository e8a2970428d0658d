package com.hyperdesk.vmrequest.infrastructure.persistence;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.application.projection.NewVmRequestProjection;
import com.hyperdesk.vmrequest.application.projection.ProjectionError;
import com.hyperdesk.vmrequest.application.projection.VmDetailsUpdate;
import com.hyperdesk.vmrequest.application.projection.VmRequestProjectionUpdater;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.application.projection.VmStatusProjectionQuery;
import com.hyperdesk.vmrequest.domain.ProjectId;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.VmSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Types;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@code vm_request_projections} via {@link NamedParameterJdbcTemplate}.
 * <p>
 * Every statement carries {@code tenant_id} in its WHERE clause; a row of another tenant is
 * invisible and reported as {@link ProjectionError.NotFound}. Concurrent writers are last-writer-wins.
 */
public class JdbcVmRequestProjectionRepository implements VmRequestProjectionUpdater, VmStatusProjectionQuery {

    private static final Logger log = LoggerFactory.getLogger(JdbcVmRequestProjectionRepository.class);

    private static final String INSERT_SQL = """
            INSERT INTO vm_request_projections (
                id, tenant_id, requester_id, requester_name, project_id, project_name, vm_name, size,
                cpu_cores, memory_gb, disk_gb, justification, status, created_at, updated_at, version)
            VALUES (
                :id, :tenantId, :requesterId, :requesterName, :projectId, :projectName, :vmName, :size,
                :cpuCores, :memoryGb, :diskGb, :justification, :status, :createdAt, :createdAt, :version)
            """;

    private static final String OVERWRITE_SQL = """
            UPDATE vm_request_projections
            SET requester_id = :requesterId, requester_name = :requesterName, project_id = :projectId,
                project_name = :projectName, vm_name = :vmName, size = :size, cpu_cores = :cpuCores,
                memory_gb = :memoryGb, disk_gb = :diskGb, justification = :justification, status = :status,
                approved_by = NULL, approved_by_name = NULL, rejected_by = NULL, rejected_by_name = NULL,
                rejection_reason = NULL, hypervisor_vm_id = NULL, ip_address = NULL, hostname = NULL,
                provisioned_at = NULL, warning_message = NULL, error_message = NULL,
                power_state = NULL, last_synced_at = NULL,
                created_at = :createdAt, updated_at = :createdAt, version = :version
            WHERE id = :id AND tenant_id = :tenantId
            """;

    private static final String UPDATE_STATUS_SQL = """
            UPDATE vm_request_projections
            SET status = :status, version = :version, updated_at = :updatedAt,
                approved_by = COALESCE(:approvedBy, approved_by),
                approved_by_name = COALESCE(:approvedByName, approved_by_name),
                rejected_by = COALESCE(:rejectedBy, rejected_by),
                rejected_by_name = COALESCE(:rejectedByName, rejected_by_name),
                rejection_reason = COALESCE(:rejectionReason, rejection_reason)
            WHERE id = :id AND tenant_id = :tenantId
            """;

    private static final String UPDATE_VM_DETAILS_SQL = """
            UPDATE vm_request_projections
            SET hypervisor_vm_id = COALESCE(:hypervisorVmId, hypervisor_vm_id),
                ip_address = COALESCE(:ipAddress, ip_address),
                hostname = COALESCE(:hostname, hostname),
                provisioned_at = COALESCE(:provisionedAt, provisioned_at),
                warning_message = COALESCE(:warningMessage, warning_message),
                error_message = :errorMessage,
                power_state = COALESCE(:powerState, power_state),
                last_synced_at = COALESCE(:lastSyncedAt, last_synced_at)
            WHERE id = :id AND tenant_id = :tenantId
            """;

    private static final String DELETE_SQL =
            "DELETE FROM vm_request_projections WHERE id = :id AND tenant_id = :tenantId";

    private static final String SELECT_SQL = """
            SELECT * FROM vm_request_projections WHERE id = :id AND tenant_id = :tenantId
            """;

    private static final String SELECT_VM_ID_SQL = """
            SELECT hypervisor_vm_id FROM vm_request_projections WHERE id = :id AND tenant_id = :tenantId
            """;

    private static final String SELECT_BY_STATUS_SQL = """
            SELECT * FROM vm_request_projections
            WHERE tenant_id = :tenantId AND status = :status
            ORDER BY created_at
            """;

    private static final RowMapper<VmRequestProjectionRow> ROW_MAPPER = (rs, rowNum) -> new VmRequestProjectionRow(
            new VmRequestId(rs.getObject("id", UUID.class)),
            rs.getString("tenant_id"),
            rs.getString("requester_id"),
            rs.getString("requester_name"),
            new ProjectId(rs.getObject("project_id", UUID.class)),
            rs.getString("project_name"),
            rs.getString("vm_name"),
            VmSize.valueOf(rs.getString("size")),
            rs.getString("justification"),
            VmRequestStatus.valueOf(rs.getString("status")),
            rs.getString("approved_by"),
            rs.getString("approved_by_name"),
            rs.getString("rejected_by"),
            rs.getString("rejected_by_name"),
            rs.getString("rejection_reason"),
            rs.getString("hypervisor_vm_id"),
            rs.getString("ip_address"),
            rs.getString("hostname"),
            SqlTimestamps.readInstant(rs, "provisioned_at"),
            rs.getString("warning_message"),
            rs.getString("error_message"),
            rs.getString("power_state"),
            SqlTimestamps.readInstant(rs, "last_synced_at"),
            SqlTimestamps.readInstant(rs, "created_at"),
            SqlTimestamps.readInstant(rs, "updated_at"),
            rs.getLong("version"));

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcVmRequestProjectionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public Result<Void, ProjectionError> insert(NewVmRequestProjection projection) {
        var params = new MapSqlParameterSource()
                .addValue("id", projection.id().value())
                .addValue("tenantId", projection.tenantId())
                .addValue("requesterId", projection.requesterId())
                .addValue("requesterName", projection.requesterName(), Types.VARCHAR)
                .addValue("projectId", projection.projectId().value())
                .addValue("projectName", projection.projectName(), Types.VARCHAR)
                .addValue("vmName", projection.vmName())
                .addValue("size", projection.size().name())
                .addValue("cpuCores", projection.size().cpuCores())
                .addValue("memoryGb", projection.size().memoryGb())
                .addValue("diskGb", projection.size().diskGb())
                .addValue("justification", projection.justification())
                .addValue("status", projection.status().name())
                .addValue("createdAt", SqlTimestamps.toUtc(projection.createdAt()))
                .addValue("version", projection.version());
        try {
            if (jdbc.update(OVERWRITE_SQL, params) > 0) {
                log.debug("Overwrote projection of VM request {}", projection.id());
                return Result.success();
            }
            jdbc.update(INSERT_SQL, params);
            return Result.success();
        } catch (DuplicateKeyException e) {
            log.warn("Projection id {} is taken by another tenant", projection.id());
            return Result.failure(new ProjectionError.NotFound(projection.id()));
        } catch (DataAccessException e) {
            return databaseError("insert", projection.id(), e);
        }
    }

    @Override
    public Result<Void, ProjectionError> updateStatus(VmRequestStatusUpdate update) {
        var params = new MapSqlParameterSource()
                .addValue("id", update.id().value())
                .addValue("tenantId", update.tenantId())
                .addValue("status", update.status().name())
                .addValue("version", update.version())
                .addValue("updatedAt", SqlTimestamps.toUtc(update.updatedAt()))
                .addValue("approvedBy", update.approvedBy(), Types.VARCHAR)
                .addValue("approvedByName", update.approvedByName(), Types.VARCHAR)
                .addValue("rejectedBy", update.rejectedBy(), Types.VARCHAR)
                .addValue("rejectedByName", update.rejectedByName(), Types.VARCHAR)
                .addValue("rejectionReason", update.rejectionReason(), Types.VARCHAR);
        return execute("updateStatus", update.id(), UPDATE_STATUS_SQL, params);
    }

    @Override
    public Result<Void, ProjectionError> updateVmDetails(VmDetailsUpdate update) {
        var params = new MapSqlParameterSource()
                .addValue("id", update.id().value())
                .addValue("tenantId", update.tenantId())
                .addValue("hypervisorVmId", update.hypervisorVmId(), Types.VARCHAR)
                .addValue("ipAddress", update.ipAddress(), Types.VARCHAR)
                .addValue("hostname", update.hostname(), Types.VARCHAR)
                .addValue("provisionedAt", SqlTimestamps.toUtc(update.provisionedAt()),
                        Types.TIMESTAMP_WITH_TIMEZONE)
                .addValue("warningMessage", update.warningMessage(), Types.VARCHAR)
                .addValue("errorMessage", update.errorMessage(), Types.VARCHAR)
                .addValue("powerState", update.powerState(), Types.VARCHAR)
                .addValue("lastSyncedAt", SqlTimestamps.toUtc(update.lastSyncedAt()),
                        Types.TIMESTAMP_WITH_TIMEZONE);
        return execute("updateVmDetails", update.id(), UPDATE_VM_DETAILS_SQL, params);
    }

    @Override
    public Result<Void, ProjectionError> remove(String tenantId, VmRequestId id) {
        var params = new MapSqlParameterSource()
                .addValue("id", id.value())
                .addValue("tenantId", tenantId);
        try {
            int deleted = jdbc.update(DELETE_SQL, params);
            if (deleted == 0) {
                log.debug("Projection of VM request {} already absent", id);
            }
            return Result.success();
        } catch (DataAccessException e) {
            return databaseError("remove", id, e);
        }
    }

    public Optional<VmRequestProjectionRow> findById(String tenantId, VmRequestId id) {
        var params = new MapSqlParameterSource()
                .addValue("id", id.value())
                .addValue("tenantId", tenantId);
        return jdbc.query(SELECT_SQL, params, ROW_MAPPER).stream().findFirst();
    }

    @Override
    public Result<Optional<String>, ProjectionError> findHypervisorVmId(String tenantId, VmRequestId id) {
        var params = new MapSqlParameterSource()
                .addValue("id", id.value())
                .addValue("tenantId", tenantId);
        try {
            List<Optional<String>> rows = jdbc.query(SELECT_VM_ID_SQL, params,
                    (rs, rowNum) -> Optional.ofNullable(rs.getString("hypervisor_vm_id")));
            if (rows.isEmpty()) {
                return Result.failure(new ProjectionError.NotFound(id));
            }
            return Result.success(rows.get(0));
        } catch (DataAccessException e) {
            log.error("Projection findHypervisorVmId failed for VM request {}", id, e);
            return Result.failure(new ProjectionError.DatabaseError(
                    "findHypervisorVmId failed for VM request " + id + ": "
                            + e.getMostSpecificCause().getMessage()));
        }
    }

    public List<VmRequestProjectionRow> findByStatus(String tenantId, VmRequestStatus status) {
        var params = new MapSqlParameterSource()
                .addValue("tenantId", tenantId)
                .addValue("status", status.name());
        return jdbc.query(SELECT_BY_STATUS_SQL, params, ROW_MAPPER);
    }

    private Result<Void, ProjectionError> execute(String operation, VmRequestId id, String sql,
                                                  MapSqlParameterSource params) {
        try {
            int updated = jdbc.update(sql, params);
            if (updated == 0) {
                log.debug("{} matched no projection row for VM request {}", operation, id);
                return Result.failure(new ProjectionError.NotFound(id));
            }
            return Result.success();
        } catch (DataAccessException e) {
            return databaseError(operation, id, e);
        }
    }

    private static Result<Void, ProjectionError> databaseError(String operation, VmRequestId id,
                                                               DataAccessException e) {
        log.error("Projection {} failed for VM request {}", operation, id, e);
        return Result.failure(new ProjectionError.DatabaseError(
                operation + " failed for VM request " + id + ": " + e.getMostSpecificCause().getMessage()));
    }
}
