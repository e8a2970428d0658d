package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.tenant.TenantIsolationEnforcer;
import com.hyperdesk.vmrequest.application.projection.NewVmRequestProjection;
import com.hyperdesk.vmrequest.application.projection.ProjectionError;
import com.hyperdesk.vmrequest.application.projection.VmDetailsUpdate;
import com.hyperdesk.vmrequest.application.projection.VmRequestProjectionUpdater;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.events.VmRequestApproved;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import com.hyperdesk.vmrequest.domain.events.VmRequestProvisioningFailed;
import com.hyperdesk.vmrequest.domain.events.VmRequestReady;
import com.hyperdesk.vmrequest.domain.events.VmRequestRejected;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * Rewrites the read-model row of one request from its event stream. Used to repair a
 * projection that missed a best-effort update.
 */
public class VmRequestProjectionRebuilder {

    private static final Logger log = LoggerFactory.getLogger(VmRequestProjectionRebuilder.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestProjectionUpdater projections;

    public VmRequestProjectionRebuilder(VmRequestEventStream eventStream, VmRequestProjectionUpdater projections) {
        this.eventStream = eventStream;
        this.projections = projections;
    }

    /**
     * @return the stream version the row now reflects
     */
    public Result<Long, VmRequestError> rebuild(String tenantId, VmRequestId requestId) {
        var loaded = eventStream.history(requestId);
        if (loaded.isFailure()) {
            return Result.failure(loaded.error());
        }
        List<VmRequestEvent> history = loaded.value();
        VmRequestAggregate aggregate = VmRequestAggregate.reconstitute(requestId, history);
        if (!TenantIsolationEnforcer.belongsTo(tenantId, aggregate.tenantId())) {
            return Result.failure(new VmRequestError.NotFound(requestId));
        }
        long version = aggregate.version();
        Instant lastChange = history.get(history.size() - 1).metadata().timestamp();

        var written = projections.insert(new NewVmRequestProjection(
                        aggregate.id(),
                        aggregate.tenantId(),
                        aggregate.requesterId(),
                        aggregate.requesterName(),
                        aggregate.projectId(),
                        aggregate.projectName(),
                        aggregate.vmName().value(),
                        aggregate.size(),
                        aggregate.justification(),
                        VmRequestStatus.PENDING,
                        aggregate.createdAt(),
                        version))
                .flatMap(ignored -> projections.updateStatus(statusUpdate(aggregate, history, version, lastChange)));
        for (VmRequestEvent event : history) {
            if (written.isFailure()) {
                break;
            }
            if (event instanceof VmRequestReady ready) {
                written = projections.updateVmDetails(VmDetailsUpdate.ready(aggregate.id(), aggregate.tenantId(),
                        ready.hypervisorVmId(), ready.ipAddress(), ready.hostname(), ready.provisionedAt(),
                        ready.warningMessage()));
            } else if (event instanceof VmRequestProvisioningFailed failed) {
                written = projections.updateVmDetails(
                        VmDetailsUpdate.failed(aggregate.id(), aggregate.tenantId(), failed.reason()));
            }
        }

        if (written.isFailure()) {
            ProjectionError error = written.error();
            log.error("Rebuilding projection of VM request {} failed: {}", requestId, error.message());
            return Result.failure(new VmRequestError.PersistenceFailure(error.message()));
        }
        log.info("Rebuilt projection of VM request {} at version {} ({})", requestId, version, aggregate.status());
        return Result.success(version);
    }

    private static VmRequestStatusUpdate statusUpdate(VmRequestAggregate aggregate, List<VmRequestEvent> history,
                                                      long version, Instant updatedAt) {
        String approvedBy = null;
        String approvedByName = null;
        String rejectedBy = null;
        String rejectedByName = null;
        String rejectionReason = null;
        for (VmRequestEvent event : history) {
            if (event instanceof VmRequestApproved approved) {
                approvedBy = approved.metadata().userId();
                approvedByName = approved.approverName();
            } else if (event instanceof VmRequestRejected rejected) {
                rejectedBy = rejected.metadata().userId();
                rejectedByName = rejected.rejectorName();
                rejectionReason = rejected.reason();
            }
        }
        return new VmRequestStatusUpdate(aggregate.id(), aggregate.tenantId(), aggregate.status(), version,
                approvedBy, approvedByName, rejectedBy, rejectedByName, rejectionReason, updatedAt);
    }
}
