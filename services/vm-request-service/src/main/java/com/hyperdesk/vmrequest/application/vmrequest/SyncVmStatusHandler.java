package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorPort;
import com.hyperdesk.vmrequest.application.projection.ProjectionError;
import com.hyperdesk.vmrequest.application.projection.VmDetailsUpdate;
import com.hyperdesk.vmrequest.application.projection.VmRequestProjectionUpdater;
import com.hyperdesk.vmrequest.application.projection.VmStatusProjectionQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Reads a provisioned VM's runtime state from the hypervisor and writes it to the read model.
 * Appends no events: power state and IP address are observations, not decisions.
 */
public class SyncVmStatusHandler {

    public static final String COMMAND = "sync_vm_status";

    private static final Logger log = LoggerFactory.getLogger(SyncVmStatusHandler.class);

    private final HypervisorPort hypervisor;
    private final VmStatusProjectionQuery query;
    private final VmRequestProjectionUpdater projections;
    private final CommandInstrumentation instrumentation;
    private final Clock clock;

    public SyncVmStatusHandler(HypervisorPort hypervisor,
                               VmStatusProjectionQuery query,
                               VmRequestProjectionUpdater projections,
                               CommandInstrumentation instrumentation,
                               Clock clock) {
        this.hypervisor = hypervisor;
        this.query = query;
        this.projections = projections;
        this.instrumentation = instrumentation;
        this.clock = clock;
    }

    public Result<SyncVmStatusResult, SyncVmStatusError> handle(SyncVmStatusCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.userId(), command.requestId().toString());
        return instrumentation.run(COMMAND, context, () -> sync(command));
    }

    private Result<SyncVmStatusResult, SyncVmStatusError> sync(SyncVmStatusCommand command) {
        var requestId = command.requestId();
        var lookup = query.findHypervisorVmId(command.tenantId(), requestId);
        if (lookup.isFailure()) {
            return Result.failure(toSyncError(command, lookup.error(), "look up VM"));
        }
        if (lookup.value().isEmpty()) {
            log.debug("VM request {} has no provisioned VM yet", requestId);
            return Result.failure(new SyncVmStatusError.NotProvisioned(requestId));
        }
        String vmId = lookup.value().get();

        var vm = hypervisor.getVm(vmId);
        if (vm.isFailure()) {
            log.warn("Could not read VM {} of request {} from the hypervisor: {}",
                    vmId, requestId, vm.error().message());
            return Result.failure(new SyncVmStatusError.HypervisorError(vm.error().message()));
        }
        var info = vm.value();

        var written = projections.updateVmDetails(VmDetailsUpdate.synced(
                requestId, command.tenantId(), vmId, info.ipAddress(), info.hostname(),
                info.powerState().name(), clock.instant()));
        if (written.isFailure()) {
            return Result.failure(toSyncError(command, written.error(), "save VM status"));
        }

        log.info("Synced VM status for request {}: powerState={}, ip={}",
                requestId, info.powerState(), info.ipAddress());
        return Result.success(new SyncVmStatusResult(requestId, info.powerState(), info.ipAddress()));
    }

    private static SyncVmStatusError toSyncError(SyncVmStatusCommand command, ProjectionError error,
                                                 String action) {
        if (error instanceof ProjectionError.NotFound) {
            return new SyncVmStatusError.NotFound(command.requestId());
        }
        log.error("Failed to {} for VM request {}: {}", action, command.requestId(), error.message());
        return new SyncVmStatusError.UpdateFailure("Failed to " + action + ": " + error.message());
    }
}
