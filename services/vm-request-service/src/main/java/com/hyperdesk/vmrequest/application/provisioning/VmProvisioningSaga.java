package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.observability.CorrelationContextHolder;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestEventStream;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.events.VmRequestApproved;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts provisioning when a request is approved.
 * <p>
 * The approval event only identifies the request; everything needed to build the VM is
 * re-derived from the stored stream. Deliveries are at least once: duplicates are turned away
 * by {@link ProvisionVmHandler} and never reach the hypervisor.
 */
public class VmProvisioningSaga {

    private static final Logger log = LoggerFactory.getLogger(VmProvisioningSaga.class);

    private final VmRequestEventStream eventStream;
    private final ProvisionVmHandler provisionVmHandler;

    public VmProvisioningSaga(VmRequestEventStream eventStream, ProvisionVmHandler provisionVmHandler) {
        this.eventStream = eventStream;
        this.provisionVmHandler = provisionVmHandler;
    }

    public Result<ProvisioningOutcome, ProvisionVmError> onApproved(VmRequestApproved event) {
        var requestId = new VmRequestId(event.requestId());
        var metadata = event.metadata();
        var context = new CorrelationContext(metadata.correlationId(), metadata.tenantId(),
                ProvisionVmHandler.SYSTEM_USER, requestId.toString());
        return CorrelationContextHolder.callWithContext(context, () -> run(requestId, event));
    }

    private Result<ProvisioningOutcome, ProvisionVmError> run(VmRequestId requestId, VmRequestApproved event) {
        var loaded = eventStream.load(requestId);
        if (loaded.isFailure()) {
            log.error("Approved VM request {} of tenant {} could not be loaded for provisioning: {}",
                    requestId, event.metadata().tenantId(), loaded.error().message());
            return Result.failure(new ProvisionVmError.RequestFailed(loaded.error()));
        }

        VmRequestAggregate aggregate = loaded.value();
        var command = new ProvisionVmCommand(
                aggregate.tenantId(),
                aggregate.id(),
                aggregate.projectId(),
                aggregate.requesterId(),
                aggregate.vmName(),
                aggregate.size(),
                null,
                event.metadata().correlationId());

        var result = provisionVmHandler.handle(command);
        result.onSuccess(outcome -> log.info("VM request {} provisioned as {}", requestId, outcome.vm().vmId()))
                .onFailure(error -> {
                    if (error instanceof ProvisionVmError.AlreadyInProgress) {
                        log.debug("Duplicate approval delivery for VM request {}", requestId);
                    } else {
                        log.error("Provisioning of VM request {} for tenant {} ended with {}",
                                requestId, aggregate.tenantId(), error);
                    }
                });
        return result;
    }
}
