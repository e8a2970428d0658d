package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.TimelineEventType;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.InvalidStateException;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Moves an approved request into {@code PROVISIONING}. The transition succeeds once; a repeated
 * delivery gets {@code InvalidState}, which is how the provisioning flow detects duplicates.
 */
public class MarkVmRequestProvisioningHandler {

    public static final String COMMAND = "mark_vm_request_provisioning";

    private static final Logger log = LoggerFactory.getLogger(MarkVmRequestProvisioningHandler.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestSideEffectPorts ports;
    private final CommandInstrumentation instrumentation;

    public MarkVmRequestProvisioningHandler(VmRequestEventStream eventStream,
                                            VmRequestSideEffectPorts ports,
                                            CommandInstrumentation instrumentation) {
        this.eventStream = eventStream;
        this.ports = ports;
        this.instrumentation = instrumentation;
    }

    public Result<VmRequestCommandResult, VmRequestError> handle(MarkVmRequestProvisioningCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.userId(), command.requestId().toString());
        return instrumentation.run(COMMAND, context, () -> eventStream
                .loadForTenant(command.requestId(), command.tenantId())
                .flatMap(aggregate -> markProvisioning(command, aggregate)));
    }

    private Result<VmRequestCommandResult, VmRequestError> markProvisioning(MarkVmRequestProvisioningCommand command,
                                                                            VmRequestAggregate aggregate) {
        var metadata = EventMetadata.create(command.tenantId(), command.userId(), command.correlationId());
        try {
            aggregate.markProvisioning(metadata);
        } catch (InvalidStateException e) {
            return Result.failure(new VmRequestError.InvalidState(e.getCurrentState(), e.getMessage()));
        }

        List<VmRequestEvent> events = VmRequestEventStream.pendingEvents(aggregate);
        var committed = eventStream.commit(aggregate);
        if (committed.isFailure()) {
            return Result.failure(committed.error());
        }
        long version = committed.value();
        log.info("VM request {} provisioning started", aggregate.id());

        instrumentation.bestEffort(COMMAND, "projection", () -> ports.projections().updateStatus(
                VmRequestStatusUpdate.status(aggregate.id(), aggregate.tenantId(), aggregate.status(), version,
                        metadata.timestamp())));
        instrumentation.bestEffort(COMMAND, "timeline", () -> ports.timeline().addTimelineEvent(
                NewTimelineEvent.of(TimelineEventType.PROVISIONING_STARTED, aggregate.id(), null,
                        "Provisioning started", metadata)));
        instrumentation.bestEffortRun(COMMAND, "publish", () -> ports.publisher().publish(events));

        return Result.success(new VmRequestCommandResult(aggregate.id(), version, true));
    }
}
