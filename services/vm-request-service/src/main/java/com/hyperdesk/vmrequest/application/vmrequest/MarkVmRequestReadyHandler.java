package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.TimelineEventType;
import com.hyperdesk.vmrequest.application.projection.VmDetailsUpdate;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.InvalidStateException;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/** Completes provisioning with the details of the created VM. Idempotent on {@code READY}. */
public class MarkVmRequestReadyHandler {

    public static final String COMMAND = "mark_vm_request_ready";

    private static final Logger log = LoggerFactory.getLogger(MarkVmRequestReadyHandler.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestSideEffectPorts ports;
    private final CommandInstrumentation instrumentation;

    public MarkVmRequestReadyHandler(VmRequestEventStream eventStream,
                                     VmRequestSideEffectPorts ports,
                                     CommandInstrumentation instrumentation) {
        this.eventStream = eventStream;
        this.ports = ports;
        this.instrumentation = instrumentation;
    }

    public Result<VmRequestCommandResult, VmRequestError> handle(MarkVmRequestReadyCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.userId(), command.requestId().toString());
        return instrumentation.run(COMMAND, context, () -> eventStream
                .loadForTenant(command.requestId(), command.tenantId())
                .flatMap(aggregate -> markReady(command, aggregate)));
    }

    private Result<VmRequestCommandResult, VmRequestError> markReady(MarkVmRequestReadyCommand command,
                                                                     VmRequestAggregate aggregate) {
        var metadata = EventMetadata.create(command.tenantId(), command.userId(), command.correlationId());
        try {
            aggregate.markReady(command.hypervisorVmId(), command.ipAddress(), command.hostname(),
                    command.provisionedAt(), command.warningMessage(), metadata);
        } catch (InvalidStateException e) {
            return Result.failure(new VmRequestError.InvalidState(e.getCurrentState(), e.getMessage()));
        }
        if (!aggregate.hasUncommittedEvents()) {
            return Result.success(new VmRequestCommandResult(aggregate.id(), aggregate.version(), false));
        }

        List<VmRequestEvent> events = VmRequestEventStream.pendingEvents(aggregate);
        var committed = eventStream.commit(aggregate);
        if (committed.isFailure()) {
            return Result.failure(committed.error());
        }
        long version = committed.value();
        log.info("VM request {} ready as {} ({})", aggregate.id(), command.hypervisorVmId(), command.hostname());

        instrumentation.bestEffort(COMMAND, "projection", () -> ports.projections().updateStatus(
                VmRequestStatusUpdate.status(aggregate.id(), aggregate.tenantId(), aggregate.status(), version,
                        metadata.timestamp())));
        instrumentation.bestEffort(COMMAND, "vm_details", () -> ports.projections().updateVmDetails(
                VmDetailsUpdate.ready(aggregate.id(), aggregate.tenantId(), command.hypervisorVmId(),
                        command.ipAddress(), command.hostname(), command.provisionedAt(),
                        command.warningMessage())));
        String address = command.ipAddress() == null ? "no IP address yet" : command.ipAddress();
        instrumentation.bestEffort(COMMAND, "timeline", () -> ports.timeline().addTimelineEvent(
                NewTimelineEvent.of(TimelineEventType.VM_READY, aggregate.id(), null,
                        "VM %s is ready (%s)".formatted(command.hostname(), address), metadata)));
        instrumentation.bestEffortRun(COMMAND, "publish", () -> ports.publisher().publish(events));

        return Result.success(new VmRequestCommandResult(aggregate.id(), version, true));
    }
}
