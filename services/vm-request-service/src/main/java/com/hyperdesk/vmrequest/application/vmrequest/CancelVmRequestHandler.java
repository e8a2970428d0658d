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
 * Cancels a pending request on behalf of its requester. Cancelling an already cancelled request
 * succeeds without appending.
 */
public class CancelVmRequestHandler {

    public static final String COMMAND = "cancel_vm_request";

    private static final Logger log = LoggerFactory.getLogger(CancelVmRequestHandler.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestSideEffectPorts ports;
    private final CommandInstrumentation instrumentation;

    public CancelVmRequestHandler(VmRequestEventStream eventStream,
                                  VmRequestSideEffectPorts ports,
                                  CommandInstrumentation instrumentation) {
        this.eventStream = eventStream;
        this.ports = ports;
        this.instrumentation = instrumentation;
    }

    public Result<VmRequestCommandResult, VmRequestError> handle(CancelVmRequestCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.userId(), command.requestId().toString());
        return instrumentation.run(COMMAND, context, () -> eventStream
                .loadForTenant(command.requestId(), command.tenantId())
                .flatMap(aggregate -> cancel(command, aggregate)));
    }

    private Result<VmRequestCommandResult, VmRequestError> cancel(CancelVmRequestCommand command,
                                                                  VmRequestAggregate aggregate) {
        if (!command.userId().equals(aggregate.requesterId())) {
            log.warn("User {} tried to cancel VM request {} owned by {}",
                    command.userId(), aggregate.id(), aggregate.requesterId());
            return Result.failure(new VmRequestError.Forbidden("Only the requester can cancel this VM request"));
        }

        var metadata = EventMetadata.create(command.tenantId(), command.userId(), command.correlationId());
        try {
            aggregate.cancel(command.reason(), metadata);
        } catch (InvalidStateException e) {
            return Result.failure(new VmRequestError.InvalidState(e.getCurrentState(), e.getMessage()));
        }
        if (!aggregate.hasUncommittedEvents()) {
            log.debug("VM request {} already cancelled", aggregate.id());
            return Result.success(new VmRequestCommandResult(aggregate.id(), aggregate.version(), false));
        }

        List<VmRequestEvent> events = VmRequestEventStream.pendingEvents(aggregate);
        var committed = eventStream.commit(aggregate);
        if (committed.isFailure()) {
            return Result.failure(committed.error());
        }
        long version = committed.value();
        log.info("VM request {} cancelled", aggregate.id());

        instrumentation.bestEffort(COMMAND, "projection", () -> ports.projections().updateStatus(
                VmRequestStatusUpdate.status(aggregate.id(), aggregate.tenantId(), aggregate.status(), version,
                        metadata.timestamp())));
        String details = command.reason() == null || command.reason().isBlank()
                ? "Request cancelled"
                : "Request cancelled: " + command.reason();
        instrumentation.bestEffort(COMMAND, "timeline", () -> ports.timeline().addTimelineEvent(
                NewTimelineEvent.of(TimelineEventType.CANCELLED, aggregate.id(), aggregate.requesterName(),
                        details, metadata)));
        instrumentation.bestEffortRun(COMMAND, "publish", () -> ports.publisher().publish(events));

        return Result.success(new VmRequestCommandResult(aggregate.id(), version, true));
    }
}
