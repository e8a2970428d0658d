package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.vmrequest.application.notification.VmRequestRejectedNotification;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.TimelineEventType;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.EmailAddress;
import com.hyperdesk.vmrequest.domain.InvalidStateException;
import com.hyperdesk.vmrequest.domain.SelfApprovalException;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Rejects a pending request with a reason. Rejecting an already rejected request succeeds
 * without appending, whatever {@code expectedVersion} it carries.
 */
public class RejectVmRequestHandler {

    public static final String COMMAND = "reject_vm_request";

    private static final Logger log = LoggerFactory.getLogger(RejectVmRequestHandler.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestSideEffectPorts ports;
    private final CommandInstrumentation instrumentation;

    public RejectVmRequestHandler(VmRequestEventStream eventStream,
                                  VmRequestSideEffectPorts ports,
                                  CommandInstrumentation instrumentation) {
        this.eventStream = eventStream;
        this.ports = ports;
        this.instrumentation = instrumentation;
    }

    public Result<VmRequestCommandResult, VmRequestError> handle(RejectVmRequestCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.adminId(), command.requestId().toString());
        return instrumentation.run(COMMAND, context, () -> eventStream
                .loadForTenant(command.requestId(), command.tenantId())
                .flatMap(aggregate -> reject(command, aggregate)));
    }

    private Result<VmRequestCommandResult, VmRequestError> reject(RejectVmRequestCommand command,
                                                                  VmRequestAggregate aggregate) {
        // A redelivered reject carries the version from before its own event.
        boolean alreadyRejected = aggregate.status() == VmRequestStatus.REJECTED;
        if (!alreadyRejected
                && command.expectedVersion() != null
                && command.expectedVersion() != aggregate.version()) {
            log.info("Rejection of VM request {} based on stale version {}, current is {}",
                    aggregate.id(), command.expectedVersion(), aggregate.version());
            return Result.failure(new VmRequestError.ConcurrencyConflict(
                    command.expectedVersion(), aggregate.version()));
        }

        var metadata = EventMetadata.create(command.tenantId(), command.adminId(), command.correlationId());
        try {
            aggregate.reject(command.reason(), command.adminName(), metadata);
        } catch (SelfApprovalException e) {
            log.warn("Admin {} tried to reject own VM request {}", command.adminId(), aggregate.id());
            return Result.failure(new VmRequestError.Forbidden(e.getMessage()));
        } catch (InvalidStateException e) {
            return Result.failure(new VmRequestError.InvalidState(e.getCurrentState(), e.getMessage()));
        }
        if (!aggregate.hasUncommittedEvents()) {
            log.debug("VM request {} already rejected", aggregate.id());
            return Result.success(new VmRequestCommandResult(aggregate.id(), aggregate.version(), false));
        }

        List<VmRequestEvent> events = VmRequestEventStream.pendingEvents(aggregate);
        var committed = eventStream.commit(aggregate);
        if (committed.isFailure()) {
            return Result.failure(committed.error());
        }
        long version = committed.value();
        log.info("VM request {} rejected by {}", aggregate.id(), command.adminId());

        instrumentation.bestEffort(COMMAND, "projection", () -> ports.projections().updateStatus(
                VmRequestStatusUpdate.rejected(aggregate.id(), aggregate.tenantId(), version,
                        command.adminId(), command.adminName(), command.reason(), metadata.timestamp())));
        instrumentation.bestEffort(COMMAND, "timeline", () -> ports.timeline().addTimelineEvent(
                NewTimelineEvent.of(TimelineEventType.REJECTED, aggregate.id(), command.adminName(),
                        "Request rejected: " + command.reason(), metadata)));
        EmailAddress.parse(aggregate.requesterEmail()).ifPresent(email ->
                instrumentation.bestEffort(COMMAND, "notification", () -> ports.notifications()
                        .sendRejectedNotification(new VmRequestRejectedNotification(
                                aggregate.id(),
                                aggregate.tenantId(),
                                email,
                                aggregate.vmName().value(),
                                aggregate.projectName(),
                                command.reason()))));
        instrumentation.bestEffortRun(COMMAND, "publish", () -> ports.publisher().publish(events));

        return Result.success(new VmRequestCommandResult(aggregate.id(), version, true));
    }
}
