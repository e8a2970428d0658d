package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.vmrequest.application.notification.VmRequestApprovedNotification;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.TimelineEventType;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.EmailAddress;
import com.hyperdesk.vmrequest.domain.InvalidStateException;
import com.hyperdesk.vmrequest.domain.SelfApprovalException;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Approves a pending request. Publishing the approval is what starts provisioning.
 */
public class ApproveVmRequestHandler {

    public static final String COMMAND = "approve_vm_request";

    private static final Logger log = LoggerFactory.getLogger(ApproveVmRequestHandler.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestSideEffectPorts ports;
    private final CommandInstrumentation instrumentation;

    public ApproveVmRequestHandler(VmRequestEventStream eventStream,
                                   VmRequestSideEffectPorts ports,
                                   CommandInstrumentation instrumentation) {
        this.eventStream = eventStream;
        this.ports = ports;
        this.instrumentation = instrumentation;
    }

    public Result<VmRequestCommandResult, VmRequestError> handle(ApproveVmRequestCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.adminId(), command.requestId().toString());
        return instrumentation.run(COMMAND, context, () -> eventStream
                .loadForTenant(command.requestId(), command.tenantId())
                .flatMap(aggregate -> approve(command, aggregate)));
    }

    private Result<VmRequestCommandResult, VmRequestError> approve(ApproveVmRequestCommand command,
                                                                   VmRequestAggregate aggregate) {
        if (command.expectedVersion() != null && command.expectedVersion() != aggregate.version()) {
            log.info("Approval of VM request {} based on stale version {}, current is {}",
                    aggregate.id(), command.expectedVersion(), aggregate.version());
            return Result.failure(new VmRequestError.ConcurrencyConflict(
                    command.expectedVersion(), aggregate.version()));
        }

        var metadata = EventMetadata.create(command.tenantId(), command.adminId(), command.correlationId());
        try {
            aggregate.approve(command.adminName(), metadata);
        } catch (SelfApprovalException e) {
            log.warn("Admin {} tried to approve own VM request {}", command.adminId(), aggregate.id());
            return Result.failure(new VmRequestError.Forbidden(e.getMessage()));
        } catch (InvalidStateException e) {
            return Result.failure(new VmRequestError.InvalidState(e.getCurrentState(), e.getMessage()));
        }

        List<VmRequestEvent> events = VmRequestEventStream.pendingEvents(aggregate);
        var committed = eventStream.commit(aggregate);
        if (committed.isFailure()) {
            return Result.failure(committed.error());
        }
        long version = committed.value();
        log.info("VM request {} approved by {}", aggregate.id(), command.adminId());

        instrumentation.bestEffort(COMMAND, "projection", () -> ports.projections().updateStatus(
                VmRequestStatusUpdate.approved(aggregate.id(), aggregate.tenantId(), version,
                        command.adminId(), command.adminName(), metadata.timestamp())));
        instrumentation.bestEffort(COMMAND, "timeline", () -> ports.timeline().addTimelineEvent(
                NewTimelineEvent.of(TimelineEventType.APPROVED, aggregate.id(), command.adminName(),
                        "Request approved", metadata)));
        EmailAddress.parse(aggregate.requesterEmail()).ifPresent(email ->
                instrumentation.bestEffort(COMMAND, "notification", () -> ports.notifications()
                        .sendApprovedNotification(new VmRequestApprovedNotification(
                                aggregate.id(),
                                aggregate.tenantId(),
                                email,
                                aggregate.vmName().value(),
                                aggregate.projectName(),
                                command.adminName()))));
        instrumentation.bestEffortRun(COMMAND, "publish", () -> ports.publisher().publish(events));

        return Result.success(new VmRequestCommandResult(aggregate.id(), version, true));
    }
}
