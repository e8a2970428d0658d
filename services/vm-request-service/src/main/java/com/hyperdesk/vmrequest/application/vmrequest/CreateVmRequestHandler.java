package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.observability.CorrelationContextHolder;
import com.hyperdesk.vmrequest.application.notification.VmRequestCreatedNotification;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.NewVmRequestProjection;
import com.hyperdesk.vmrequest.application.projection.TimelineEventType;
import com.hyperdesk.vmrequest.domain.EmailAddress;
import com.hyperdesk.vmrequest.domain.VmRequestAggregate;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Opens a new VM request.
 * <p>
 * The quota check runs before any event exists. After the first event is stored the read model,
 * timeline, requester notification and event publication are attempted best-effort.
 */
public class CreateVmRequestHandler {

    public static final String COMMAND = "create_vm_request";

    private static final Logger log = LoggerFactory.getLogger(CreateVmRequestHandler.class);

    private final VmRequestEventStream eventStream;
    private final VmRequestSideEffectPorts ports;
    private final CommandInstrumentation instrumentation;
    private final QuotaChecker quotaChecker;

    public CreateVmRequestHandler(VmRequestEventStream eventStream,
                                  VmRequestSideEffectPorts ports,
                                  CommandInstrumentation instrumentation,
                                  QuotaChecker quotaChecker) {
        this.eventStream = eventStream;
        this.ports = ports;
        this.instrumentation = instrumentation;
        this.quotaChecker = quotaChecker;
    }

    public CreateVmRequestHandler(VmRequestEventStream eventStream,
                                  VmRequestSideEffectPorts ports,
                                  CommandInstrumentation instrumentation) {
        this(eventStream, ports, instrumentation, QuotaChecker.alwaysAllow());
    }

    public Result<VmRequestCommandResult, VmRequestError> handle(CreateVmRequestCommand command) {
        var context = new CorrelationContext(
                command.correlationId(), command.tenantId(), command.requesterId(), null);
        return instrumentation.run(COMMAND, context, () -> doHandle(command, context));
    }

    private Result<VmRequestCommandResult, VmRequestError> doHandle(CreateVmRequestCommand command,
                                                                    CorrelationContext context) {
        var quota = quotaChecker.check(command.tenantId(), command.projectId(), command.size());
        if (quota.isFailure()) {
            log.info("Quota denied {} VM for project {}: {}",
                    command.size(), command.projectId(), quota.error().message());
            return Result.failure(quota.error());
        }

        var metadata = EventMetadata.create(command.tenantId(), command.requesterId(), command.correlationId());
        var aggregate = VmRequestAggregate.create(
                command.requesterId(),
                command.requesterName(),
                command.projectId(),
                command.projectName(),
                command.vmName(),
                command.size(),
                command.justification(),
                command.requesterEmail(),
                metadata);
        List<VmRequestEvent> events = VmRequestEventStream.pendingEvents(aggregate);

        var committed = eventStream.commit(aggregate);
        if (committed.isFailure()) {
            return Result.failure(committed.error());
        }
        long version = committed.value();
        CorrelationContextHolder.set(context.withRequestId(aggregate.id().toString()));
        log.info("VM request {} created for {} ({} in project {})",
                aggregate.id(), command.vmName(), command.size(), command.projectName());

        instrumentation.bestEffort(COMMAND, "projection", () -> ports.projections().insert(
                new NewVmRequestProjection(
                        aggregate.id(),
                        aggregate.tenantId(),
                        aggregate.requesterId(),
                        aggregate.requesterName(),
                        aggregate.projectId(),
                        aggregate.projectName(),
                        aggregate.vmName().value(),
                        aggregate.size(),
                        aggregate.justification(),
                        aggregate.status(),
                        aggregate.createdAt(),
                        version)));
        instrumentation.bestEffort(COMMAND, "timeline", () -> ports.timeline().addTimelineEvent(
                NewTimelineEvent.of(TimelineEventType.CREATED, aggregate.id(), command.requesterName(),
                        "Requested %s VM '%s'".formatted(aggregate.size(), aggregate.vmName()), metadata)));
        sendNotification(command, aggregate);
        instrumentation.bestEffortRun(COMMAND, "publish", () -> ports.publisher().publish(events));

        return Result.success(new VmRequestCommandResult(aggregate.id(), version, true));
    }

    private void sendNotification(CreateVmRequestCommand command, VmRequestAggregate aggregate) {
        Optional<EmailAddress> email = EmailAddress.parse(command.requesterEmail());
        if (email.isEmpty()) {
            log.warn("Requester of VM request {} has no usable e-mail address, skipping notification",
                    aggregate.id());
            return;
        }
        instrumentation.bestEffort(COMMAND, "notification", () -> ports.notifications().sendCreatedNotification(
                new VmRequestCreatedNotification(
                        aggregate.id(),
                        aggregate.tenantId(),
                        email.get(),
                        aggregate.vmName().value(),
                        aggregate.projectName(),
                        aggregate.size())));
    }
}
