package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.observability.SpanHelper;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorVmSpec;
import com.hyperdesk.vmrequest.application.hypervisor.ProvisioningResult;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.MappingError;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ProvisioningRequest;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMapper;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMappingRepository;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestFailedCommand;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestFailedHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestProvisioningCommand;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestProvisioningHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestReadyCommand;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestReadyHandler;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestError;
import io.opentelemetry.api.trace.SpanKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;

/**
 * Drives one approved request through provisioning.
 * <p>
 * The {@code APPROVED -> PROVISIONING} transition is the idempotency guard: if it is refused the
 * request is already being handled and the hypervisor is not called. Once provisioning has
 * started the request always ends in {@code READY} or {@code FAILED} unless the event store
 * itself fails.
 */
public class ProvisionVmHandler {

    /** Principal recorded on events produced by provisioning. */
    public static final String SYSTEM_USER = "system:provisioning";

    private static final Logger log = LoggerFactory.getLogger(ProvisionVmHandler.class);

    private final MarkVmRequestProvisioningHandler markProvisioning;
    private final MarkVmRequestReadyHandler markReady;
    private final MarkVmRequestFailedHandler markFailed;
    private final ResourceMappingRepository mappings;
    private final ResourceMapper resourceMapper;
    private final ResilientProvisioningService provisioningService;
    private final SpanHelper spans;
    private final Clock clock;

    public ProvisionVmHandler(MarkVmRequestProvisioningHandler markProvisioning,
                              MarkVmRequestReadyHandler markReady,
                              MarkVmRequestFailedHandler markFailed,
                              ResourceMappingRepository mappings,
                              ResourceMapper resourceMapper,
                              ResilientProvisioningService provisioningService,
                              SpanHelper spans,
                              Clock clock) {
        this.markProvisioning = markProvisioning;
        this.markReady = markReady;
        this.markFailed = markFailed;
        this.mappings = mappings;
        this.resourceMapper = resourceMapper;
        this.provisioningService = provisioningService;
        this.spans = spans;
        this.clock = clock;
    }

    public Result<ProvisioningOutcome, ProvisionVmError> handle(ProvisionVmCommand command) {
        return spans.inSpan("vm_request.provision", SpanKind.INTERNAL,
                Map.of(SpanHelper.ATTR_REQUEST_ID, command.requestId().toString(),
                        "vm.size", command.size().name()),
                () -> provision(command),
                Result::isFailure);
    }

    private Result<ProvisioningOutcome, ProvisionVmError> provision(ProvisionVmCommand command) {
        var started = markProvisioning.handle(new MarkVmRequestProvisioningCommand(
                command.tenantId(), SYSTEM_USER, command.requestId(), command.correlationId()));
        if (started.isFailure()) {
            if (started.error() instanceof VmRequestError.InvalidState invalid) {
                log.info("VM request {} is already {}, skipping provisioning",
                        command.requestId(), invalid.currentState());
                return Result.failure(new ProvisionVmError.AlreadyInProgress(
                        command.requestId(), invalid.currentState()));
            }
            return Result.failure(new ProvisionVmError.RequestFailed(started.error()));
        }

        var spec = resolveSpec(command);
        if (spec.isFailure()) {
            MappingError mappingError = spec.error();
            log.error("Cannot map VM request {} onto hypervisor resources: {}",
                    command.requestId(), mappingError.message());
            var failed = recordFailure(command, ProvisioningErrorCode.VM_CONFIG_INVALID, false, 0);
            if (failed.isFailure()) {
                return Result.failure(new ProvisionVmError.RequestFailed(failed.error()));
            }
            return Result.failure(new ProvisionVmError.MappingFailed(mappingError));
        }

        var created = provisioningService.provision(spec.value(), command.correlationId());
        if (created.isFailure()) {
            ProvisioningFailure failure = created.error();
            var failed = recordFailure(command, failure.errorCode(), failure.lastError().retriable(),
                    failure.attempts());
            if (failed.isFailure()) {
                return Result.failure(new ProvisionVmError.RequestFailed(failed.error()));
            }
            return Result.failure(new ProvisionVmError.HypervisorFailed(failure.lastError(), failure.attempts()));
        }

        ProvisioningResult vm = created.value();
        var ready = markReady.handle(new MarkVmRequestReadyCommand(
                command.tenantId(), SYSTEM_USER, command.requestId(), vm.vmId(), vm.ipAddress(), vm.hostname(),
                vm.provisionedAt(), vm.warningMessage(), command.correlationId()));
        if (ready.isFailure()) {
            log.error("VM {} was created for request {} but could not be recorded: {}",
                    vm.vmId(), command.requestId(), ready.error().message());
            return Result.failure(new ProvisionVmError.RequestFailed(ready.error()));
        }
        return Result.success(new ProvisioningOutcome(command.requestId(), vm, ready.value().version()));
    }

    private Result<HypervisorVmSpec, MappingError> resolveSpec(ProvisionVmCommand command) {
        return mappings.findByTenant(command.tenantId())
                .map(mapping -> resourceMapper.toVmSpec(new ProvisioningRequest(
                        command.tenantId(), command.vmName(), command.size(), command.networkName()), mapping))
                .orElseGet(() -> Result.failure(new MappingError.MissingMapping(command.tenantId())));
    }

    private Result<?, VmRequestError> recordFailure(ProvisionVmCommand command, ProvisioningErrorCode code,
                                                    boolean retriable, int attempts) {
        return markFailed.handle(new MarkVmRequestFailedCommand(
                command.tenantId(), SYSTEM_USER, command.requestId(), code.name(), code.userMessage(),
                retriable, attempts, clock.instant(), command.correlationId()));
    }
}
