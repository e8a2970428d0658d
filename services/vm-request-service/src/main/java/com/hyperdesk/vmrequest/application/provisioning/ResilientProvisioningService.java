package com.hyperdesk.vmrequest.application.provisioning;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorPort;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorVmSpec;
import com.hyperdesk.vmrequest.application.hypervisor.ProvisioningResult;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates VMs through the {@link HypervisorPort}, retrying retriable errors with exponential
 * backoff. Non-retriable errors end the attempt sequence at once.
 */
public class ResilientProvisioningService {

    private static final Logger log = LoggerFactory.getLogger(ResilientProvisioningService.class);

    private final HypervisorPort hypervisor;
    private final ProvisioningRetryPolicy policy;
    private final RetryConfig retryConfig;

    public ResilientProvisioningService(HypervisorPort hypervisor, ProvisioningRetryPolicy policy) {
        this.hypervisor = hypervisor;
        this.policy = policy;
        this.retryConfig = RetryConfig.<Result<ProvisioningResult, HypervisorError>>custom()
                .maxAttempts(policy.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        policy.initialInterval(), policy.multiplier(), policy.maxInterval()))
                .retryOnResult(result -> result.isFailure() && result.error().retriable())
                .retryOnException(e -> false)
                .failAfterMaxAttempts(false)
                .build();
    }

    public Result<ProvisioningResult, ProvisioningFailure> provision(HypervisorVmSpec spec, String correlationId) {
        Retry retry = Retry.of("provisioning-" + correlationId, retryConfig);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "Retrying creation of VM {} (attempt {}/{}) in {} ms",
                spec.name(), event.getNumberOfRetryAttempts() + 1, policy.maxAttempts(),
                event.getWaitInterval().toMillis()));

        AtomicInteger attempts = new AtomicInteger();
        Result<ProvisioningResult, HypervisorError> result;
        try {
            result = Retry.decorateSupplier(retry, () -> {
                int attempt = attempts.incrementAndGet();
                if (attempt > 1) {
                    log.info("Creating VM {} on {}, attempt {}/{}",
                            spec.name(), hypervisor.type(), attempt, policy.maxAttempts());
                }
                return hypervisor.createVm(spec);
            }).get();
        } catch (RuntimeException e) {
            log.error("Hypervisor adapter threw while creating VM {}", spec.name(), e);
            result = Result.failure(new HypervisorError.UnknownError(
                    "Unexpected error: " + e.getClass().getSimpleName()));
        }

        if (result.isSuccess()) {
            return Result.success(result.value());
        }
        HypervisorError error = result.error();
        if (error.retriable()) {
            log.error("Giving up on VM {} after {} attempts: {}", spec.name(), attempts.get(), error.message());
        } else {
            log.warn("Permanent error creating VM {}: {}", spec.name(), error.message());
        }
        return Result.failure(new ProvisioningFailure(error, Math.max(1, attempts.get())));
    }
}
