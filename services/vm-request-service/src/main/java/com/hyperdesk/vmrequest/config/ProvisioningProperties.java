package com.hyperdesk.vmrequest.config;

import com.hyperdesk.vmrequest.application.provisioning.ProvisioningRetryPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Provisioning retry and executor settings, bound from {@code hyperdesk.provisioning.*}.
 * Unset values fall back to the defaults of {@link ProvisioningRetryPolicy}.
 */
@ConfigurationProperties(prefix = "hyperdesk.provisioning")
@Validated
public record ProvisioningProperties(@Valid Retry retry, @Min(1) int executorPoolSize) {

    public ProvisioningProperties {
        if (retry == null) {
            retry = new Retry(0, null, 0, null);
        }
        if (executorPoolSize <= 0) {
            executorPoolSize = 4;
        }
    }

    public ProvisioningRetryPolicy retryPolicy() {
        return new ProvisioningRetryPolicy(retry.maxAttempts(), retry.initialInterval(), retry.multiplier(),
                retry.maxInterval());
    }

    public record Retry(int maxAttempts, Duration initialInterval, double multiplier, Duration maxInterval) {

        public Retry {
            if (maxAttempts <= 0) {
                maxAttempts = ProvisioningRetryPolicy.DEFAULT_MAX_ATTEMPTS;
            }
            if (initialInterval == null) {
                initialInterval = ProvisioningRetryPolicy.DEFAULT_INITIAL_INTERVAL;
            }
            if (multiplier <= 0) {
                multiplier = ProvisioningRetryPolicy.DEFAULT_MULTIPLIER;
            }
            if (maxInterval == null) {
                maxInterval = ProvisioningRetryPolicy.DEFAULT_MAX_INTERVAL;
            }
        }
    }
}
