package com.hyperdesk.vmrequest.config;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service identity, bound from {@code hyperdesk.service.*}.
 *
 * <pre>
 * hyperdesk:
 *   service:
 *     name: vm-request-service
 *     environment: production
 * </pre>
 *
 * @param name        used as the {@code service} tag on metrics. Required.
 * @param environment deployment environment, defaults to {@code development}
 */
@ConfigurationProperties(prefix = "hyperdesk.service")
@Validated
public record VmRequestServiceProperties(@NotBlank String name, String environment, String description) {

    public VmRequestServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
    }
}
