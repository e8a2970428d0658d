package com.hyperdesk.vmrequest.application.provisioning;

import java.time.Duration;

/**
 * Exponential backoff for retriable hypervisor errors.
 *
 * @param maxAttempts total attempts including the first
 */
public record ProvisioningRetryPolicy(int maxAttempts, Duration initialInterval, double multiplier,
                                      Duration maxInterval) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final Duration DEFAULT_INITIAL_INTERVAL = Duration.ofSeconds(10);
    public static final double DEFAULT_MULTIPLIER = 2.0;
    public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(120);

    public ProvisioningRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialInterval == null || initialInterval.isNegative() || initialInterval.isZero()) {
            throw new IllegalArgumentException("initialInterval must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        if (maxInterval == null || maxInterval.compareTo(initialInterval) < 0) {
            throw new IllegalArgumentException("maxInterval must not be shorter than initialInterval");
        }
    }

    public static ProvisioningRetryPolicy defaults() {
        return new ProvisioningRetryPolicy(
                DEFAULT_MAX_ATTEMPTS, DEFAULT_INITIAL_INTERVAL, DEFAULT_MULTIPLIER, DEFAULT_MAX_INTERVAL);
    }
}
