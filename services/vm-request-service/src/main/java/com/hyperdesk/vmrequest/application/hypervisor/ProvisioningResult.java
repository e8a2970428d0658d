package com.hyperdesk.vmrequest.application.hypervisor;

import java.time.Instant;

/**
 * A VM the backend created.
 *
 * @param ipAddress      {@code null} when the guest did not report an address in time
 * @param warningMessage non-fatal issue worth showing to the requester, or {@code null}
 */
public record ProvisioningResult(
        String vmId,
        String ipAddress,
        String hostname,
        Instant provisionedAt,
        String warningMessage) {}
