package com.hyperdesk.vmrequest.domain.events;

import com.hyperdesk.eventstore.EventMetadata;

import java.time.Instant;
import java.util.UUID;

/**
 * The hypervisor created the VM.
 *
 * @param hypervisorVmId backend-assigned VM id
 * @param ipAddress      detected address, {@code null} when guest tools did not report one in time
 * @param hostname       configured hostname
 * @param provisionedAt  when the VM became ready
 * @param warningMessage non-fatal provisioning warning, e.g. an IP detection timeout
 */
public record VmRequestReady(
        UUID requestId,
        String hypervisorVmId,
        String ipAddress,
        String hostname,
        Instant provisionedAt,
        String warningMessage,
        EventMetadata metadata) implements VmRequestEvent {}
