package com.hyperdesk.vmrequest.infrastructure.hypervisor.rest;

import java.time.Instant;
import java.util.List;

/** JSON bodies of the hypervisor management API. */
public final class RestHypervisorApi {

    private RestHypervisorApi() {
    }

    public record StatusResponse(String version) {}

    public record ResourceResponse(String id, String name, String kind, List<ResourceResponse> children) {}

    public record CreateVmBody(
            String name,
            String hostname,
            String template,
            int cpu,
            int memoryGb,
            int diskGb,
            String computeTarget,
            String datastore,
            String networkId) {}

    public record VmResponse(
            String id,
            String name,
            String powerState,
            String ipAddress,
            String hostname,
            int cpu,
            int memoryGb,
            Instant createdAt,
            String warning) {}

    public record MigrateBody(String targetComputeId) {}

    /** Error body; every field is optional. */
    public record ErrorBody(
            String message,
            String field,
            String resourceType,
            String resourceId,
            Integer requested,
            Integer available) {}
}
