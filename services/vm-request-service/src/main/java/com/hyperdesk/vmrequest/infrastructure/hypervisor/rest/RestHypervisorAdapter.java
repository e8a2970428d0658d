package com.hyperdesk.vmrequest.infrastructure.hypervisor.rest;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.application.hypervisor.ConnectionInfo;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorCapabilities;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorPort;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorType;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorVmSpec;
import com.hyperdesk.vmrequest.application.hypervisor.ProvisioningResult;
import com.hyperdesk.vmrequest.application.hypervisor.ResourceKind;
import com.hyperdesk.vmrequest.application.hypervisor.ResourceNode;
import com.hyperdesk.vmrequest.application.hypervisor.VmInfo;
import com.hyperdesk.vmrequest.application.hypervisor.VmPowerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Hypervisor reached through an HTTP/JSON management API.
 * <p>
 * Supports live migration but not snapshots. Every {@link RestClientException} is translated by
 * {@link RestHypervisorErrorMapper}.
 */
public class RestHypervisorAdapter implements HypervisorPort {

    private static final Logger log = LoggerFactory.getLogger(RestHypervisorAdapter.class);

    private static final HypervisorCapabilities CAPABILITIES = new HypervisorCapabilities(
            false, true, new HypervisorCapabilities.HotAdd(true, true, true), 64, 512);

    private final RestClient restClient;
    private final RestHypervisorErrorMapper errorMapper;
    private final String endpoint;
    private final Clock clock;

    public RestHypervisorAdapter(RestClient restClient, RestHypervisorErrorMapper errorMapper, String endpoint,
                                 Clock clock) {
        this.restClient = restClient;
        this.errorMapper = errorMapper;
        this.endpoint = endpoint;
        this.clock = clock;
    }

    @Override
    public HypervisorType type() {
        return HypervisorType.REST;
    }

    @Override
    public HypervisorCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Result<ConnectionInfo, HypervisorError> testConnection() {
        return call("testConnection", "endpoint", endpoint, () -> {
            var status = restClient.get().uri("/api/v1/status")
                    .retrieve()
                    .body(RestHypervisorApi.StatusResponse.class);
            return new ConnectionInfo(HypervisorType.REST, endpoint, status == null ? null : status.version());
        });
    }

    @Override
    public Result<List<ResourceNode>, HypervisorError> listResources() {
        return call("listResources", "resources", endpoint, () -> {
            RestHypervisorApi.ResourceResponse[] nodes = restClient.get().uri("/api/v1/resources")
                    .retrieve()
                    .body(RestHypervisorApi.ResourceResponse[].class);
            return nodes == null ? List.of() : List.of(nodes).stream().map(RestHypervisorAdapter::toNode).toList();
        });
    }

    @Override
    public Result<ProvisioningResult, HypervisorError> createVm(HypervisorVmSpec spec) {
        if (!CAPABILITIES.canHost(spec.cpuCores(), spec.memoryGb())) {
            return Result.failure(new HypervisorError.InvalidVmSpec("size",
                    "%d vCPU / %d GB exceeds the per-VM limit".formatted(spec.cpuCores(), spec.memoryGb())));
        }
        var body = new RestHypervisorApi.CreateVmBody(spec.name(), spec.hostname(), spec.template(),
                spec.cpuCores(), spec.memoryGb(), spec.diskGb(), spec.computeTarget(), spec.datastore(),
                spec.networkId());
        return call("createVm", "vm", spec.name(), () -> {
            var created = restClient.post().uri("/api/v1/vms")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(RestHypervisorApi.VmResponse.class);
            if (created == null || created.id() == null) {
                throw new IllegalStateException("Hypervisor API returned no VM id");
            }
            log.info("Hypervisor created VM {} as {}", spec.name(), created.id());
            return new ProvisioningResult(created.id(), created.ipAddress(),
                    created.hostname() != null ? created.hostname() : spec.hostname(),
                    created.createdAt() != null ? created.createdAt() : clock.instant(),
                    created.warning());
        });
    }

    @Override
    public Result<VmInfo, HypervisorError> getVm(String vmId) {
        return call("getVm", "vm", vmId, () -> {
            var vm = restClient.get().uri("/api/v1/vms/{id}", vmId)
                    .retrieve()
                    .body(RestHypervisorApi.VmResponse.class);
            if (vm == null) {
                throw new IllegalStateException("Hypervisor API returned an empty VM body");
            }
            return new VmInfo(vm.id(), vm.name(), powerState(vm.powerState()), vm.ipAddress(), vm.hostname(),
                    vm.cpu(), vm.memoryGb());
        });
    }

    @Override
    public Result<Void, HypervisorError> startVm(String vmId) {
        return call("startVm", "vm", vmId, () -> {
            restClient.post().uri("/api/v1/vms/{id}/start", vmId).retrieve().toBodilessEntity();
            return null;
        });
    }

    @Override
    public Result<Void, HypervisorError> stopVm(String vmId) {
        return call("stopVm", "vm", vmId, () -> {
            restClient.post().uri("/api/v1/vms/{id}/stop", vmId).retrieve().toBodilessEntity();
            return null;
        });
    }

    @Override
    public Result<Void, HypervisorError> deleteVm(String vmId) {
        return call("deleteVm", "vm", vmId, () -> {
            restClient.delete().uri("/api/v1/vms/{id}", vmId).retrieve().toBodilessEntity();
            return null;
        });
    }

    @Override
    public Result<Void, HypervisorError> migrateVm(String vmId, String targetComputeId) {
        return call("migrateVm", "vm", vmId, () -> {
            restClient.post().uri("/api/v1/vms/{id}/migrate", vmId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new RestHypervisorApi.MigrateBody(targetComputeId))
                    .retrieve()
                    .toBodilessEntity();
            return null;
        });
    }

    private <T> Result<T, HypervisorError> call(String operation, String resourceType, String resourceId,
                                                Supplier<T> request) {
        try {
            return Result.success(request.get());
        } catch (RestClientException | IllegalStateException e) {
            HypervisorError error = errorMapper.map(operation, resourceType, resourceId, e);
            log.warn("Hypervisor {} on {} failed: {} (retriable={})",
                    operation, resourceId, error.message(), error.retriable());
            return Result.failure(error);
        }
    }

    private static ResourceNode toNode(RestHypervisorApi.ResourceResponse node) {
        List<ResourceNode> children = node.children() == null
                ? List.of()
                : node.children().stream().map(RestHypervisorAdapter::toNode).toList();
        return new ResourceNode(node.id(), node.name(), resourceKind(node.kind()), children);
    }

    private static ResourceKind resourceKind(String kind) {
        if (kind == null) {
            return ResourceKind.SITE;
        }
        return switch (kind.toLowerCase(Locale.ROOT)) {
            case "cluster", "host", "compute", "resource-pool" -> ResourceKind.COMPUTE;
            case "datastore", "storage", "volume" -> ResourceKind.STORAGE;
            case "network", "portgroup", "vlan" -> ResourceKind.NETWORK;
            default -> ResourceKind.SITE;
        };
    }

    private static VmPowerState powerState(String state) {
        if (state == null) {
            return VmPowerState.UNKNOWN;
        }
        return switch (state.toLowerCase(Locale.ROOT)) {
            case "running", "on", "powered_on" -> VmPowerState.POWERED_ON;
            case "stopped", "off", "powered_off" -> VmPowerState.POWERED_OFF;
            case "suspended", "paused" -> VmPowerState.SUSPENDED;
            default -> VmPowerState.UNKNOWN;
        };
    }
}
