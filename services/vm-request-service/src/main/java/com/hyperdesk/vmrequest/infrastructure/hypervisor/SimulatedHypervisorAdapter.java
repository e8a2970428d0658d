package com.hyperdesk.vmrequest.infrastructure.hypervisor;

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

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory backend with a fixed CPU and memory pool. Used for local runs and tests.
 * <p>
 * Supports snapshots but not live migration. Failures can be queued with
 * {@link #failNextCreates(HypervisorError...)} to exercise retry paths.
 */
public class SimulatedHypervisorAdapter implements HypervisorPort {

    private static final Logger log = LoggerFactory.getLogger(SimulatedHypervisorAdapter.class);

    static final String COMPUTE_ID = "sim-cluster-01";
    static final String DATASTORE_ID = "sim-datastore-01";
    static final String NETWORK_ID = "sim-net-default";

    private static final HypervisorCapabilities CAPABILITIES = new HypervisorCapabilities(
            true, false, new HypervisorCapabilities.HotAdd(true, true, false), 32, 128);

    private final int totalCpu;
    private final int totalMemoryGb;
    private final Clock clock;

    private final Map<String, SimulatedVm> vms = new HashMap<>();
    private final Deque<HypervisorError> scheduledFailures = new ArrayDeque<>();
    private int usedCpu;
    private int usedMemoryGb;
    private int sequence;

    public SimulatedHypervisorAdapter(int totalCpu, int totalMemoryGb, Clock clock) {
        if (totalCpu <= 0 || totalMemoryGb <= 0) {
            throw new IllegalArgumentException("Simulated capacity must be positive");
        }
        this.totalCpu = totalCpu;
        this.totalMemoryGb = totalMemoryGb;
        this.clock = clock;
    }

    @Override
    public HypervisorType type() {
        return HypervisorType.SIMULATED;
    }

    @Override
    public HypervisorCapabilities capabilities() {
        return CAPABILITIES;
    }

    @Override
    public Result<ConnectionInfo, HypervisorError> testConnection() {
        return Result.success(new ConnectionInfo(HypervisorType.SIMULATED, "memory://simulated", "1.0"));
    }

    @Override
    public Result<List<ResourceNode>, HypervisorError> listResources() {
        return Result.success(List.of(new ResourceNode("sim-dc-01", "Simulated datacenter", ResourceKind.SITE,
                List.of(ResourceNode.leaf(COMPUTE_ID, "Simulated cluster", ResourceKind.COMPUTE),
                        ResourceNode.leaf(DATASTORE_ID, "Simulated datastore", ResourceKind.STORAGE),
                        ResourceNode.leaf(NETWORK_ID, "Default network", ResourceKind.NETWORK)))));
    }

    @Override
    public synchronized Result<ProvisioningResult, HypervisorError> createVm(HypervisorVmSpec spec) {
        HypervisorError scheduled = scheduledFailures.poll();
        if (scheduled != null) {
            log.info("Simulated createVm for {} fails with scheduled {}", spec.name(), scheduled);
            return Result.failure(scheduled);
        }
        if (!CAPABILITIES.canHost(spec.cpuCores(), spec.memoryGb())) {
            return Result.failure(new HypervisorError.InvalidVmSpec("size",
                    "%d vCPU / %d GB exceeds the per-VM limit".formatted(spec.cpuCores(), spec.memoryGb())));
        }
        if (spec.computeTarget() != null && !COMPUTE_ID.equals(spec.computeTarget())) {
            return Result.failure(new HypervisorError.ResourceNotFound("compute", spec.computeTarget()));
        }
        boolean nameTaken = vms.values().stream().anyMatch(vm -> vm.name.equals(spec.name()));
        if (nameTaken) {
            return Result.failure(new HypervisorError.ResourceAlreadyExists("vm", spec.name()));
        }
        int availableCpu = totalCpu - usedCpu;
        if (spec.cpuCores() > availableCpu) {
            return Result.failure(new HypervisorError.ResourceExhausted("cpu", spec.cpuCores(), availableCpu));
        }
        int availableMemory = totalMemoryGb - usedMemoryGb;
        if (spec.memoryGb() > availableMemory) {
            return Result.failure(new HypervisorError.ResourceExhausted("memory", spec.memoryGb(), availableMemory));
        }

        sequence++;
        String vmId = "sim-vm-" + sequence;
        String ipAddress = "10.0." + (sequence / 250) + "." + (sequence % 250 + 2);
        var vm = new SimulatedVm(vmId, spec.name(), spec.hostname(), ipAddress, spec.cpuCores(), spec.memoryGb());
        vms.put(vmId, vm);
        usedCpu += spec.cpuCores();
        usedMemoryGb += spec.memoryGb();
        log.info("Simulated VM {} created as {} ({} vCPU, {} GB)", spec.name(), vmId, spec.cpuCores(), spec.memoryGb());
        return Result.success(new ProvisioningResult(vmId, ipAddress, spec.hostname(), clock.instant(), null));
    }

    @Override
    public synchronized Result<VmInfo, HypervisorError> getVm(String vmId) {
        SimulatedVm vm = vms.get(vmId);
        if (vm == null) {
            return Result.failure(new HypervisorError.ResourceNotFound("vm", vmId));
        }
        return Result.success(new VmInfo(vm.id, vm.name, vm.powerState, vm.ipAddress, vm.hostname,
                vm.cpuCores, vm.memoryGb));
    }

    @Override
    public synchronized Result<Void, HypervisorError> startVm(String vmId) {
        return setPowerState(vmId, VmPowerState.POWERED_ON);
    }

    @Override
    public synchronized Result<Void, HypervisorError> stopVm(String vmId) {
        return setPowerState(vmId, VmPowerState.POWERED_OFF);
    }

    @Override
    public synchronized Result<Void, HypervisorError> deleteVm(String vmId) {
        SimulatedVm vm = vms.remove(vmId);
        if (vm == null) {
            return Result.failure(new HypervisorError.ResourceNotFound("vm", vmId));
        }
        usedCpu -= vm.cpuCores;
        usedMemoryGb -= vm.memoryGb;
        return Result.success();
    }

    @Override
    public synchronized Result<String, HypervisorError> createSnapshot(String vmId, String snapshotName) {
        SimulatedVm vm = vms.get(vmId);
        if (vm == null) {
            return Result.failure(new HypervisorError.ResourceNotFound("vm", vmId));
        }
        vm.snapshots++;
        return Result.success(vmId + "-snap-" + vm.snapshots);
    }

    /** Makes the next {@code errors.length} create calls fail with the given errors, in order. */
    public synchronized void failNextCreates(HypervisorError... errors) {
        scheduledFailures.addAll(Arrays.asList(errors));
    }

    public synchronized int availableCpu() {
        return totalCpu - usedCpu;
    }

    private Result<Void, HypervisorError> setPowerState(String vmId, VmPowerState state) {
        SimulatedVm vm = vms.get(vmId);
        if (vm == null) {
            return Result.failure(new HypervisorError.ResourceNotFound("vm", vmId));
        }
        vm.powerState = state;
        return Result.success();
    }

    private static final class SimulatedVm {
        private final String id;
        private final String name;
        private final String hostname;
        private final String ipAddress;
        private final int cpuCores;
        private final int memoryGb;
        private VmPowerState powerState = VmPowerState.POWERED_ON;
        private int snapshots;

        private SimulatedVm(String id, String name, String hostname, String ipAddress, int cpuCores, int memoryGb) {
            this.id = id;
            this.name = name;
            this.hostname = hostname;
            this.ipAddress = ipAddress;
            this.cpuCores = cpuCores;
            this.memoryGb = memoryGb;
        }
    }
}
