package com.hyperdesk.vmrequest.application.hypervisor;

import com.hyperdesk.eventstore.Result;

import java.util.List;

/**
 * VM lifecycle operations against one virtualization backend.
 * <p>
 * Every operation reports failures as a {@link HypervisorError} value. Snapshots and live
 * migration are optional and gated by {@link #capabilities()}; the default implementations
 * answer {@link HypervisorError.OperationNotSupported}.
 */
public interface HypervisorPort {

    HypervisorType type();

    HypervisorCapabilities capabilities();

    Result<ConnectionInfo, HypervisorError> testConnection();

    Result<List<ResourceNode>, HypervisorError> listResources();

    Result<ProvisioningResult, HypervisorError> createVm(HypervisorVmSpec spec);

    Result<VmInfo, HypervisorError> getVm(String vmId);

    Result<Void, HypervisorError> startVm(String vmId);

    Result<Void, HypervisorError> stopVm(String vmId);

    Result<Void, HypervisorError> deleteVm(String vmId);

    /**
     * @return backend id of the new snapshot
     */
    default Result<String, HypervisorError> createSnapshot(String vmId, String snapshotName) {
        return Result.failure(new HypervisorError.OperationNotSupported("createSnapshot", type()));
    }

    default Result<Void, HypervisorError> migrateVm(String vmId, String targetComputeId) {
        return Result.failure(new HypervisorError.OperationNotSupported("migrateVm", type()));
    }
}
