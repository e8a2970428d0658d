package com.hyperdesk.vmrequest.application.hypervisor;

/**
 * Backend-native description of a VM to create, produced by the resource mapper.
 *
 * @param computeTarget cluster, host or pool id the VM is placed on
 * @param networkId     backend id of the network the primary NIC joins
 */
public record HypervisorVmSpec(
        String name,
        String hostname,
        String template,
        int cpuCores,
        int memoryGb,
        int diskGb,
        String computeTarget,
        String datastore,
        String networkId) {

    public HypervisorVmSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (cpuCores <= 0 || memoryGb <= 0 || diskGb <= 0) {
            throw new IllegalArgumentException("cpuCores, memoryGb and diskGb must be positive");
        }
    }
}
