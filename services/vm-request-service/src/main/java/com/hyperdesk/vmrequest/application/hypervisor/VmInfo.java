package com.hyperdesk.vmrequest.application.hypervisor;

/** Current runtime view of a VM as reported by the backend. */
public record VmInfo(
        String vmId,
        String name,
        VmPowerState powerState,
        String ipAddress,
        String hostname,
        int cpuCores,
        int memoryGb) {}
