package com.hyperdesk.vmrequest.application.hypervisor;

/**
 * What a backend can do beyond the required operations. Check before calling an optional
 * operation; an unsupported one answers {@link HypervisorError.OperationNotSupported}.
 *
 * @param maxCpu      largest vCPU count a single VM may get
 * @param maxMemoryGb largest memory size a single VM may get
 */
public record HypervisorCapabilities(
        boolean supportsSnapshots,
        boolean supportsLiveMigration,
        HotAdd hotAdd,
        int maxCpu,
        int maxMemoryGb) {

    /** Resources that can be grown on a running VM. */
    public record HotAdd(boolean cpu, boolean memory, boolean disk) {

        public static HotAdd none() {
            return new HotAdd(false, false, false);
        }
    }

    public boolean canHost(int cpuCores, int memoryGb) {
        return cpuCores <= maxCpu && memoryGb <= maxMemoryGb;
    }
}
