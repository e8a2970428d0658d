package com.hyperdesk.vmrequest.application.hypervisor;

/** Backends that can sit behind {@link HypervisorPort}. */
public enum HypervisorType {
    SIMULATED,
    REST
}
