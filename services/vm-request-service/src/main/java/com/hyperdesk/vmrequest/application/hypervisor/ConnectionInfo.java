package com.hyperdesk.vmrequest.application.hypervisor;

/** Answer of a successful connection test. */
public record ConnectionInfo(HypervisorType type, String endpoint, String version) {}
