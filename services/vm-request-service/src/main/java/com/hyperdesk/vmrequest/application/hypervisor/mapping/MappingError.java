package com.hyperdesk.vmrequest.application.hypervisor.mapping;

/** A provisioning request that cannot be translated for the backend. */
public sealed interface MappingError {

    String message();

    record MissingMapping(String tenantId) implements MappingError {
        @Override
        public String message() {
            return "No resource mapping configured for tenant " + tenantId;
        }
    }

    record UnknownNetwork(String tenantId, String networkName) implements MappingError {
        @Override
        public String message() {
            return "Network '%s' is not mapped for tenant %s".formatted(networkName, tenantId);
        }
    }
}
