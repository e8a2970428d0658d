package com.hyperdesk.vmrequest.application.hypervisor;

/** Common shape every backend hierarchy is translated into. */
public enum ResourceKind {
    SITE,
    COMPUTE,
    STORAGE,
    NETWORK
}
