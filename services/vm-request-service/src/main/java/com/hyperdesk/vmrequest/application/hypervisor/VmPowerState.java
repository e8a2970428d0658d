package com.hyperdesk.vmrequest.application.hypervisor;

public enum VmPowerState {
    POWERED_ON,
    POWERED_OFF,
    SUSPENDED,
    UNKNOWN
}
