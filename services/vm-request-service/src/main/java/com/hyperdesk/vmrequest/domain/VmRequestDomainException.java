package com.hyperdesk.vmrequest.domain;

/**
 * A transition the aggregate refuses. Checked so that every caller decides how to report it;
 * command handlers turn it into a typed error value.
 */
public abstract class VmRequestDomainException extends Exception {

    protected VmRequestDomainException(String message) {
        super(message);
    }
}
