package com.hyperdesk.vmrequest.domain;

/** The request is not in a state that allows the operation. */
public class InvalidStateException extends VmRequestDomainException {

    private final VmRequestStatus currentState;
    private final VmRequestStatus expectedState;
    private final String operation;

    public InvalidStateException(VmRequestStatus currentState, VmRequestStatus expectedState, String operation) {
        super("Cannot %s request in state %s, expected %s".formatted(operation, currentState, expectedState));
        this.currentState = currentState;
        this.expectedState = expectedState;
        this.operation = operation;
    }

    public VmRequestStatus getCurrentState() {
        return currentState;
    }

    public VmRequestStatus getExpectedState() {
        return expectedState;
    }

    public String getOperation() {
        return operation;
    }
}
