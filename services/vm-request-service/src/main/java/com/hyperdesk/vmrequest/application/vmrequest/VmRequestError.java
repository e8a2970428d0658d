package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;

/**
 * Typed failures of VM request commands. A command returns exactly one of these or succeeds.
 */
public sealed interface VmRequestError {

    String message();

    /** No such request for the caller's tenant. Also used for requests owned by other tenants. */
    record NotFound(VmRequestId requestId) implements VmRequestError {
        @Override
        public String message() {
            return "VM request not found: " + requestId;
        }
    }

    /** The caller may not perform this operation on the request. */
    record Forbidden(String message) implements VmRequestError {}

    /** The request's current state does not allow the operation. */
    record InvalidState(VmRequestStatus currentState, String message) implements VmRequestError {}

    /** Someone else changed the request first; reload and decide again. */
    record ConcurrencyConflict(long expectedVersion, long actualVersion) implements VmRequestError {
        @Override
        public String message() {
            return "VM request was modified concurrently: expected version %d, actual %d"
                    .formatted(expectedVersion, actualVersion);
        }
    }

    /** The event store could not be read or written. */
    record PersistenceFailure(String message) implements VmRequestError {}

    /** The tenant or project has no capacity left for this size. */
    record QuotaExceeded(String message) implements VmRequestError {}
}
