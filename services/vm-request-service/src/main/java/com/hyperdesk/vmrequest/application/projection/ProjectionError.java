package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.vmrequest.domain.VmRequestId;

/**
 * Why a read-model write did not take effect.
 * <p>
 * {@link NotFound} means zero rows matched: the row belongs to another tenant or the projection
 * has not caught up yet. It is an expected race, reported rather than thrown.
 */
public sealed interface ProjectionError {

    String message();

    record NotFound(VmRequestId requestId) implements ProjectionError {
        @Override
        public String message() {
            return "No projection row for VM request " + requestId;
        }
    }

    record DatabaseError(String message) implements ProjectionError {}
}
