package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.domain.VmRequestId;

/**
 * Write side of the VM request read model.
 * <p>
 * Every call is keyed by request id and tenant id and is idempotent: applying the same write
 * twice leaves the same row. Implementations report failures as values and never throw for
 * database problems.
 */
public interface VmRequestProjectionUpdater {

    /** Inserts the row, or overwrites it when a row with the same id and tenant exists. */
    Result<Void, ProjectionError> insert(NewVmRequestProjection projection);

    Result<Void, ProjectionError> updateStatus(VmRequestStatusUpdate update);

    Result<Void, ProjectionError> updateVmDetails(VmDetailsUpdate update);

    /** Deletes the row; an already absent row counts as success. */
    Result<Void, ProjectionError> remove(String tenantId, VmRequestId id);
}
