package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.domain.ProjectId;
import com.hyperdesk.vmrequest.domain.VmSize;

/** Decides whether a tenant may request another VM of the given size. */
@FunctionalInterface
public interface QuotaChecker {

    Result<Void, VmRequestError.QuotaExceeded> check(String tenantId, ProjectId projectId, VmSize size);

    static QuotaChecker alwaysAllow() {
        return (tenantId, projectId, size) -> Result.success();
    }
}
