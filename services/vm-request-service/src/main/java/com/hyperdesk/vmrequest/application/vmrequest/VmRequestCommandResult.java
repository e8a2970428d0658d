package com.hyperdesk.vmrequest.application.vmrequest;

import com.hyperdesk.vmrequest.domain.VmRequestId;

/**
 * Successful command outcome.
 *
 * @param requestId    the affected request
 * @param version      stream length after the command
 * @param stateChanged {@code false} when the command was an idempotent repeat and appended nothing
 */
public record VmRequestCommandResult(VmRequestId requestId, long version, boolean stateChanged) {}
