package com.hyperdesk.vmrequest.domain;

import java.util.Objects;
import java.util.UUID;

/** Identity of a VM request; also the id of its event stream. */
public record VmRequestId(UUID value) {

    public VmRequestId {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static VmRequestId generate() {
        return new VmRequestId(UUID.randomUUID());
    }

    public static VmRequestId fromString(String raw) {
        return new VmRequestId(UUID.fromString(raw));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
