package com.hyperdesk.vmrequest.domain;

import java.util.Objects;
import java.util.UUID;

/** Project a requested VM is billed and grouped under. */
public record ProjectId(UUID value) {

    public ProjectId {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ProjectId fromString(String raw) {
        return new ProjectId(UUID.fromString(raw));
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
