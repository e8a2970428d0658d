package com.hyperdesk.vmrequest.application.hypervisor;

import java.util.List;

/** Node of the backend's resource tree. */
public record ResourceNode(String id, String name, ResourceKind kind, List<ResourceNode> children) {

    public ResourceNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ResourceNode leaf(String id, String name, ResourceKind kind) {
        return new ResourceNode(id, name, kind, List.of());
    }
}
