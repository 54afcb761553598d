package com.converge.core.model;

import java.util.List;

/**
 * A node of the declared resource graph.
 * <p>
 * Resources are immutable. Edges to other resources are {@link ResourceId}s
 * into the owning {@link ResourceGraph}; the build stage produces updated
 * copies and swaps them into the graph.
 */
public interface Resource {

    /** Stable name used to diff this resource across deployments. */
    String resourceName();

    ResourceType resourceType();

    /** Ids of the resources this one needs, in declaration order. */
    default List<ResourceId> dependencies() {
        return List.of();
    }

    /** Names of fields still waiting for the build stage. */
    default List<String> pendingFields() {
        return List.of();
    }

    <R> R accept(ResourceVisitor<R> visitor);
}
