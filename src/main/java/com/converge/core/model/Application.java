package com.converge.core.model;

import java.util.List;

/**
 * Root of a declared graph: the stage being deployed and its top-level resources.
 *
 * @param stage stage name, also the key of the deployed-resources record
 * @param graph arena with every resource
 * @param roots top-level resources in declaration order
 */
public record Application(String stage, ResourceGraph graph, List<ResourceId> roots) {

    public Application {
        roots = List.copyOf(roots);
    }

    public static Application empty(String stage) {
        return new Application(stage, new ResourceGraph(), List.of());
    }
}
