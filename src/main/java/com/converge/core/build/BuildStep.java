package com.converge.core.build;

import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;

/**
 * One local pass over the resource graph.
 * <p>
 * A step is called once per resource, in dependency order, and fills in the
 * fields it owns by replacing resources in the graph.
 */
public interface BuildStep {

    void handle(ResourceGraph graph, ResourceId id);
}
