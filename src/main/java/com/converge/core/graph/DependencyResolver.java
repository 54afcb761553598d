package com.converge.core.graph;

import com.converge.core.model.Application;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Orders the resources of an application so that every resource comes after
 * everything it depends on.
 * <p>
 * Depth-first post-order walk from each root in declaration order. A resource
 * reachable through several edges appears once, at the position of its first
 * visit. The graph must be acyclic; cycles are not detected.
 */
@Component
public class DependencyResolver {

    private static final Logger log = LoggerFactory.getLogger(DependencyResolver.class);

    public List<ResourceId> order(Application application) {
        ResourceGraph graph = application.graph();
        List<ResourceId> ordered = new ArrayList<>();
        Set<ResourceId> visited = new HashSet<>();
        for (ResourceId root : application.roots()) {
            visit(graph, root, visited, ordered);
        }
        log.debug("Ordered {} resources for stage {}", ordered.size(), application.stage());
        return ordered;
    }

    private void visit(ResourceGraph graph, ResourceId id, Set<ResourceId> visited, List<ResourceId> ordered) {
        if (!visited.add(id)) {
            return;
        }
        for (ResourceId dependency : graph.get(id).dependencies()) {
            visit(graph, dependency, visited, ordered);
        }
        ordered.add(id);
    }
}
