package com.converge.core.build;

import com.converge.core.model.Application;
import com.converge.core.model.Resource;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered resources whose late-bound fields have all been filled.
 * Instances only come out of {@link #verify}, so holding one proves the
 * build stage finished.
 */
public final class BuiltResources {

    private final Application application;
    private final List<ResourceId> order;

    private BuiltResources(Application application, List<ResourceId> order) {
        this.application = application;
        this.order = List.copyOf(order);
    }

    /**
     * Checks that no resource in {@code order} still has a pending field.
     *
     * @throws BuildException naming every resource and field left pending
     */
    public static BuiltResources verify(Application application, List<ResourceId> order) {
        List<String> problems = new ArrayList<>();
        for (ResourceId id : order) {
            Resource resource = application.graph().get(id);
            for (String field : resource.pendingFields()) {
                problems.add(resource.resourceName() + "." + field);
            }
        }
        if (!problems.isEmpty()) {
            throw new BuildException("Unresolved fields after build: " + String.join(", ", problems));
        }
        return new BuiltResources(application, order);
    }

    public Application application() {
        return application;
    }

    public ResourceGraph graph() {
        return application.graph();
    }

    public List<ResourceId> order() {
        return order;
    }

    public String stage() {
        return application.stage();
    }
}
