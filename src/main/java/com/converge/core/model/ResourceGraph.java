package com.converge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Arena holding every resource of one deploy attempt.
 * <p>
 * Resources reference each other by {@link ResourceId}. Adding the same
 * record twice yields two distinct ids; sharing a resource means passing
 * the same id to two dependents.
 */
public class ResourceGraph {

    private final List<Resource> resources = new ArrayList<>();

    public ResourceId add(Resource resource) {
        resources.add(resource);
        return new ResourceId(resources.size() - 1);
    }

    public Resource get(ResourceId id) {
        checkId(id);
        return resources.get(id.index());
    }

    /**
     * Returns the resource with the given id, checked against the expected variant.
     *
     * @throws IllegalArgumentException if the resource is of another type
     */
    public <T extends Resource> T get(ResourceId id, Class<T> type) {
        Resource resource = get(id);
        if (!type.isInstance(resource)) {
            throw new IllegalArgumentException("Resource " + id + " is a "
                    + resource.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        }
        return type.cast(resource);
    }

    /** Swaps in an updated copy of a resource, keeping every edge to it intact. */
    public void replace(ResourceId id, Resource resource) {
        checkId(id);
        resources.set(id.index(), resource);
    }

    public int size() {
        return resources.size();
    }

    public List<ResourceId> ids() {
        return IntStream.range(0, resources.size()).mapToObj(ResourceId::new).toList();
    }

    private void checkId(ResourceId id) {
        if (id.index() < 0 || id.index() >= resources.size()) {
            throw new IllegalArgumentException("No resource " + id + " in graph of size " + resources.size());
        }
    }
}
