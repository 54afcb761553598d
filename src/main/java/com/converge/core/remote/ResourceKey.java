package com.converge.core.remote;

import com.converge.core.model.Resource;
import com.converge.core.model.ResourceType;

/**
 * Cache key of a remote lookup.
 */
public record ResourceKey(ResourceType resourceType, String resourceName) {

    public static ResourceKey of(Resource resource) {
        return new ResourceKey(resource.resourceType(), resource.resourceName());
    }
}
