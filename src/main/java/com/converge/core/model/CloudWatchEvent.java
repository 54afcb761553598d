package com.converge.core.model;

import java.util.List;

/**
 * A rule invoking a function when an event matches a JSON pattern.
 */
public record CloudWatchEvent(
        String resourceName,
        String ruleName,
        String eventPattern,
        String ruleDescription,
        ResourceId lambdaFunction
) implements Resource {

    @Override
    public ResourceType resourceType() {
        return ResourceType.CLOUDWATCH_EVENT;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(lambdaFunction);
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitCloudWatchEvent(this);
    }
}
