package com.converge.core.model;

import java.util.List;

/**
 * Event source mapping that feeds queue messages to a function.
 */
public record SqsEventSource(
        String resourceName,
        String queue,
        int batchSize,
        int maximumBatchingWindowInSeconds,
        ResourceId lambdaFunction
) implements Resource {

    @Override
    public ResourceType resourceType() {
        return ResourceType.SQS_EVENT;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(lambdaFunction);
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitSqsEventSource(this);
    }
}
