package com.converge.core.model;

import java.util.List;

/**
 * A rule invoking a function on a schedule, e.g. {@code rate(5 minutes)}.
 */
public record ScheduledEvent(
        String resourceName,
        String ruleName,
        String scheduleExpression,
        String ruleDescription,
        ResourceId lambdaFunction
) implements Resource {

    @Override
    public ResourceType resourceType() {
        return ResourceType.SCHEDULED_EVENT;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(lambdaFunction);
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitScheduledEvent(this);
    }
}
