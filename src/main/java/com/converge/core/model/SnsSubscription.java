package com.converge.core.model;

import java.util.List;

/**
 * Subscription of a function to a topic.
 *
 * @param topic topic name or full topic ARN
 */
public record SnsSubscription(String resourceName, String topic, ResourceId lambdaFunction) implements Resource {

    public boolean topicIsArn() {
        return topic.startsWith("arn:");
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.SNS_EVENT;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(lambdaFunction);
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitSnsSubscription(this);
    }
}
