package com.converge.core.model;

import java.util.List;

/**
 * Bucket notification that invokes a function.
 *
 * @param events object events, e.g. {@code s3:ObjectCreated:*}
 * @param prefix key prefix filter, empty for none
 * @param suffix key suffix filter, empty for none
 */
public record S3BucketNotification(
        String resourceName,
        String bucket,
        List<String> events,
        String prefix,
        String suffix,
        ResourceId lambdaFunction
) implements Resource {

    public S3BucketNotification {
        events = List.copyOf(events);
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.S3_EVENT;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(lambdaFunction);
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitS3BucketNotification(this);
    }
}
