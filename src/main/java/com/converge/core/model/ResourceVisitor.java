package com.converge.core.model;

/**
 * Exhaustive dispatch over the resource variants.
 * Adding a variant breaks every consumer until it handles the new case.
 *
 * @param <R> result type of a visit
 */
public interface ResourceVisitor<R> {

    R visitLambdaFunction(LambdaFunction function);

    R visitManagedIamRole(ManagedIamRole role);

    R visitPreCreatedIamRole(PreCreatedIamRole role);

    R visitAutoGenIamPolicy(AutoGenIamPolicy policy);

    R visitFileBasedIamPolicy(FileBasedIamPolicy policy);

    R visitDeploymentPackage(DeploymentPackage deploymentPackage);

    R visitRestApi(RestApi restApi);

    R visitScheduledEvent(ScheduledEvent event);

    R visitCloudWatchEvent(CloudWatchEvent event);

    R visitS3BucketNotification(S3BucketNotification notification);

    R visitSnsSubscription(SnsSubscription subscription);

    R visitSqsEventSource(SqsEventSource eventSource);
}
