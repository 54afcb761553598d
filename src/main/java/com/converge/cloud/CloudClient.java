package com.converge.cloud;

import java.util.List;
import java.util.Map;

/**
 * Synchronous client for the cloud APIs the deployer drives.
 * <p>
 * Read methods are used while planning; the rest are only invoked by the
 * executor through {@code ApiCallDispatcher}. Failures surface as
 * {@link CloudClientException}; a missing resource on a lookup surfaces as
 * {@link ResourceDoesNotExistException}.
 */
public interface CloudClient {

    // -- Account --

    String regionName();

    String partitionName();

    // -- Functions --

    boolean lambdaFunctionExists(String functionName);

    FunctionConfiguration getFunctionConfiguration(String functionName);

    /** @return the ARN of the new function */
    String createFunction(FunctionDefinition definition);

    /** @return the ARN of the updated function */
    String updateFunction(FunctionUpdate update);

    void putFunctionConcurrency(String functionName, int reservedConcurrentExecutions);

    void deleteFunctionConcurrency(String functionName);

    void deleteFunction(String functionName);

    // -- Roles --

    String getRoleArnForName(String roleName);

    RoleDetails getRole(String roleName);

    Map<String, Object> getRolePolicy(String roleName, String policyName);

    /** @return the ARN of the new role */
    String createRole(String name, Map<String, Object> trustPolicy, Map<String, Object> policy);

    void putRolePolicy(String roleName, String policyName, Map<String, Object> policyDocument);

    void updateAssumeRolePolicy(String roleName, Map<String, Object> trustPolicy);

    void deleteRole(String name);

    // -- REST APIs --

    boolean restApiExists(String restApiId);

    /** @return the id of the imported API */
    String importRestApi(Map<String, Object> swaggerDocument, String endpointType);

    void updateApiFromSwagger(String restApiId, Map<String, Object> swaggerDocument);

    void updateRestApi(String restApiId, List<Map<String, String>> patchOperations);

    void addPermissionForApigateway(String functionName, String regionName, String accountId, String restApiId);

    void deployRestApi(String restApiId, String apiGatewayStage);

    void deleteRestApi(String restApiId);

    // -- Event rules --

    boolean ruleExists(String ruleName);

    /**
     * Creates or updates a rule. Exactly one of {@code scheduleExpression}
     * and {@code eventPattern} is set.
     *
     * @return the rule ARN
     */
    String getOrCreateRuleArn(String ruleName, String scheduleExpression, String eventPattern, String ruleDescription);

    void connectRuleToLambda(String ruleName, String functionArn);

    void addPermissionForCloudwatchEvent(String ruleArn, String functionArn);

    void deleteRule(String ruleName);

    // -- S3 --

    void addPermissionForS3Event(String bucket, String functionArn);

    void connectS3BucketToLambda(String bucket, String functionArn, List<String> events, String prefix, String suffix);

    void disconnectS3BucketFromLambda(String bucket, String functionArn);

    void removePermissionForS3Event(String bucket, String functionArn);

    // -- SNS --

    /**
     * Whether the subscription still exists and connects {@code topic} (name or ARN) to the function.
     */
    boolean verifySnsSubscriptionCurrent(String subscriptionArn, String topic, String functionArn);

    void addPermissionForSnsTopic(String topicArn, String functionArn);

    /** @return the subscription ARN */
    String subscribeFunctionToTopic(String topicArn, String functionArn);

    void unsubscribeFromTopic(String subscriptionArn);

    void removePermissionForSnsTopic(String topicArn, String functionArn);

    // -- SQS --

    /**
     * Whether the event source mapping still exists and connects {@code queue} (name or ARN) to the function.
     */
    boolean verifyEventSourceCurrent(String eventUuid, String queue, String functionArn);

    /** @return the UUID of the event source mapping */
    String createSqsEventSource(String queueArn, String functionName, int batchSize, int maximumBatchingWindowInSeconds);

    void updateSqsEventSource(String eventUuid, int batchSize, int maximumBatchingWindowInSeconds);

    void removeSqsEventSource(String eventUuid);
}
