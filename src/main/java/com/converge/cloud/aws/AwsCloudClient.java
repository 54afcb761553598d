package com.converge.cloud.aws;

import com.converge.cloud.CloudClient;
import com.converge.cloud.CloudClientException;
import com.converge.cloud.FunctionConfiguration;
import com.converge.cloud.FunctionDefinition;
import com.converge.cloud.FunctionUpdate;
import com.converge.cloud.ResourceDoesNotExistException;
import com.converge.cloud.RoleDetails;
import com.converge.core.executor.ServicePrincipals;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.RegionMetadata;
import software.amazon.awssdk.services.apigateway.ApiGatewayClient;
import software.amazon.awssdk.services.apigateway.model.CreateDeploymentRequest;
import software.amazon.awssdk.services.apigateway.model.DeleteRestApiRequest;
import software.amazon.awssdk.services.apigateway.model.GetRestApiRequest;
import software.amazon.awssdk.services.apigateway.model.ImportRestApiRequest;
import software.amazon.awssdk.services.apigateway.model.PatchOperation;
import software.amazon.awssdk.services.apigateway.model.PutMode;
import software.amazon.awssdk.services.apigateway.model.PutRestApiRequest;
import software.amazon.awssdk.services.apigateway.model.UpdateRestApiRequest;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.eventbridge.model.DeleteRuleRequest;
import software.amazon.awssdk.services.eventbridge.model.DescribeRuleRequest;
import software.amazon.awssdk.services.eventbridge.model.ListTargetsByRuleRequest;
import software.amazon.awssdk.services.eventbridge.model.PutRuleRequest;
import software.amazon.awssdk.services.eventbridge.model.PutTargetsRequest;
import software.amazon.awssdk.services.eventbridge.model.RemoveTargetsRequest;
import software.amazon.awssdk.services.eventbridge.model.Target;
import software.amazon.awssdk.services.iam.IamClient;
import software.amazon.awssdk.services.iam.model.CreateRoleRequest;
import software.amazon.awssdk.services.iam.model.DeleteRolePolicyRequest;
import software.amazon.awssdk.services.iam.model.DeleteRoleRequest;
import software.amazon.awssdk.services.iam.model.GetRolePolicyRequest;
import software.amazon.awssdk.services.iam.model.GetRoleRequest;
import software.amazon.awssdk.services.iam.model.ListRolePoliciesRequest;
import software.amazon.awssdk.services.iam.model.NoSuchEntityException;
import software.amazon.awssdk.services.iam.model.PutRolePolicyRequest;
import software.amazon.awssdk.services.iam.model.Role;
import software.amazon.awssdk.services.iam.model.UpdateAssumeRolePolicyRequest;
import software.amazon.awssdk.services.lambda.LambdaClient;
import software.amazon.awssdk.services.lambda.model.AddPermissionRequest;
import software.amazon.awssdk.services.lambda.model.CreateEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.CreateFunctionRequest;
import software.amazon.awssdk.services.lambda.model.DeleteEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.DeleteFunctionConcurrencyRequest;
import software.amazon.awssdk.services.lambda.model.DeleteFunctionRequest;
import software.amazon.awssdk.services.lambda.model.Environment;
import software.amazon.awssdk.services.lambda.model.FunctionCode;
import software.amazon.awssdk.services.lambda.model.GetEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.GetEventSourceMappingResponse;
import software.amazon.awssdk.services.lambda.model.GetFunctionConfigurationRequest;
import software.amazon.awssdk.services.lambda.model.GetFunctionRequest;
import software.amazon.awssdk.services.lambda.model.GetFunctionResponse;
import software.amazon.awssdk.services.lambda.model.GetPolicyRequest;
import software.amazon.awssdk.services.lambda.model.Layer;
import software.amazon.awssdk.services.lambda.model.ListTagsRequest;
import software.amazon.awssdk.services.lambda.model.PutFunctionConcurrencyRequest;
import software.amazon.awssdk.services.lambda.model.RemovePermissionRequest;
import software.amazon.awssdk.services.lambda.model.ResourceNotFoundException;
import software.amazon.awssdk.services.lambda.model.TagResourceRequest;
import software.amazon.awssdk.services.lambda.model.TracingConfig;
import software.amazon.awssdk.services.lambda.model.TracingMode;
import software.amazon.awssdk.services.lambda.model.UntagResourceRequest;
import software.amazon.awssdk.services.lambda.model.UpdateEventSourceMappingRequest;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionCodeRequest;
import software.amazon.awssdk.services.lambda.model.UpdateFunctionConfigurationRequest;
import software.amazon.awssdk.services.lambda.model.VpcConfig;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.FilterRule;
import software.amazon.awssdk.services.s3.model.FilterRuleName;
import software.amazon.awssdk.services.s3.model.GetBucketNotificationConfigurationRequest;
import software.amazon.awssdk.services.s3.model.GetBucketNotificationConfigurationResponse;
import software.amazon.awssdk.services.s3.model.LambdaFunctionConfiguration;
import software.amazon.awssdk.services.s3.model.NotificationConfiguration;
import software.amazon.awssdk.services.s3.model.NotificationConfigurationFilter;
import software.amazon.awssdk.services.s3.model.PutBucketNotificationConfigurationRequest;
import software.amazon.awssdk.services.s3.model.S3KeyFilter;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.GetSubscriptionAttributesRequest;
import software.amazon.awssdk.services.sns.model.SubscribeRequest;
import software.amazon.awssdk.services.sns.model.UnsubscribeRequest;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * {@link CloudClient} backed by the AWS SDK for Java v2.
 * <p>
 * Credentials and retries are whatever the SDK's default chain and retry
 * policy provide. Every {@link SdkException} is translated into a
 * {@link CloudClientException} naming the failed operation; "not found"
 * answers from lookups become {@link ResourceDoesNotExistException} or a
 * {@code false} existence result.
 */
public class AwsCloudClient implements CloudClient, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AwsCloudClient.class);

    private final Region region;
    private final LambdaClient lambda;
    private final IamClient iam;
    private final ApiGatewayClient apiGateway;
    private final EventBridgeClient events;
    private final S3Client s3;
    private final SnsClient sns;
    private final ObjectMapper objectMapper;

    AwsCloudClient(Region region, LambdaClient lambda, IamClient iam, ApiGatewayClient apiGateway,
                   EventBridgeClient events, S3Client s3, SnsClient sns, ObjectMapper objectMapper) {
        this.region = region;
        this.lambda = lambda;
        this.iam = iam;
        this.apiGateway = apiGateway;
        this.events = events;
        this.s3 = s3;
        this.sns = sns;
        this.objectMapper = objectMapper;
    }

    public static AwsCloudClient create(Region region, AwsCredentialsProvider credentials, ObjectMapper objectMapper) {
        return new AwsCloudClient(region,
                LambdaClient.builder().region(region).credentialsProvider(credentials).build(),
                IamClient.builder().region(globalRegion(region)).credentialsProvider(credentials).build(),
                ApiGatewayClient.builder().region(region).credentialsProvider(credentials).build(),
                EventBridgeClient.builder().region(region).credentialsProvider(credentials).build(),
                S3Client.builder().region(region).credentialsProvider(credentials).build(),
                SnsClient.builder().region(region).credentialsProvider(credentials).build(),
                objectMapper);
    }

    private static Region globalRegion(Region region) {
        return switch (partitionOf(region)) {
            case "aws-cn" -> Region.AWS_CN_GLOBAL;
            case "aws-us-gov" -> Region.AWS_US_GOV_GLOBAL;
            default -> Region.AWS_GLOBAL;
        };
    }

    private static String partitionOf(Region region) {
        RegionMetadata metadata = region.metadata();
        return metadata == null ? "aws" : metadata.partition().id();
    }

    // -- Account --

    @Override
    public String regionName() {
        return region.id();
    }

    @Override
    public String partitionName() {
        return partitionOf(region);
    }

    // -- Functions --

    @Override
    public boolean lambdaFunctionExists(String functionName) {
        try {
            call("GetFunction", () -> lambda.getFunction(GetFunctionRequest.builder().functionName(functionName).build()));
            return true;
        } catch (ResourceDoesNotExistException e) {
            return false;
        }
    }

    @Override
    public FunctionConfiguration getFunctionConfiguration(String functionName) {
        GetFunctionResponse response = call("GetFunction",
                () -> lambda.getFunction(GetFunctionRequest.builder().functionName(functionName).build()));
        var config = response.configuration();
        var vpc = config.vpcConfig();
        return new FunctionConfiguration(
                config.functionArn(),
                config.role(),
                config.runtimeAsString(),
                config.handler(),
                config.timeout(),
                config.memorySize(),
                config.environment() == null ? Map.of() : config.environment().variables(),
                response.hasTags() ? response.tags() : Map.of(),
                vpc == null ? List.of() : vpc.securityGroupIds(),
                vpc == null ? List.of() : vpc.subnetIds(),
                config.layers().stream().map(Layer::arn).collect(Collectors.toList()),
                config.tracingConfig() != null && config.tracingConfig().mode() == TracingMode.ACTIVE,
                config.codeSha256(),
                response.concurrency() == null ? null : response.concurrency().reservedConcurrentExecutions());
    }

    @Override
    public String createFunction(FunctionDefinition definition) {
        log.info("Creating function {}", definition.functionName());
        var request = CreateFunctionRequest.builder()
                .functionName(definition.functionName())
                .role(definition.roleArn())
                .runtime(definition.runtime())
                .handler(definition.handler())
                .code(FunctionCode.builder().zipFile(readZip(definition.zipFile())).build())
                .environment(Environment.builder().variables(definition.environmentVariables()).build())
                .tags(definition.tags())
                .timeout(definition.timeout())
                .memorySize(definition.memorySize())
                .vpcConfig(VpcConfig.builder()
                        .securityGroupIds(definition.securityGroupIds())
                        .subnetIds(definition.subnetIds())
                        .build())
                .layers(definition.layers())
                .tracingConfig(tracing(definition.xray()))
                .build();
        return call("CreateFunction", () -> lambda.createFunction(request)).functionArn();
    }

    @Override
    public String updateFunction(FunctionUpdate update) {
        String name = update.functionName();
        if (update.zipFile() != null) {
            log.info("Updating code of function {}", name);
            call("UpdateFunctionCode", () -> lambda.updateFunctionCode(UpdateFunctionCodeRequest.builder()
                    .functionName(name)
                    .zipFile(readZip(update.zipFile()))
                    .build()));
            waitUntilUpdated(name);
        }
        if (update.changesConfiguration()) {
            log.info("Updating configuration of function {}", name);
            var builder = UpdateFunctionConfigurationRequest.builder().functionName(name);
            if (update.roleArn() != null) builder.role(update.roleArn());
            if (update.runtime() != null) builder.runtime(update.runtime());
            if (update.handler() != null) builder.handler(update.handler());
            if (update.timeout() != null) builder.timeout(update.timeout());
            if (update.memorySize() != null) builder.memorySize(update.memorySize());
            if (update.environmentVariables() != null) {
                builder.environment(Environment.builder().variables(update.environmentVariables()).build());
            }
            if (update.securityGroupIds() != null || update.subnetIds() != null) {
                builder.vpcConfig(VpcConfig.builder()
                        .securityGroupIds(update.securityGroupIds() == null ? List.of() : update.securityGroupIds())
                        .subnetIds(update.subnetIds() == null ? List.of() : update.subnetIds())
                        .build());
            }
            if (update.layers() != null) builder.layers(update.layers());
            if (update.xray() != null) builder.tracingConfig(tracing(update.xray()));
            call("UpdateFunctionConfiguration", () -> lambda.updateFunctionConfiguration(builder.build()));
            waitUntilUpdated(name);
        }
        String arn = call("GetFunctionConfiguration", () -> lambda.getFunctionConfiguration(
                GetFunctionConfigurationRequest.builder().functionName(name).build())).functionArn();
        if (update.tags() != null) {
            updateTags(arn, update.tags());
        }
        return arn;
    }

    private void updateTags(String functionArn, Map<String, String> tags) {
        Map<String, String> current = call("ListTags",
                () -> lambda.listTags(ListTagsRequest.builder().resource(functionArn).build())).tags();
        Set<String> removed = new HashSet<>(current.keySet());
        removed.removeAll(tags.keySet());
        if (!removed.isEmpty()) {
            call("UntagResource", () -> lambda.untagResource(UntagResourceRequest.builder()
                    .resource(functionArn).tagKeys(removed).build()));
        }
        if (!tags.isEmpty()) {
            call("TagResource", () -> lambda.tagResource(TagResourceRequest.builder()
                    .resource(functionArn).tags(tags).build()));
        }
    }

    private void waitUntilUpdated(String functionName) {
        call("WaitUntilFunctionUpdated", () -> lambda.waiter().waitUntilFunctionUpdated(
                GetFunctionConfigurationRequest.builder().functionName(functionName).build()));
    }

    @Override
    public void putFunctionConcurrency(String functionName, int reservedConcurrentExecutions) {
        call("PutFunctionConcurrency", () -> lambda.putFunctionConcurrency(PutFunctionConcurrencyRequest.builder()
                .functionName(functionName)
                .reservedConcurrentExecutions(reservedConcurrentExecutions)
                .build()));
    }

    @Override
    public void deleteFunctionConcurrency(String functionName) {
        call("DeleteFunctionConcurrency", () -> lambda.deleteFunctionConcurrency(
                DeleteFunctionConcurrencyRequest.builder().functionName(functionName).build()));
    }

    @Override
    public void deleteFunction(String functionName) {
        log.info("Deleting function {}", functionName);
        call("DeleteFunction", () -> lambda.deleteFunction(DeleteFunctionRequest.builder().functionName(functionName).build()));
    }

    // -- Roles --

    @Override
    public String getRoleArnForName(String roleName) {
        return fetchRole(roleName).arn();
    }

    @Override
    public RoleDetails getRole(String roleName) {
        Role role = fetchRole(roleName);
        return new RoleDetails(role.roleName(), role.arn(), decodePolicy(role.assumeRolePolicyDocument()));
    }

    private Role fetchRole(String roleName) {
        return call("GetRole", () -> iam.getRole(GetRoleRequest.builder().roleName(roleName).build())).role();
    }

    @Override
    public Map<String, Object> getRolePolicy(String roleName, String policyName) {
        String document = call("GetRolePolicy", () -> iam.getRolePolicy(GetRolePolicyRequest.builder()
                .roleName(roleName).policyName(policyName).build())).policyDocument();
        return decodePolicy(document);
    }

    @Override
    public String createRole(String name, Map<String, Object> trustPolicy, Map<String, Object> policy) {
        log.info("Creating role {}", name);
        String arn = call("CreateRole", () -> iam.createRole(CreateRoleRequest.builder()
                .roleName(name)
                .assumeRolePolicyDocument(toJson(trustPolicy))
                .build())).role().arn();
        putRolePolicy(name, name, policy);
        return arn;
    }

    @Override
    public void putRolePolicy(String roleName, String policyName, Map<String, Object> policyDocument) {
        call("PutRolePolicy", () -> iam.putRolePolicy(PutRolePolicyRequest.builder()
                .roleName(roleName)
                .policyName(policyName)
                .policyDocument(toJson(policyDocument))
                .build()));
    }

    @Override
    public void updateAssumeRolePolicy(String roleName, Map<String, Object> trustPolicy) {
        call("UpdateAssumeRolePolicy", () -> iam.updateAssumeRolePolicy(UpdateAssumeRolePolicyRequest.builder()
                .roleName(roleName)
                .policyDocument(toJson(trustPolicy))
                .build()));
    }

    @Override
    public void deleteRole(String name) {
        log.info("Deleting role {}", name);
        List<String> policyNames = call("ListRolePolicies",
                () -> iam.listRolePolicies(ListRolePoliciesRequest.builder().roleName(name).build())).policyNames();
        for (String policyName : policyNames) {
            call("DeleteRolePolicy", () -> iam.deleteRolePolicy(DeleteRolePolicyRequest.builder()
                    .roleName(name).policyName(policyName).build()));
        }
        call("DeleteRole", () -> iam.deleteRole(DeleteRoleRequest.builder().roleName(name).build()));
    }

    // -- REST APIs --

    @Override
    public boolean restApiExists(String restApiId) {
        try {
            call("GetRestApi", () -> apiGateway.getRestApi(GetRestApiRequest.builder().restApiId(restApiId).build()));
            return true;
        } catch (ResourceDoesNotExistException e) {
            return false;
        }
    }

    @Override
    public String importRestApi(Map<String, Object> swaggerDocument, String endpointType) {
        return call("ImportRestApi", () -> apiGateway.importRestApi(ImportRestApiRequest.builder()
                .body(SdkBytes.fromUtf8String(toJson(swaggerDocument)))
                .parameters(Map.of("endpointConfigurationTypes", endpointType))
                .failOnWarnings(true)
                .build())).id();
    }

    @Override
    public void updateApiFromSwagger(String restApiId, Map<String, Object> swaggerDocument) {
        call("PutRestApi", () -> apiGateway.putRestApi(PutRestApiRequest.builder()
                .restApiId(restApiId)
                .mode(PutMode.OVERWRITE)
                .body(SdkBytes.fromUtf8String(toJson(swaggerDocument)))
                .failOnWarnings(true)
                .build()));
    }

    @Override
    public void updateRestApi(String restApiId, List<Map<String, String>> patchOperations) {
        List<PatchOperation> operations = patchOperations.stream()
                .map(op -> PatchOperation.builder()
                        .op(op.get("op"))
                        .path(op.get("path"))
                        .value(op.get("value"))
                        .build())
                .collect(Collectors.toList());
        call("UpdateRestApi", () -> apiGateway.updateRestApi(UpdateRestApiRequest.builder()
                .restApiId(restApiId)
                .patchOperations(operations)
                .build()));
    }

    @Override
    public void addPermissionForApigateway(String functionName, String regionName, String accountId, String restApiId) {
        String sourceArn = "arn:" + partitionName() + ":execute-api:" + regionName + ":" + accountId + ":" + restApiId + "/*";
        addPermissionIfMissing(functionName, servicePrincipal("apigateway"), sourceArn);
    }

    @Override
    public void deployRestApi(String restApiId, String apiGatewayStage) {
        call("CreateDeployment", () -> apiGateway.createDeployment(CreateDeploymentRequest.builder()
                .restApiId(restApiId)
                .stageName(apiGatewayStage)
                .build()));
    }

    @Override
    public void deleteRestApi(String restApiId) {
        log.info("Deleting rest API {}", restApiId);
        call("DeleteRestApi", () -> apiGateway.deleteRestApi(DeleteRestApiRequest.builder().restApiId(restApiId).build()));
    }

    // -- Event rules --

    @Override
    public boolean ruleExists(String ruleName) {
        try {
            call("DescribeRule", () -> events.describeRule(DescribeRuleRequest.builder().name(ruleName).build()));
            return true;
        } catch (ResourceDoesNotExistException e) {
            return false;
        }
    }

    @Override
    public String getOrCreateRuleArn(String ruleName, String scheduleExpression, String eventPattern,
                                     String ruleDescription) {
        return call("PutRule", () -> events.putRule(PutRuleRequest.builder()
                .name(ruleName)
                .scheduleExpression(scheduleExpression)
                .eventPattern(eventPattern)
                .description(ruleDescription)
                .build())).ruleArn();
    }

    @Override
    public void connectRuleToLambda(String ruleName, String functionArn) {
        call("PutTargets", () -> events.putTargets(PutTargetsRequest.builder()
                .rule(ruleName)
                .targets(Target.builder().id("1").arn(functionArn).build())
                .build()));
    }

    @Override
    public void addPermissionForCloudwatchEvent(String ruleArn, String functionArn) {
        addPermissionIfMissing(functionArn, servicePrincipal("events"), ruleArn);
    }

    @Override
    public void deleteRule(String ruleName) {
        List<String> targetIds = call("ListTargetsByRule", () -> events.listTargetsByRule(
                ListTargetsByRuleRequest.builder().rule(ruleName).build())).targets().stream()
                .map(Target::id)
                .collect(Collectors.toList());
        if (!targetIds.isEmpty()) {
            call("RemoveTargets", () -> events.removeTargets(RemoveTargetsRequest.builder()
                    .rule(ruleName).ids(targetIds).build()));
        }
        call("DeleteRule", () -> events.deleteRule(DeleteRuleRequest.builder().name(ruleName).build()));
    }

    // -- S3 --

    @Override
    public void addPermissionForS3Event(String bucket, String functionArn) {
        addPermissionIfMissing(functionArn, servicePrincipal("s3"), bucketArn(bucket));
    }

    @Override
    public void connectS3BucketToLambda(String bucket, String functionArn, List<String> eventNames,
                                        String prefix, String suffix) {
        GetBucketNotificationConfigurationResponse current = bucketNotifications(bucket);
        List<LambdaFunctionConfiguration> lambdaConfigs = new ArrayList<>();
        for (LambdaFunctionConfiguration config : current.lambdaFunctionConfigurations()) {
            if (!functionArn.equals(config.lambdaFunctionArn())) {
                lambdaConfigs.add(config);
            }
        }
        var newConfig = LambdaFunctionConfiguration.builder()
                .lambdaFunctionArn(functionArn)
                .eventsWithStrings(eventNames);
        List<FilterRule> rules = new ArrayList<>();
        if (prefix != null && !prefix.isEmpty()) {
            rules.add(FilterRule.builder().name(FilterRuleName.PREFIX).value(prefix).build());
        }
        if (suffix != null && !suffix.isEmpty()) {
            rules.add(FilterRule.builder().name(FilterRuleName.SUFFIX).value(suffix).build());
        }
        if (!rules.isEmpty()) {
            newConfig.filter(NotificationConfigurationFilter.builder()
                    .key(S3KeyFilter.builder().filterRules(rules).build())
                    .build());
        }
        lambdaConfigs.add(newConfig.build());
        putBucketNotifications(bucket, current, lambdaConfigs);
    }

    @Override
    public void disconnectS3BucketFromLambda(String bucket, String functionArn) {
        GetBucketNotificationConfigurationResponse current = bucketNotifications(bucket);
        List<LambdaFunctionConfiguration> remaining = current.lambdaFunctionConfigurations().stream()
                .filter(config -> !functionArn.equals(config.lambdaFunctionArn()))
                .collect(Collectors.toList());
        putBucketNotifications(bucket, current, remaining);
    }

    @Override
    public void removePermissionForS3Event(String bucket, String functionArn) {
        removePermissionForSource(functionArn, bucketArn(bucket));
    }

    private GetBucketNotificationConfigurationResponse bucketNotifications(String bucket) {
        return call("GetBucketNotificationConfiguration", () -> s3.getBucketNotificationConfiguration(
                GetBucketNotificationConfigurationRequest.builder().bucket(bucket).build()));
    }

    private void putBucketNotifications(String bucket, GetBucketNotificationConfigurationResponse current,
                                        List<LambdaFunctionConfiguration> lambdaConfigs) {
        var configuration = NotificationConfiguration.builder()
                .topicConfigurations(current.topicConfigurations())
                .queueConfigurations(current.queueConfigurations())
                .lambdaFunctionConfigurations(lambdaConfigs);
        if (current.eventBridgeConfiguration() != null) {
            configuration.eventBridgeConfiguration(current.eventBridgeConfiguration());
        }
        call("PutBucketNotificationConfiguration", () -> s3.putBucketNotificationConfiguration(
                PutBucketNotificationConfigurationRequest.builder()
                        .bucket(bucket)
                        .notificationConfiguration(configuration.build())
                        .build()));
    }

    private String bucketArn(String bucket) {
        return "arn:" + partitionName() + ":s3:::" + bucket;
    }

    // -- SNS --

    @Override
    public boolean verifySnsSubscriptionCurrent(String subscriptionArn, String topic, String functionArn) {
        Map<String, String> attributes;
        try {
            attributes = call("GetSubscriptionAttributes", () -> sns.getSubscriptionAttributes(
                    GetSubscriptionAttributesRequest.builder().subscriptionArn(subscriptionArn).build())).attributes();
        } catch (ResourceDoesNotExistException e) {
            return false;
        }
        return functionArn.equals(attributes.get("Endpoint")) && arnMatches(attributes.get("TopicArn"), topic);
    }

    @Override
    public void addPermissionForSnsTopic(String topicArn, String functionArn) {
        addPermissionIfMissing(functionArn, servicePrincipal("sns"), topicArn);
    }

    @Override
    public String subscribeFunctionToTopic(String topicArn, String functionArn) {
        return call("Subscribe", () -> sns.subscribe(SubscribeRequest.builder()
                .topicArn(topicArn)
                .protocol("lambda")
                .endpoint(functionArn)
                .returnSubscriptionArn(true)
                .build())).subscriptionArn();
    }

    @Override
    public void unsubscribeFromTopic(String subscriptionArn) {
        call("Unsubscribe", () -> sns.unsubscribe(UnsubscribeRequest.builder().subscriptionArn(subscriptionArn).build()));
    }

    @Override
    public void removePermissionForSnsTopic(String topicArn, String functionArn) {
        removePermissionForSource(functionArn, topicArn);
    }

    // -- SQS --

    @Override
    public boolean verifyEventSourceCurrent(String eventUuid, String queue, String functionArn) {
        GetEventSourceMappingResponse mapping;
        try {
            mapping = call("GetEventSourceMapping", () -> lambda.getEventSourceMapping(
                    GetEventSourceMappingRequest.builder().uuid(eventUuid).build()));
        } catch (ResourceDoesNotExistException e) {
            return false;
        }
        return functionArn.equals(mapping.functionArn())
                && arnMatches(mapping.eventSourceArn(), queue)
                && !"Deleting".equals(mapping.state());
    }

    @Override
    public String createSqsEventSource(String queueArn, String functionName, int batchSize,
                                       int maximumBatchingWindowInSeconds) {
        return call("CreateEventSourceMapping", () -> lambda.createEventSourceMapping(
                CreateEventSourceMappingRequest.builder()
                        .eventSourceArn(queueArn)
                        .functionName(functionName)
                        .batchSize(batchSize)
                        .maximumBatchingWindowInSeconds(maximumBatchingWindowInSeconds)
                        .build())).uuid();
    }

    @Override
    public void updateSqsEventSource(String eventUuid, int batchSize, int maximumBatchingWindowInSeconds) {
        call("UpdateEventSourceMapping", () -> lambda.updateEventSourceMapping(
                UpdateEventSourceMappingRequest.builder()
                        .uuid(eventUuid)
                        .batchSize(batchSize)
                        .maximumBatchingWindowInSeconds(maximumBatchingWindowInSeconds)
                        .build()));
    }

    @Override
    public void removeSqsEventSource(String eventUuid) {
        call("DeleteEventSourceMapping", () -> lambda.deleteEventSourceMapping(
                DeleteEventSourceMappingRequest.builder().uuid(eventUuid).build()));
    }

    // -- Permissions --

    private void addPermissionIfMissing(String functionName, String principal, String sourceArn) {
        if (permissionStatementId(functionName, sourceArn) != null) {
            log.debug("Function {} already allows {} from {}", functionName, principal, sourceArn);
            return;
        }
        call("AddPermission", () -> lambda.addPermission(AddPermissionRequest.builder()
                .functionName(functionName)
                .statementId(UUID.randomUUID().toString())
                .action("lambda:InvokeFunction")
                .principal(principal)
                .sourceArn(sourceArn)
                .build()));
    }

    private void removePermissionForSource(String functionName, String sourceArn) {
        String statementId = permissionStatementId(functionName, sourceArn);
        if (statementId == null) {
            return;
        }
        call("RemovePermission", () -> lambda.removePermission(RemovePermissionRequest.builder()
                .functionName(functionName)
                .statementId(statementId)
                .build()));
    }

    /** Sid of the resource policy statement granting invoke from {@code sourceArn}, or {@code null}. */
    private String permissionStatementId(String functionName, String sourceArn) {
        String policy;
        try {
            policy = call("GetPolicy", () -> lambda.getPolicy(GetPolicyRequest.builder()
                    .functionName(functionName).build())).policy();
        } catch (ResourceDoesNotExistException e) {
            return null;
        }
        Map<String, Object> document = fromJson(policy);
        if (!(document.get("Statement") instanceof List<?> statements)) {
            return null;
        }
        for (Object item : statements) {
            if (item instanceof Map<?, ?> statement
                    && statement.get("Condition") instanceof Map<?, ?> condition
                    && condition.get("ArnLike") instanceof Map<?, ?> arnLike
                    && sourceArn.equals(arnLike.get("AWS:SourceArn"))) {
                return String.valueOf(statement.get("Sid"));
            }
        }
        return null;
    }

    private String servicePrincipal(String service) {
        return ServicePrincipals.servicePrincipal(service, regionName(), ServicePrincipals.urlSuffix(partitionName()));
    }

    // -- Helpers --

    /**
     * Runs an SDK call, translating SDK failures. HTTP 404 and the services'
     * not-found error codes become {@link ResourceDoesNotExistException}.
     */
    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (ResourceNotFoundException
                 | NoSuchEntityException
                 | software.amazon.awssdk.services.apigateway.model.NotFoundException
                 | software.amazon.awssdk.services.eventbridge.model.ResourceNotFoundException
                 | software.amazon.awssdk.services.sns.model.NotFoundException e) {
            throw new ResourceDoesNotExistException(operation + ": " + e.getMessage(), e);
        } catch (SdkException e) {
            throw new CloudClientException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private static boolean arnMatches(String arn, String nameOrArn) {
        return arn != null && (arn.equals(nameOrArn) || arn.endsWith(":" + nameOrArn));
    }

    private static TracingConfig tracing(boolean xray) {
        return TracingConfig.builder().mode(xray ? TracingMode.ACTIVE : TracingMode.PASS_THROUGH).build();
    }

    private static SdkBytes readZip(String zipFile) {
        try {
            return SdkBytes.fromByteArray(Files.readAllBytes(Path.of(zipFile)));
        } catch (IOException e) {
            throw new CloudClientException("Unable to read deployment package " + zipFile, e);
        }
    }

    private Map<String, Object> decodePolicy(String document) {
        if (document == null || document.isEmpty()) {
            return Map.of();
        }
        // IAM returns policy documents URL-encoded
        return fromJson(URLDecoder.decode(document, StandardCharsets.UTF_8));
    }

    private Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, new TypeReference<>() {});
        } catch (JsonProcessingException e) {
            throw new CloudClientException("Unexpected policy document: " + json, e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CloudClientException("Unable to serialize request document", e);
        }
    }

    @Override
    public void close() {
        lambda.close();
        iam.close();
        apiGateway.close();
        events.close();
        s3.close();
        sns.close();
    }
}
