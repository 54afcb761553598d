package com.converge.core.remote;

import com.converge.cloud.CloudClient;
import com.converge.cloud.FunctionConfiguration;
import com.converge.cloud.ResourceDoesNotExistException;
import com.converge.cloud.RoleDetails;
import com.converge.core.model.LambdaFunction;
import com.converge.core.model.ManagedIamRole;
import com.converge.core.model.Resource;
import com.converge.core.model.SnsSubscription;
import com.converge.core.model.SqsEventSource;
import com.converge.core.state.DeployedResources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of what is currently deployed, cached per resource.
 * <p>
 * Functions and roles are looked up live. Every other managed type is tracked
 * through the previous deployment's record, confirmed with an existence
 * check where the service offers one. One instance serves one deploy attempt.
 */
public class RemoteState {

    private static final Logger log = LoggerFactory.getLogger(RemoteState.class);

    private final CloudClient client;
    private final DeployedResources deployedResources;
    private final Map<ResourceKey, Boolean> existsCache = new HashMap<>();
    private final Map<ResourceKey, ResourceSnapshot> snapshotCache = new HashMap<>();

    public RemoteState(CloudClient client, DeployedResources deployedResources) {
        this.client = client;
        this.deployedResources = deployedResources;
    }

    /**
     * Whether the resource is deployed. Queried once per (type, name).
     *
     * @throws IllegalArgumentException for types that are never deployed on their own
     */
    public boolean exists(Resource resource) {
        ResourceKey key = ResourceKey.of(resource);
        Boolean cached = existsCache.get(key);
        if (cached != null) {
            return cached;
        }
        boolean exists = queryExists(resource);
        log.debug("Remote state for {} {}: {}", key.resourceType(), key.resourceName(), exists ? "exists" : "absent");
        existsCache.put(key, exists);
        return exists;
    }

    /**
     * Attributes of the deployed resource, or {@link ResourceSnapshot#absent()} when it is not deployed.
     */
    public ResourceSnapshot fetch(Resource resource) {
        ResourceKey key = ResourceKey.of(resource);
        ResourceSnapshot cached = snapshotCache.get(key);
        if (cached != null) {
            return cached;
        }
        ResourceSnapshot snapshot = exists(resource) ? querySnapshot(resource) : ResourceSnapshot.absent();
        snapshotCache.put(key, snapshot);
        return snapshot;
    }

    private boolean queryExists(Resource resource) {
        return switch (resource.resourceType()) {
            case LAMBDA_FUNCTION -> client.lambdaFunctionExists(((LambdaFunction) resource).functionName());
            case IAM_ROLE -> roleExists(((ManagedIamRole) resource).roleName());
            case REST_API -> recorded(resource)
                    .map(values -> values.get("rest_api_id"))
                    .map(id -> client.restApiExists(id.toString()))
                    .orElse(false);
            case SCHEDULED_EVENT, CLOUDWATCH_EVENT -> recorded(resource)
                    .map(values -> values.get("rule_name"))
                    .map(rule -> client.ruleExists(rule.toString()))
                    .orElse(false);
            case S3_EVENT -> recorded(resource).isPresent();
            case SNS_EVENT -> recorded(resource)
                    .map(values -> client.verifySnsSubscriptionCurrent(
                            String.valueOf(values.get("subscription_arn")),
                            ((SnsSubscription) resource).topic(),
                            String.valueOf(values.get("lambda_arn"))))
                    .orElse(false);
            case SQS_EVENT -> recorded(resource)
                    .map(values -> client.verifyEventSourceCurrent(
                            String.valueOf(values.get("event_uuid")),
                            ((SqsEventSource) resource).queue(),
                            String.valueOf(values.get("lambda_arn"))))
                    .orElse(false);
            case PRE_CREATED_IAM_ROLE, IAM_POLICY, DEPLOYMENT_PACKAGE ->
                    throw new IllegalArgumentException("Unsupported resource type for remote lookup: "
                            + resource.resourceType());
        };
    }

    private ResourceSnapshot querySnapshot(Resource resource) {
        return switch (resource.resourceType()) {
            case LAMBDA_FUNCTION -> functionSnapshot((LambdaFunction) resource);
            case IAM_ROLE -> roleSnapshot((ManagedIamRole) resource);
            case REST_API, SCHEDULED_EVENT, CLOUDWATCH_EVENT, S3_EVENT, SNS_EVENT, SQS_EVENT ->
                    ResourceSnapshot.of(recorded(resource).orElseGet(Map::of));
            case PRE_CREATED_IAM_ROLE, IAM_POLICY, DEPLOYMENT_PACKAGE ->
                    throw new IllegalArgumentException("Unsupported resource type for remote lookup: "
                            + resource.resourceType());
        };
    }

    private boolean roleExists(String roleName) {
        try {
            client.getRoleArnForName(roleName);
            return true;
        } catch (ResourceDoesNotExistException e) {
            return false;
        }
    }

    private ResourceSnapshot functionSnapshot(LambdaFunction function) {
        FunctionConfiguration config = client.getFunctionConfiguration(function.functionName());
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("lambda_arn", config.functionArn());
        attributes.put("role_arn", config.roleArn());
        attributes.put("runtime", config.runtime());
        attributes.put("handler", config.handler());
        attributes.put("timeout", config.timeout());
        attributes.put("memory_size", config.memorySize());
        attributes.put("environment_variables", config.environmentVariables());
        attributes.put("tags", config.tags());
        attributes.put("security_group_ids", config.securityGroupIds());
        attributes.put("subnet_ids", config.subnetIds());
        attributes.put("layers", config.layers());
        attributes.put("xray", config.xray());
        attributes.put("code_sha256", config.codeSha256());
        attributes.put("reserved_concurrency", config.reservedConcurrency());
        return ResourceSnapshot.of(attributes);
    }

    private ResourceSnapshot roleSnapshot(ManagedIamRole role) {
        RoleDetails details = client.getRole(role.roleName());
        Map<String, Object> policy;
        try {
            policy = client.getRolePolicy(role.roleName(), role.roleName());
        } catch (ResourceDoesNotExistException e) {
            log.debug("Role {} has no inline policy named after it", role.roleName());
            policy = Map.of();
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("role_name", details.roleName());
        attributes.put("role_arn", details.roleArn());
        attributes.put("trust_policy", details.trustPolicy());
        attributes.put("policy_document", policy);
        return ResourceSnapshot.of(attributes);
    }

    private Optional<Map<String, Object>> recorded(Resource resource) {
        return deployedResources.resourceValues(resource.resourceName());
    }
}
