package com.converge.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A function managed by the deployer.
 *
 * @param functionName        name of the function in the account
 * @param deploymentPackage   id of the {@link DeploymentPackage} holding the code
 * @param timeout             seconds, pending until defaults are injected
 * @param memorySize          megabytes, pending until defaults are injected
 * @param role                id of the {@link IamRole} the function runs as
 * @param reservedConcurrency reserved executions, or {@code null} for none
 */
public record LambdaFunction(
        String resourceName,
        String functionName,
        ResourceId deploymentPackage,
        Map<String, String> environmentVariables,
        String runtime,
        String handler,
        Map<String, String> tags,
        Deferred<Integer> timeout,
        Deferred<Integer> memorySize,
        ResourceId role,
        List<String> securityGroupIds,
        List<String> subnetIds,
        Integer reservedConcurrency,
        List<String> layers,
        boolean xray
) implements Resource {

    public LambdaFunction {
        environmentVariables = Map.copyOf(environmentVariables);
        tags = Map.copyOf(tags);
        securityGroupIds = List.copyOf(securityGroupIds);
        subnetIds = List.copyOf(subnetIds);
        layers = List.copyOf(layers);
    }

    public LambdaFunction withTimeout(int seconds) {
        return new LambdaFunction(resourceName, functionName, deploymentPackage, environmentVariables,
                runtime, handler, tags, Deferred.of(seconds), memorySize, role, securityGroupIds,
                subnetIds, reservedConcurrency, layers, xray);
    }

    public LambdaFunction withMemorySize(int megabytes) {
        return new LambdaFunction(resourceName, functionName, deploymentPackage, environmentVariables,
                runtime, handler, tags, timeout, Deferred.of(megabytes), role, securityGroupIds,
                subnetIds, reservedConcurrency, layers, xray);
    }

    public boolean needsVpc() {
        return !securityGroupIds.isEmpty() && !subnetIds.isEmpty();
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.LAMBDA_FUNCTION;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(role, deploymentPackage);
    }

    @Override
    public List<String> pendingFields() {
        List<String> pending = new ArrayList<>();
        if (timeout.isPending()) pending.add("timeout");
        if (memorySize.isPending()) pending.add("memory_size");
        return pending;
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitLambdaFunction(this);
    }
}
