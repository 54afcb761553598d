package com.converge.core.model;

import java.util.List;
import java.util.Map;

/**
 * Small declared graphs shared by the pipeline tests.
 */
public final class Fixtures {

    public static final String ROLE_ARN = "arn:aws:iam::123456789012:role/precreated";

    private Fixtures() {}

    public static LambdaFunction function(String name, ResourceId deploymentPackage, ResourceId role) {
        return new LambdaFunction(name, "myapp-dev-" + name, deploymentPackage, Map.of(), "python3.12",
                "app." + name, Map.of(), Deferred.pending(), Deferred.pending(), role, List.of(), List.of(),
                null, List.of(), false);
    }

    public static LambdaFunction builtFunction(String name, ResourceId deploymentPackage, ResourceId role) {
        return function(name, deploymentPackage, role).withTimeout(60).withMemorySize(128);
    }

    /** One function with a pre-created role and a pending package; the function is the only root. */
    public static Application singleFunction(String stage) {
        ResourceGraph graph = new ResourceGraph();
        ResourceId role = graph.add(new PreCreatedIamRole("role", ROLE_ARN));
        ResourceId pkg = graph.add(new DeploymentPackage("deployment", Deferred.pending()));
        ResourceId fn = graph.add(function("foo", pkg, role));
        return new Application(stage, graph, List.of(fn));
    }
}
