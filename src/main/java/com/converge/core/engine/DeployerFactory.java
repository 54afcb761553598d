package com.converge.core.engine;

import com.converge.cloud.CloudClient;
import com.converge.core.build.ApiDefinitionBuilder;
import com.converge.core.build.BuildStage;
import com.converge.core.build.DeploymentPackager;
import com.converge.core.build.InjectDefaults;
import com.converge.core.build.PolicyGenerator;
import com.converge.core.build.RoleTraitsInjector;
import com.converge.core.build.ZipPackageBuilder;
import com.converge.core.executor.Executor;
import com.converge.core.executor.Ui;
import com.converge.core.graph.DependencyResolver;
import com.converge.core.metrics.DeployMetrics;
import com.converge.core.planner.NoopPlanStage;
import com.converge.core.planner.PlanStage;
import com.converge.core.remote.RemoteState;
import com.converge.core.state.DeployedResources;
import com.converge.core.state.ResultsRecorder;
import com.converge.core.sweeper.ResourceSweeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Wires a fresh {@link Deployer} for each deploy attempt, so the remote state
 * cache and the executor's variable pool never outlive one run.
 */
@Service
public class DeployerFactory {

    private final CloudClient client;
    private final ObjectMapper objectMapper;
    private final ConvergeProperties properties;
    private final DeployMetrics metrics;
    private final DependencyResolver resolver;

    public DeployerFactory(CloudClient client, ObjectMapper objectMapper, ConvergeProperties properties,
                           DeployMetrics metrics, DependencyResolver resolver) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.metrics = metrics;
        this.resolver = resolver;
    }

    public Deployer createDeployer(String stage, Ui ui) {
        DeployedResources deployed = loadDeployed(stage);
        BuildStage buildStage = new BuildStage(List.of(
                new RoleTraitsInjector(),
                new InjectDefaults(properties.getLambda().getDefaultTimeout(),
                        properties.getLambda().getDefaultMemorySize()),
                new DeploymentPackager(new ZipPackageBuilder(properties.sourcePath(),
                        properties.configPath().resolve("deployments"))),
                new PolicyGenerator(objectMapper, properties.configPath()),
                new ApiDefinitionBuilder()));
        return new Deployer(resolver, buildStage, new PlanStage(new RemoteState(client, deployed), objectMapper),
                new ResourceSweeper(), newExecutor(ui), new ResultsRecorder(objectMapper), deployed, metrics,
                properties.projectPath());
    }

    /**
     * A deployer that plans nothing, so the sweeper deletes everything the stage recorded.
     * Deploy it with {@code Application.empty(stage)}.
     */
    public Deployer createDeletionDeployer(String stage, Ui ui) {
        DeployedResources deployed = loadDeployed(stage);
        return new Deployer(resolver, new BuildStage(List.of()), new NoopPlanStage(), new ResourceSweeper(),
                newExecutor(ui), new ResultsRecorder(objectMapper), deployed, metrics, properties.projectPath());
    }

    public DeployedResources loadDeployed(String stage) {
        return DeployedResources.load(objectMapper, properties.projectPath(), stage);
    }

    private Executor newExecutor(Ui ui) {
        return new Executor(client, ui);
    }
}
