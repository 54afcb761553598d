package com.converge.core.engine;

import com.converge.cloud.CloudClientException;
import com.converge.core.build.BuildException;
import com.converge.core.build.BuildStage;
import com.converge.core.build.BuiltResources;
import com.converge.core.executor.Executor;
import com.converge.core.graph.DependencyResolver;
import com.converge.core.logging.MdcContext;
import com.converge.core.metrics.DeployMetrics;
import com.converge.core.model.Application;
import com.converge.core.model.ResourceId;
import com.converge.core.plan.ApiCall;
import com.converge.core.plan.Plan;
import com.converge.core.planner.Planner;
import com.converge.core.state.DeployedResources;
import com.converge.core.state.ResultsRecorder;
import com.converge.core.state.StateException;
import com.converge.core.sweeper.ResourceSweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs one deploy attempt: order, build, plan, sweep, execute, record.
 * <p>
 * The record is only written after every instruction succeeded, so a failed
 * attempt leaves the previous record for the next run to diff against.
 */
public class Deployer {

    private static final Logger log = LoggerFactory.getLogger(Deployer.class);

    private final DependencyResolver resolver;
    private final BuildStage buildStage;
    private final Planner planner;
    private final ResourceSweeper sweeper;
    private final Executor executor;
    private final ResultsRecorder recorder;
    private final DeployedResources deployed;
    private final DeployMetrics metrics;
    private final Path projectDir;

    public Deployer(DependencyResolver resolver, BuildStage buildStage, Planner planner, ResourceSweeper sweeper,
                    Executor executor, ResultsRecorder recorder, DeployedResources deployed,
                    DeployMetrics metrics, Path projectDir) {
        this.resolver = resolver;
        this.buildStage = buildStage;
        this.planner = planner;
        this.sweeper = sweeper;
        this.executor = executor;
        this.recorder = recorder;
        this.deployed = deployed;
        this.metrics = metrics;
        this.projectDir = projectDir;
    }

    public DeploymentResult deploy(Application application) {
        String stage = application.stage();
        long start = System.currentTimeMillis();
        MdcContext.setStage(stage);
        try {
            List<ResourceId> order = resolver.order(application);
            BuiltResources built = buildStage.execute(application, order);
            Plan plan = planner.plan(built);
            Plan swept = sweeper.sweep(plan, deployed);

            List<ApiCall> calls = swept.instructionsOf(ApiCall.class);
            metrics.recordPlanSize(swept.size());
            metrics.recordSweeperDeletions(calls.size() - plan.instructionsOf(ApiCall.class).size());
            log.info("Executing {} instructions ({} API calls) for stage {}", swept.size(), calls.size(), stage);

            executor.execute(swept);
            calls.forEach(call -> metrics.recordApiCall(call.methodName()));

            Path recordFile = recorder.record(executor.resourceValues(), stage, projectDir);
            metrics.recordDeployResult("success");
            return new DeploymentResult(stage, executor.resourceValues(), recordFile, calls.size());
        } catch (BuildException e) {
            metrics.recordDeployResult("failed");
            throw new DeploymentException(stage, "Unable to build stage " + stage + ": " + e.getMessage(), e);
        } catch (CloudClientException e) {
            metrics.recordDeployResult("failed");
            String context = executor.lastApiMethod()
                    .map(method -> "calling " + method)
                    .orElse("while planning");
            throw new DeploymentException(stage,
                    "Deployment of stage " + stage + " failed " + context + ": " + e.getMessage(), e);
        } catch (StateException e) {
            metrics.recordDeployResult("failed");
            throw new DeploymentException(stage, e.getMessage(), e);
        } finally {
            metrics.recordDeployDuration(stage, System.currentTimeMillis() - start);
            MdcContext.clear();
        }
    }
}
