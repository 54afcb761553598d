package com.converge.core.engine;

import com.converge.cloud.CloudClient;
import com.converge.cloud.CloudClientException;
import com.converge.core.build.BuildException;
import com.converge.core.build.BuildStage;
import com.converge.core.executor.Executor;
import com.converge.core.graph.DependencyResolver;
import com.converge.core.metrics.DeployMetrics;
import com.converge.core.model.Application;
import com.converge.core.model.ResourceType;
import com.converge.core.plan.Plan;
import com.converge.core.plan.RecordResourceValue;
import com.converge.core.planner.Planner;
import com.converge.core.state.DeployedResources;
import com.converge.core.state.ResultsRecorder;
import com.converge.core.sweeper.ResourceSweeper;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class DeployerTest {

    private static final String BAR_ARN = "arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-bar";

    @TempDir
    Path projectDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final List<String> messages = new ArrayList<>();

    private CloudClient client;
    private DependencyResolver resolver;
    private BuildStage buildStage;
    private Planner planner;

    @BeforeEach
    void setUp() {
        client = mock(CloudClient.class);
        resolver = mock(DependencyResolver.class);
        buildStage = mock(BuildStage.class);
        planner = mock(Planner.class);
        when(resolver.order(any())).thenReturn(List.of());
        when(planner.plan(any())).thenReturn(Plan.builder()
                .add(new RecordResourceValue(ResourceType.LAMBDA_FUNCTION, "foo", "lambda_arn", "arn:foo"))
                .build());
    }

    private Deployer deployer(DeployedResources deployed) {
        return new Deployer(resolver, buildStage, planner, new ResourceSweeper(), new Executor(client, messages::add),
                new ResultsRecorder(objectMapper), deployed, new DeployMetrics(registry), projectDir);
    }

    private static DeployedResources fooAndBar() {
        return new DeployedResources(List.of(
                Map.of("name", "foo", "resource_type", "lambda_function", "lambda_arn", "arn:foo"),
                Map.of("name", "bar", "resource_type", "lambda_function", "lambda_arn", BAR_ARN)));
    }

    @Test
    @DisplayName("a successful deploy sweeps, executes and records")
    void successRecords() {
        DeploymentResult result = deployer(fooAndBar()).deploy(Application.empty("dev"));

        verify(client).deleteFunction(BAR_ARN);
        assertEquals(List.of("Deleting function: " + BAR_ARN), messages);
        assertEquals(1, result.apiCalls());
        assertEquals(ResultsRecorder.recordPath(projectDir, "dev"), result.recordFile());
        assertEquals(List.of("foo"), DeployedResources.load(objectMapper, projectDir, "dev").resourceNames());
        assertEquals(1.0, registry.find("converge.deploys.total").tag("status", "success").counter().count());
        assertEquals(1.0, registry.find("converge.api.calls").tag("method", "delete_function").counter().count());
    }

    @Test
    @DisplayName("a failed API call names the method and leaves the record alone")
    void failureDoesNotRecord() {
        doThrow(new CloudClientException("access denied")).when(client).deleteFunction(BAR_ARN);

        DeploymentException e = assertThrows(DeploymentException.class,
                () -> deployer(fooAndBar()).deploy(Application.empty("dev")));

        assertEquals("dev", e.getStage());
        assertTrue(e.getMessage().contains("calling delete_function"), e.getMessage());
        assertTrue(e.getMessage().contains("access denied"), e.getMessage());
        assertFalse(Files.exists(ResultsRecorder.recordPath(projectDir, "dev")));
        assertEquals(1.0, registry.find("converge.deploys.total").tag("status", "failed").counter().count());
    }

    @Test
    @DisplayName("a build failure is reported against the stage")
    void buildFailure() {
        when(buildStage.execute(any(), any())).thenThrow(new BuildException("Unresolved fields after build: foo.timeout"));

        DeploymentException e = assertThrows(DeploymentException.class,
                () -> deployer(DeployedResources.empty()).deploy(Application.empty("prod")));

        assertEquals("Unable to build stage prod: Unresolved fields after build: foo.timeout", e.getMessage());
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("the stage is cleared from the MDC once the deploy ends")
    void clearsMdc() {
        deployer(DeployedResources.empty()).deploy(Application.empty("dev"));

        assertNull(MDC.get("stage"));
        assertNotNull(registry.find("converge.deploy.duration").tag("stage", "dev").timer());
    }
}
