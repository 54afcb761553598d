package com.converge.core.engine;

import com.converge.cloud.CloudClient;
import com.converge.cloud.FunctionConfiguration;
import com.converge.cloud.FunctionDefinition;
import com.converge.core.build.PackageDigest;
import com.converge.core.graph.DependencyResolver;
import com.converge.core.metrics.DeployMetrics;
import com.converge.core.model.Application;
import com.converge.core.model.Fixtures;
import com.converge.core.state.DeployedResources;
import com.converge.core.state.ResultsRecorder;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DeployerFactoryTest {

    @TempDir
    Path projectDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private CloudClient client;
    private DeployerFactory factory;

    @BeforeEach
    void setUp() {
        client = mock(CloudClient.class);
        ConvergeProperties properties = new ConvergeProperties();
        properties.setProjectDir(projectDir.toString());
        factory = new DeployerFactory(client, objectMapper, properties,
                new DeployMetrics(new SimpleMeterRegistry()), new DependencyResolver());
    }

    @Test
    @DisplayName("deleting a stage removes every recorded resource, dependents first")
    void deletionDeployer() {
        new ResultsRecorder(objectMapper).record(List.of(
                Map.of("name", "default-role", "resource_type", "iam_role",
                        "role_name", "myapp-dev", "role_arn", "arn:aws:iam::123456789012:role/myapp-dev"),
                Map.of("name", "foo", "resource_type", "lambda_function",
                        "lambda_arn", "arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-foo")),
                "dev", projectDir);

        DeploymentResult result = factory.createDeletionDeployer("dev", message -> { })
                .deploy(Application.empty("dev"));

        InOrder order = inOrder(client);
        order.verify(client).deleteFunction("arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-foo");
        order.verify(client).deleteRole("myapp-dev");
        assertEquals(2, result.apiCalls());
        assertTrue(factory.loadDeployed("dev").isEmpty());
    }

    @Test
    @DisplayName("a first deploy packages the sources, creates the function and records it")
    void deployThenRedeploy() throws IOException {
        String functionArn = "arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-foo";
        Files.createDirectories(projectDir.resolve("app"));
        Files.writeString(projectDir.resolve("app").resolve("app.py"), "def foo(event, context):\n    return {}\n");
        when(client.lambdaFunctionExists("myapp-dev-foo")).thenReturn(false);
        when(client.createFunction(any())).thenReturn(functionArn);

        DeploymentResult first = factory.createDeployer("dev", message -> { })
                .deploy(Fixtures.singleFunction("dev"));

        ArgumentCaptor<FunctionDefinition> created = ArgumentCaptor.forClass(FunctionDefinition.class);
        verify(client).createFunction(created.capture());
        assertEquals(Fixtures.ROLE_ARN, created.getValue().roleArn());
        assertEquals(60, created.getValue().timeout());
        assertEquals(128, created.getValue().memorySize());
        Path zipFile = Path.of(created.getValue().zipFile());
        assertTrue(zipFile.startsWith(projectDir.resolve(".converge").resolve("deployments")));
        assertEquals(ResultsRecorder.recordPath(projectDir, "dev"), first.recordFile());
        assertTrue(Files.exists(projectDir.resolve(".converge").resolve("deployed").resolve("dev.json")));
        assertEquals(functionArn, factory.loadDeployed("dev").resourceValues("foo").orElseThrow().get("lambda_arn"));

        // live configuration now matches what is declared
        when(client.lambdaFunctionExists("myapp-dev-foo")).thenReturn(true);
        when(client.getFunctionConfiguration("myapp-dev-foo")).thenReturn(new FunctionConfiguration(
                functionArn, Fixtures.ROLE_ARN, "python3.12", "app.foo", 60, 128,
                Map.of(), Map.of(), List.of(), List.of(), List.of(), false,
                PackageDigest.sha256Base64(zipFile), null));

        DeploymentResult second = factory.createDeployer("dev", message -> { })
                .deploy(Fixtures.singleFunction("dev"));

        assertEquals(0, second.apiCalls());
        verify(client, times(1)).createFunction(any());
        verify(client, never()).updateFunction(any());
        verify(client, never()).putFunctionConcurrency(anyString(), anyInt());
        verify(client, never()).deleteFunctionConcurrency(anyString());
        verify(client, never()).deleteFunction(anyString());
        assertEquals(List.of("foo"), factory.loadDeployed("dev").resourceNames());
    }

    @Test
    @DisplayName("configured lambda defaults fill in functions that declare no timeout or memory size")
    void configuredLambdaDefaults() throws IOException {
        ConvergeProperties properties = new ConvergeProperties();
        properties.setProjectDir(projectDir.toString());
        properties.getLambda().setDefaultTimeout(300);
        properties.getLambda().setDefaultMemorySize(512);
        DeployerFactory configured = new DeployerFactory(client, objectMapper, properties,
                new DeployMetrics(new SimpleMeterRegistry()), new DependencyResolver());
        Files.createDirectories(projectDir.resolve("app"));
        Files.writeString(projectDir.resolve("app").resolve("app.py"), "def foo(event, context):\n    return {}\n");
        when(client.createFunction(any())).thenReturn("arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-foo");

        configured.createDeployer("dev", message -> { }).deploy(Fixtures.singleFunction("dev"));

        ArgumentCaptor<FunctionDefinition> created = ArgumentCaptor.forClass(FunctionDefinition.class);
        verify(client).createFunction(created.capture());
        assertEquals(300, created.getValue().timeout());
        assertEquals(512, created.getValue().memorySize());
    }

    @Test
    @DisplayName("a stage that was never deployed loads empty")
    void loadDeployedMissing() {
        assertEquals(DeployedResources.empty().resources(), factory.loadDeployed("qa").resources());
    }
}
