package com.converge.dispatch.cli;

import com.converge.core.engine.Deployer;
import com.converge.core.engine.DeployerFactory;
import com.converge.core.engine.DeploymentException;
import com.converge.core.engine.DeploymentResult;
import com.converge.core.state.DeployedResources;
import com.converge.core.state.StateException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests for the Converge CLI command structure.
 * Exercises picocli directly without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private static DeployedResources deployedDev() {
        return new DeployedResources(List.of(
                Map.of("name", "default-role", "resource_type", "iam_role", "role_name", "myapp-dev"),
                Map.of("name", "foo", "resource_type", "lambda_function",
                        "lambda_arn", "arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-foo")));
    }

    private CommandLine.IFactory createFactory(DeployerFactory deployerFactory) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == DeleteCommand.class) {
                    return (K) new DeleteCommand(deployerFactory);
                }
                if (cls == ResourcesCommand.class) {
                    return (K) new ResourcesCommand(deployerFactory);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(DeployerFactory deployerFactory, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ConvergeCommand(), createFactory(deployerFactory));
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private CliResult execute(String... args) {
        return execute(mock(DeployerFactory.class), args);
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute("--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("delete"));
            assertTrue(result.output().contains("resources"));
            assertTrue(result.output().contains("help"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute("--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Converge 0.1.0"));
        }

        @Test
        @DisplayName("an unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("deploy-everything").exitCode());
        }
    }

    @Nested
    @DisplayName("delete")
    class DeleteTests {

        @Test
        @DisplayName("deploys an empty application through the deletion deployer")
        void deletesStage() {
            DeployerFactory factory = mock(DeployerFactory.class);
            Deployer deployer = mock(Deployer.class);
            when(factory.loadDeployed("prod")).thenReturn(deployedDev());
            when(factory.createDeletionDeployer(eq("prod"), any())).thenReturn(deployer);
            when(deployer.deploy(any())).thenReturn(
                    new DeploymentResult("prod", List.of(), Path.of(".converge/deployed/prod.json"), 2));

            CliResult result = execute(factory, "delete", "--stage", "prod");

            assertEquals(0, result.exitCode(), result.output());
            verify(deployer).deploy(argThat(app -> app.stage().equals("prod") && app.roots().isEmpty()));
            assertTrue(result.output().contains("Stage prod deleted (2 API calls)"));
        }

        @Test
        @DisplayName("does nothing when the stage was never deployed")
        void nothingDeployed() {
            DeployerFactory factory = mock(DeployerFactory.class);
            when(factory.loadDeployed(anyString())).thenReturn(DeployedResources.empty());

            CliResult result = execute(factory, "delete");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Nothing is deployed for stage dev"));
            verify(factory, never()).createDeletionDeployer(anyString(), any());
        }

        @Test
        @DisplayName("a failed deletion exits non-zero with the failure")
        void failure() {
            DeployerFactory factory = mock(DeployerFactory.class);
            Deployer deployer = mock(Deployer.class);
            when(factory.loadDeployed("dev")).thenReturn(deployedDev());
            when(factory.createDeletionDeployer(eq("dev"), any())).thenReturn(deployer);
            when(deployer.deploy(any())).thenThrow(new DeploymentException("dev",
                    "Deployment of stage dev failed calling delete_role: access denied", null));

            CliResult result = execute(factory, "delete", "-s", "dev");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("failed calling delete_role"));
        }
    }

    @Nested
    @DisplayName("resources")
    class ResourcesTests {

        @Test
        @DisplayName("lists recorded resources and the report")
        void listsResources() {
            DeployerFactory factory = mock(DeployerFactory.class);
            when(factory.loadDeployed("dev")).thenReturn(deployedDev());

            CliResult result = execute(factory, "resources");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("default-role"));
            assertTrue(result.output().contains("iam_role"));
            assertTrue(result.output().contains("Lambda ARN: arn:aws:lambda:us-west-2:123456789012:function:myapp-dev-foo"));
        }

        @Test
        @DisplayName("an unreadable record exits non-zero")
        void unreadableRecord() {
            DeployerFactory factory = mock(DeployerFactory.class);
            when(factory.loadDeployed("dev")).thenThrow(new StateException("Unable to read deployed record", null));

            CliResult result = execute(factory, "resources");

            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("Unable to read deployed record"));
        }
    }
}
