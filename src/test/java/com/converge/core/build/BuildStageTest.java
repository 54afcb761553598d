package com.converge.core.build;

import com.converge.core.graph.DependencyResolver;
import com.converge.core.model.Application;
import com.converge.core.model.AutoGenIamPolicy;
import com.converge.core.model.Deferred;
import com.converge.core.model.DeploymentPackage;
import com.converge.core.model.FileBasedIamPolicy;
import com.converge.core.model.Fixtures;
import com.converge.core.model.LambdaFunction;
import com.converge.core.model.ManagedIamRole;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;
import com.converge.core.model.RoleTraits;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BuildStageTest {

    @Nested
    @DisplayName("InjectDefaults")
    class InjectDefaultsTests {

        @Test
        @DisplayName("fills pending timeout and memory size")
        void fillsPending() {
            Application app = Fixtures.singleFunction("dev");
            ResourceId fn = app.roots().get(0);

            new InjectDefaults().handle(app.graph(), fn);

            LambdaFunction function = app.graph().get(fn, LambdaFunction.class);
            assertEquals(60, function.timeout().get());
            assertEquals(128, function.memorySize().get());
        }

        @Test
        @DisplayName("keeps values the function declared")
        void keepsDeclared() {
            Application app = Fixtures.singleFunction("dev");
            ResourceId fn = app.roots().get(0);
            app.graph().replace(fn, app.graph().get(fn, LambdaFunction.class).withMemorySize(512));

            new InjectDefaults(30, 256).handle(app.graph(), fn);

            LambdaFunction function = app.graph().get(fn, LambdaFunction.class);
            assertEquals(30, function.timeout().get());
            assertEquals(512, function.memorySize().get());
        }
    }

    @Nested
    @DisplayName("PolicyGenerator")
    class PolicyGeneratorTests {

        private final ObjectMapper objectMapper = new ObjectMapper();

        @Test
        @DisplayName("reads file based policies from the config directory")
        void readsPolicyFile(@TempDir Path configDir) throws IOException {
            Files.writeString(configDir.resolve("policy-dev.json"),
                    "{\"Version\": \"2012-10-17\", \"Statement\": []}");
            ResourceGraph graph = new ResourceGraph();
            ResourceId id = graph.add(new FileBasedIamPolicy("policy", "policy-dev.json", Deferred.pending()));

            new PolicyGenerator(objectMapper, configDir).handle(graph, id);

            Map<String, Object> document = graph.get(id, FileBasedIamPolicy.class).document().get();
            assertEquals("2012-10-17", document.get("Version"));
        }

        @Test
        @DisplayName("a missing policy file is a build failure")
        void missingPolicyFile(@TempDir Path configDir) {
            ResourceGraph graph = new ResourceGraph();
            ResourceId id = graph.add(new FileBasedIamPolicy("policy", "missing.json", Deferred.pending()));

            var generator = new PolicyGenerator(objectMapper, configDir);
            BuildException e = assertThrows(BuildException.class, () -> generator.handle(graph, id));
            assertTrue(e.getMessage().contains("missing.json"));
        }

        @Test
        @DisplayName("auto generated policies include statements for their traits")
        void autoGenWithTraits(@TempDir Path configDir) {
            ResourceGraph graph = new ResourceGraph();
            ResourceId id = graph.add(new AutoGenIamPolicy("policy", Deferred.pending(), Set.of(RoleTraits.VPC_NEEDED)));

            new PolicyGenerator(objectMapper, configDir).handle(graph, id);

            Map<String, Object> document = graph.get(id, AutoGenIamPolicy.class).document().get();
            List<?> statements = (List<?>) document.get("Statement");
            assertEquals(List.of(IamPolicies.cloudWatchLogsStatement(), IamPolicies.vpcAttachStatement()), statements);
        }
    }

    @Nested
    @DisplayName("RoleTraitsInjector")
    class RoleTraitsInjectorTests {

        @Test
        @DisplayName("a function in a VPC marks its role policy VPC_NEEDED")
        void vpcTrait() {
            ResourceGraph graph = new ResourceGraph();
            ResourceId policy = graph.add(new AutoGenIamPolicy("policy", Deferred.pending(), Set.of()));
            ResourceId role = graph.add(new ManagedIamRole("role", "myapp-dev", IamPolicies.lambdaTrustPolicy(), policy));
            ResourceId pkg = graph.add(new DeploymentPackage("deployment", Deferred.pending()));
            LambdaFunction plain = Fixtures.function("foo", pkg, role);
            ResourceId fn = graph.add(new LambdaFunction(plain.resourceName(), plain.functionName(), pkg,
                    Map.of(), "python3.12", "app.foo", Map.of(), Deferred.pending(), Deferred.pending(), role,
                    List.of("sg-1"), List.of("subnet-1"), null, List.of(), true));

            new RoleTraitsInjector().handle(graph, fn);

            assertEquals(Set.of(RoleTraits.VPC_NEEDED, RoleTraits.XRAY_NEEDED),
                    graph.get(policy, AutoGenIamPolicy.class).traits());
        }

        @Test
        @DisplayName("security groups without subnets do not need VPC access")
        void partialVpc() {
            ResourceGraph graph = new ResourceGraph();
            ResourceId policy = graph.add(new AutoGenIamPolicy("policy", Deferred.pending(), Set.of()));
            ResourceId role = graph.add(new ManagedIamRole("role", "myapp-dev", IamPolicies.lambdaTrustPolicy(), policy));
            ResourceId pkg = graph.add(new DeploymentPackage("deployment", Deferred.pending()));
            ResourceId fn = graph.add(new LambdaFunction("foo", "myapp-dev-foo", pkg, Map.of(), "python3.12",
                    "app.foo", Map.of(), Deferred.pending(), Deferred.pending(), role,
                    List.of("sg-1"), List.of(), null, List.of(), false));

            new RoleTraitsInjector().handle(graph, fn);

            assertTrue(graph.get(policy, AutoGenIamPolicy.class).traits().isEmpty());
        }
    }

    @Nested
    @DisplayName("ZipPackageBuilder")
    class ZipPackageBuilderTests {

        @Test
        @DisplayName("same sources give the same archive name and bytes")
        void deterministic(@TempDir Path root) throws IOException {
            Path source = Files.createDirectories(root.resolve("app"));
            Files.writeString(source.resolve("app.py"), "def handler(event, context):\n    return {}\n");
            Files.createDirectories(source.resolve("lib"));
            Files.writeString(source.resolve("lib/util.py"), "X = 1\n");

            Path first = new ZipPackageBuilder(source, root.resolve("out1")).createDeploymentPackage();
            Path second = new ZipPackageBuilder(source, root.resolve("out2")).createDeploymentPackage();

            assertEquals(first.getFileName(), second.getFileName());
            assertArrayEquals(Files.readAllBytes(first), Files.readAllBytes(second));
            assertEquals(PackageDigest.sha256Hex(first) + ".zip", first.getFileName().toString());
        }

        @Test
        @DisplayName("a missing source directory is a build failure")
        void missingSource(@TempDir Path root) {
            var builder = new ZipPackageBuilder(root.resolve("nope"), root.resolve("out"));
            assertThrows(BuildException.class, builder::createDeploymentPackage);
        }

        @Test
        @DisplayName("the packager fills the filename of pending packages")
        void packagerFillsFilename(@TempDir Path root) {
            Path zip = root.resolve("abc.zip");
            ResourceGraph graph = new ResourceGraph();
            ResourceId id = graph.add(new DeploymentPackage("deployment", Deferred.pending()));

            new DeploymentPackager(() -> zip).handle(graph, id);

            assertEquals(zip.toString(), graph.get(id, DeploymentPackage.class).filename().get());
        }
    }

    @Nested
    @DisplayName("BuildStage")
    class StageTests {

        @Test
        @DisplayName("a field left pending fails the build naming resource and field")
        void pendingFieldFails() {
            Application app = Fixtures.singleFunction("dev");
            List<ResourceId> order = new DependencyResolver().order(app);
            BuildStage stage = new BuildStage(List.of(new InjectDefaults()));

            BuildException e = assertThrows(BuildException.class, () -> stage.execute(app, order));
            assertTrue(e.getMessage().contains("deployment.filename"));
        }

        @Test
        @DisplayName("all steps together leave nothing pending")
        void allStepsResolve(@TempDir Path root) {
            Application app = Fixtures.singleFunction("dev");
            List<ResourceId> order = new DependencyResolver().order(app);
            BuildStage stage = new BuildStage(List.of(
                    new RoleTraitsInjector(),
                    new InjectDefaults(),
                    new DeploymentPackager(() -> root.resolve("pkg.zip")),
                    new PolicyGenerator(new ObjectMapper(), root),
                    new ApiDefinitionBuilder()));

            BuiltResources built = stage.execute(app, order);

            assertEquals(order, built.order());
            assertEquals("dev", built.stage());
        }
    }
}
