package com.converge.dispatch.cli;

import com.converge.core.engine.DeployerFactory;
import com.converge.core.engine.DeploymentReporter;
import com.converge.core.state.DeployedResources;
import com.converge.core.state.StateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: converge resources [--stage &lt;stage&gt;]
 * <p>
 * Lists what the last successful deployment of a stage recorded.
 */
@Command(name = "resources", mixinStandardHelpOptions = true, description = "List the deployed resources of a stage")
@Component
public class ResourcesCommand implements Callable<Integer> {

    @Option(names = {"--stage", "-s"}, description = "Stage to inspect (default: ${DEFAULT-VALUE})",
            defaultValue = "dev")
    String stage;

    private final DeployerFactory deployerFactory;

    public ResourcesCommand(DeployerFactory deployerFactory) {
        this.deployerFactory = deployerFactory;
    }

    @Override
    public Integer call() {
        DeployedResources deployed;
        try {
            deployed = deployerFactory.loadDeployed(stage);
        } catch (StateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }

        if (deployed.isEmpty()) {
            ConsoleOutput.info("Nothing is deployed for stage " + stage);
            return 0;
        }

        System.out.println();
        System.out.printf("  %-30s %-25s%n", "NAME", "TYPE");
        System.out.println("  " + "-".repeat(56));
        for (Map<String, Object> resource : deployed.resources()) {
            System.out.printf("  %-30s %-25s%n", resource.get("name"), resource.get("resource_type"));
        }
        ConsoleOutput.report(new DeploymentReporter().generateReport(deployed.resources()));
        return 0;
    }
}
