package com.converge.dispatch.cli;

import com.converge.core.engine.DeployerFactory;
import com.converge.core.engine.DeploymentException;
import com.converge.core.engine.DeploymentResult;
import com.converge.core.model.Application;
import com.converge.core.state.StateException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

/**
 * CLI command: converge delete [--stage &lt;stage&gt;]
 * <p>
 * Deletes every resource recorded for the stage, newest first.
 */
@Command(name = "delete", mixinStandardHelpOptions = true, description = "Delete all resources of a stage")
@Component
public class DeleteCommand implements Callable<Integer> {

    @Option(names = {"--stage", "-s"}, description = "Stage to delete (default: ${DEFAULT-VALUE})",
            defaultValue = "dev")
    String stage;

    private final DeployerFactory deployerFactory;

    public DeleteCommand(DeployerFactory deployerFactory) {
        this.deployerFactory = deployerFactory;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        try {
            if (deployerFactory.loadDeployed(stage).isEmpty()) {
                ConsoleOutput.info("Nothing is deployed for stage " + stage);
                return 0;
            }

            ConsoleOutput.info("Deleting stage " + stage);
            DeploymentResult result = deployerFactory.createDeletionDeployer(stage, new ConsoleUi())
                    .deploy(Application.empty(stage));
            ConsoleOutput.success("Stage " + stage + " deleted (" + result.apiCalls() + " API calls)");
            return 0;
        } catch (DeploymentException | StateException e) {
            ConsoleOutput.error(e.getMessage());
            return 1;
        }
    }
}
