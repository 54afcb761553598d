package com.converge.core.build;

import com.converge.core.model.DeploymentPackage;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;

/**
 * Sets the filename of every pending deployment package.
 */
public class DeploymentPackager implements BuildStep {

    private final PackageBuilder packageBuilder;

    public DeploymentPackager(PackageBuilder packageBuilder) {
        this.packageBuilder = packageBuilder;
    }

    @Override
    public void handle(ResourceGraph graph, ResourceId id) {
        if (graph.get(id) instanceof DeploymentPackage deploymentPackage && deploymentPackage.filename().isPending()) {
            String filename = packageBuilder.createDeploymentPackage().toString();
            graph.replace(id, deploymentPackage.withFilename(filename));
        }
    }
}
