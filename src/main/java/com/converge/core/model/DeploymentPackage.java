package com.converge.core.model;

import java.util.List;

/**
 * The zip archive uploaded as a function's code.
 *
 * @param resourceName graph name
 * @param filename     path of the built zip, pending until packaging runs
 */
public record DeploymentPackage(String resourceName, Deferred<String> filename) implements Resource {

    public DeploymentPackage withFilename(String filename) {
        return new DeploymentPackage(resourceName, Deferred.of(filename));
    }

    @Override
    public ResourceType resourceType() {
        return ResourceType.DEPLOYMENT_PACKAGE;
    }

    @Override
    public List<String> pendingFields() {
        return filename.isPending() ? List.of("filename") : List.of();
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitDeploymentPackage(this);
    }
}
