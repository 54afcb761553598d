package com.converge.core.build;

import java.nio.file.Path;

/**
 * Produces the zip archive uploaded as function code.
 */
public interface PackageBuilder {

    /**
     * Builds (or reuses) the deployment package.
     *
     * @return path of the zip file
     * @throws BuildException if the archive cannot be written
     */
    Path createDeploymentPackage();
}
