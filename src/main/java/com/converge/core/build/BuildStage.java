package com.converge.core.build;

import com.converge.core.model.Application;
import com.converge.core.model.ResourceId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs every build step over every resource, then verifies nothing is left pending.
 */
public class BuildStage {

    private static final Logger log = LoggerFactory.getLogger(BuildStage.class);

    private final List<BuildStep> steps;

    public BuildStage(List<BuildStep> steps) {
        this.steps = List.copyOf(steps);
    }

    public BuiltResources execute(Application application, List<ResourceId> order) {
        for (BuildStep step : steps) {
            log.debug("Running build step {}", step.getClass().getSimpleName());
            for (ResourceId id : order) {
                step.handle(application.graph(), id);
            }
        }
        return BuiltResources.verify(application, order);
    }
}
