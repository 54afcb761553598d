package com.converge.core.planner;

import com.converge.core.build.BuiltResources;
import com.converge.core.plan.Plan;

/**
 * Plans nothing. Used when tearing a stage down: the sweeper then sees every
 * recorded resource as orphaned.
 */
public class NoopPlanStage implements Planner {

    @Override
    public Plan plan(BuiltResources resources) {
        return Plan.empty();
    }
}
