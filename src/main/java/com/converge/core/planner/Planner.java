package com.converge.core.planner;

import com.converge.core.build.BuiltResources;
import com.converge.core.plan.Plan;

/**
 * Turns built resources into a plan.
 */
public interface Planner {

    Plan plan(BuiltResources resources);
}
