package com.converge.core.build;

import com.converge.core.model.AutoGenIamPolicy;
import com.converge.core.model.LambdaFunction;
import com.converge.core.model.ManagedIamRole;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;
import com.converge.core.model.RoleTraits;

/**
 * Marks the auto-generated policy of a function's role with the capabilities
 * the function's configuration implies (VPC networking, tracing).
 * Must run before {@link PolicyGenerator}.
 */
public class RoleTraitsInjector implements BuildStep {

    @Override
    public void handle(ResourceGraph graph, ResourceId id) {
        if (!(graph.get(id) instanceof LambdaFunction function)) {
            return;
        }
        if (!(graph.get(function.role()) instanceof ManagedIamRole role)) {
            return;
        }
        if (!(graph.get(role.policy()) instanceof AutoGenIamPolicy policy)) {
            return;
        }
        AutoGenIamPolicy updated = policy;
        if (function.needsVpc()) {
            updated = updated.withTrait(RoleTraits.VPC_NEEDED);
        }
        if (function.xray()) {
            updated = updated.withTrait(RoleTraits.XRAY_NEEDED);
        }
        if (!updated.equals(policy)) {
            graph.replace(role.policy(), updated);
        }
    }
}
