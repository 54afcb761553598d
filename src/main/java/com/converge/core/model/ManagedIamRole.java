package com.converge.core.model;

import java.util.List;
import java.util.Map;

/**
 * A role created and kept in sync by the deployer.
 *
 * @param roleName    name of the role in the account
 * @param trustPolicy assume-role policy document
 * @param policy      id of the {@link IamPolicy} put inline on the role
 */
public record ManagedIamRole(
        String resourceName,
        String roleName,
        Map<String, Object> trustPolicy,
        ResourceId policy
) implements IamRole {

    @Override
    public ResourceType resourceType() {
        return ResourceType.IAM_ROLE;
    }

    @Override
    public List<ResourceId> dependencies() {
        return List.of(policy);
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitManagedIamRole(this);
    }
}
