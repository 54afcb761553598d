package com.converge.core.model;

/**
 * A role that already exists and is referenced by ARN only.
 */
public record PreCreatedIamRole(String resourceName, String roleArn) implements IamRole {

    @Override
    public ResourceType resourceType() {
        return ResourceType.PRE_CREATED_IAM_ROLE;
    }

    @Override
    public <R> R accept(ResourceVisitor<R> visitor) {
        return visitor.visitPreCreatedIamRole(this);
    }
}
