package com.converge.core.plan;

import com.converge.core.model.ResourceType;

/**
 * Records the current value of a pool variable as a resource field.
 */
public record RecordResourceVariable(
        ResourceType resourceType,
        String resourceName,
        String field,
        String variableName
) implements RecordResource {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitRecordResourceVariable(this);
    }
}
