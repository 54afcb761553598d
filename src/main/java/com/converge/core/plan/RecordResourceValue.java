package com.converge.core.plan;

import com.converge.core.model.ResourceType;

/**
 * Records a literal value as a resource field.
 */
public record RecordResourceValue(
        ResourceType resourceType,
        String resourceName,
        String field,
        Object value
) implements RecordResource {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitRecordResourceValue(this);
    }
}
