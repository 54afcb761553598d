package com.converge.core.plan;

import java.util.List;

/**
 * Appends values to a pool list, creating it on first use.
 */
public record StoreMultipleValue(String name, List<Object> values) implements Instruction {

    public StoreMultipleValue {
        values = List.copyOf(values);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitStoreMultipleValue(this);
    }
}
