package com.converge.core.plan;

/**
 * Binds a resolved value to a pool name.
 */
public record StoreValue(String name, Object value) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitStoreValue(this);
    }
}
