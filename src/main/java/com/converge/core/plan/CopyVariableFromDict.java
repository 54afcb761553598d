package com.converge.core.plan;

/**
 * Copies one key of a map held in the pool to a new pool name.
 */
public record CopyVariableFromDict(String fromVar, String key, String toVar) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitCopyVariableFromDict(this);
    }
}
