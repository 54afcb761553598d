package com.converge.core.plan;

public record CopyVariable(String fromVar, String toVar) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitCopyVariable(this);
    }
}
