package com.converge.core.plan;

/**
 * One step of a {@link Plan}. The set of instructions is closed; consumers
 * dispatch through {@link InstructionVisitor}.
 */
public interface Instruction {

    <R> R accept(InstructionVisitor<R> visitor);
}
