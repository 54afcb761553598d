package com.converge.core.plan;

/**
 * Evaluates a JMESPath expression against a pool value.
 */
public record JpSearch(String expression, String inputVar, String outputVar) implements Instruction {

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitJpSearch(this);
    }
}
