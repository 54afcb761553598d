package com.converge.core.plan;

import java.util.List;

/**
 * Calls a function from the executor's fixed builtin registry.
 *
 * @param functionName {@code parse_arn}, {@code interrogate_profile} or {@code service_principal}
 */
public record BuiltinFunction(String functionName, List<Object> args, String outputVar) implements Instruction {

    public BuiltinFunction {
        args = List.copyOf(args);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitBuiltinFunction(this);
    }
}
