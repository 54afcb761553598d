package com.converge.core.plan;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Invocation of a named cloud client method.
 *
 * @param methodName client method, e.g. {@code create_function}
 * @param params     keyword parameters; values may contain {@link Variable}s and {@link StringFormat}s
 * @param outputVar  pool name the result is stored under, or {@code null}
 */
public record ApiCall(String methodName, Map<String, Object> params, String outputVar) implements Instruction {

    public ApiCall {
        params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public ApiCall(String methodName, Map<String, Object> params) {
        this(methodName, params, null);
    }

    @Override
    public <R> R accept(InstructionVisitor<R> visitor) {
        return visitor.visitApiCall(this);
    }
}
