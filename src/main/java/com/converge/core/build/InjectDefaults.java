package com.converge.core.build;

import com.converge.core.model.LambdaFunction;
import com.converge.core.model.ResourceGraph;
import com.converge.core.model.ResourceId;

/**
 * Gives functions the default timeout and memory size when they declare none.
 */
public class InjectDefaults implements BuildStep {

    public static final int DEFAULT_TIMEOUT = 60;
    public static final int DEFAULT_MEMORY_SIZE = 128;

    private final int timeout;
    private final int memorySize;

    public InjectDefaults() {
        this(DEFAULT_TIMEOUT, DEFAULT_MEMORY_SIZE);
    }

    public InjectDefaults(int timeout, int memorySize) {
        this.timeout = timeout;
        this.memorySize = memorySize;
    }

    @Override
    public void handle(ResourceGraph graph, ResourceId id) {
        if (!(graph.get(id) instanceof LambdaFunction function)) {
            return;
        }
        LambdaFunction updated = function;
        if (updated.timeout().isPending()) {
            updated = updated.withTimeout(timeout);
        }
        if (updated.memorySize().isPending()) {
            updated = updated.withMemorySize(memorySize);
        }
        if (updated != function) {
            graph.replace(id, updated);
        }
    }
}
