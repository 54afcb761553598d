package com.converge.core.model;

/**
 * Handle of a resource inside a {@link ResourceGraph}.
 * Two edges carrying the same id point at the same node.
 *
 * @param index position of the resource in its graph
 */
public record ResourceId(int index) {

    @Override
    public String toString() {
        return "#" + index;
    }
}
