package com.converge.core.plan;

/**
 * Reference to a pool entry, resolved when the instruction carrying it runs.
 */
public record Variable(String name) {
}
