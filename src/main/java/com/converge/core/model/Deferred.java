package com.converge.core.model;

import java.util.Objects;

/**
 * A field value that is either still pending or resolved.
 * <p>
 * Declared resources carry pending fields for attributes the build stage
 * computes locally (defaults, package filename, policy and API documents).
 * The build stage replaces them with resolved copies before planning starts.
 *
 * @param <T> type of the resolved value
 */
public final class Deferred<T> {

    private final T value;
    private final boolean pending;

    private Deferred(T value, boolean pending) {
        this.value = value;
        this.pending = pending;
    }

    public static <T> Deferred<T> pending() {
        return new Deferred<>(null, true);
    }

    public static <T> Deferred<T> of(T value) {
        return new Deferred<>(Objects.requireNonNull(value, "value"), false);
    }

    public boolean isPending() {
        return pending;
    }

    /**
     * Returns the resolved value.
     *
     * @throws IllegalStateException if the value is still pending
     */
    public T get() {
        if (pending) {
            throw new IllegalStateException("Value has not been resolved yet");
        }
        return value;
    }

    public T orElse(T fallback) {
        return pending ? fallback : value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Deferred<?> other)) return false;
        return pending == other.pending && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return pending ? 0 : Objects.hashCode(value) + 1;
    }

    @Override
    public String toString() {
        return pending ? "Deferred[pending]" : "Deferred[" + value + "]";
    }
}
