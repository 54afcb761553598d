package com.converge.core.remote;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Live or recorded attributes of a deployed resource, keyed by the field names
 * used in the deployed-resources record.
 */
public final class ResourceSnapshot {

    private static final ResourceSnapshot ABSENT = new ResourceSnapshot(false, Map.of());

    private final boolean present;
    private final Map<String, Object> attributes;

    private ResourceSnapshot(boolean present, Map<String, Object> attributes) {
        this.present = present;
        this.attributes = attributes;
    }

    public static ResourceSnapshot absent() {
        return ABSENT;
    }

    public static ResourceSnapshot of(Map<String, ?> attributes) {
        return new ResourceSnapshot(true, Collections.unmodifiableMap(new LinkedHashMap<>(attributes)));
    }

    public boolean isPresent() {
        return present;
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Object get(String field) {
        return attributes.get(field);
    }

    public String getString(String field) {
        Object value = attributes.get(field);
        return value == null ? null : value.toString();
    }

    /** Integer view of a numeric field, {@code null} when unset. */
    public Integer getInteger(String field) {
        Object value = attributes.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        return Integer.valueOf(value.toString());
    }

    /** Whether the snapshot holds {@code expected} for {@code field}; numbers compare by value. */
    public boolean matches(String field, Object expected) {
        Object actual = attributes.get(field);
        if (actual instanceof Number a && expected instanceof Number e) {
            return a.longValue() == e.longValue();
        }
        return Objects.equals(actual, expected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResourceSnapshot other)) return false;
        return present == other.present && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(present, attributes);
    }

    @Override
    public String toString() {
        return present ? "ResourceSnapshot" + attributes : "ResourceSnapshot[absent]";
    }
}
