package com.entity.blocking.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable mapping from field name to field value for a single record.
 * Values are plain strings, numbers, or collections of strings for set-valued fields.
 */
public final class Instance {

    private static final Instance EMPTY = new Instance(Map.of());

    private final Map<String, Object> fields;

    private Instance(Map<String, Object> fields) {
        this.fields = fields;
    }

    public static Instance of(Map<String, ?> fields) {
        Objects.requireNonNull(fields, "fields is required");
        // LinkedHashMap rather than Map.copyOf: null values mean "missing" and must be kept
        return new Instance(Collections.unmodifiableMap(new LinkedHashMap<>(fields)));
    }

    public static Instance empty() {
        return EMPTY;
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Returns the value as a string, or null when the field is absent.
     */
    public String getString(String field) {
        Object value = fields.get(field);
        return value == null ? null : value.toString();
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    /**
     * Returns true when the field is missing, null, blank, or an empty collection.
     */
    public boolean isEmpty(String field) {
        return isEmptyValue(fields.get(field));
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public static boolean isEmptyValue(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof Collection<?> c) {
            return c.isEmpty();
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Instance other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "Instance" + fields;
    }
}
