package com.entity.blocking.index;

import java.util.Objects;

/**
 * Identifies a shared index: one per field and index type.
 */
public record IndexKey(String field, String indexType) {

    public IndexKey {
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(indexType, "indexType is required");
    }

    @Override
    public String toString() {
        return field + "/" + indexType;
    }
}
