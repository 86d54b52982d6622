package com.entity.blocking.core.model;

import java.util.Map;
import java.util.Objects;

/**
 * A record identifier paired with its field values.
 *
 * @param id       the record identifier
 * @param instance the record's field values
 */
public record DataRecord(String id, Instance instance) {

    public DataRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(instance, "instance is required");
    }

    public static DataRecord of(String id, Map<String, ?> fields) {
        return new DataRecord(id, Instance.of(fields));
    }
}
