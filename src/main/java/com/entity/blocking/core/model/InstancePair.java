package com.entity.blocking.core.model;

import java.util.Objects;

/**
 * Two instances presented together as a labeled training example.
 */
public record InstancePair(Instance first, Instance second) {

    public InstancePair {
        Objects.requireNonNull(first, "first is required");
        Objects.requireNonNull(second, "second is required");
    }
}
