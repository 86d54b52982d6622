package com.entity.blocking.predicate;

import com.entity.blocking.core.model.Instance;

import java.util.Set;

/**
 * A rule that maps a record to zero or more raw block keys.
 * Records that share a key (from the same predicate) are compared pairwise downstream.
 */
public interface BlockingPredicate {

    /**
     * Computes the raw block keys for an instance.
     *
     * @param instance the record's field values
     * @param target   true when the record belongs to the second dataset of a record-linkage run
     * @return block keys (never null, may be empty)
     */
    Set<String> apply(Instance instance, boolean target);

    default Set<String> apply(Instance instance) {
        return apply(instance, false);
    }

    /**
     * Whether this predicate needs a built shared index before it may be invoked.
     * Fixed for the lifetime of the predicate.
     */
    default boolean requiresIndex() {
        return false;
    }

    /**
     * Human-readable description used in diagnostics output.
     */
    String describe();
}
