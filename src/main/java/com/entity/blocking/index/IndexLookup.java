package com.entity.blocking.index;

import java.util.Optional;

/**
 * Resolves an {@link IndexKey} to the built index currently registered for it.
 * Predicates hold a lookup rather than the index itself, so that releasing the
 * index in one place releases it for every predicate.
 */
@FunctionalInterface
public interface IndexLookup {

    /**
     * Returns the built index for the key, or empty if none is built.
     */
    Optional<Index> find(IndexKey key);

    /**
     * A lookup that never resolves anything.
     */
    IndexLookup NONE = key -> Optional.empty();
}
