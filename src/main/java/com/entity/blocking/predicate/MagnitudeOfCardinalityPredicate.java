package com.entity.blocking.predicate;

import java.util.Set;

/**
 * Match on the order of magnitude (base 10, rounded) of the set's size.
 * Sets of size 1-3 share key "0", 4-31 share "1", and so on.
 */
public class MagnitudeOfCardinalityPredicate extends SimplePredicate {

    public MagnitudeOfCardinalityPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        int size = SetPredicates.orderedDistinct(value).size();
        if (size == 0) {
            return Set.of();
        }
        return Set.of(String.valueOf(Math.round(Math.log10(size))));
    }
}
