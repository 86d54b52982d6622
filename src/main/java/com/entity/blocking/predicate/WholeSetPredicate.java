package com.entity.blocking.predicate;

import java.util.Set;

/**
 * Match on the entire set, independent of element order.
 */
public class WholeSetPredicate extends SimplePredicate {

    public WholeSetPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        Set<String> elements = SetPredicates.sortedDistinct(value);
        if (elements.isEmpty()) {
            return Set.of();
        }
        return Set.of(SetPredicates.join(elements));
    }
}
