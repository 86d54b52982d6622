package com.entity.blocking.predicate;

import java.util.List;
import java.util.Set;

/**
 * Match on the last element of an ordered set-valued field.
 */
public class LastSetElementPredicate extends SimplePredicate {

    public LastSetElementPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        List<String> elements = SetPredicates.elements(value);
        return elements.isEmpty() ? Set.of() : Set.of(elements.get(elements.size() - 1));
    }
}
