package com.entity.blocking.predicate;

import java.util.List;
import java.util.Set;

/**
 * Match on the first element of an ordered set-valued field.
 */
public class FirstSetElementPredicate extends SimplePredicate {

    public FirstSetElementPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        List<String> elements = SetPredicates.elements(value);
        return elements.isEmpty() ? Set.of() : Set.of(elements.get(0));
    }
}
