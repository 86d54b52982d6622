package com.entity.blocking.predicate;

import java.util.Set;

/**
 * One key per three-element combination of the distinct set elements: records sharing
 * any three elements share a block.
 */
public class CommonThreeElementsPredicate extends SimplePredicate {

    public CommonThreeElementsPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        return SetPredicates.combinations(value, 3);
    }
}
