package com.entity.blocking.predicate;

import java.util.Set;

/**
 * One key per two-element combination of the distinct set elements: records sharing
 * any two elements share a block.
 */
public class CommonTwoElementsPredicate extends SimplePredicate {

    public CommonTwoElementsPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        return SetPredicates.combinations(value, 2);
    }
}
