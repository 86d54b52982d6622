package com.entity.blocking.predicate;

import java.util.Set;

/**
 * One key per set element: records sharing any element share a block.
 */
public class CommonSetElementPredicate extends SimplePredicate {

    public CommonSetElementPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        return SetPredicates.orderedDistinct(value);
    }
}
