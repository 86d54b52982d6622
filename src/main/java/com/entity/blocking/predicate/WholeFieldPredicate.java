package com.entity.blocking.predicate;

import java.util.Locale;
import java.util.Set;

/**
 * Exact match on the whole (trimmed, lower-cased) field value.
 */
public class WholeFieldPredicate extends SimplePredicate {

    public WholeFieldPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        return Set.of(value.toString().trim().toLowerCase(Locale.ROOT));
    }
}
