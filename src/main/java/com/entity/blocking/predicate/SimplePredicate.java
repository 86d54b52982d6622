package com.entity.blocking.predicate;

import com.entity.blocking.core.model.Instance;

import java.util.Objects;
import java.util.Set;

/**
 * Stateless predicate over a single field. Empty field values never produce keys.
 */
public abstract class SimplePredicate implements BlockingPredicate {

    protected final String field;

    protected SimplePredicate(String field) {
        this.field = Objects.requireNonNull(field, "field is required");
    }

    @Override
    public final Set<String> apply(Instance instance, boolean target) {
        Object value = instance.get(field);
        if (Instance.isEmptyValue(value)) {
            return Set.of();
        }
        return keys(value);
    }

    /**
     * Computes keys for a non-empty field value.
     */
    protected abstract Set<String> keys(Object value);

    public String getField() {
        return field;
    }

    @Override
    public String describe() {
        return getClass().getSimpleName() + "(" + field + ")";
    }

    @Override
    public String toString() {
        return describe();
    }
}
