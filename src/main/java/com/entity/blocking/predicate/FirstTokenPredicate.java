package com.entity.blocking.predicate;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Match on the first whitespace-separated token of the field.
 */
public class FirstTokenPredicate extends SimplePredicate {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public FirstTokenPredicate(String field) {
        super(field);
    }

    @Override
    protected Set<String> keys(Object value) {
        String cleaned = value.toString().trim().toLowerCase(Locale.ROOT);
        if (cleaned.isEmpty()) {
            return Set.of();
        }
        return Set.of(WHITESPACE.split(cleaned, 2)[0]);
    }
}
