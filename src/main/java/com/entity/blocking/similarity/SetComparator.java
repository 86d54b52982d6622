package com.entity.blocking.similarity;

import java.util.Collection;

/**
 * Compares two set-valued field values and returns a single scalar feature.
 * Whether larger means closer depends on the implementation; {@link #UNDEFINED}
 * is returned when the inputs carry nothing to compare.
 */
public interface SetComparator {

    double UNDEFINED = Double.NaN;

    /**
     * Compares two sets. Null is treated as the empty set.
     */
    double compare(Collection<String> set1, Collection<String> set2);

    /**
     * Returns the name of this comparator.
     */
    String getName();

    static boolean isUndefined(double value) {
        return Double.isNaN(value);
    }
}
