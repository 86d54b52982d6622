package com.entity.blocking.similarity;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Minimum edit distance over all cross pairs of elements.
 * Pairs involving an empty element are skipped. Cost is {@code |set1| * |set2|} distance
 * computations, so this is only suitable for small sets.
 */
public class MinDistanceSetSimilarity implements SetComparator {

    private final EditDistance distance;

    public MinDistanceSetSimilarity() {
        this(new AffineGapDistance());
    }

    public MinDistanceSetSimilarity(EditDistance distance) {
        this.distance = Objects.requireNonNull(distance, "distance is required");
    }

    @Override
    public double compare(Collection<String> set1, Collection<String> set2) {
        Collection<String> first = set1 != null ? set1 : List.of();
        Collection<String> second = set2 != null ? set2 : List.of();

        double closest = UNDEFINED;
        for (String w1 : first) {
            if (w1 == null || w1.isEmpty()) {
                continue;
            }
            for (String w2 : second) {
                if (w2 == null || w2.isEmpty()) {
                    continue;
                }
                double d = distance.distance(w1, w2);
                if (Double.isNaN(closest) || d < closest) {
                    closest = d;
                }
            }
        }
        return closest;
    }

    @Override
    public String getName() {
        return "MinDistanceSet";
    }
}
