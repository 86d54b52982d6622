package com.entity.blocking.diagnostics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projected number of pairwise comparisons implied by a set of blocks.
 *
 * <p>Within one dataset each key contributes {@code n * n} pairs. This over-counts: it includes
 * self pairs and both orders of each pair ({@code n * (n - 1) / 2} is the exact figure), and a pair
 * blocked together by several predicates is counted once per predicate. The true comparison
 * volume after de-duplication is generally lower. The approximation is kept so figures stay
 * comparable with historical reports.</p>
 *
 * <p>Across two datasets a key contributes {@code n1 * n2}, and only keys present on both sides count.</p>
 *
 * @param pairsPerKey  projected pairs for every contributing key
 * @param total        sum of all projected pairs
 * @param distribution distribution statistics of the per-key pair counts
 */
public record PairProjection(Map<String, Long> pairsPerKey, long total, SizeDistribution distribution) {

    public PairProjection {
        pairsPerKey = Collections.unmodifiableMap(new LinkedHashMap<>(pairsPerKey));
    }

    /**
     * Projection for deduplication within a single dataset.
     */
    public static PairProjection dedupe(Map<String, Long> sizes, int showLargest) {
        Map<String, Long> pairs = new LinkedHashMap<>();
        sizes.forEach((key, n) -> pairs.put(key, n * n));
        return of(pairs, showLargest);
    }

    /**
     * Projection for record linkage between two datasets.
     */
    public static PairProjection link(Map<String, Long> sizes1, Map<String, Long> sizes2, int showLargest) {
        Map<String, Long> pairs = new LinkedHashMap<>();
        sizes1.forEach((key, n1) -> {
            long n2 = sizes2.getOrDefault(key, 0L);
            if (n2 > 0) {
                pairs.put(key, n1 * n2);
            }
        });
        return of(pairs, showLargest);
    }

    private static PairProjection of(Map<String, Long> pairs, int showLargest) {
        long total = pairs.values().stream().mapToLong(Long::longValue).sum();
        return new PairProjection(pairs, total, SizeDistribution.of(pairs, showLargest));
    }
}
