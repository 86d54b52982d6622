package com.entity.blocking.diagnostics;

import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Summary statistics of a key-to-size mapping: block count, mean, percentiles,
 * and the largest entries.
 *
 * @param blocks      number of keys
 * @param mean        mean size
 * @param percentiles size at the 25th, 50th, 75th, 95th and 99th percentile
 * @param largest     the largest entries, biggest first
 */
public record SizeDistribution(
        int blocks,
        double mean,
        Map<Integer, Double> percentiles,
        List<BlockSize> largest
) {
    static final int[] REPORTED_PERCENTILES = {25, 50, 75, 95, 99};

    public SizeDistribution {
        percentiles = Collections.unmodifiableMap(new LinkedHashMap<>(percentiles));
        largest = List.copyOf(largest);
    }

    public static SizeDistribution empty() {
        return new SizeDistribution(0, Double.NaN, Map.of(), List.of());
    }

    /**
     * Computes the distribution of the given sizes.
     * An empty mapping yields {@link #empty()}.
     */
    public static SizeDistribution of(Map<String, Long> sizes, int showLargest) {
        if (sizes.isEmpty()) {
            return empty();
        }
        long[] sorted = sizes.values().stream().mapToLong(Long::longValue).sorted().toArray();
        double mean = Arrays.stream(sorted).average().orElse(Double.NaN);

        Map<Integer, Double> percentiles = new LinkedHashMap<>();
        for (int p : REPORTED_PERCENTILES) {
            percentiles.put(p, Percentiles.of(sorted, p));
        }

        List<BlockSize> largest = sizes.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(showLargest)
                .map(e -> new BlockSize(e.getKey(), e.getValue()))
                .toList();

        return new SizeDistribution(sorted.length, mean, percentiles, largest);
    }

    public boolean isEmpty() {
        return blocks == 0;
    }

    public double percentile(int p) {
        return percentiles.getOrDefault(p, Double.NaN);
    }

    /**
     * A single key and its size.
     */
    public record BlockSize(String key, long size) {}
}
