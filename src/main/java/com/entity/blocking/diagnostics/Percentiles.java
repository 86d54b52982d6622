package com.entity.blocking.diagnostics;

/**
 * Percentiles by linear interpolation between closest ranks.
 */
final class Percentiles {

    private Percentiles() {
    }

    /**
     * @param sorted     values in ascending order, non-empty
     * @param percentile in [0, 100]
     */
    static double of(long[] sorted, double percentile) {
        if (sorted.length == 0) {
            throw new IllegalArgumentException("No values");
        }
        if (percentile < 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be between 0 and 100");
        }
        double rank = percentile / 100.0 * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (rank - lower);
    }
}
