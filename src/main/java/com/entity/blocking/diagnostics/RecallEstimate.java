package com.entity.blocking.diagnostics;

import java.util.OptionalDouble;

/**
 * Estimated blocking recall over labeled matching pairs.
 *
 * @param matchPairs number of labeled matching pairs examined
 * @param recalled   number of those pairs that share at least one block
 */
public record RecallEstimate(int matchPairs, int recalled) {

    public RecallEstimate {
        if (matchPairs < 0 || recalled < 0 || recalled > matchPairs) {
            throw new IllegalArgumentException("recalled must be between 0 and matchPairs");
        }
    }

    /**
     * Fraction of matching pairs that blocking would present to the classifier,
     * or empty when there were no matching pairs.
     */
    public OptionalDouble recall() {
        if (matchPairs == 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) recalled / matchPairs);
    }
}
