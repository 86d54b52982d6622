package com.entity.blocking.diagnostics;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SizeDistributionTest {

    private final Map<String, Long> sizes = Map.of("a", 1L, "b", 2L, "c", 3L, "d", 4L);

    @Test
    void summaryStatistics() {
        SizeDistribution distribution = SizeDistribution.of(sizes, 10);

        assertEquals(4, distribution.blocks());
        assertEquals(2.5, distribution.mean(), 1e-9);
        assertEquals(4, distribution.largest().size());
        assertEquals(new SizeDistribution.BlockSize("d", 4L), distribution.largest().get(0));
    }

    @ParameterizedTest
    @CsvSource({
            "25, 1.75",
            "50, 2.5",
            "75, 3.25",
            "95, 3.85",
            "99, 3.97"
    })
    void percentilesInterpolateLinearly(int percentile, double expected) {
        assertEquals(expected, SizeDistribution.of(sizes, 10).percentile(percentile), 1e-9);
    }

    @Test
    void singleBlock() {
        SizeDistribution distribution = SizeDistribution.of(Map.of("only", 7L), 10);

        assertEquals(7.0, distribution.percentile(25));
        assertEquals(7.0, distribution.percentile(99));
    }

    @Test
    void emptyInputIsNoData() {
        SizeDistribution distribution = SizeDistribution.of(Map.of(), 10);

        assertTrue(distribution.isEmpty());
        assertTrue(Double.isNaN(distribution.mean()));
        assertTrue(distribution.largest().isEmpty());
    }

    @Test
    void percentileOfEmptyValuesRejected() {
        assertThrows(IllegalArgumentException.class, () -> Percentiles.of(new long[0], 50));
    }
}
