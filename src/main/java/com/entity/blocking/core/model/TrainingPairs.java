package com.entity.blocking.core.model;

import java.util.List;
import java.util.Map;

/**
 * Labeled instance pairs, split into pairs known to match and pairs known to be distinct.
 *
 * @param match    pairs labeled as the same real-world entity
 * @param distinct pairs labeled as different entities
 */
public record TrainingPairs(List<InstancePair> match, List<InstancePair> distinct) {

    public static final String MATCH = "match";
    public static final String DISTINCT = "distinct";

    public TrainingPairs {
        match = match != null ? List.copyOf(match) : List.of();
        distinct = distinct != null ? List.copyOf(distinct) : List.of();
    }

    /**
     * Builds training pairs from a map keyed by {@code "match"} and {@code "distinct"}.
     * A missing key yields an empty list.
     */
    public static TrainingPairs fromMap(Map<String, List<InstancePair>> labeled) {
        return new TrainingPairs(labeled.get(MATCH), labeled.get(DISTINCT));
    }

    public static TrainingPairs empty() {
        return new TrainingPairs(List.of(), List.of());
    }

    public int size() {
        return match.size() + distinct.size();
    }
}
