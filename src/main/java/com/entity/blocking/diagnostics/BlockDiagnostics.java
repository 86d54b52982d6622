package com.entity.blocking.diagnostics;

import com.entity.blocking.blocking.Blocker;
import com.entity.blocking.core.model.BlockedRecord;
import com.entity.blocking.core.model.Instance;
import com.entity.blocking.core.model.InstancePair;
import com.entity.blocking.core.model.TrainingPairs;
import com.entity.blocking.logging.LogContext;
import com.entity.blocking.metrics.BlockingMetrics;
import com.entity.blocking.predicate.CompoundPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Block quality diagnostics: block size distributions, projected comparison volume,
 * and recall against labeled matching pairs.
 *
 * <p>Only counts per key are kept in memory; blocks themselves are never materialized.</p>
 */
public class BlockDiagnostics {
    private static final Logger log = LoggerFactory.getLogger(BlockDiagnostics.class);

    private final Blocker blocker;
    private final BlockingMetrics metrics;
    private final int showLargest;

    public BlockDiagnostics(Blocker blocker) {
        this.blocker = blocker;
        this.metrics = blocker.getMetrics();
        this.showLargest = blocker.getOptions().getShowLargestBlocks();
    }

    /**
     * Counts records per block for a dataset. Keys are re-rendered as
     * {@code rawKey:ordinal:predicateDescription}.
     */
    public Map<String, Long> blockSizes(Map<String, Instance> dataset, boolean target) {
        try (Stream<BlockedRecord> pairs = blocker.emit(dataset, target)) {
            return blockSizes(pairs);
        }
    }

    /**
     * Counts records per block in an already emitted key stream.
     */
    public Map<String, Long> blockSizes(Stream<BlockedRecord> pairs) {
        Map<String, Long> counts = new HashMap<>();
        Map<String, Integer> ordinals = new HashMap<>();
        pairs.forEach(pair -> {
            String rendered = pair.key().toString();
            counts.merge(rendered, 1L, Long::sum);
            ordinals.putIfAbsent(rendered, pair.key().ordinal());
        });

        Map<String, Long> described = new LinkedHashMap<>();
        counts.forEach((rendered, n) -> {
            described.put(rendered + ":" + blocker.describe(ordinals.get(rendered)), n);
            metrics.recordBlockSize(n);
        });
        return described;
    }

    public SizeDistribution sizeDistribution(Map<String, Long> sizes) {
        return SizeDistribution.of(sizes, showLargest);
    }

    /**
     * Projected comparisons within one dataset.
     */
    public PairProjection projectedPairs(Map<String, Long> sizes) {
        return PairProjection.dedupe(sizes, showLargest);
    }

    /**
     * Projected comparisons between two datasets.
     */
    public PairProjection projectedPairs(Map<String, Long> sizes1, Map<String, Long> sizes2) {
        if (sizes2 == null) {
            return projectedPairs(sizes1);
        }
        return PairProjection.link(sizes1, sizes2, showLargest);
    }

    /**
     * Estimates the fraction of labeled matches that share at least one block.
     * A pair counts as recalled as soon as one predicate gives both records a common key;
     * the second record is evaluated as the target side.
     */
    public RecallEstimate recallEstimate(TrainingPairs trainingPairs) {
        int recalled = 0;
        for (InstancePair pair : trainingPairs.match()) {
            if (isRecalled(pair)) {
                recalled++;
            }
        }
        RecallEstimate estimate = new RecallEstimate(trainingPairs.match().size(), recalled);
        estimate.recall().ifPresent(metrics::recordRecall);
        return estimate;
    }

    private boolean isRecalled(InstancePair pair) {
        for (CompoundPredicate predicate : blocker.getPredicates()) {
            Set<String> keys = predicate.apply(pair.first(), false);
            if (keys.isEmpty()) {
                continue;
            }
            for (String key : predicate.apply(pair.second(), true)) {
                if (keys.contains(key)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Logs a size distribution under a heading.
     */
    public void reportBlockSizes(Map<String, Long> sizes, String name) {
        logDistribution(name, sizeDistribution(sizes));
    }

    /**
     * Logs block statistics for one or two datasets and the projected number of pairs to score.
     *
     * @param data1 the dataset to deduplicate, or the first side of a linkage
     * @param data2 the second side of a linkage, or null for deduplication
     */
    public PairProjection reportBlockerStats(Map<String, Instance> data1, Map<String, Instance> data2) {
        try (LogContext ctx = LogContext.forDiagnostics(LogContext.generateRunId())) {
            Map<String, Long> sizes1 = blockSizes(data1, false);
            reportBlockSizes(sizes1, "Block stats for data1");

            Map<String, Long> sizes2 = null;
            if (data2 != null) {
                sizes2 = blockSizes(data2, true);
                reportBlockSizes(sizes2, "Block stats for data2");
            }

            PairProjection projection = projectedPairs(sizes1, sizes2);
            logDistribution("Blocked pairs to be scored", projection.distribution());
            log.info("");
            log.info("TOTAL BLOCKED PAIRS: {}", String.format("%,d", projection.total()));
            log.info("");
            return projection;
        }
    }

    /**
     * Logs the estimated blocking recall over the labeled matches.
     */
    public RecallEstimate reportRecall(TrainingPairs trainingPairs) {
        try (LogContext ctx = LogContext.forDiagnostics(LogContext.generateRunId())) {
            RecallEstimate estimate = recallEstimate(trainingPairs);
            OptionalDouble recall = estimate.recall();
            if (recall.isPresent()) {
                log.info("ESTIMATED BLOCKING RECALL: {}", recall.getAsDouble());
            } else {
                log.warn("ESTIMATED BLOCKING RECALL: no data (no labeled matching pairs)");
            }
            log.info("");
            return estimate;
        }
    }

    private void logDistribution(String name, SizeDistribution distribution) {
        log.info("{}:", name);
        if (distribution.isEmpty()) {
            log.info("  no data");
            return;
        }
        log.info("  blocks: {}", String.format("%,d", distribution.blocks()));
        log.info("  mean size: {}", String.format("%.1f", distribution.mean()));
        distribution.percentiles().forEach((p, value) ->
                log.info("  {}th percentile: {}", p, value));
        log.info("  largest {} blocks:", distribution.largest().size());
        for (SizeDistribution.BlockSize block : distribution.largest()) {
            log.info("    '{}': {}", block.key(), String.format("%,d", block.size()));
        }
    }
}
