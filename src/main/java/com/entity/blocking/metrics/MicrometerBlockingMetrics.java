package com.entity.blocking.metrics;

import com.entity.blocking.index.IndexKey;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link BlockingMetrics}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code blocking.records} - Counter of records pushed through the predicates</li>
 *   <li>{@code blocking.keys} - Counter of tagged block keys emitted</li>
 *   <li>{@code blocking.index.build} - Timer (tags: field, indexType)</li>
 *   <li>{@code blocking.index.documents} - DistributionSummary of corpus sizes (tags: field, indexType)</li>
 *   <li>{@code blocking.block.size} - DistributionSummary of block sizes</li>
 *   <li>{@code blocking.recall} - Gauge holding the last estimated blocking recall</li>
 * </ul>
 */
public class MicrometerBlockingMetrics implements BlockingMetrics {

    private final MeterRegistry registry;
    private final Map<IndexKey, Timer> buildTimers = new ConcurrentHashMap<>();
    private final Map<IndexKey, DistributionSummary> corpusSizes = new ConcurrentHashMap<>();
    private final Counter recordCounter;
    private final Counter keyCounter;
    private final DistributionSummary blockSizeSummary;
    private final AtomicLong recallBits = new AtomicLong(Double.doubleToLongBits(Double.NaN));

    public MicrometerBlockingMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.recordCounter = Counter.builder("blocking.records")
                .description("Number of records pushed through the blocking predicates")
                .register(registry);
        this.keyCounter = Counter.builder("blocking.keys")
                .description("Number of tagged block keys emitted")
                .register(registry);
        this.blockSizeSummary = DistributionSummary.builder("blocking.block.size")
                .description("Distribution of block sizes")
                .register(registry);
        Gauge.builder("blocking.recall", recallBits, bits -> Double.longBitsToDouble(bits.get()))
                .description("Last estimated blocking recall over labeled matches")
                .register(registry);
    }

    @Override
    public void incrementRecordsBlocked() {
        recordCounter.increment();
    }

    @Override
    public void incrementKeysEmitted(int count) {
        if (count > 0) {
            keyCounter.increment(count);
        }
    }

    @Override
    public void recordIndexBuild(IndexKey key, int documents, Duration duration) {
        Timer timer = buildTimers.computeIfAbsent(key, k ->
                Timer.builder("blocking.index.build")
                        .description("Duration of index construction")
                        .tag("field", k.field())
                        .tag("indexType", k.indexType())
                        .register(registry));
        timer.record(duration);
        DistributionSummary summary = corpusSizes.computeIfAbsent(key, k ->
                DistributionSummary.builder("blocking.index.documents")
                        .description("Number of documents in a built index")
                        .tag("field", k.field())
                        .tag("indexType", k.indexType())
                        .register(registry));
        summary.record(documents);
    }

    @Override
    public void recordBlockSize(long size) {
        blockSizeSummary.record(size);
    }

    @Override
    public void recordRecall(double recall) {
        recallBits.set(Double.doubleToLongBits(recall));
    }
}
