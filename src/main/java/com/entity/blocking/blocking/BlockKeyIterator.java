package com.entity.blocking.blocking;

import com.entity.blocking.core.model.BlockKey;
import com.entity.blocking.core.model.BlockedRecord;
import com.entity.blocking.core.model.DataRecord;
import com.entity.blocking.metrics.BlockingMetrics;
import com.entity.blocking.predicate.CompoundPredicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Single-pass iterator that pulls records lazily and yields one {@link BlockedRecord}
 * per (predicate, key) produced for each record.
 */
class BlockKeyIterator implements Iterator<BlockedRecord> {
    private static final Logger log = LoggerFactory.getLogger(BlockKeyIterator.class);

    private final Iterator<DataRecord> records;
    private final List<CompoundPredicate> predicates;
    private final boolean target;
    private final int progressInterval;
    private final ProgressCallback progress;
    private final CancellationToken cancellation;
    private final BlockingMetrics metrics;
    private final Deque<BlockedRecord> pending = new ArrayDeque<>();
    private final long startNanos = System.nanoTime();
    private long processed;

    BlockKeyIterator(Iterator<DataRecord> records, List<CompoundPredicate> predicates, boolean target,
                     int progressInterval, ProgressCallback progress, CancellationToken cancellation,
                     BlockingMetrics metrics) {
        this.records = records;
        this.predicates = predicates;
        this.target = target;
        this.progressInterval = progressInterval;
        this.progress = progress;
        this.cancellation = cancellation;
        this.metrics = metrics;
    }

    @Override
    public boolean hasNext() {
        while (pending.isEmpty() && records.hasNext()) {
            block(records.next());
        }
        return !pending.isEmpty();
    }

    @Override
    public BlockedRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return pending.poll();
    }

    private void block(DataRecord record) {
        int emitted = 0;
        for (int ordinal = 0; ordinal < predicates.size(); ordinal++) {
            Set<String> keys = predicates.get(ordinal).apply(record.instance(), target);
            for (String key : keys) {
                pending.add(new BlockedRecord(new BlockKey(key, ordinal), record.id()));
            }
            emitted += keys.size();
        }
        processed++;
        metrics.incrementRecordsBlocked();
        metrics.incrementKeysEmitted(emitted);

        if (processed % progressInterval == 0) {
            checkpoint();
        }
    }

    private void checkpoint() {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        log.info("blocking.progress records={} elapsedSeconds={}", processed, elapsed.toMillis() / 1000.0);
        progress.onProgress(processed, elapsed);
        if (cancellation.isCancelled()) {
            log.warn("blocking.cancelled records={}", processed);
            throw new CancellationException("Blocking cancelled after " + processed + " records");
        }
    }
}
